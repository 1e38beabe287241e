package com.questrail.consensus.engine;

/**
 * Events the engine reports to its owner.
 */
public sealed interface ConsensusEvent permits ConsensusEvent.NeedSync
{
    /** The engine saw blocks too far ahead of its clock and must resync. */
    record NeedSync() implements ConsensusEvent {}
}
