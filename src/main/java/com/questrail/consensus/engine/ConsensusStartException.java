package com.questrail.consensus.engine;

/**
 * The engine refused to start because a startup precondition was not met.
 */
public final class ConsensusStartException extends RuntimeException
{
    public ConsensusStartException(String message) {
        super(message);
    }

    public ConsensusStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
