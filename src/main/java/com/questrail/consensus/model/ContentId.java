package com.questrail.consensus.model;

/**
 * Identifier derived from content by hashing.
 */
public interface ContentId
{
    Hash hash();
}
