package com.questrail.consensus.signing;

import com.questrail.consensus.model.ContentId;
import com.questrail.consensus.model.Hash;

/**
 * Derives the identifier of a wrapped payload from the payload and its
 * content hash.
 */
@FunctionalInterface
public interface IdDerivation<T, I extends ContentId>
{
    I derive(T content, Hash contentHash);
}
