package com.questrail.consensus.engine;

import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Wrapped;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Shared block store, visible to both the engine and the test body.
 * Thread-safe.
 */
public final class BlockStorage
{
    private final ConcurrentMap<BlockId, Wrapped<Block, BlockId>> blocks = new ConcurrentHashMap<>();

    public void storeBlock(Wrapped<Block, BlockId> block) {
        Objects.requireNonNull(block, "block");
        blocks.put(block.id(), block);
    }

    public Optional<Wrapped<Block, BlockId>> retrieveBlock(BlockId id) {
        return Optional.ofNullable(blocks.get(id));
    }

    public boolean contains(BlockId id) {
        return blocks.containsKey(id);
    }

    public int size() {
        return blocks.size();
    }
}
