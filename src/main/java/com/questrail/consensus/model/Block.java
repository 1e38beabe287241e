package com.questrail.consensus.model;

import java.util.List;
import java.util.Objects;

/**
 * A block: its signed header plus the operations it carries.
 *
 * <p>A wrapped block shares the identifier of its wrapped header, so a block
 * can be asked for by header alone.</p>
 */
public record Block(Wrapped<BlockHeader, BlockId> header,
                    List<Wrapped<Operation, OperationId>> operations) {
    public Block {
        Objects.requireNonNull(header, "header");
        operations = List.copyOf(operations);
    }

    public Slot slot() {
        return header.content().slot();
    }

    public List<BlockId> parents() {
        return header.content().parents();
    }
}
