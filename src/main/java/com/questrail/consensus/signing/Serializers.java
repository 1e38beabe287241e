package com.questrail.consensus.signing;

import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockHeader;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Endorsement;
import com.questrail.consensus.model.Hash;
import com.questrail.consensus.model.Operation;
import com.questrail.consensus.model.OperationType;
import com.questrail.consensus.model.Slot;
import com.questrail.consensus.model.Wrapped;

import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Serializers
 * -----------------------------------------------------------------------------
 * The fixed wire layouts used to content-address model objects.
 *
 * <p>Nested wrapped objects are written as identifier plus signature, so a
 * block hash covers the exact header and operations it carries.</p>
 */
public final class Serializers
{
    private static final byte OP_TRANSACTION = 0;
    private static final byte OP_ROLL_BUY = 1;
    private static final byte OP_ROLL_SELL = 2;
    private static final byte OP_EXECUTE_SC = 3;

    private Serializers() {}

    public static final ContentSerializer<Endorsement> ENDORSEMENT = (e, out) -> {
        writeSlot(e.slot(), out);
        out.writeInt(e.index());
        writeHash(e.endorsedBlock().hash(), out);
    };

    public static final ContentSerializer<Operation> OPERATION = (op, out) -> {
        out.writeLong(op.fee());
        out.writeLong(op.expirePeriod());
        OperationType type = op.type();
        if (type instanceof OperationType.Transaction t) {
            out.writeByte(OP_TRANSACTION);
            writeHash(t.recipient().hash(), out);
            out.writeLong(t.amount());
        } else if (type instanceof OperationType.RollBuy b) {
            out.writeByte(OP_ROLL_BUY);
            out.writeLong(b.rollCount());
        } else if (type instanceof OperationType.RollSell s) {
            out.writeByte(OP_ROLL_SELL);
            out.writeLong(s.rollCount());
        } else if (type instanceof OperationType.ExecuteSc sc) {
            out.writeByte(OP_EXECUTE_SC);
            byte[] data = sc.data();
            out.writeInt(data.length);
            out.write(data);
            out.writeLong(sc.maxGas());
            out.writeLong(sc.coins());
            out.writeLong(sc.gasPrice());
        } else {
            throw new IOException("unknown operation type " + type);
        }
    };

    public static final ContentSerializer<BlockHeader> BLOCK_HEADER = (h, out) -> {
        writeSlot(h.slot(), out);
        out.writeInt(h.parents().size());
        for (BlockId parent : h.parents()) {
            writeHash(parent.hash(), out);
        }
        writeHash(h.operationMerkleRoot(), out);
        out.writeInt(h.endorsements().size());
        for (Wrapped<Endorsement, ?> e : h.endorsements()) {
            writeWrapped(e, out);
        }
    };

    public static final ContentSerializer<Block> BLOCK = (b, out) -> {
        writeWrapped(b.header(), out);
        out.writeInt(b.operations().size());
        for (Wrapped<Operation, ?> op : b.operations()) {
            writeWrapped(op, out);
        }
    };

    private static void writeSlot(Slot slot, DataOutputStream out) throws IOException {
        out.writeLong(slot.period());
        out.writeByte(slot.thread());
    }

    private static void writeHash(Hash hash, DataOutputStream out) throws IOException {
        out.write(hash.toBytes());
    }

    private static void writeWrapped(Wrapped<?, ?> wrapped, DataOutputStream out) throws IOException {
        writeHash(wrapped.id().hash(), out);
        byte[] signature = wrapped.signature();
        out.writeShort(signature.length);
        out.write(signature);
    }
}
