package com.questrail.consensus.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * The kinds of operation a block may carry.
 */
public sealed interface OperationType
        permits OperationType.Transaction, OperationType.RollBuy,
                OperationType.RollSell, OperationType.ExecuteSc
{
    /** Coin transfer. */
    record Transaction(Address recipient, long amount) implements OperationType {
        public Transaction {
            Objects.requireNonNull(recipient, "recipient");
        }
    }

    record RollBuy(long rollCount) implements OperationType {}

    record RollSell(long rollCount) implements OperationType {}

    /** Smart-contract execution. */
    record ExecuteSc(byte[] data, long maxGas, long coins, long gasPrice) implements OperationType {
        public ExecuteSc {
            data = Objects.requireNonNull(data, "data").clone();
        }

        @Override
        public byte[] data() {
            return data.clone();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ExecuteSc that)) return false;
            return maxGas == that.maxGas && coins == that.coins && gasPrice == that.gasPrice
                    && Arrays.equals(data, that.data);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Arrays.hashCode(data), maxGas, coins, gasPrice);
        }

        @Override
        public String toString() {
            return "ExecuteSc[" + data.length + " bytes, maxGas=" + maxGas + "]";
        }
    }
}
