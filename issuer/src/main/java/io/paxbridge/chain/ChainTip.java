package io.paxbridge.chain;

import io.paxbridge.utils.Bits256;

import java.util.List;

public final class ChainTip {
    private final Bits256 blockHash;
    private final int height;
    private final long blockTime;
    private final List<Bits256> txids;
    private final int numTx;

    public ChainTip(Bits256 blockHash, int height, long blockTime, List<Bits256> txids, int numTx) {
        this.blockHash = blockHash;
        this.height = height;
        this.blockTime = blockTime;
        this.txids = List.copyOf(txids);
        this.numTx = numTx;
    }

    public Bits256 blockHash() {
        return blockHash;
    }

    public int height() {
        return height;
    }

    public long blockTime() {
        return blockTime;
    }

    // At most the capacity requested by the caller
    public List<Bits256> txids() {
        return txids;
    }

    // Number of transactions in the block, may exceed txids().size()
    public int numTx() {
        return numTx;
    }

    @Override
    public String toString() {
        return String.format("ChainTip{hash=%s, height=%d, time=%d, numTx=%d}", blockHash, height, blockTime, numTx);
    }
}
