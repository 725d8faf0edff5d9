package io.paxbridge.notary;

import io.paxbridge.utils.Bits256;

// Unspent output eligible to fund a notary transaction. Never persisted.
public final class FundingCandidate {
    private final long amount;
    private final String address;
    private final String scriptPubKey;
    private final Bits256 txid;
    private final int vout;

    public FundingCandidate(long amount, String address, String scriptPubKey, Bits256 txid, int vout) {
        this.amount = amount;
        this.address = address;
        this.scriptPubKey = scriptPubKey;
        this.txid = txid;
        this.vout = vout;
    }

    public long amount() {
        return amount;
    }

    public String address() {
        return address;
    }

    public String scriptPubKey() {
        return scriptPubKey;
    }

    public Bits256 txid() {
        return txid;
    }

    public int vout() {
        return vout;
    }

    @Override
    public String toString() {
        return String.format("FundingCandidate{txid=%s, vout=%d, amount=%d, address=%s}", txid, vout, amount, address);
    }
}
