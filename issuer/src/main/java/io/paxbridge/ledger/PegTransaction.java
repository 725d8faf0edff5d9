package io.paxbridge.ledger;

import io.paxbridge.utils.Bits256;
import io.paxbridge.utils.BytesUtils;
import io.paxbridge.utils.PaxCoinsUtils;
import io.paxbridge.utils.Utils;

import java.util.Arrays;
import java.util.Objects;

/**
 * Ledger entry of a recognized peg request. Immutable: the ledger replaces entries instead of
 * mutating them, so a reader never observes a half written record.
 */
public final class PegTransaction {
    private final Bits256 txid;
    private final int vout;
    private final long fiatoshis;
    private final long peggedAmount;
    private final boolean shortFlag;
    private final String symbol;
    private final byte[] rmd160;
    private final String coinAddress;
    private final int height;
    private final int marked;

    public PegTransaction(Bits256 txid, int vout, long fiatoshis, long peggedAmount, boolean shortFlag, String symbol,
                          byte[] rmd160, String coinAddress, int height, int marked) {
        this.txid = Objects.requireNonNull(txid);
        this.vout = vout;
        this.fiatoshis = fiatoshis;
        this.peggedAmount = peggedAmount;
        this.shortFlag = shortFlag;
        this.symbol = symbol == null ? "" : symbol;
        this.rmd160 = rmd160 == null ? new byte[Utils.RIPEMD160_LENGTH] : Arrays.copyOf(rmd160, rmd160.length);
        this.coinAddress = coinAddress == null ? "" : coinAddress;
        this.height = height;
        this.marked = marked;
    }

    // Entry with nothing but its identity, as created by a mark on an unseen txid
    static PegTransaction empty(Bits256 txid, int vout) {
        return new PegTransaction(txid, vout, 0, 0, false, "", null, "", 0, 0);
    }

    PegTransaction withMarked(int mark) {
        return new PegTransaction(txid, vout, fiatoshis, peggedAmount, shortFlag, symbol, rmd160, coinAddress, height, mark);
    }

    PegTransaction withOutpoint(Bits256 newTxid, int newVout) {
        return new PegTransaction(newTxid, newVout, fiatoshis, peggedAmount, shortFlag, symbol, rmd160, coinAddress, height, marked);
    }

    public Bits256 txid() {
        return txid;
    }

    public int vout() {
        return vout;
    }

    // Requested amount in the fiat unit, satoshi scale
    public long fiatoshis() {
        return fiatoshis;
    }

    // Oracle equivalent in the pegged unit, satoshi scale
    public long peggedAmount() {
        return peggedAmount;
    }

    public boolean shortFlag() {
        return shortFlag;
    }

    public String symbol() {
        return symbol;
    }

    public byte[] rmd160() {
        return Arrays.copyOf(rmd160, rmd160.length);
    }

    public String coinAddress() {
        return coinAddress;
    }

    // Fiat chain height of the request
    public int height() {
        return height;
    }

    // 0 while pending, otherwise the settlement or void height
    public int marked() {
        return marked;
    }

    public boolean isPending() {
        return marked == 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof PegTransaction))
            return false;
        PegTransaction other = (PegTransaction) obj;
        return vout == other.vout
                && fiatoshis == other.fiatoshis
                && peggedAmount == other.peggedAmount
                && shortFlag == other.shortFlag
                && height == other.height
                && marked == other.marked
                && txid.equals(other.txid)
                && symbol.equals(other.symbol)
                && coinAddress.equals(other.coinAddress)
                && Arrays.equals(rmd160, other.rmd160);
    }

    @Override
    public int hashCode() {
        return Objects.hash(txid, vout, fiatoshis, peggedAmount, shortFlag, symbol, coinAddress, height, marked)
                * 31 + Arrays.hashCode(rmd160);
    }

    @Override
    public String toString() {
        return String.format("PegTransaction {\ntxid = %s\nvout = %d\nfiat = %s %s\npegged = %s\nshort = %b\naddress = %s\nrmd160 = %s\nheight = %d\nmarked = %d\n}",
                txid, vout, PaxCoinsUtils.toDecimalString(fiatoshis), symbol, PaxCoinsUtils.toDecimalString(peggedAmount),
                shortFlag, coinAddress, BytesUtils.toHexString(rmd160), height, marked);
    }
}
