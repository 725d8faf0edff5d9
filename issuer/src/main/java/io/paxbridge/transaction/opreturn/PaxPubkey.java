package io.paxbridge.transaction.opreturn;

import io.paxbridge.utils.BytesUtils;
import io.paxbridge.utils.CoinAddress;
import io.paxbridge.utils.Utils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

/**
 * Peg request metadata packed to look like a compressed public key.
 * <pre>
 * offset  size  field
 *  0       1    0x02 (long) or 0x03 (short)
 *  1       3    fiat ticker, uppercase ASCII
 *  4       8    amount magnitude, little endian, satoshi scale
 * 12       1    address type
 * 13      20    hash160 of the requester public key
 * </pre>
 * The amount carries no sign bit: a short request is signalled by the first byte only.
 */
public final class PaxPubkey {
    public static final int LENGTH = 33;
    public static final int TICKER_LENGTH = 3;

    private static final int PREFIX_OFFSET = 0;
    private static final int TICKER_OFFSET = 1;
    private static final int AMOUNT_OFFSET = 4;
    private static final int ADDRESS_TYPE_OFFSET = 12;
    private static final int RMD160_OFFSET = 13;

    private static final byte LONG_PREFIX = 0x02;
    private static final byte SHORT_PREFIX = 0x03;

    private final boolean shortFlag;
    private final byte[] ticker;
    private final long amount;
    private final int addressType;
    private final byte[] rmd160;

    // Builds a request: the ticker is normalized to upper case ASCII
    public PaxPubkey(boolean shortFlag, String ticker, long amount, int addressType, byte[] rmd160) {
        this(shortFlag, tickerBytes(ticker), amount, addressType, rmd160);
    }

    public PaxPubkey(boolean shortFlag, String ticker, long amount, CoinAddress address) {
        this(shortFlag, ticker, amount, address.addressType(), address.rmd160());
    }

    // Ticker bytes kept as found on the wire, so a decoded key encodes back to the same bytes
    private PaxPubkey(boolean shortFlag, byte[] ticker, long amount, int addressType, byte[] rmd160) {
        if (amount < 0)
            throw new IllegalArgumentException("Amount magnitude can't be negative: " + amount);
        if (addressType < 0 || addressType > 0xFF)
            throw new IllegalArgumentException("Address type must fit in one byte: " + addressType);
        if (rmd160 == null || rmd160.length != Utils.RIPEMD160_LENGTH)
            throw new IllegalArgumentException("Address hash must be 20 bytes long");
        this.shortFlag = shortFlag;
        this.ticker = ticker;
        this.amount = amount;
        this.addressType = addressType;
        this.rmd160 = Arrays.copyOf(rmd160, rmd160.length);
    }

    private static byte[] tickerBytes(String ticker) {
        if (ticker == null || ticker.length() != TICKER_LENGTH || !StandardCharsets.US_ASCII.newEncoder().canEncode(ticker))
            throw new IllegalArgumentException("Ticker must be exactly 3 ASCII characters: " + ticker);
        return ticker.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
    }

    public boolean shortFlag() {
        return shortFlag;
    }

    public String ticker() {
        return new String(ticker, StandardCharsets.ISO_8859_1);
    }

    // Magnitude as stored on the wire
    public long amount() {
        return amount;
    }

    // Magnitude negated for short requests
    public long signedAmount() {
        return shortFlag ? -amount : amount;
    }

    public int addressType() {
        return addressType;
    }

    public byte[] rmd160() {
        return Arrays.copyOf(rmd160, rmd160.length);
    }

    public CoinAddress address() {
        return new CoinAddress(addressType, rmd160);
    }

    public byte[] bytes() {
        byte[] res = new byte[LENGTH];
        res[PREFIX_OFFSET] = shortFlag ? SHORT_PREFIX : LONG_PREFIX;
        System.arraycopy(ticker, 0, res, TICKER_OFFSET, TICKER_LENGTH);
        BytesUtils.putReversedLong(res, AMOUNT_OFFSET, amount);
        res[ADDRESS_TYPE_OFFSET] = (byte) addressType;
        System.arraycopy(rmd160, 0, res, RMD160_OFFSET, Utils.RIPEMD160_LENGTH);
        return res;
    }

    public static PaxPubkey parse(byte[] bytes, int offset) {
        if (offset < 0 || bytes.length < offset + LENGTH)
            throw new IllegalArgumentException("PaxPubkey: Value is out of array bounds");

        boolean shortFlag = bytes[offset + PREFIX_OFFSET] == SHORT_PREFIX;
        byte[] ticker = Arrays.copyOfRange(bytes, offset + TICKER_OFFSET, offset + TICKER_OFFSET + TICKER_LENGTH);
        long amount = BytesUtils.getReversedLong(bytes, offset + AMOUNT_OFFSET);
        if (amount < 0)
            throw new IllegalArgumentException("PaxPubkey: amount magnitude overflows");
        int addressType = bytes[offset + ADDRESS_TYPE_OFFSET] & 0xFF;
        byte[] rmd160 = Arrays.copyOfRange(bytes, offset + RMD160_OFFSET, offset + RMD160_OFFSET + Utils.RIPEMD160_LENGTH);
        return new PaxPubkey(shortFlag, ticker, amount, addressType, rmd160);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof PaxPubkey))
            return false;
        PaxPubkey other = (PaxPubkey) obj;
        return shortFlag == other.shortFlag
                && amount == other.amount
                && addressType == other.addressType
                && Arrays.equals(ticker, other.ticker)
                && Arrays.equals(rmd160, other.rmd160);
    }

    @Override
    public int hashCode() {
        int h = Boolean.hashCode(shortFlag);
        h = 31 * h + Arrays.hashCode(ticker);
        h = 31 * h + Long.hashCode(amount);
        h = 31 * h + addressType;
        return 31 * h + Arrays.hashCode(rmd160);
    }

    @Override
    public String toString() {
        return String.format("PaxPubkey {\nshort = %b\nticker = %s\namount = %d\naddressType = %d\nrmd160 = %s\n}",
                shortFlag, ticker(), amount, addressType, BytesUtils.toHexString(rmd160));
    }
}
