package io.paxbridge.utils;

import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;

import java.util.Arrays;

/**
 * Base58Check transparent address: one address type byte followed by a 20 bytes hash160.
 */
public final class CoinAddress {
    private final int addressType;
    private final byte[] rmd160;

    public CoinAddress(int addressType, byte[] rmd160) {
        if (addressType < 0 || addressType > 0xFF)
            throw new IllegalArgumentException("Address type must fit in one byte: " + addressType);
        if (rmd160 == null || rmd160.length != Utils.RIPEMD160_LENGTH)
            throw new IllegalArgumentException("Address hash must be 20 bytes long");
        this.addressType = addressType;
        this.rmd160 = Arrays.copyOf(rmd160, rmd160.length);
    }

    public static CoinAddress fromPubkey(int addressType, byte[] pubkey) {
        return new CoinAddress(addressType, Utils.Ripemd160Sha256Hash(pubkey));
    }

    public static CoinAddress fromBase58(String address) {
        byte[] decoded;
        try {
            decoded = Base58.decodeChecked(address);
        } catch (AddressFormatException e) {
            throw new IllegalArgumentException("Invalid address: " + address, e);
        }
        if (decoded.length != 1 + Utils.RIPEMD160_LENGTH)
            throw new IllegalArgumentException(String.format("Invalid address %s: payload length %d", address, decoded.length));
        return new CoinAddress(decoded[0] & 0xFF, Arrays.copyOfRange(decoded, 1, decoded.length));
    }

    public int addressType() {
        return addressType;
    }

    public byte[] rmd160() {
        return Arrays.copyOf(rmd160, rmd160.length);
    }

    public String toBase58() {
        return Base58.encodeChecked(addressType, rmd160);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof CoinAddress))
            return false;
        CoinAddress other = (CoinAddress) obj;
        return addressType == other.addressType && Arrays.equals(rmd160, other.rmd160);
    }

    @Override
    public int hashCode() {
        return 31 * addressType + Arrays.hashCode(rmd160);
    }

    @Override
    public String toString() {
        return toBase58();
    }
}
