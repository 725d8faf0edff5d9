package io.paxbridge.utils;

import java.util.Arrays;

// 256-bit hash (block hash or transaction id) in the byte order of its RPC hex representation.
// Copies on the way in and out, provides proper hashCode and compare methods implementation.
public final class Bits256 implements java.io.Serializable, Comparable<Bits256> {

    public static final int LENGTH = 32;
    public static final Bits256 ZERO = new Bits256(new byte[LENGTH]);

    private final byte[] data;

    public Bits256(byte[] data) {
        if (data == null || data.length != LENGTH)
            throw new IllegalArgumentException("Bits256 requires exactly 32 bytes");
        this.data = Arrays.copyOf(data, LENGTH);
    }

    public static Bits256 fromHex(String hex) {
        if (!BytesUtils.isHexString(hex, LENGTH))
            throw new IllegalArgumentException("Not a 64 hex chars hash: " + hex);
        return new Bits256(BytesUtils.fromHexString(hex));
    }

    public byte[] bytes() {
        return Arrays.copyOf(data, LENGTH);
    }

    public boolean isZero() {
        for (byte b : data) {
            if (b != 0)
                return false;
        }
        return true;
    }

    public String toHex() {
        return BytesUtils.toHexString(data);
    }

    @Override
    public String toString() {
        return toHex();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == null)
            return false;
        if (obj == this)
            return true;
        if (!(this.getClass().equals(obj.getClass())))
            return false;
        return Arrays.equals(data, ((Bits256)obj).data);
    }

    @Override
    public int hashCode() {
        //do not use Arrays.hashCode, it generates too many collisions (31 is too low)
        int h = 1;
        for (byte b : data) {
            h = h * (-1640531527) + b;
        }
        return h;
    }

    @Override
    public int compareTo(Bits256 o) {
        for (int i = 0; i < LENGTH; i++) {
            int b1 = data[i] & 0xFF;
            int b2 = o.data[i] & 0xFF;
            if (b1 != b2)
                return b1 - b2;
        }
        return 0;
    }
}
