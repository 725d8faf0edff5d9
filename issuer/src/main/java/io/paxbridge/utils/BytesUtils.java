package io.paxbridge.utils;

import com.google.common.base.CharMatcher;
import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

import java.util.Arrays;

public final class BytesUtils {
    private BytesUtils() {}

    private static final CharMatcher HEX_DIGIT = CharMatcher.anyOf("0123456789abcdefABCDEF");

    // Get Reversed Int value from byte array starting from an offset position without copying an array
    public static int getReversedInt(byte[] bytes, int offset) {
        if(offset < 0 || bytes.length < offset + 4)
            throw new IllegalArgumentException("Value is out of array bounds");

        return Ints.fromBytes(  bytes[offset + 3],
                                bytes[offset + 2],
                                bytes[offset + 1],
                                bytes[offset]);
    }

    // Get Reversed Long value from byte array starting from an offset position without copying an array
    public static long getReversedLong(byte[] bytes, int offset) {
        if(offset < 0 || bytes.length < offset + 8)
            throw new IllegalArgumentException("Value is out of array bounds");

        return Longs.fromBytes( bytes[offset + 7],
                                bytes[offset + 6],
                                bytes[offset + 5],
                                bytes[offset + 4],
                                bytes[offset + 3],
                                bytes[offset + 2],
                                bytes[offset + 1],
                                bytes[offset]);
    }

    // Write Int value in LE order into the array starting from an offset position
    public static void putReversedInt(byte[] bytes, int offset, int value) {
        if(offset < 0 || bytes.length < offset + 4)
            throw new IllegalArgumentException("Value is out of array bounds");

        byte[] be = Ints.toByteArray(value);
        for (int i = 0; i < 4; i++)
            bytes[offset + i] = be[3 - i];
    }

    // Write Long value in LE order into the array starting from an offset position
    public static void putReversedLong(byte[] bytes, int offset, long value) {
        if(offset < 0 || bytes.length < offset + 8)
            throw new IllegalArgumentException("Value is out of array bounds");

        byte[] be = Longs.toByteArray(value);
        for (int i = 0; i < 8; i++)
            bytes[offset + i] = be[7 - i];
    }

    // Get byte array from hex string;
    public static byte[] fromHexString(String hex) {
        return BaseEncoding.base16().lowerCase().decode(hex.toLowerCase());
    }

    // Get hex string representation of byte array
    public static String toHexString(byte[] bytes) {
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }

    // Number of hex digits in the string, or -1 if it contains anything else or has odd length.
    // Only ASCII digits count: anything accepted here must decode with fromHexString.
    public static int hexLength(String str) {
        if (str == null || str.length() % 2 != 0 || !HEX_DIGIT.matchesAllOf(str))
            return -1;
        return str.length();
    }

    public static boolean isHexString(String str, int expectedBytes) {
        return hexLength(str) == expectedBytes * 2;
    }

    public static boolean regionEquals(byte[] bytes, int offset, byte[] expected) {
        if (offset < 0 || bytes.length < offset + expected.length)
            return false;
        return Arrays.equals(bytes, offset, offset + expected.length, expected, 0, expected.length);
    }
}
