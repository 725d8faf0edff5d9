package io.paxbridge.utils;

import org.junit.Test;

import static org.junit.Assert.*;

public class BytesUtilsTest {

    @Test
    public void BytesUtilsTest_getReversedInt() {
        byte[] bytes = {1, 0, 0, 0, 0};
        assertEquals("Values expected to by equal", 1, BytesUtils.getReversedInt(bytes, 0));
        assertEquals("Values expected to by equal", 0, BytesUtils.getReversedInt(bytes, 1));

        assertThrows(IllegalArgumentException.class, () -> BytesUtils.getReversedInt(bytes, 2));
        assertThrows(IllegalArgumentException.class, () -> BytesUtils.getReversedInt(bytes, -1));
    }

    @Test
    public void BytesUtilsTest_getReversedLong() {
        byte[] bytes = {0x00, 0x65, (byte) 0xcd, 0x1d, 0, 0, 0, 0};
        assertEquals("Values expected to by equal", 500000000L, BytesUtils.getReversedLong(bytes, 0));
        assertThrows(IllegalArgumentException.class, () -> BytesUtils.getReversedLong(bytes, 1));
    }

    @Test
    public void BytesUtilsTest_putReversed() {
        byte[] bytes = new byte[12];
        BytesUtils.putReversedLong(bytes, 0, 500000000L);
        BytesUtils.putReversedInt(bytes, 8, 123456);

        assertEquals("Values expected to by equal", "0065cd1d0000000040e20100", BytesUtils.toHexString(bytes));
        assertEquals(500000000L, BytesUtils.getReversedLong(bytes, 0));
        assertEquals(123456, BytesUtils.getReversedInt(bytes, 8));

        assertThrows(IllegalArgumentException.class, () -> BytesUtils.putReversedInt(bytes, 9, 1));
        assertThrows(IllegalArgumentException.class, () -> BytesUtils.putReversedLong(bytes, 5, 1));
    }

    @Test
    public void BytesUtilsTest_hexLength() {
        assertEquals(4, BytesUtils.hexLength("0aFf"));
        assertEquals(0, BytesUtils.hexLength(""));
        assertEquals("Odd length is not valid hex", -1, BytesUtils.hexLength("abc"));
        assertEquals("Non hex char is not valid hex", -1, BytesUtils.hexLength("0g"));
        assertEquals(-1, BytesUtils.hexLength(null));
        assertEquals("Non ASCII digits are not hex", -1, BytesUtils.hexLength("\u0660\u0660"));
        assertEquals("Fullwidth letters are not hex", -1, BytesUtils.hexLength("\uff21\uff22"));

        assertTrue(BytesUtils.isHexString("00ff", 2));
        assertFalse(BytesUtils.isHexString("00ff", 3));
    }

    @Test
    public void BytesUtilsTest_hexConversion() {
        byte[] bytes = {0x0a, (byte) 0xff, 0x10};
        assertEquals("0aff10", BytesUtils.toHexString(bytes));
        assertArrayEquals(bytes, BytesUtils.fromHexString("0AFF10"));
    }

    @Test
    public void BytesUtilsTest_regionEquals() {
        byte[] bytes = {1, 2, 3, 4};
        assertTrue(BytesUtils.regionEquals(bytes, 1, new byte[]{2, 3}));
        assertFalse(BytesUtils.regionEquals(bytes, 1, new byte[]{2, 4}));
        assertFalse("Region outside the array never matches", BytesUtils.regionEquals(bytes, 3, new byte[]{4, 5}));
        assertFalse(BytesUtils.regionEquals(bytes, -1, new byte[]{1}));
    }
}
