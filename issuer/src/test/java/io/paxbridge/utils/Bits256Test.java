package io.paxbridge.utils;

import org.junit.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.*;

public class Bits256Test {
    private static final String HASH = "00000000000000000000000000000000000000000000000000000000000000ff";

    @Test
    public void fromHex() {
        Bits256 hash = Bits256.fromHex(HASH);
        assertEquals(HASH, hash.toHex());
        assertFalse(hash.isZero());
        assertTrue(Bits256.ZERO.isZero());

        assertThrows(IllegalArgumentException.class, () -> Bits256.fromHex("ff"));
        assertThrows(IllegalArgumentException.class, () -> Bits256.fromHex(HASH.replace('f', 'x')));
        assertThrows(IllegalArgumentException.class, () -> new Bits256(new byte[31]));
    }

    @Test
    public void copiesData() {
        byte[] data = new byte[Bits256.LENGTH];
        Bits256 hash = new Bits256(data);
        data[0] = 1;
        assertTrue("Constructor must copy the input", hash.isZero());

        hash.bytes()[0] = 1;
        assertTrue("Accessor must return a copy", hash.isZero());
    }

    @Test
    public void equalityAndOrder() {
        Bits256 a = Bits256.fromHex(HASH);
        Bits256 b = Bits256.fromHex(HASH);
        Set<Bits256> set = new HashSet<>();
        set.add(a);
        set.add(b);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(1, set.size());
        assertTrue(Bits256.ZERO.compareTo(a) < 0);
        assertTrue(a.compareTo(Bits256.ZERO) > 0);
        assertEquals(0, a.compareTo(b));
    }
}
