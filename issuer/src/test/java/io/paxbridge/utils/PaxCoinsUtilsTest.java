package io.paxbridge.utils;

import org.junit.Test;

import java.math.BigDecimal;

import static org.junit.Assert.*;

public class PaxCoinsUtilsTest {

    @Test
    public void satoshis() {
        assertEquals(500000000L, PaxCoinsUtils.toSatoshis(new BigDecimal("5")));
        assertEquals(10000L, PaxCoinsUtils.toSatoshis(new BigDecimal("0.0001")));
        assertEquals("Rounded half up at the 8th digit", 2L, PaxCoinsUtils.toSatoshis(new BigDecimal("0.000000015")));
        assertEquals("5.00000000", PaxCoinsUtils.toDecimalString(500000000L));
        assertEquals("-0.00010000", PaxCoinsUtils.toDecimalString(-10000L));
    }
}
