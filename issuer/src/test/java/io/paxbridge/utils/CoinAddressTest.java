package io.paxbridge.utils;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class CoinAddressTest {
    private static final String SPECIAL_PUBKEY = "020e46e79a2a8d12b9b5d12c7a91adb4e454edfae43c0a0cb805427d2ac7613fd9";
    private static final String SPECIAL_RMD160 = "f1dce4182fce875748c4986b240ff7d7bc3fffb0";

    @Test
    public void toBase58() {
        byte[] rmd160 = new byte[Utils.RIPEMD160_LENGTH];
        Arrays.fill(rmd160, (byte) 0x11);
        assertEquals("RAqS1bAuWqW2f6ufsU5H4XpKfy5Pqj2oHz", new CoinAddress(60, rmd160).toBase58());
    }

    @Test
    public void fromPubkey() {
        CoinAddress address = CoinAddress.fromPubkey(0, BytesUtils.fromHexString(SPECIAL_PUBKEY));
        assertEquals(SPECIAL_RMD160, BytesUtils.toHexString(address.rmd160()));
        assertEquals("1P3rU1Nk1pmc2BiWC8dEy9bZa1ZbMp5jfg", address.toBase58());
    }

    @Test
    public void fromBase58() {
        CoinAddress address = CoinAddress.fromBase58("RAqS1bAuWqW2f6ufsU5H4XpKfy5Pqj2oHz");
        assertEquals(60, address.addressType());
        assertEquals("1111111111111111111111111111111111111111", BytesUtils.toHexString(address.rmd160()));
        assertEquals(address, new CoinAddress(60, address.rmd160()));
    }

    @Test
    public void fromBase58_invalid() {
        assertThrows("Bad checksum", IllegalArgumentException.class, () -> CoinAddress.fromBase58("RAqS1bAuWqW2f6ufsU5H4XpKfy5Pqj2oHy"));
        assertThrows("Not base58", IllegalArgumentException.class, () -> CoinAddress.fromBase58("0OIl"));
        assertThrows(IllegalArgumentException.class, () -> new CoinAddress(256, new byte[Utils.RIPEMD160_LENGTH]));
        assertThrows(IllegalArgumentException.class, () -> new CoinAddress(60, new byte[19]));
    }
}
