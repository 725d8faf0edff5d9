package io.paxbridge.utils;

import java.util.Arrays;
import java.util.Optional;

public final class ScriptUtils {
    private ScriptUtils() {}

    public static final byte OP_RETURN = (byte) 0x6a;
    public static final byte OP_DUP = (byte) 0x76;
    public static final byte OP_HASH160 = (byte) 0xa9;
    public static final byte OP_EQUALVERIFY = (byte) 0x88;
    public static final byte OP_CHECKSIG = (byte) 0xac;

    public static final int COMPRESSED_PUBKEY_LENGTH = 33;
    public static final int P2PK_SCRIPT_LENGTH = 35;
    public static final int P2PKH_SCRIPT_LENGTH = 25;

    // <33> pubkey OP_CHECKSIG
    public static boolean isPayToPubkey(byte[] script) {
        return script.length == P2PK_SCRIPT_LENGTH
                && script[0] == COMPRESSED_PUBKEY_LENGTH
                && script[P2PK_SCRIPT_LENGTH - 1] == OP_CHECKSIG;
    }

    // OP_DUP OP_HASH160 <20> rmd160 OP_EQUALVERIFY OP_CHECKSIG
    public static boolean isPayToPubkeyHash(byte[] script) {
        return script.length == P2PKH_SCRIPT_LENGTH
                && script[0] == OP_DUP
                && script[1] == OP_HASH160
                && script[2] == Utils.RIPEMD160_LENGTH
                && script[23] == OP_EQUALVERIFY
                && script[24] == OP_CHECKSIG;
    }

    public static boolean isPayToPubkey(byte[] script, byte[] pubkey33) {
        return isPayToPubkey(script) && BytesUtils.regionEquals(script, 1, pubkey33);
    }

    public static boolean isPayToPubkeyHash(byte[] script, byte[] rmd160) {
        return isPayToPubkeyHash(script) && BytesUtils.regionEquals(script, 3, rmd160);
    }

    public static boolean isOpReturn(byte[] script) {
        return script.length > 0 && script[0] == OP_RETURN;
    }

    // Address the script pays to, for the two standard transparent forms only.
    public static Optional<CoinAddress> destination(byte[] script, int pubType) {
        if (isPayToPubkey(script))
            return Optional.of(CoinAddress.fromPubkey(pubType, Arrays.copyOfRange(script, 1, 1 + COMPRESSED_PUBKEY_LENGTH)));
        if (isPayToPubkeyHash(script))
            return Optional.of(new CoinAddress(pubType, Arrays.copyOfRange(script, 3, 3 + Utils.RIPEMD160_LENGTH)));
        return Optional.empty();
    }
}
