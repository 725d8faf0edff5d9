package io.paxbridge.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class PaxCoinsUtils {
    private PaxCoinsUtils() {}

    public static final long COIN = 100000000;
    public static final int COIN_DECIMALS = 8;

    // JSON amounts carry 8 fractional digits; internally they are satoshis.
    public static long toSatoshis(BigDecimal amount) {
        return amount.movePointRight(COIN_DECIMALS).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    public static BigDecimal fromSatoshis(long satoshis) {
        return BigDecimal.valueOf(satoshis, COIN_DECIMALS);
    }

    // "%.8f" rendering used in RPC parameters and logs
    public static String toDecimalString(long satoshis) {
        return fromSatoshis(satoshis).toPlainString();
    }
}
