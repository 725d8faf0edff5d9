package io.paxbridge.settings;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public final class IssuerSettings {
    private final String pegSymbol;
    private final boolean pegShortFlag;
    private final String nativeUnit;
    private final String registryCoin;
    private final long fundingDenomination;
    private final int maxHeightsPerScan;
    private final int maxScriptSize;
    private final Duration blockPause;
    private final Duration failurePause;
    private final Duration scanInterval;
    private final Duration fundingInterval;
    private final byte[] specialNotaryPubkey;
    private final byte[] specialNotaryRmd160;
    private final LogSettings log;
    private final List<CoinSettings> coins;

    public IssuerSettings(String pegSymbol, boolean pegShortFlag, String nativeUnit, String registryCoin, long fundingDenomination, int maxHeightsPerScan,
                          int maxScriptSize, Duration blockPause, Duration failurePause, Duration scanInterval,
                          Duration fundingInterval, byte[] specialNotaryPubkey, byte[] specialNotaryRmd160,
                          LogSettings log, List<CoinSettings> coins) {
        this.pegSymbol = pegSymbol;
        this.pegShortFlag = pegShortFlag;
        this.nativeUnit = nativeUnit;
        this.registryCoin = registryCoin;
        this.fundingDenomination = fundingDenomination;
        this.maxHeightsPerScan = maxHeightsPerScan;
        this.maxScriptSize = maxScriptSize;
        this.blockPause = blockPause;
        this.failurePause = failurePause;
        this.scanInterval = scanInterval;
        this.fundingInterval = fundingInterval;
        this.specialNotaryPubkey = specialNotaryPubkey.clone();
        this.specialNotaryRmd160 = specialNotaryRmd160.clone();
        this.log = log;
        this.coins = List.copyOf(coins);
    }

    // Symbol of the pegged asset issued locally
    public String pegSymbol() {
        return pegSymbol;
    }

    // Direction of the local peg: long mints against fiat collateral, short is the inverse
    public boolean pegShortFlag() {
        return pegShortFlag;
    }

    // Unit the pegged assets are priced in
    public String nativeUnit() {
        return nativeUnit;
    }

    // Coin answering the notaries and paxprice queries
    public String registryCoin() {
        return registryCoin;
    }

    public long fundingDenomination() {
        return fundingDenomination;
    }

    public int maxHeightsPerScan() {
        return maxHeightsPerScan;
    }

    public int maxScriptSize() {
        return maxScriptSize;
    }

    public Duration blockPause() {
        return blockPause;
    }

    public Duration failurePause() {
        return failurePause;
    }

    public Duration scanInterval() {
        return scanInterval;
    }

    public Duration fundingInterval() {
        return fundingInterval;
    }

    public byte[] specialNotaryPubkey() {
        return specialNotaryPubkey.clone();
    }

    public byte[] specialNotaryRmd160() {
        return specialNotaryRmd160.clone();
    }

    public LogSettings log() {
        return log;
    }

    public List<CoinSettings> coins() {
        return coins;
    }

    public Optional<CoinSettings> coin(String symbol) {
        return coins.stream().filter(c -> c.symbol().equalsIgnoreCase(symbol)).findFirst();
    }

    public static final class LogSettings {
        public final String logDir;
        public final String logFileName;
        public final String logFileLevel;
        public final String logConsoleLevel;

        public LogSettings(String logDir, String logFileName, String logFileLevel, String logConsoleLevel) {
            this.logDir = logDir;
            this.logFileName = logFileName;
            this.logFileLevel = logFileLevel;
            this.logConsoleLevel = logConsoleLevel;
        }
    }
}
