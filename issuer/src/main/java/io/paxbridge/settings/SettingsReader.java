package io.paxbridge.settings;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.paxbridge.chain.NodeMode;
import io.paxbridge.utils.BytesUtils;
import io.paxbridge.utils.ScriptUtils;
import io.paxbridge.utils.Utils;

import java.io.File;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class SettingsReader {
    private static final String ROOT = "pax";

    private final IssuerSettings issuerSettings;
    private final Config config;

    public SettingsReader(String userConfigPath) {
        this(readConfigFromPath(userConfigPath));
        // init log4j logging system as soon as possible after having read the settings
        LogInitializer.initLogManager(this.issuerSettings);
    }

    SettingsReader(Config config) {
        this.config = config;
        this.issuerSettings = fromConfig(config);
    }

    public IssuerSettings getIssuerSettings() {
        return this.issuerSettings;
    }

    public Config getConfig() {
        return this.config;
    }

    public static Config readConfigFromPath(String userConfigPath) {
        File file = new File(userConfigPath);
        if (!file.isFile())
            throw new IllegalArgumentException("Configuration file not found: " + userConfigPath);
        return ConfigFactory.parseFile(file)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }

    public static IssuerSettings fromConfig(Config root) {
        Config pax = root.getConfig(ROOT);
        Config scanner = pax.getConfig("scanner");
        Config special = pax.getConfig("specialNotary");
        Config log = pax.getConfig("log");

        byte[] specialPubkey = parseHex(special.getString("pubkey"), ScriptUtils.COMPRESSED_PUBKEY_LENGTH, "specialNotary.pubkey");
        byte[] specialRmd160 = parseHex(special.getString("rmd160"), Utils.RIPEMD160_LENGTH, "specialNotary.rmd160");

        List<CoinSettings> coins = new ArrayList<>();
        for (Config coin : pax.getConfigList("coins"))
            coins.add(coinFromConfig(coin.withFallback(pax.getConfig("coinDefaults"))));

        return new IssuerSettings(
                pax.getString("peg.symbol"),
                pax.getBoolean("peg.shortFlag"),
                pax.getString("nativeUnit"),
                pax.getString("registryCoin"),
                pax.getLong("fundingDenomination"),
                scanner.getInt("maxHeightsPerScan"),
                scanner.getInt("maxScriptSize"),
                scanner.getDuration("blockPause"),
                scanner.getDuration("failurePause"),
                scanner.getDuration("pollInterval"),
                pax.getDuration("funding.pollInterval"),
                specialPubkey,
                specialRmd160,
                new IssuerSettings.LogSettings(
                        log.getString("dir"),
                        log.getString("fileName"),
                        log.getString("fileLevel"),
                        log.getString("consoleLevel")),
                coins);
    }

    private static CoinSettings coinFromConfig(Config coin) {
        String symbol = coin.getString("symbol");
        int pubType = coin.getInt("pubType");
        if (pubType < 0 || pubType > 0xFF)
            throw new IllegalArgumentException(String.format("Coin %s: pubType %d doesn't fit in one byte", symbol, pubType));
        Duration timeout = coin.getDuration("rpc.timeout");
        return new CoinSettings(
                symbol,
                NodeMode.fromString(coin.getString("mode")),
                URI.create(coin.getString("rpc.url")),
                coin.getString("rpc.user"),
                coin.getString("rpc.password"),
                timeout,
                pubType,
                coin.getBoolean("scan"),
                coin.getStringList("notaryAddresses"));
    }

    private static byte[] parseHex(String hex, int expectedBytes, String path) {
        if (!BytesUtils.isHexString(hex, expectedBytes))
            throw new IllegalArgumentException(String.format("%s must be %d bytes of hex: %s", path, expectedBytes, hex));
        return BytesUtils.fromHexString(hex);
    }
}
