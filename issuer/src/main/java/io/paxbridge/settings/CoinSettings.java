package io.paxbridge.settings;

import io.paxbridge.chain.NodeMode;

import java.net.URI;
import java.time.Duration;
import java.util.List;

public final class CoinSettings {
    private final String symbol;
    private final NodeMode mode;
    private final URI rpcUrl;
    private final String rpcUser;
    private final String rpcPassword;
    private final Duration rpcTimeout;
    private final int pubType;
    private final boolean scan;
    private final List<String> notaryAddresses;

    public CoinSettings(String symbol, NodeMode mode, URI rpcUrl, String rpcUser, String rpcPassword, Duration rpcTimeout,
                        int pubType, boolean scan, List<String> notaryAddresses) {
        this.symbol = symbol;
        this.mode = mode;
        this.rpcUrl = rpcUrl;
        this.rpcUser = rpcUser;
        this.rpcPassword = rpcPassword;
        this.rpcTimeout = rpcTimeout;
        this.pubType = pubType;
        this.scan = scan;
        this.notaryAddresses = List.copyOf(notaryAddresses);
    }

    public String symbol() {
        return symbol;
    }

    public NodeMode mode() {
        return mode;
    }

    public URI rpcUrl() {
        return rpcUrl;
    }

    public String rpcUser() {
        return rpcUser;
    }

    public String rpcPassword() {
        return rpcPassword;
    }

    public Duration rpcTimeout() {
        return rpcTimeout;
    }

    // Base58 version byte of pay-to-pubkey-hash addresses
    public int pubType() {
        return pubType;
    }

    // Whether an issuance scanner watches this chain for peg requests
    public boolean scan() {
        return scan;
    }

    public List<String> notaryAddresses() {
        return notaryAddresses;
    }

    @Override
    public String toString() {
        return String.format("CoinSettings{symbol=%s, mode=%s, rpcUrl=%s, pubType=%d, scan=%b, notaryAddresses=%s}",
                symbol, mode, rpcUrl, pubType, scan, notaryAddresses);
    }
}
