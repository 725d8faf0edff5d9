package io.paxbridge.chain;

import io.paxbridge.rpc.RpcClient;
import io.paxbridge.settings.CoinSettings;
import io.paxbridge.wallet.WalletKeyResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Chain adapters of all configured coins, looked up by ticker.
 */
public class CoinRegistry {
    private static final Logger logger = LogManager.getLogger(CoinRegistry.class);

    private final Map<String, ChainAdapter> adapters = new LinkedHashMap<>();
    private final Map<String, CoinSettings> settings = new LinkedHashMap<>();
    private final Map<String, RpcClient> rpcClients = new LinkedHashMap<>();

    /**
     * Registers a coin served by a remote daemon.
     */
    public synchronized ChainAdapter registerRemote(CoinSettings coin) {
        if (coin.mode().isEmbedded())
            throw new IllegalArgumentException(String.format("Coin %s is configured as %s, an embedded node is required", coin.symbol(), coin.mode()));
        RpcClient rpc = new RpcClient(coin.rpcUrl(), coin.rpcUser(), coin.rpcPassword(), coin.rpcTimeout());
        rpcClients.put(key(coin.symbol()), rpc);
        return put(coin, new RemoteChainAdapter(coin.symbol(), rpc));
    }

    /**
     * Registers a coin served by an in-process node. Its RPC endpoint is still kept for the services
     * living only on a daemon, like the notary list.
     */
    public synchronized ChainAdapter registerEmbedded(CoinSettings coin, EmbeddedNode node, WalletKeyResolver wallet) {
        if (!coin.mode().isEmbedded())
            throw new IllegalArgumentException(String.format("Coin %s is configured as %s, not as an embedded node", coin.symbol(), coin.mode()));
        rpcClients.put(key(coin.symbol()), new RpcClient(coin.rpcUrl(), coin.rpcUser(), coin.rpcPassword(), coin.rpcTimeout()));
        return put(coin, new EmbeddedChainAdapter(coin.symbol(), coin.mode(), node, wallet, coin.pubType()));
    }

    // Registers an already built adapter
    public synchronized ChainAdapter register(CoinSettings coin, ChainAdapter adapter) {
        return put(coin, adapter);
    }

    public synchronized Optional<ChainAdapter> get(String symbol) {
        return Optional.ofNullable(adapters.get(key(symbol)));
    }

    public synchronized Optional<CoinSettings> settings(String symbol) {
        return Optional.ofNullable(settings.get(key(symbol)));
    }

    public synchronized Optional<RpcClient> rpcClient(String symbol) {
        return Optional.ofNullable(rpcClients.get(key(symbol)));
    }

    public synchronized List<ChainAdapter> adapters() {
        return new ArrayList<>(adapters.values());
    }

    public synchronized int size() {
        return adapters.size();
    }

    private ChainAdapter put(CoinSettings coin, ChainAdapter adapter) {
        String key = key(coin.symbol());
        if (adapters.containsKey(key))
            throw new IllegalArgumentException("Coin is already registered: " + coin.symbol());
        adapters.put(key, adapter);
        settings.put(key, coin);
        logger.info("registered coin {} in {} mode", coin.symbol(), coin.mode());
        return adapter;
    }

    private static String key(String symbol) {
        return symbol.toUpperCase(Locale.ROOT);
    }
}
