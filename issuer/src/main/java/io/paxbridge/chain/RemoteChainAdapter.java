package io.paxbridge.chain;

import com.fasterxml.jackson.databind.JsonNode;
import io.paxbridge.rpc.RpcClient;
import io.paxbridge.rpc.RpcException;
import io.paxbridge.utils.Bits256;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Every operation is a single JSON-RPC request to the coin's own node.
 */
public class RemoteChainAdapter extends AbstractChainAdapter {
    private final RpcClient rpc;

    public RemoteChainAdapter(String symbol, RpcClient rpc) {
        super(symbol);
        this.rpc = rpc;
    }

    @Override
    public NodeMode mode() {
        return NodeMode.RemoteOnly;
    }

    @Override
    public Bits256 bestBlockHash() {
        return call("getbestblockhash", List.of())
                .flatMap(AbstractChainAdapter::parseHash)
                .orElse(Bits256.ZERO);
    }

    @Override
    public Optional<JsonNode> getBlock(Bits256 blockHash) {
        return call("getblock", List.of(blockHash.toHex()));
    }

    @Override
    public Optional<Bits256> getBlockHash(int height) {
        Optional<JsonNode> result = call("getblockhash", List.of(height));
        Optional<Bits256> hash = result.flatMap(AbstractChainAdapter::parseHash);
        if (result.isPresent() && hash.isEmpty())
            logger.warn("{} getblockhash {} returned a malformed hash: {}", symbol, height, result.get());
        return hash;
    }

    @Override
    public OptionalInt getInfoHeight() {
        Optional<JsonNode> info = call("getinfo", List.of());
        if (info.isEmpty())
            return OptionalInt.empty();
        int blocks = info.get().path("blocks").asInt(0);
        return blocks == 0 ? OptionalInt.empty() : OptionalInt.of(blocks);
    }

    @Override
    public Optional<JsonNode> getTransaction(Bits256 txid) {
        return call("getrawtransaction", List.of(txid.toHex(), 1));
    }

    @Override
    public Optional<JsonNode> decodeRawTransaction(String rawTx) {
        return call("decoderawtransaction", List.of(rawTx));
    }

    @Override
    public Optional<JsonNode> listUnspent(String address) {
        Optional<JsonNode> unspents = call("listunspent", List.of(0, 99999999, List.of(address)));
        if (unspents.isEmpty())
            logger.warn("{} null listunspent for {}", symbol, address);
        return unspents;
    }

    // The remote node signs with its own wallet. Without vins it looks the inputs up itself.
    @Override
    public Optional<JsonNode> signRawTransaction(String rawTx, JsonNode vins) {
        if (vins == null || vins.isNull())
            return call("signrawtransaction", List.of(rawTx));
        return call("signrawtransaction", List.of(rawTx, vins));
    }

    @Override
    public Optional<Bits256> sendRawTransaction(String signedTx) {
        Optional<JsonNode> result = call("sendrawtransaction", List.of(signedTx));
        logger.info("{} sendrawtransaction -> {}", symbol, result.map(JsonNode::toString).orElse("null"));
        return result.flatMap(AbstractChainAdapter::parseHash);
    }

    private Optional<JsonNode> call(String method, List<Object> params) {
        try {
            return Optional.of(rpc.call(method, params));
        } catch (RpcException e) {
            logger.warn("{} {} failed: {}", symbol, method, e.error);
            return Optional.empty();
        }
    }
}
