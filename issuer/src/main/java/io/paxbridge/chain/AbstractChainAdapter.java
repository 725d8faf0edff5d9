package io.paxbridge.chain;

import com.fasterxml.jackson.databind.JsonNode;
import io.paxbridge.utils.Bits256;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

public abstract class AbstractChainAdapter implements ChainAdapter {
    protected final Logger logger = LogManager.getLogger(getClass());

    protected final String symbol;
    private final AtomicInteger longestChain = new AtomicInteger(0);

    protected AbstractChainAdapter(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public int longestChain() {
        return longestChain.get();
    }

    @Override
    public Optional<ChainTip> getChainTip(int maxTx) {
        Bits256 bestHash = bestBlockHash();
        if (bestHash.isZero())
            return Optional.empty();

        Optional<JsonNode> block = getBlock(bestHash);
        if (block.isEmpty())
            return Optional.empty();

        int height = block.get().path("height").asInt(0);
        long time = block.get().path("time").asLong(0);
        if (height == 0 || time == 0) {
            logger.debug("{} chain tip {} has no height or time", symbol, bestHash);
            return Optional.empty();
        }
        longestChain.accumulateAndGet(height, Math::max);

        List<Bits256> txids = new ArrayList<>();
        int numTx = 0;
        JsonNode tx = block.get().get("tx");
        if (tx != null && tx.isArray()) {
            numTx = tx.size();
            for (int i = 0; i < numTx && i < maxTx; i++)
                txids.add(parseHash(tx.get(i)).orElse(Bits256.ZERO));
        }
        return Optional.of(new ChainTip(bestHash, height, time, txids, numTx));
    }

    protected static Optional<Bits256> parseHash(JsonNode node) {
        if (node == null || !node.isTextual())
            return Optional.empty();
        try {
            return Optional.of(Bits256.fromHex(node.asText()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
