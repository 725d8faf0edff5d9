package io.paxbridge.chain;

import com.fasterxml.jackson.databind.JsonNode;
import io.paxbridge.utils.Bits256;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Query and broadcast facade over one coin. Every call answers "absent" instead of failing
 * when the node can't be reached or replies with something unusable.
 */
public interface ChainAdapter {

    String symbol();

    // Fixed for the lifetime of the adapter
    NodeMode mode();

    // ZERO when unknown
    Bits256 bestBlockHash();

    Optional<JsonNode> getBlock(Bits256 blockHash);

    Optional<Bits256> getBlockHash(int height);

    // Current chain height as reported by getinfo
    OptionalInt getInfoHeight();

    Optional<JsonNode> getTransaction(Bits256 txid);

    Optional<JsonNode> decodeRawTransaction(String rawTx);

    Optional<JsonNode> listUnspent(String address);

    Optional<JsonNode> signRawTransaction(String rawTx, JsonNode vins);

    Optional<Bits256> sendRawTransaction(String signedTx);

    Optional<ChainTip> getChainTip(int maxTx);

    // Highest height seen so far through getChainTip
    int longestChain();
}
