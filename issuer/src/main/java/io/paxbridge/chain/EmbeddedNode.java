package io.paxbridge.chain;

import com.fasterxml.jackson.databind.JsonNode;
import io.paxbridge.utils.Bits256;

import java.util.List;
import java.util.Optional;

/**
 * Full node running inside the process. Its validation rules and storage are its own business;
 * the adapter only reads state and hands over transactions.
 */
public interface EmbeddedNode {

    // Hash of the highest chain block, ZERO if none
    Bits256 bestBlockHash();

    Optional<JsonNode> block(Bits256 blockHash);

    Optional<Bits256> blockHash(int height);

    int height();

    Optional<JsonNode> rawTransaction(Bits256 txid);

    Optional<JsonNode> decodeRawTransaction(String rawTx);

    Optional<JsonNode> listUnspent(String address);

    Optional<JsonNode> signRawTransaction(String rawTx, JsonNode vins, List<String> wifs, String sigHashType);

    // Zero when the node rejected the transaction
    Bits256 sendRawTransaction(String signedTx);
}
