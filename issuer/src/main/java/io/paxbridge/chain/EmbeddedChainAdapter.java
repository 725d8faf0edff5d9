package io.paxbridge.chain;

import com.fasterxml.jackson.databind.JsonNode;
import io.paxbridge.utils.Bits256;
import io.paxbridge.utils.BytesUtils;
import io.paxbridge.utils.CoinAddress;
import io.paxbridge.utils.ScriptUtils;
import io.paxbridge.wallet.WalletKeyResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Reads and writes the state of a node embedded in the process. Inputs are signed with keys
 * resolved locally from the wallet.
 */
public class EmbeddedChainAdapter extends AbstractChainAdapter {
    static final int MAX_SPEND_SCRIPT_SIZE = 256;
    static final String SIGHASH_ALL = "ALL";

    private final NodeMode mode;
    private final EmbeddedNode node;
    private final WalletKeyResolver wallet;
    private final int pubType;

    public EmbeddedChainAdapter(String symbol, NodeMode mode, EmbeddedNode node, WalletKeyResolver wallet, int pubType) {
        super(symbol);
        if (!mode.isEmbedded())
            throw new IllegalArgumentException("Embedded adapter requires an embedded node mode, got " + mode);
        this.mode = mode;
        this.node = node;
        this.wallet = wallet;
        this.pubType = pubType;
    }

    @Override
    public NodeMode mode() {
        return mode;
    }

    @Override
    public Bits256 bestBlockHash() {
        return node.bestBlockHash();
    }

    @Override
    public Optional<JsonNode> getBlock(Bits256 blockHash) {
        return node.block(blockHash);
    }

    @Override
    public Optional<Bits256> getBlockHash(int height) {
        return node.blockHash(height);
    }

    @Override
    public OptionalInt getInfoHeight() {
        int height = node.height();
        return height == 0 ? OptionalInt.empty() : OptionalInt.of(height);
    }

    @Override
    public Optional<JsonNode> getTransaction(Bits256 txid) {
        return node.rawTransaction(txid);
    }

    @Override
    public Optional<JsonNode> decodeRawTransaction(String rawTx) {
        return node.decodeRawTransaction(rawTx);
    }

    @Override
    public Optional<JsonNode> listUnspent(String address) {
        return node.listUnspent(address);
    }

    @Override
    public Optional<JsonNode> signRawTransaction(String rawTx, JsonNode vins) {
        List<String> wifs = new ArrayList<>();
        if (vins != null && vins.isArray()) {
            for (JsonNode vin : vins)
                wifs.add(resolveWif(vin));
        }
        return node.signRawTransaction(rawTx, vins, wifs, SIGHASH_ALL);
    }

    // Empty string when the spending key is not ours, so the signer leaves that input alone
    private String resolveWif(JsonNode vin) {
        String scriptHex = vin.path("scriptPubkey").asText(null);
        if (scriptHex == null || BytesUtils.hexLength(scriptHex) <= 0 || scriptHex.length() >= MAX_SPEND_SCRIPT_SIZE * 2)
            return "";
        Optional<CoinAddress> address = ScriptUtils.destination(BytesUtils.fromHexString(scriptHex), pubType);
        if (address.isEmpty()) {
            logger.debug("{} can't resolve address of spend script {}", symbol, scriptHex);
            return "";
        }
        return wallet.wifForAddress(address.get().toBase58()).orElse("");
    }

    @Override
    public Optional<Bits256> sendRawTransaction(String signedTx) {
        Bits256 txid = node.sendRawTransaction(signedTx);
        logger.info("{} sendrawtransaction -> {}", symbol, txid);
        return txid.isZero() ? Optional.empty() : Optional.of(txid);
    }
}
