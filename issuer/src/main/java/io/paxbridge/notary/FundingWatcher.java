package io.paxbridge.notary;

import com.fasterxml.jackson.databind.JsonNode;
import io.paxbridge.chain.ChainAdapter;
import io.paxbridge.utils.Bits256;
import io.paxbridge.utils.BytesUtils;
import io.paxbridge.utils.PaxCoinsUtils;
import io.paxbridge.utils.ScriptUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.Random;

/**
 * Finds spendable outputs of the funding denomination at a notary address.
 */
public class FundingWatcher {
    private static final Logger logger = LogManager.getLogger(FundingWatcher.class);

    private final ChainAdapter chain;
    private final long denomination;
    private final Random random;

    public FundingWatcher(ChainAdapter chain, long denomination, Random random) {
        this.chain = chain;
        this.denomination = denomination;
        this.random = random;
    }

    /**
     * Among all eligible outputs one is picked at random, so notaries drawing from the same
     * address pool don't all race for the first one.
     */
    public UtxoSelection haveUtxo(String address) {
        Optional<JsonNode> unspents = chain.listUnspent(address);
        if (unspents.isEmpty()) {
            logger.warn("{} null return from listunspent for {}", chain.symbol(), address);
            return UtxoSelection.NONE;
        }
        JsonNode array = unspents.get();
        int n = array.isArray() ? array.size() : 0;
        if (n == 0) {
            logger.info("{} no unspents at {}", chain.symbol(), address);
            return UtxoSelection.NONE;
        }

        int count = 0;
        FundingCandidate selected = null;
        for (JsonNode item : array) {
            Optional<FundingCandidate> candidate = toCandidate(item, address);
            if (candidate.isEmpty())
                continue;
            if (selected == null || random.nextInt(n / 2 + 1) == 0)
                selected = candidate.get();
            count++;
        }

        if (count == 0)
            logger.info("{} no utxo: need to fund address {} or wait for splitfund to confirm", chain.symbol(), address);
        else
            logger.debug("{} haveutxo.{} at {}, selected {}", chain.symbol(), count, address, selected);
        return new UtxoSelection(count, selected);
    }

    // Pay-to-pubkey output of the notary's own key
    public static boolean isMine(JsonNode output, byte[] minerKey33) {
        String hex = output.path("scriptPubKey").path("hex").asText(null);
        if (hex == null || BytesUtils.hexLength(hex) != ScriptUtils.P2PK_SCRIPT_LENGTH * 2)
            return false;
        return ScriptUtils.isPayToPubkey(BytesUtils.fromHexString(hex), minerKey33);
    }

    private Optional<FundingCandidate> toCandidate(JsonNode item, String address) {
        JsonNode amountNode = item.get("amount");
        if (amountNode == null || !amountNode.isNumber())
            return Optional.empty();
        long satoshis;
        try {
            satoshis = PaxCoinsUtils.toSatoshis(amountNode.decimalValue());
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
        if (satoshis != denomination || !address.equals(item.path("address").asText(null)))
            return Optional.empty();

        String script = item.path("scriptPubKey").asText(null);
        if (!BytesUtils.isHexString(script, ScriptUtils.P2PK_SCRIPT_LENGTH))
            return Optional.empty();

        Bits256 txid;
        try {
            txid = Bits256.fromHex(item.path("txid").asText(""));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        int vout = item.path("vout").asInt(-1);
        if (txid.isZero() || vout < 0)
            return Optional.empty();
        return Optional.of(new FundingCandidate(satoshis, address, script, txid, vout));
    }
}
