package io.paxbridge.issuer;

import com.fasterxml.jackson.databind.JsonNode;
import io.paxbridge.chain.ChainAdapter;
import io.paxbridge.ledger.PaxLedger;
import io.paxbridge.oracle.FiatDestination;
import io.paxbridge.oracle.PriceOracleClient;
import io.paxbridge.settings.IssuerSettings;
import io.paxbridge.transaction.opreturn.OpReturnData;
import io.paxbridge.transaction.opreturn.PaxPubkey;
import io.paxbridge.transaction.opreturn.PaxWithdrawal;
import io.paxbridge.utils.Bits256;
import io.paxbridge.utils.BytesUtils;
import io.paxbridge.utils.PaxCoinsUtils;
import io.paxbridge.utils.ScriptUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Catches up with a chain block by block looking for peg requests carried in OP_RETURN outputs,
 * and records the qualifying ones in the ledger.
 * <p>
 * Each call scans a bounded number of heights. A height is only passed once every transaction
 * of its block was fetched, so a failed height is scanned again on the next call; the ledger
 * existence check keeps that replay harmless.
 */
public class IssuanceScanner {
    private static final Logger logger = LogManager.getLogger(IssuanceScanner.class);

    private final ChainAdapter chain;
    private final PriceOracleClient oracle;
    private final PaxLedger ledger;
    private final IssuerSettings config;
    private final Clock clock;

    private int scanHeight;

    public IssuanceScanner(ChainAdapter chain, PriceOracleClient oracle, PaxLedger ledger, IssuerSettings config,
                           Clock clock, int startHeight) {
        this.chain = chain;
        this.oracle = oracle;
        this.ledger = ledger;
        this.config = config;
        this.clock = clock;
        this.scanHeight = startHeight;
    }

    public String symbol() {
        return chain.symbol();
    }

    public synchronized int scanHeight() {
        return scanHeight;
    }

    public synchronized ScanResult scan() {
        if (scanHeight <= 0)
            scanHeight = 1;

        OptionalInt info = chain.getInfoHeight();
        if (info.isEmpty()) {
            logger.error("error from {}: no chain info", chain.symbol());
            return new ScanResult(scanHeight, 0, 0, ScanResult.Status.CHAIN_UNAVAILABLE);
        }
        int target = info.getAsInt();

        int height = scanHeight;
        boolean failed = false;
        for (int i = 0; i < config.maxHeightsPerScan() && height <= target; i++, height++) {
            if (!scanBlock(height)) {
                logger.error("{} error height {}", chain.symbol(), height);
                failed = true;
                break;
            }
            if (!pause()) {
                // the block was fully processed, only the pause was cut short
                height++;
                break;
            }
        }
        scanHeight = height;

        long realtime = height >= target ? clock.instant().getEpochSecond() : 0;
        ScanResult.Status status = failed ? ScanResult.Status.FETCH_FAILED
                : realtime != 0 ? ScanResult.Status.CAUGHT_UP : ScanResult.Status.CATCHING_UP;
        return new ScanResult(height, target, realtime, status);
    }

    boolean scanBlock(int height) {
        Optional<Bits256> blockHash = chain.getBlockHash(height);
        if (blockHash.isEmpty()) {
            logger.warn("{} error from getblockhash {}", chain.symbol(), height);
            return false;
        }
        Optional<JsonNode> block = chain.getBlock(blockHash.get());
        if (block.isEmpty()) {
            logger.warn("{} error getblock {}", chain.symbol(), blockHash.get());
            return false;
        }
        JsonNode txs = block.get().get("tx");
        if (txs == null || !txs.isArray()) {
            logger.warn("{} block {} at {} has no tx array", chain.symbol(), blockHash.get(), height);
            return false;
        }

        int n = txs.size();
        for (int i = 0; i < n; i++) {
            String txidHex = txs.get(i).asText("");
            if (!BytesUtils.isHexString(txidHex, Bits256.LENGTH) || !scanTransaction(height, i, Bits256.fromHex(txidHex))) {
                logger.warn("{} issuer block ht.{} error i.{} vs n.{}", chain.symbol(), height, i, n);
                return false;
            }
        }
        return true;
    }

    boolean scanTransaction(int height, int txi, Bits256 txid) {
        Optional<JsonNode> tx = chain.getTransaction(txid);
        if (tx.isEmpty())
            return false;
        JsonNode vouts = tx.get().get("vout");
        if (vouts == null || !vouts.isArray()) {
            logger.warn("{} error getting vouts of {}", chain.symbol(), txid);
            return false;
        }

        Bits256 txHash = txid;
        String reportedTxid = tx.get().path("txid").asText("");
        if (BytesUtils.isHexString(reportedTxid, Bits256.LENGTH))
            txHash = Bits256.fromHex(reportedTxid);

        boolean isSpecial = false;
        for (int vout = 0; vout < vouts.size(); vout++) {
            JsonNode item = vouts.get(vout);
            long value = outputValue(item);
            String hex = item.path("scriptPubKey").path("hex").asText(null);
            if (hex == null)
                continue;
            int hexLength = BytesUtils.hexLength(hex);
            if (hexLength < 0) {
                logger.debug("{} {}/{} script is not hex, skipped", chain.symbol(), txHash, vout);
                continue;
            }
            if (hexLength / 2 > config.maxScriptSize()) {
                logger.debug("{} {}/{} script of {} bytes is oversized, skipped", chain.symbol(), txHash, vout, hexLength / 2);
                continue;
            }
            byte[] script = BytesUtils.fromHexString(hex);
            if (vout == 0 && isSpecialFunding(script)) {
                isSpecial = true;
                continue;
            }
            voutUpdate(isSpecial, height, txi, txHash, vout, value, script);
        }
        return true;
    }

    // Output paying the special notary key, by pubkey or by its hash
    boolean isSpecialFunding(byte[] script) {
        return ScriptUtils.isPayToPubkey(script, config.specialNotaryPubkey())
                || ScriptUtils.isPayToPubkeyHash(script, config.specialNotaryRmd160());
    }

    void voutUpdate(boolean isSpecial, int height, int txi, Bits256 txid, int vout, long value, byte[] script) {
        Optional<OpReturnData> opReturn;
        try {
            opReturn = OpReturnData.parse(script);
        } catch (IllegalArgumentException e) {
            logger.debug("{} {}/{} malformed OP_RETURN: {}", chain.symbol(), txid, vout, e.getMessage());
            return;
        }
        if (opReturn.isEmpty())
            return;

        OpReturnData data = opReturn.get();
        if (data.tag() == OpReturnData.TAG_WITHDRAW && !config.pegSymbol().equals(config.nativeUnit())) {
            logger.info("WITHDRAW ht.{} txi.{} vout.{} {} opretlen.{} special.{}",
                    height, txi, vout, PaxCoinsUtils.toDecimalString(value), data.payloadLength(), isSpecial);
            if (data.payloadLength() == PaxWithdrawal.PAYLOAD_LENGTH)
                withdraw(txid, vout, value, script, data);
        } else if (data.tag() == OpReturnData.TAG_ISSUED) {
            // issued markers are informational only
            logger.info("WITHDRAW issued ht.{} txi.{} vout.{} {}", height, txi, vout, PaxCoinsUtils.toDecimalString(value));
        }
    }

    private void withdraw(Bits256 txid, int vout, long value, byte[] script, OpReturnData data) {
        PaxWithdrawal withdrawal;
        try {
            withdrawal = PaxWithdrawal.parse(script, data.tagOffset());
        } catch (IllegalArgumentException e) {
            logger.warn("{} {}/{} malformed withdrawal: {}", chain.symbol(), txid, vout, e.getMessage());
            return;
        }
        PaxPubkey pubkey = withdrawal.pubkey();
        long fiatoshis = pubkey.amount();
        boolean shortFlag = pubkey.shortFlag();
        String coinAddress = pubkey.address().toBase58();

        FiatDestination destination = oracle.fiatDestination(true, coinAddress, withdrawal.height(), pubkey.ticker(), fiatoshis);
        long checktoshis = destination.peggedAmount();
        if (shortFlag != config.pegShortFlag())
            return;

        if (!shortFlag) {
            logger.info("{} <- txid.v{} {} checkpubkey check {} v {} dest.({}) height.{}",
                    txid, vout, destination.pubkey().map(p -> BytesUtils.toHexString(p.bytes())).orElse(""),
                    PaxCoinsUtils.toDecimalString(checktoshis), PaxCoinsUtils.toDecimalString(value),
                    destination.destAddress().orElse(""), withdrawal.height());
            if (value <= fiatoshis && ledger.find(txid).isEmpty())
                ledger.withdraw(coinAddress, fiatoshis, shortFlag, pubkey.ticker(), checktoshis, pubkey.rmd160(),
                        txid, vout, withdrawal.height());
        } else {
            logger.info("{} opret['{}'] value {} vs check {}", BytesUtils.toHexString(script), (char) data.tag(),
                    PaxCoinsUtils.toDecimalString(value), PaxCoinsUtils.toDecimalString(checktoshis));
            if (value >= fiatoshis) {
                // short settlement is not implemented: nothing is recorded
                logger.debug("{}/{} short withdrawal qualifies, no settlement path", txid, vout);
            }
        }
    }

    private long outputValue(JsonNode item) {
        JsonNode value = item.get("value");
        if (value == null || !value.isNumber())
            return 0;
        try {
            return PaxCoinsUtils.toSatoshis(value.decimalValue());
        } catch (ArithmeticException e) {
            return 0;
        }
    }

    // false when interrupted
    private boolean pause() {
        Duration pause = config.blockPause();
        if (pause.isZero() || pause.isNegative())
            return true;
        try {
            Thread.sleep(pause.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
