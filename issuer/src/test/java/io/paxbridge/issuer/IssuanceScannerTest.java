package io.paxbridge.issuer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.ConfigFactory;
import io.paxbridge.chain.ChainAdapter;
import io.paxbridge.ledger.PaxLedger;
import io.paxbridge.ledger.PegTransaction;
import io.paxbridge.oracle.PriceOracleClient;
import io.paxbridge.rpc.RpcClient;
import io.paxbridge.settings.IssuerSettings;
import io.paxbridge.settings.SettingsReader;
import io.paxbridge.transaction.opreturn.PaxPubkey;
import io.paxbridge.transaction.opreturn.PaxWithdrawal;
import io.paxbridge.utils.Bits256;
import io.paxbridge.utils.BytesUtils;
import io.paxbridge.utils.Utils;
import org.junit.Before;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class IssuanceScannerTest {
    private static final String SPECIAL_PUBKEY = "020e46e79a2a8d12b9b5d12c7a91adb4e454edfae43c0a0cb805427d2ac7613fd9";
    private static final String SPECIAL_RMD160 = "f1dce4182fce875748c4986b240ff7d7bc3fffb0";
    private static final String PAYMENT_SCRIPT = "76a914" + "2222222222222222222222222222222222222222" + "88ac";
    private static final long NOW = 1700000000L;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<Bits256, JsonNode> blocks = new HashMap<>();
    private final Map<Bits256, JsonNode> transactions = new HashMap<>();
    private final byte[] rmd160 = new byte[Utils.RIPEMD160_LENGTH];

    private ChainAdapter chain;
    private RpcClient oracleRpc;
    private PaxLedger ledger;
    private Clock clock;

    @Before
    public void setUp() throws Exception {
        Arrays.fill(rmd160, (byte) 0x11);
        chain = mock(ChainAdapter.class);
        when(chain.symbol()).thenReturn("KMD");
        when(chain.getBlockHash(anyInt())).thenAnswer(args -> Optional.of(blockHash(args.getArgument(0))));
        when(chain.getBlock(any())).thenAnswer(args -> {
            JsonNode block = blocks.get(args.<Bits256>getArgument(0));
            return Optional.of(block == null ? mapper.readTree("{\"tx\":[]}") : block);
        });
        when(chain.getTransaction(any())).thenAnswer(args -> Optional.ofNullable(transactions.get(args.<Bits256>getArgument(0))));

        oracleRpc = mock(RpcClient.class);
        when(oracleRpc.call(eq("paxprice"), anyList())).thenReturn(mapper.readTree("{\"price\":0.01}"));

        ledger = new PaxLedger();
        clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
    }

    private static IssuerSettings settings(String overrides) {
        return SettingsReader.fromConfig(ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.parseString("pax.scanner.blockPause = 0s"))
                .withFallback(ConfigFactory.defaultReference())
                .resolve());
    }

    private IssuanceScanner scanner(IssuerSettings settings, int startHeight) {
        PriceOracleClient oracle = new PriceOracleClient(oracleRpc, settings.nativeUnit(), 60);
        return new IssuanceScanner(chain, oracle, ledger, settings, clock, startHeight);
    }

    private IssuanceScanner scanner(int startHeight) {
        return scanner(settings(""), startHeight);
    }

    private static Bits256 blockHash(int height) {
        byte[] bytes = new byte[Bits256.LENGTH];
        bytes[0] = (byte) 0xbb;
        bytes[28] = (byte) (height >> 24);
        bytes[29] = (byte) (height >> 16);
        bytes[30] = (byte) (height >> 8);
        bytes[31] = (byte) height;
        return new Bits256(bytes);
    }

    private static Bits256 txid(int n) {
        byte[] bytes = new byte[Bits256.LENGTH];
        bytes[0] = (byte) 0xaa;
        bytes[31] = (byte) n;
        return new Bits256(bytes);
    }

    private String withdrawalScript(boolean shortFlag, String ticker, long fiatoshis, int height) {
        return BytesUtils.toHexString(new PaxWithdrawal(new PaxPubkey(shortFlag, ticker, fiatoshis, 60, rmd160), height).toScript());
    }

    // vouts given as (value, script hex) pairs
    private void addTransaction(int height, Bits256 txid, Object... vouts) {
        ObjectNode tx = mapper.createObjectNode();
        tx.put("txid", txid.toHex());
        ArrayNode outputs = tx.putArray("vout");
        for (int i = 0; i < vouts.length; i += 2) {
            ObjectNode output = outputs.addObject();
            output.put("value", new BigDecimal((String) vouts[i]));
            output.put("n", i / 2);
            output.putObject("scriptPubKey").put("hex", (String) vouts[i + 1]);
        }
        transactions.put(txid, tx);

        Bits256 hash = blockHash(height);
        ObjectNode block = (ObjectNode) blocks.computeIfAbsent(hash, h -> {
            ObjectNode b = mapper.createObjectNode();
            b.putArray("tx");
            return b;
        });
        ((ArrayNode) block.get("tx")).add(txid.toHex());
    }

    @Test
    public void scan_longPegWithdrawalIsRecorded() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        addTransaction(10, txid(1), "1.0", PAYMENT_SCRIPT, "0", withdrawalScript(false, "USD", 500000000L, 1200));

        ScanResult result = scanner(10).scan();

        assertEquals(ScanResult.Status.CAUGHT_UP, result.status());
        assertEquals(11, result.height());
        assertEquals(10, result.targetHeight());
        assertEquals(NOW, result.realtime());

        PegTransaction entry = ledger.find(txid(1)).get();
        assertEquals(500000000L, entry.fiatoshis());
        assertEquals(1000000L, entry.peggedAmount());
        assertEquals("USD", entry.symbol());
        assertEquals(1, entry.vout());
        assertEquals(1200, entry.height());
        assertEquals(0, entry.marked());
        assertEquals("RAqS1bAuWqW2f6ufsU5H4XpKfy5Pqj2oHz", entry.coinAddress());
        assertEquals(500000000L, ledger.total());
    }

    @Test
    public void scan_outputValueEqualToRequestIsRecorded() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        addTransaction(10, txid(1), "5.0", withdrawalScript(false, "USD", 500000000L, 1200));

        ScanResult result = scanner(10).scan();

        assertEquals(ScanResult.Status.CAUGHT_UP, result.status());
        assertEquals(1, ledger.size());
        PegTransaction entry = ledger.find(txid(1)).get();
        assertEquals(500000000L, entry.fiatoshis());
        assertEquals(0, entry.vout());
        assertEquals(0, entry.marked());
        assertTrue(entry.isPending());
    }

    @Test
    public void scan_nonAsciiDigitsScriptIsSkipped() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        // U+0660 is a decimal digit for Character.digit, not a hex digit
        addTransaction(10, txid(1), "0", "\u0660\u0660", "0", withdrawalScript(false, "USD", 900L, 5));

        ScanResult result = scanner(10).scan();

        assertEquals(ScanResult.Status.CAUGHT_UP, result.status());
        assertEquals("Height is passed", 11, result.height());
        PegTransaction entry = ledger.find(txid(1)).get();
        assertEquals("Valid output of the same transaction is still recorded", 900L, entry.fiatoshis());
        assertEquals(1, entry.vout());
    }

    @Test
    public void scan_duplicateIsNotRewritten() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        addTransaction(10, txid(1), "0", withdrawalScript(false, "USD", 500000000L, 1200));
        ledger.mark(txid(1), 0, 900);

        scanner(10).scan();
        scanner(10).scan();

        PegTransaction entry = ledger.find(txid(1)).get();
        assertEquals(1, ledger.size());
        assertEquals("Known txids are left alone", 0L, entry.fiatoshis());
        assertEquals(900, entry.marked());
    }

    @Test
    public void scan_replayedBlockDoesNotDuplicate() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        addTransaction(10, txid(1), "0", withdrawalScript(false, "USD", 500000000L, 1200));

        scanner(10).scan();
        scanner(10).scan();

        assertEquals(1, ledger.size());
        assertEquals(500000000L, ledger.total());
    }

    @Test
    public void scan_boundedNumberOfHeights() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(5000));

        IssuanceScanner scanner = scanner(1);
        ScanResult result = scanner.scan();

        assertEquals(ScanResult.Status.CATCHING_UP, result.status());
        assertEquals(1001, result.height());
        assertEquals(1001, scanner.scanHeight());
        assertEquals(0L, result.realtime());
        assertFalse(result.isRealtime());
        verify(chain, times(1000)).getBlockHash(anyInt());

        assertEquals(2001, scanner.scan().height());
    }

    @Test
    public void scan_chainUnavailable() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.empty());

        IssuanceScanner scanner = scanner(42);
        ScanResult result = scanner.scan();

        assertEquals(ScanResult.Status.CHAIN_UNAVAILABLE, result.status());
        assertEquals(42, result.height());
        assertEquals(42, scanner.scanHeight());
        verify(chain, never()).getBlockHash(anyInt());
    }

    @Test
    public void scan_nonPositiveStartHeight() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(3));
        ScanResult result = scanner(-5).scan();

        assertEquals(4, result.height());
        verify(chain).getBlockHash(1);
    }

    @Test
    public void scan_fetchFailureIsRetried() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        when(chain.getBlockHash(3)).thenReturn(Optional.empty());

        IssuanceScanner scanner = scanner(1);
        ScanResult result = scanner.scan();
        assertEquals(ScanResult.Status.FETCH_FAILED, result.status());
        assertEquals(3, result.height());

        when(chain.getBlockHash(3)).thenReturn(Optional.of(blockHash(3)));
        result = scanner.scan();
        assertEquals(ScanResult.Status.CAUGHT_UP, result.status());
        assertEquals(11, result.height());
    }

    @Test
    public void scan_missingTransactionFailsTheBlock() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(5));
        addTransaction(4, txid(1), "0", withdrawalScript(false, "USD", 100L, 1));
        transactions.remove(txid(1));

        ScanResult result = scanner(1).scan();
        assertEquals(ScanResult.Status.FETCH_FAILED, result.status());
        assertEquals(4, result.height());
    }

    @Test
    public void scan_specialFundingOutput() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        addTransaction(10, txid(1), "0.0001", "21" + SPECIAL_PUBKEY + "ac", "0", withdrawalScript(false, "USD", 700L, 5));

        IssuanceScanner scanner = scanner(10);
        scanner.scan();

        assertTrue(scanner.isSpecialFunding(BytesUtils.fromHexString("21" + SPECIAL_PUBKEY + "ac")));
        assertTrue(scanner.isSpecialFunding(BytesUtils.fromHexString("76a914" + SPECIAL_RMD160 + "88ac")));
        assertFalse(scanner.isSpecialFunding(BytesUtils.fromHexString(PAYMENT_SCRIPT)));
        assertEquals(700L, ledger.find(txid(1)).get().fiatoshis());
    }

    @Test
    public void scan_shortRequestOnLongPegIsIgnored() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        addTransaction(10, txid(1), "0", withdrawalScript(true, "USD", 500L, 5));

        scanner(10).scan();
        assertEquals(0, ledger.size());
    }

    @Test
    public void scan_shortPegRecordsNothing() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        addTransaction(10, txid(1), "10", withdrawalScript(true, "USD", 500L, 5));

        scanner(settings("pax.peg.shortFlag = true"), 10).scan();
        assertEquals(0, ledger.size());
    }

    @Test
    public void scan_outputValueAboveRequestIsIgnored() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        addTransaction(10, txid(1), "1", withdrawalScript(false, "USD", 500L, 5));

        scanner(10).scan();
        assertEquals(0, ledger.size());
    }

    @Test
    public void scan_nativePegIgnoresWithdrawals() throws Exception {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        addTransaction(10, txid(1), "0", withdrawalScript(false, "USD", 500L, 5));

        scanner(settings("pax.peg.symbol = KMD"), 10).scan();
        assertEquals(0, ledger.size());
        verify(oracleRpc, never()).call(eq("paxprice"), anyList());
    }

    @Test
    public void scan_malformedOutputsDoNotFailTheBlock() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        byte[] oversized = new byte[10001];
        oversized[0] = 0x6a;
        addTransaction(10, txid(1),
                "0", "6a4c",
                "0", "6a26",
                "0", "zz",
                "0", BytesUtils.toHexString(oversized),
                "0", "6a0158",
                "0", withdrawalScript(false, "USD", 900L, 5));

        ScanResult result = scanner(10).scan();
        assertEquals(ScanResult.Status.CAUGHT_UP, result.status());
        assertEquals(5, ledger.find(txid(1)).get().vout());
    }

    @Test
    public void scan_issuedMarkerIsLogOnly() {
        when(chain.getInfoHeight()).thenReturn(OptionalInt.of(10));
        addTransaction(10, txid(1), "0", "6a0358aabb");

        assertEquals(ScanResult.Status.CAUGHT_UP, scanner(10).scan().status());
        assertEquals(0, ledger.size());
    }
}
