package io.paxbridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.paxbridge.chain.ChainAdapter;
import io.paxbridge.chain.CoinRegistry;
import io.paxbridge.chain.RemoteChainAdapter;
import io.paxbridge.issuer.IssuanceScanner;
import io.paxbridge.issuer.ScanResult;
import io.paxbridge.ledger.PaxLedger;
import io.paxbridge.ledger.PegTransaction;
import io.paxbridge.notary.FundingWatcher;
import io.paxbridge.notary.NotaryRegistry;
import io.paxbridge.notary.NotarySet;
import io.paxbridge.notary.UtxoSelection;
import io.paxbridge.oracle.FiatDestination;
import io.paxbridge.oracle.PriceOracleClient;
import io.paxbridge.rpc.RpcClient;
import io.paxbridge.settings.CoinSettings;
import io.paxbridge.settings.IssuerSettings;
import io.paxbridge.settings.SettingsReader;
import io.paxbridge.tools.utils.CommandProcessor;
import io.paxbridge.tools.utils.Command;
import io.paxbridge.tools.utils.MessagePrinter;
import io.paxbridge.transaction.opreturn.OpReturnData;
import io.paxbridge.transaction.opreturn.PaxPubkey;
import io.paxbridge.transaction.opreturn.PaxWithdrawal;
import io.paxbridge.utils.BytesUtils;
import io.paxbridge.utils.CoinAddress;
import io.paxbridge.utils.PaxCoinsUtils;

import java.net.URI;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

public class PaxToolCommandProcessor extends CommandProcessor {

    private final ObjectMapper mapper = new ObjectMapper();

    public PaxToolCommandProcessor(MessagePrinter printer) {
        super(printer);
    }

    @Override
    public void processCommand(String input) throws Exception {
        Command command = parseCommand(input);
        try {
            switch (command.name()) {
                case "help":
                    printUsageMsg();
                    break;
                case "encodePaxPubkey":
                    encodePaxPubkey(command.data());
                    break;
                case "decodePaxPubkey":
                    decodePaxPubkey(command.data());
                    break;
                case "decodeOpReturn":
                    decodeOpReturn(command.data());
                    break;
                case "fiatDestination":
                    fiatDestination(command.data());
                    break;
                case "scan":
                    scan(command.data());
                    break;
                case "haveUtxo":
                    haveUtxo(command.data());
                    break;
                case "notaries":
                    notaries(command.data());
                    break;
                default:
                    printUnsupportedCommandMsg(command.name());
            }
        } catch (Exception e) {
            printError(e.getMessage());
        }
    }

    @Override
    protected void printUsageMsg() {
        ObjectNode resJson = mapper.createObjectNode();

        resJson.putIfAbsent("Usage", mapper.createArrayNode()
                .add("From command line: <program name> <command name> [<json data>]")
                .add("For interactive mode: <command name> [<json data>]")
                .add("Json data can be read from a file: <command name> -f <path to json file>"));
        resJson.putIfAbsent("Supported commands", mapper.createArrayNode()
                .add("help")
                .add("encodePaxPubkey <arguments>")
                .add("decodePaxPubkey <arguments>")
                .add("decodeOpReturn <arguments>")
                .add("fiatDestination <arguments>")
                .add("scan <arguments>")
                .add("haveUtxo <arguments>")
                .add("notaries <arguments>")
                .add("exit")
        );

        printer.print(resJson.toString());
    }

    private void printUsage(String error, String usage) {
        ObjectNode resJson = mapper.createObjectNode();
        resJson.put("error", error);
        resJson.put("Usage", usage);
        printer.print(resJson.toString());
    }

    private void printError(String error) {
        ObjectNode resJson = mapper.createObjectNode();
        resJson.put("error", error);
        printer.print(resJson.toString());
    }

    private void encodePaxPubkey(JsonNode json) {
        String usage = "encodePaxPubkey { \"ticker\": \"USD\", \"amount\": <satoshis>, \"address\": <base58 address>, \"short\": false }";
        if (!json.has("ticker") || !json.get("ticker").isTextual() || json.get("ticker").asText().length() != PaxPubkey.TICKER_LENGTH) {
            printUsage("ticker is not specified or has invalid format.", usage);
            return;
        } else if (!json.has("amount") || !json.get("amount").canConvertToLong() || json.get("amount").asLong() < 0) {
            printUsage("amount is not specified or has invalid format.", usage);
            return;
        } else if (!json.has("address") || !json.get("address").isTextual()) {
            printUsage("address is not specified or has invalid format.", usage);
            return;
        }
        boolean shortFlag = json.path("short").asBoolean(false);
        CoinAddress address = CoinAddress.fromBase58(json.get("address").asText());
        PaxPubkey pubkey = new PaxPubkey(shortFlag, json.get("ticker").asText(), json.get("amount").asLong(), address);

        ObjectNode resJson = mapper.createObjectNode();
        resJson.put("pubkey", BytesUtils.toHexString(pubkey.bytes()));
        printer.print(resJson.toString());
    }

    private void decodePaxPubkey(JsonNode json) {
        String usage = "decodePaxPubkey { \"pubkey\": <33 bytes hex> }";
        if (!json.has("pubkey") || !BytesUtils.isHexString(json.get("pubkey").asText(null), PaxPubkey.LENGTH)) {
            printUsage("pubkey is not specified or has invalid format.", usage);
            return;
        }
        PaxPubkey pubkey = PaxPubkey.parse(BytesUtils.fromHexString(json.get("pubkey").asText()), 0);
        printer.print(pubkeyJson(pubkey).toString());
    }

    private void decodeOpReturn(JsonNode json) {
        String usage = "decodeOpReturn { \"script\": <script hex> }";
        if (!json.has("script") || BytesUtils.hexLength(json.get("script").asText(null)) < 0) {
            printUsage("script is not specified or has invalid format.", usage);
            return;
        }
        byte[] script = BytesUtils.fromHexString(json.get("script").asText());
        Optional<OpReturnData> data = OpReturnData.parse(script);
        if (data.isEmpty()) {
            printError("script is not an OP_RETURN output.");
            return;
        }

        ObjectNode resJson = mapper.createObjectNode();
        resJson.put("tag", String.valueOf((char) data.get().tag()));
        resJson.put("payloadLength", data.get().payloadLength());
        if (data.get().tag() == OpReturnData.TAG_WITHDRAW && data.get().payloadLength() == PaxWithdrawal.PAYLOAD_LENGTH) {
            PaxWithdrawal withdrawal = PaxWithdrawal.parse(script, data.get().tagOffset());
            resJson.set("withdrawal", pubkeyJson(withdrawal.pubkey()));
            resJson.put("height", withdrawal.height());
        }
        printer.print(resJson.toString());
    }

    private void fiatDestination(JsonNode json) {
        String usage = "fiatDestination { \"rpc\": {\"url\": url, \"user\": user, \"password\": password}, \"nativeUnit\": \"KMD\", " +
                "\"pubType\": 60, \"height\": height, \"base\": \"USD\", \"amount\": <satoshis>, \"address\": <base58 address>, \"toPegged\": true }";
        if (!json.has("rpc") || !json.get("rpc").path("url").isTextual()) {
            printUsage("rpc.url is not specified or has invalid format.", usage);
            return;
        } else if (!json.has("height") || !json.get("height").canConvertToInt()) {
            printUsage("height is not specified or has invalid format.", usage);
            return;
        } else if (!json.has("base") || !json.get("base").isTextual()) {
            printUsage("base is not specified or has invalid format.", usage);
            return;
        } else if (!json.has("amount") || !json.get("amount").canConvertToLong()) {
            printUsage("amount is not specified or has invalid format.", usage);
            return;
        } else if (!json.has("address") || !json.get("address").isTextual()) {
            printUsage("address is not specified or has invalid format.", usage);
            return;
        }
        JsonNode rpcJson = json.get("rpc");
        RpcClient rpc = new RpcClient(URI.create(rpcJson.get("url").asText()), rpcJson.path("user").asText(""),
                rpcJson.path("password").asText(""), Duration.ofSeconds(30));
        PriceOracleClient oracle = new PriceOracleClient(rpc, json.path("nativeUnit").asText("KMD"), json.path("pubType").asInt(60));

        FiatDestination destination = oracle.fiatDestination(json.path("toPegged").asBoolean(true),
                json.get("address").asText(), json.get("height").asInt(), json.get("base").asText(), json.get("amount").asLong());

        ObjectNode resJson = mapper.createObjectNode();
        resJson.put("peggedAmount", destination.peggedAmount());
        resJson.put("pegged", PaxCoinsUtils.toDecimalString(destination.peggedAmount()));
        destination.pubkey().ifPresent(p -> resJson.put("pubkey", BytesUtils.toHexString(p.bytes())));
        destination.destAddress().ifPresent(a -> resJson.put("destAddress", a));
        printer.print(resJson.toString());
    }

    private void scan(JsonNode json) {
        String usage = "scan { \"config\": <path to settings file>, \"coin\": <ticker>, \"from\": <height> }";
        if (!json.has("config") || !json.get("config").isTextual()) {
            printUsage("config is not specified or has invalid format.", usage);
            return;
        } else if (!json.has("coin") || !json.get("coin").isTextual()) {
            printUsage("coin is not specified or has invalid format.", usage);
            return;
        }
        IssuerSettings settings = readSettings(json.get("config").asText());
        CoinRegistry registry = IssuerAppModule.coinRegistry(settings);
        ChainAdapter chain = registry.get(json.get("coin").asText())
                .orElseThrow(() -> new IllegalArgumentException("coin is not configured as a remote coin: " + json.get("coin").asText()));
        RpcClient registryRpc = registry.rpcClient(settings.registryCoin())
                .orElseThrow(() -> new IllegalArgumentException("registry coin is not configured: " + settings.registryCoin()));
        int destPubType = registry.settings(settings.registryCoin()).map(CoinSettings::pubType).orElseThrow();

        PaxLedger ledger = new PaxLedger();
        IssuanceScanner scanner = new IssuanceScanner(chain, new PriceOracleClient(registryRpc, settings.nativeUnit(), destPubType),
                ledger, settings, Clock.systemUTC(), json.path("from").asInt(1));
        ScanResult result = scanner.scan();

        ObjectNode resJson = mapper.createObjectNode();
        resJson.put("status", result.status().name());
        resJson.put("height", result.height());
        resJson.put("targetHeight", result.targetHeight());
        resJson.put("realtime", result.realtime());
        ArrayNode entries = resJson.putArray("withdrawals");
        for (PegTransaction entry : ledger.entries()) {
            ObjectNode item = entries.addObject();
            item.put("txid", entry.txid().toHex());
            item.put("vout", entry.vout());
            item.put("symbol", entry.symbol());
            item.put("fiatoshis", entry.fiatoshis());
            item.put("peggedAmount", entry.peggedAmount());
            item.put("address", entry.coinAddress());
            item.put("height", entry.height());
        }
        resJson.put("pendingTotal", ledger.total());
        printer.print(resJson.toString());
    }

    private void haveUtxo(JsonNode json) {
        String usage = "haveUtxo { \"config\": <path to settings file>, \"coin\": <ticker>, \"address\": <base58 address> }";
        if (!json.has("config") || !json.get("config").isTextual()) {
            printUsage("config is not specified or has invalid format.", usage);
            return;
        } else if (!json.has("coin") || !json.get("coin").isTextual()) {
            printUsage("coin is not specified or has invalid format.", usage);
            return;
        } else if (!json.has("address") || !json.get("address").isTextual()) {
            printUsage("address is not specified or has invalid format.", usage);
            return;
        }
        IssuerSettings settings = readSettings(json.get("config").asText());
        ChainAdapter chain = remoteAdapter(settings, json.get("coin").asText());

        UtxoSelection selection = new FundingWatcher(chain, settings.fundingDenomination(), new SecureRandom())
                .haveUtxo(json.get("address").asText());

        ObjectNode resJson = mapper.createObjectNode();
        resJson.put("count", selection.count());
        selection.selected().ifPresent(c -> {
            ObjectNode item = resJson.putObject("selected");
            item.put("txid", c.txid().toHex());
            item.put("vout", c.vout());
            item.put("amount", c.amount());
            item.put("scriptPubKey", c.scriptPubKey());
        });
        printer.print(resJson.toString());
    }

    private void notaries(JsonNode json) {
        String usage = "notaries { \"config\": <path to settings file>, \"height\": height }";
        if (!json.has("config") || !json.get("config").isTextual()) {
            printUsage("config is not specified or has invalid format.", usage);
            return;
        } else if (!json.has("height") || !json.get("height").canConvertToInt()) {
            printUsage("height is not specified or has invalid format.", usage);
            return;
        }
        IssuerSettings settings = readSettings(json.get("config").asText());
        CoinSettings registryCoin = settings.coin(settings.registryCoin())
                .orElseThrow(() -> new IllegalArgumentException("registry coin is not configured: " + settings.registryCoin()));
        RpcClient rpc = new RpcClient(registryCoin.rpcUrl(), registryCoin.rpcUser(), registryCoin.rpcPassword(), registryCoin.rpcTimeout());

        Optional<NotarySet> notaries = new NotaryRegistry(rpc, registryCoin.mode()).notaries(json.get("height").asInt());
        if (notaries.isEmpty()) {
            printError("notaries are not available at height " + json.get("height").asInt());
            return;
        }

        ObjectNode resJson = mapper.createObjectNode();
        resJson.put("height", notaries.get().height());
        ArrayNode pubkeys = resJson.putArray("pubkeys");
        for (int i = 0; i < notaries.get().size(); i++)
            pubkeys.add(BytesUtils.toHexString(notaries.get().pubkey(i)));
        printer.print(resJson.toString());
    }

    private ObjectNode pubkeyJson(PaxPubkey pubkey) {
        ObjectNode resJson = mapper.createObjectNode();
        resJson.put("short", pubkey.shortFlag());
        resJson.put("ticker", pubkey.ticker());
        resJson.put("amount", pubkey.amount());
        resJson.put("addressType", pubkey.addressType());
        resJson.put("rmd160", BytesUtils.toHexString(pubkey.rmd160()));
        resJson.put("address", pubkey.address().toBase58());
        return resJson;
    }

    private static IssuerSettings readSettings(String path) {
        return SettingsReader.fromConfig(SettingsReader.readConfigFromPath(path));
    }

    private static ChainAdapter remoteAdapter(IssuerSettings settings, String symbol) {
        CoinSettings coin = settings.coin(symbol)
                .orElseThrow(() -> new IllegalArgumentException("coin is not configured: " + symbol));
        return new RemoteChainAdapter(coin.symbol(),
                new RpcClient(coin.rpcUrl(), coin.rpcUser(), coin.rpcPassword(), coin.rpcTimeout()));
    }
}
