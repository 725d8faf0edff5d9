package io.paxbridge.issuer;

import com.google.inject.Inject;
import com.google.inject.name.Named;
import io.paxbridge.chain.ChainAdapter;
import io.paxbridge.chain.CoinRegistry;
import io.paxbridge.ledger.PaxLedger;
import io.paxbridge.notary.FundingWatcher;
import io.paxbridge.notary.UtxoSelection;
import io.paxbridge.oracle.PriceOracleClient;
import io.paxbridge.rpc.RpcClient;
import io.paxbridge.settings.CoinSettings;
import io.paxbridge.settings.IssuerSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs one issuance scanner per scanning coin and the funding checks of the configured
 * notary addresses, each as a fixed delay task sharing a single ledger.
 */
public class IssuerService {
    private static final Logger logger = LogManager.getLogger(IssuerService.class);

    private final IssuerSettings settings;
    private final CoinRegistry registry;
    private final PaxLedger ledger;
    private final Clock clock;
    private final Random random;

    private final List<IssuanceScanner> scanners = new ArrayList<>();
    private final Map<String, ScanResult> lastResults = new ConcurrentHashMap<>();
    private ScheduledExecutorService executor;

    @Inject
    public IssuerService(@Named("IssuerSettings") IssuerSettings settings,
                         @Named("CoinRegistry") CoinRegistry registry,
                         @Named("PaxLedger") PaxLedger ledger,
                         @Named("Clock") Clock clock,
                         @Named("FundingRandom") Random random) {
        this.settings = settings;
        this.registry = registry;
        this.ledger = ledger;
        this.clock = clock;
        this.random = random;
    }

    public synchronized void start() {
        if (executor != null)
            throw new IllegalStateException("Issuer service is already running");

        PriceOracleClient oracle = priceOracle();
        List<Runnable> tasks = new ArrayList<>();
        List<Duration> delays = new ArrayList<>();

        for (CoinSettings coin : settings.coins()) {
            Optional<ChainAdapter> adapter = registry.get(coin.symbol());
            if (adapter.isEmpty()) {
                logger.warn("coin {} is configured but not registered, skipped", coin.symbol());
                continue;
            }
            if (coin.scan()) {
                IssuanceScanner scanner = new IssuanceScanner(adapter.get(), oracle, ledger, settings, clock, 1);
                scanners.add(scanner);
                tasks.add(() -> runScan(scanner));
                delays.add(settings.scanInterval());
            }
            if (!coin.notaryAddresses().isEmpty()) {
                FundingWatcher watcher = new FundingWatcher(adapter.get(), settings.fundingDenomination(), random);
                for (String address : coin.notaryAddresses()) {
                    tasks.add(() -> runFundingCheck(watcher, coin.symbol(), address));
                    delays.add(settings.fundingInterval());
                }
            }
        }

        // one thread per task: a long catch-up scan never holds back the funding checks
        executor = Executors.newScheduledThreadPool(Math.max(1, tasks.size()));
        for (int i = 0; i < tasks.size(); i++)
            schedule(tasks.get(i), delays.get(i));
        logger.info("issuer service started: {} scanner(s), {} task(s), peg {}{}", scanners.size(), tasks.size(),
                settings.pegShortFlag() ? "short " : "", settings.pegSymbol());
    }

    public synchronized void stop() {
        if (executor == null)
            return;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS))
                logger.warn("issuer tasks did not terminate in time");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        scanners.clear();
        logger.info("issuer service stopped, {} pending fiat", ledger.total());
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    public synchronized List<IssuanceScanner> scanners() {
        return Collections.unmodifiableList(new ArrayList<>(scanners));
    }

    public Optional<ScanResult> lastResult(String symbol) {
        return Optional.ofNullable(lastResults.get(symbol));
    }

    public PaxLedger ledger() {
        return ledger;
    }

    // The price service lives on the registry chain's daemon
    PriceOracleClient priceOracle() {
        RpcClient rpc = registry.rpcClient(settings.registryCoin())
                .orElseThrow(() -> new IllegalStateException("Registry coin is not registered: " + settings.registryCoin()));
        int destPubType = registry.settings(settings.registryCoin()).map(CoinSettings::pubType).orElseThrow();
        return new PriceOracleClient(rpc, settings.nativeUnit(), destPubType);
    }

    ScanResult runScan(IssuanceScanner scanner) {
        ScanResult result = scanner.scan();
        lastResults.put(scanner.symbol(), result);
        logger.debug("{} {}", scanner.symbol(), result);
        if (result.status() == ScanResult.Status.CHAIN_UNAVAILABLE)
            pause(settings.failurePause());
        return result;
    }

    // Number of eligible funding outputs at one notary address
    int runFundingCheck(FundingWatcher watcher, String symbol, String address) {
        UtxoSelection selection = watcher.haveUtxo(address);
        logger.info("{} {} has {} funding utxo(s)", symbol, address, selection.count());
        return selection.count();
    }

    private void schedule(Runnable task, Duration delay) {
        long millis = Math.max(1, delay.toMillis());
        executor.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // an escaping exception would cancel the periodic task
                logger.error("issuer task failed", e);
            }
        }, 0, millis, TimeUnit.MILLISECONDS);
    }

    private static void pause(Duration pause) {
        if (pause.isZero() || pause.isNegative())
            return;
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
