package io.paxbridge;

import com.google.inject.AbstractModule;
import com.google.inject.name.Names;
import io.paxbridge.chain.CoinRegistry;
import io.paxbridge.ledger.PaxLedger;
import io.paxbridge.settings.CoinSettings;
import io.paxbridge.settings.IssuerSettings;
import io.paxbridge.settings.SettingsReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

public class IssuerAppModule extends AbstractModule {
    private static final Logger logger = LogManager.getLogger(IssuerAppModule.class);

    private final IssuerSettings issuerSettings;

    public IssuerAppModule(String userSettingsFileName) {
        this(new SettingsReader(userSettingsFileName).getIssuerSettings());
    }

    public IssuerAppModule(IssuerSettings issuerSettings) {
        this.issuerSettings = issuerSettings;
    }

    @Override
    protected void configure() {
        bind(IssuerSettings.class)
                .annotatedWith(Names.named("IssuerSettings"))
                .toInstance(issuerSettings);

        bind(CoinRegistry.class)
                .annotatedWith(Names.named("CoinRegistry"))
                .toInstance(coinRegistry(issuerSettings));

        bind(PaxLedger.class)
                .annotatedWith(Names.named("PaxLedger"))
                .toInstance(new PaxLedger());

        bind(Clock.class)
                .annotatedWith(Names.named("Clock"))
                .toInstance(Clock.systemUTC());

        bind(Random.class)
                .annotatedWith(Names.named("FundingRandom"))
                .toInstance(new SecureRandom());
    }

    // Only remote coins can be served from configuration, an embedded node has to be registered by its host
    static CoinRegistry coinRegistry(IssuerSettings settings) {
        CoinRegistry registry = new CoinRegistry();
        for (CoinSettings coin : settings.coins()) {
            if (coin.mode().isEmbedded())
                logger.warn("coin {} needs an embedded node, not registered", coin.symbol());
            else
                registry.registerRemote(coin);
        }
        return registry;
    }
}
