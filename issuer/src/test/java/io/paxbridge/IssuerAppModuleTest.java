package io.paxbridge;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.typesafe.config.ConfigFactory;
import io.paxbridge.chain.CoinRegistry;
import io.paxbridge.issuer.IssuerService;
import io.paxbridge.settings.IssuerSettings;
import io.paxbridge.settings.SettingsReader;
import org.junit.Test;

import static org.junit.Assert.*;

public class IssuerAppModuleTest {

    private static IssuerSettings settings() {
        return SettingsReader.fromConfig(ConfigFactory.parseString(
                "pax.coins = [{ symbol = KMD }, { symbol = BTC, mode = EmbeddedFull, pubType = 0 }]")
                .withFallback(ConfigFactory.defaultReference())
                .resolve());
    }

    @Test
    public void coinRegistrySkipsEmbeddedCoins() {
        CoinRegistry registry = IssuerAppModule.coinRegistry(settings());
        assertTrue(registry.get("KMD").isPresent());
        assertTrue(registry.get("BTC").isEmpty());
    }

    @Test
    public void injectsIssuerService() {
        Injector injector = Guice.createInjector(new IssuerAppModule(settings()));
        IssuerService service = injector.getInstance(IssuerService.class);

        assertNotNull(service);
        assertFalse(service.isRunning());
        assertEquals(0, service.ledger().size());
    }
}
