package io.paxbridge;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.paxbridge.issuer.IssuerService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;

public class IssuerApp {
    public static void main(String[] args) {
        if (args.length < 1) {
            System.out.println("Please provide settings file name as first parameter!");
            return;
        }

        if (!new File(args[0]).exists()) {
            System.out.println("File on path " + args[0] + " doesn't exist");
            return;
        }
        String settingsFileName = args[0];

        Injector injector = Guice.createInjector(new IssuerAppModule(settingsFileName));
        IssuerService issuerService = injector.getInstance(IssuerService.class);

        Logger logger = LogManager.getLogger(IssuerApp.class);
        logger.info("...starting issuer...");

        Runtime.getRuntime().addShutdownHook(new Thread(issuerService::stop, "issuer-shutdown"));
        issuerService.start();
        System.out.println("Pax issuer successfully started...");
    }
}
