package io.paxbridge;

import io.paxbridge.tools.utils.ConsolePrinter;
import io.paxbridge.tools.utils.MessagePrinter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.Scanner;

public class PaxTool {
    public static void main(String[] args) {

        // initialize log properties since this app uses log4j from the issuer library
        // - no log dir here
        System.setProperty("logDir", "");
        // - default name for the log file
        String logFileName = System.getProperty("java.io.tmpdir") + File.separator + "pax_tool.log";
        System.setProperty("logFileName", logFileName);
        // - default levels: all in the file and just errors on console
        System.setProperty("logFileLevel", "all");
        System.setProperty("logConsoleLevel", "error");

        Logger logger = LogManager.getLogger(PaxTool.class);

        MessagePrinter printer = new ConsolePrinter();
        PaxToolCommandProcessor processor = new PaxToolCommandProcessor(printer);
        if (args.length > 0)
            try {
                StringBuilder cmd = new StringBuilder(args[0]);
                for (int i = 1; i < args.length; i++)
                    cmd.append(" ").append(args[i]);
                logger.info("Starting pax tool with cmd input: " + cmd);
                processor.processCommand(cmd.toString());
            } catch (Exception e) {
                printer.print(e.getMessage());
            }
        else {
            printer.print("Tool successfully started...\nPlease, enter the command:");
            Scanner scanner = new Scanner(System.in);
            while (scanner.hasNextLine()) {
                String input = scanner.nextLine();
                try {
                    if (input.startsWith("exit"))
                        break;
                    logger.info("Starting pax tool with cmd input: " + input);
                    processor.processCommand(input);
                } catch (Exception e) {
                    printer.print(e.getMessage());
                }
            }
        }
        logger.info("... exiting pax tool application.");
    }
}
