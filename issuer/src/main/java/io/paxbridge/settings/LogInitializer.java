package io.paxbridge.settings;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class LogInitializer {
    private static boolean initDone = false;
    // note: the order is important, from the most verbose level to "off"
    private static final Set<String> levelSet = new LinkedHashSet<>(
            List.of("all", "trace", "debug", "info", "warn", "error", "fatal", "off"));

    public static synchronized void initLogManager(String logDir, String logFileName, String logFileLevel, String logConsoleLevel) {
        if (initDone) return;
        initDone = true;

        String checkedFileLevel = getCheckedLevel(logFileLevel);
        String checkedConsoleLevel = getCheckedLevel(logConsoleLevel);
        String logRootLevel = getRootLevel(checkedFileLevel, checkedConsoleLevel);

        // make sure logDir ends with a separator
        if (!logDir.isBlank() && !logDir.endsWith(File.separator)) {
            logDir = logDir + File.separator;
        }

        // init log4j2 logger
        System.setProperty("logDir", logDir);
        System.setProperty("logFileName", logFileName);
        System.setProperty("logRootLevel", logRootLevel);
        System.setProperty("logFileLevel", checkedFileLevel);
        System.setProperty("logConsoleLevel", checkedConsoleLevel);

        Logger logger = LogManager.getLogger(LogInitializer.class);
        logger.log(
            Level.INFO, "Logging system started, log file: [{}], file log level: [{}], console log level: [{}]",
            logDir + logFileName, checkedFileLevel, checkedConsoleLevel
        );
    }

    public static void initLogManager(IssuerSettings settings) {
        IssuerSettings.LogSettings log = settings.log();
        initLogManager(log.logDir, log.logFileName, log.logFileLevel, log.logConsoleLevel);
    }

    // root level is the most verbose of the two appender levels
    static String getRootLevel(String fileLevel, String consoleLevel) {
        for (var level : levelSet) {
            if (level.equals(fileLevel) || level.equals(consoleLevel))
                return level;
        }
        return "all";
    }

    public static String getCheckedLevel(String inLevel) {
        if (inLevel != null && levelSet.contains(inLevel.toLowerCase())) {
            return inLevel.toLowerCase();
        }
        System.out.println("ERROR: specified log4j level: [" + inLevel + "] not valid: defaulting to [info]");
        return "info";
    }
}
