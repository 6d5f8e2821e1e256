package com.acme.metadata.extractor.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Installs the bundled JUL configuration and applies the {@code --log-level} option.
 */
final class LogLevels {
    private static final String CONFIG_RESOURCE = "/extractor-logging.properties";

    private LogLevels() {
    }

    static Level parse(String name) {
        if (name == null) {
            return Level.INFO;
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "DEBUG", "TRACE" -> Level.FINE;
            case "WARN", "WARNING" -> Level.WARNING;
            case "ERROR" -> Level.SEVERE;
            default -> Level.INFO;
        };
    }

    static void configure(String levelName) {
        try (InputStream in = LogLevels.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(LogLevels.class.getName()).warning("Cannot load " + CONFIG_RESOURCE + ": " + e.getMessage());
        }
        Level level = parse(levelName);
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }
}
