package com.queuectl.app;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Installs the bundled {@code logging.properties} unless the JVM was started with
 * {@code -Djava.util.logging.config.file}.
 */
final class LoggingSetup {
    static final String CONFIG_FILE_PROPERTY = "java.util.logging.config.file";
    private static final String BUNDLED_CONFIG = "/logging.properties";

    private LoggingSetup() {
    }

    static void install() {
        if (System.getProperty(CONFIG_FILE_PROPERTY) != null) {
            return;
        }
        try (InputStream in = LoggingSetup.class.getResourceAsStream(BUNDLED_CONFIG)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(LoggingSetup.class.getName())
                    .log(Level.WARNING, "Could not load " + BUNDLED_CONFIG + ", using JVM defaults", e);
        }
    }
}
