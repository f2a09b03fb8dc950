package com.minimax.games;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Loads the bundled {@code logging.properties} for the command line entry points.
 */
final class LoggingSupport {

    private static final Logger LOGGER = Logger.getLogger(LoggingSupport.class.getName());
    private static final String CONFIG_RESOURCE = "/logging.properties";

    private LoggingSupport() {
    }

    static void configure() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream input = LoggingSupport.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (input == null) {
                LOGGER.warning("Logging configuration " + CONFIG_RESOURCE + " not found on the classpath");
                return;
            }
            LogManager.getLogManager().readConfiguration(input);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to load logging configuration", ex);
        }
    }
}
