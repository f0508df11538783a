package ca.gc.cra.midscan.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Runtime adjustments to the Logback configuration.
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String APP_LOGGER = "ca.gc.cra.midscan";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the application loggers to DEBUG so individual search attempts become visible. Third-party loggers
   * keep their configured level.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger app = context.getLogger(APP_LOGGER);
      if (!Level.DEBUG.equals(app.getLevel())) {
        app.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
