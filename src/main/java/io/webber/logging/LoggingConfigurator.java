package io.webber.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code --verbose} switch by lowering the Logback root logger to DEBUG.
 *
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /** Switches the root logger to DEBUG; a no-op with a warning on other SLF4J backends. */
  public static void enableVerboseLogging() {
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend is not Logback");
      return;
    }
    context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
    log.debug("Verbose logging enabled");
  }
}
