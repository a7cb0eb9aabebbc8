package ca.gc.cra.metawriter.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Switches MetaWriter's own loggers to DEBUG at runtime for {@code --verbose} and the {@code verbose} setting.
 *
 * <p>Only the {@value #APPLICATION_LOGGER} hierarchy is raised; third-party loggers keep the levels from
 * {@code logback.xml}.</p>
 *
 * @implNote Requires Logback; other SLF4J bindings log a warning and keep their configuration.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Root of the application's logger hierarchy. */
  public static final String APPLICATION_LOGGER = "ca.gc.cra.metawriter";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /**
   * Raises the application loggers to DEBUG.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} cannot change levels at runtime",
          factory.getClass().getName());
      return false;
    }
    Logger app = context.getLogger(APPLICATION_LOGGER);
    if (app.getLevel() != Level.DEBUG) {
      app.setLevel(Level.DEBUG);
      log.debug("Debug logging enabled for {}", APPLICATION_LOGGER);
    }
    return true;
  }
}
