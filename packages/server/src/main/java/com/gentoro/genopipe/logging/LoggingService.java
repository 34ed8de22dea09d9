package com.gentoro.genopipe.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Single entry point for obtaining loggers and applying configured log levels. */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.level.<logger>: <LEVEL>} entries to Logback. The special key {@code
   * logging.level.root} targets the root logger. Unknown level names fall back to DEBUG, which is
   * Logback's own behaviour for {@link Level#toLevel(String)}.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .warn("Logback is not the active SLF4J binding; logging.level settings are ignored");
      return;
    }

    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String value = levels.getString(name);
      if (value == null || value.isBlank()) continue;
      // Hierarchical configurations escape dots inside a node name by doubling them.
      String unescaped = name.replace("..", ".");
      String loggerName =
          "root".equalsIgnoreCase(unescaped) ? Logger.ROOT_LOGGER_NAME : unescaped;
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim()));
      getLogger(LoggingService.class).debug("Log level for {} set to {}", loggerName, value);
    }
  }
}
