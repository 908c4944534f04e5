package com.github.simbo1905.pingstore;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/// Sends the store's JUL output to stdout, one line per record with the thread name, so that
/// interleavings in the concurrency tests can be read back and Maven does not report the
/// WARNING lines of the negative tests as build warnings. Store tests extend this class.
///
/// The level comes from the `com.github.simbo1905.pingstore.testLogLevel` system property
/// (INFO unless set; an unknown name also means INFO).
public abstract class JulLoggingConfig {

  static final String LOG_LEVEL_PROPERTY = "com.github.simbo1905.pingstore.testLogLevel";

  // strong reference; JUL only holds loggers weakly and would drop the configuration
  private static final Logger STORE_LOGGER =
      Logger.getLogger(JulLoggingConfig.class.getPackageName());

  static {
    final Level level = levelFromProperty();
    final ConsoleHandler stdout =
        new ConsoleHandler() {
          {
            setOutputStream(System.out);
          }
        };
    stdout.setLevel(level);
    stdout.setFormatter(new TestLineFormatter());

    STORE_LOGGER.setUseParentHandlers(false);
    STORE_LOGGER.addHandler(stdout);
    STORE_LOGGER.setLevel(level);
  }

  private static Level levelFromProperty() {
    final String name = System.getProperty(LOG_LEVEL_PROPERTY, "INFO").trim();
    try {
      return Level.parse(name.toUpperCase());
    } catch (IllegalArgumentException unknown) {
      return Level.INFO;
    }
  }

  /// `12:04:05.123 [pool-1-thread-2] WARNING JsonFilePingStore: message`
  private static final class TestLineFormatter extends Formatter {

    @Override
    public String format(LogRecord record) {
      final String source = record.getLoggerName();
      final StringBuilder line =
          new StringBuilder()
              .append(LocalTime.ofInstant(record.getInstant(), ZoneId.systemDefault()))
              .append(" [")
              .append(Thread.currentThread().getName())
              .append("] ")
              .append(record.getLevel().getName())
              .append(' ')
              .append(source == null ? "" : source.substring(source.lastIndexOf('.') + 1))
              .append(": ")
              .append(formatMessage(record))
              .append(System.lineSeparator());
      if (record.getThrown() != null) {
        final StringWriter trace = new StringWriter();
        record.getThrown().printStackTrace(new PrintWriter(trace));
        line.append(trace);
      }
      return line.toString();
    }
  }
}
