package org.monetdb.client.log;

import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.slf4j.helpers.MessageFormatter;

/**
 * {@link MonetLogger} backed by java.util.logging. Output written through a handler configured
 * with {@link Slf4jFormatter} looks the same as the SLF4J back end.
 */
public class JulLogger implements MonetLogger {

  private final Logger logger;

  public JulLogger(String name) {
    this.logger = Logger.getLogger(name);
  }

  @Override
  public void trace(String format, Object... arguments) {
    log(Level.FINEST, null, format, arguments);
  }

  @Override
  public void debug(String format, Object... arguments) {
    log(Level.FINE, null, format, arguments);
  }

  @Override
  public void info(String format, Object... arguments) {
    log(Level.INFO, null, format, arguments);
  }

  @Override
  public void warn(String format, Object... arguments) {
    log(Level.WARNING, null, format, arguments);
  }

  @Override
  public void error(String format, Object... arguments) {
    log(Level.SEVERE, null, format, arguments);
  }

  @Override
  public void error(Throwable throwable, String format, Object... arguments) {
    log(Level.SEVERE, throwable, format, arguments);
  }

  @Override
  public boolean isDebugEnabled() {
    return logger.isLoggable(Level.FINE);
  }

  static String render(String format, Object... arguments) {
    return MessageFormatter.arrayFormat(format, arguments).getMessage();
  }

  private void log(Level level, Throwable throwable, String format, Object... arguments) {
    if (!logger.isLoggable(level)) {
      return;
    }
    LogRecord record = new LogRecord(level, render(format, arguments));
    record.setLoggerName(logger.getName());
    record.setThrown(throwable);
    // the caller is the frame above this facade
    StackTraceElement[] stack = new Throwable().getStackTrace();
    if (stack.length > 2) {
      record.setSourceClassName(stack[2].getClassName());
      record.setSourceMethodName(stack[2].getMethodName());
    }
    logger.log(record);
  }
}
