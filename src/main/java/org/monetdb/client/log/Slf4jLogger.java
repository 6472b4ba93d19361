package org.monetdb.client.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link MonetLogger} backed by SLF4J. */
public class Slf4jLogger implements MonetLogger {

  private final Logger logger;

  public Slf4jLogger(Class<?> clazz) {
    this.logger = LoggerFactory.getLogger(clazz);
  }

  @Override
  public void trace(String format, Object... arguments) {
    logger.trace(format, arguments);
  }

  @Override
  public void debug(String format, Object... arguments) {
    logger.debug(format, arguments);
  }

  @Override
  public void info(String format, Object... arguments) {
    logger.info(format, arguments);
  }

  @Override
  public void warn(String format, Object... arguments) {
    logger.warn(format, arguments);
  }

  @Override
  public void error(String format, Object... arguments) {
    logger.error(format, arguments);
  }

  @Override
  public void error(Throwable throwable, String format, Object... arguments) {
    if (logger.isErrorEnabled()) {
      logger.error(JulLogger.render(format, arguments), throwable);
    }
  }

  @Override
  public boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }
}
