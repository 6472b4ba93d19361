package org.monetdb.client.log;

/**
 * Logging facade used throughout the client. Messages use SLF4J style {@code {}} placeholders
 * regardless of the back end that renders them.
 */
public interface MonetLogger {

  void trace(String format, Object... arguments);

  void debug(String format, Object... arguments);

  void info(String format, Object... arguments);

  void warn(String format, Object... arguments);

  void error(String format, Object... arguments);

  void error(Throwable throwable, String format, Object... arguments);

  boolean isDebugEnabled();
}
