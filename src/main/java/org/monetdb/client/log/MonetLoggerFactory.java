package org.monetdb.client.log;

import java.util.Locale;

/**
 * Creates {@link MonetLogger} instances. The back end is picked once per call from the {@value
 * #LOGGER_IMPL_PROPERTY} system property; SLF4J is used when the property is absent or unknown.
 */
public class MonetLoggerFactory {

  public static final String LOGGER_IMPL_PROPERTY = "org.monetdb.client.loggerImpl";

  /** Supported logging back ends. */
  public enum LoggerImpl {
    SLF4JLOGGER,
    JDKLOGGER;

    static LoggerImpl fromProperty(String value) {
      if (value == null) {
        return SLF4JLOGGER;
      }
      try {
        return LoggerImpl.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        return SLF4JLOGGER;
      }
    }
  }

  private MonetLoggerFactory() {}

  public static MonetLogger getLogger(Class<?> clazz) {
    LoggerImpl impl = LoggerImpl.fromProperty(System.getProperty(LOGGER_IMPL_PROPERTY));
    switch (impl) {
      case JDKLOGGER:
        return new JulLogger(clazz.getName());
      case SLF4JLOGGER:
      default:
        return new Slf4jLogger(clazz);
    }
  }
}
