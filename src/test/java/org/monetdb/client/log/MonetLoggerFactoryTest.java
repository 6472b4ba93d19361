package org.monetdb.client.log;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class MonetLoggerFactoryTest {

  @AfterEach
  void tearDown() {
    System.clearProperty(MonetLoggerFactory.LOGGER_IMPL_PROPERTY);
  }

  @Test
  void testSlf4jIsDefault() {
    assertTrue(MonetLoggerFactory.getLogger(MonetLoggerFactoryTest.class) instanceof Slf4jLogger);
  }

  @Test
  void testUnknownImplFallsBackToSlf4j() {
    System.setProperty(MonetLoggerFactory.LOGGER_IMPL_PROPERTY, "log4j");
    assertTrue(MonetLoggerFactory.getLogger(MonetLoggerFactoryTest.class) instanceof Slf4jLogger);
  }

  @Test
  void testJdkLoggerSelected() {
    System.setProperty(MonetLoggerFactory.LOGGER_IMPL_PROPERTY, "jdklogger");
    assertTrue(MonetLoggerFactory.getLogger(MonetLoggerFactoryTest.class) instanceof JulLogger);
  }

  @Test
  void testJulLoggerFormatsPlaceholdersAndSource() {
    String name = "org.monetdb.client.log.test." + System.nanoTime();
    Logger julLogger = Logger.getLogger(name);
    List<LogRecord> records = new ArrayList<>();
    Handler handler =
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            records.add(record);
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };
    julLogger.addHandler(handler);
    julLogger.setUseParentHandlers(false);
    julLogger.setLevel(Level.ALL);

    JulLogger logger = new JulLogger(name);
    logger.debug("Window now ({},{})", 100, 300);
    logger.error(new IllegalStateException("lost"), "Fetch of result {} failed", 7);

    assertEquals(2, records.size());
    assertEquals("Window now (100,300)", records.get(0).getMessage());
    assertEquals(Level.FINE, records.get(0).getLevel());
    assertEquals(MonetLoggerFactoryTest.class.getName(), records.get(0).getSourceClassName());
    assertEquals(
        "testJulLoggerFormatsPlaceholdersAndSource", records.get(0).getSourceMethodName());
    assertEquals("Fetch of result 7 failed", records.get(1).getMessage());
    assertEquals("lost", records.get(1).getThrown().getMessage());
    assertTrue(logger.isDebugEnabled());
  }
}
