package org.monetdb.client.api.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.monetdb.client.exception.MonetValidationException;

public class MonetConnectionContextTest {

  @Test
  void testDefaults() throws MonetValidationException {
    MonetConnectionContext context = MonetConnectionContext.parse(null, null);

    assertEquals(1, context.getBinaryLevel());
    assertEquals(100, context.getReplySize());
    assertEquals(2500, context.getMaxPrefetch());
    assertFalse(context.getAutoCommit());
    assertEquals(-1, context.getConnectTimeout());
    assertNull(context.getUrl());
  }

  @Test
  void testPropertiesApplied() throws MonetValidationException {
    Properties properties = new Properties();
    properties.setProperty("replysize", "-1");
    properties.setProperty("maxprefetch", "0");
    properties.setProperty("binary", "0");
    properties.setProperty("autocommit", "true");
    properties.setProperty("connect_timeout", "3000");

    MonetConnectionContext context =
        MonetConnectionContext.parse("mapi:monetdb://localhost:50000/demo", properties);

    assertEquals(-1, context.getReplySize());
    assertEquals(0, context.getMaxPrefetch());
    assertEquals(0, context.getBinaryLevel());
    assertTrue(context.getAutoCommit());
    assertEquals(3000, context.getConnectTimeout());
  }

  @Test
  void testUrlOptionsOverrideProperties() throws MonetValidationException {
    Properties properties = new Properties();
    properties.setProperty("replysize", "20");
    properties.setProperty("binary", "1");

    MonetConnectionContext context =
        MonetConnectionContext.parse(
            "mapi:monetdb://localhost:50000/demo?replysize=250&binary=off&maxprefetch=-1",
            properties);

    assertEquals(250, context.getReplySize());
    assertEquals(0, context.getBinaryLevel());
    assertEquals(-1, context.getMaxPrefetch());
  }

  @Test
  void testBinarySpellings() throws MonetValidationException {
    assertEquals(1, MonetConnectionContext.parse("mapi:monetdb://h/db?binary=on", null)
        .getBinaryLevel());
    assertEquals(1, MonetConnectionContext.parse("mapi:monetdb://h/db?binary=TRUE", null)
        .getBinaryLevel());
    assertEquals(0, MonetConnectionContext.parse("mapi:monetdb://h/db?binary=false", null)
        .getBinaryLevel());
    assertEquals(2, MonetConnectionContext.parse("mapi:monetdb://h/db?binary=2", null)
        .getBinaryLevel());
  }

  @Test
  void testInvalidValuesRejected() {
    assertThrows(
        MonetValidationException.class,
        () -> MonetConnectionContext.parse("mapi:monetdb://h/db?replysize=lots", null));
    assertThrows(
        MonetValidationException.class,
        () -> MonetConnectionContext.parse("mapi:monetdb://h/db?replysize=0", null));
    assertThrows(
        MonetValidationException.class,
        () -> MonetConnectionContext.parse("mapi:monetdb://h/db?maxprefetch=-3", null));
    assertThrows(
        MonetValidationException.class,
        () -> MonetConnectionContext.parse("mapi:monetdb://h/db?binary=maybe", null));
  }
}
