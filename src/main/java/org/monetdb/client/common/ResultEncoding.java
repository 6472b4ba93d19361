package org.monetdb.client.common;

/** Wire encoding of a batch of result rows. */
public enum ResultEncoding {
  TEXT,
  BINARY
}
