package org.monetdb.client.api.internal;

/** Resolved connection settings. */
public interface IMonetConnectionContext {

  /** The MAPI URL the connection was created for, may be null. */
  String getUrl();

  /** Binary level; binary result batches are used when it is positive. */
  int getBinaryLevel();

  int getReplySize();

  int getMaxPrefetch();

  boolean getAutoCommit();

  /** Socket timeout while connecting in milliseconds, -1 for the transport default. */
  int getConnectTimeout();
}
