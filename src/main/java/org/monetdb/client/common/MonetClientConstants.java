package org.monetdb.client.common;

public final class MonetClientConstants {

  private MonetClientConstants() {}

  public static final String MAPI_URL_PREFIX = "mapi:monetdb://";

  /** Reply size meaning "the whole result set in one response". */
  public static final int UNLIMITED = -1;

  public static final int DEFAULT_REPLY_SIZE = 100;
  public static final int DEFAULT_MAX_PREFETCH = 2500;

  /** Page size reported to bulk readers when the reply size is unlimited. */
  public static final int DEFAULT_ARRAY_SIZE = 100;

  /**
   * Initial reply size requested instead of {@link #UNLIMITED} when the remainder can be pulled in
   * binary form afterwards.
   */
  public static final int UNLIMITED_BINARY_INITIAL_REPLY_SIZE = 10;

  /** Server reply size before the handshake changed it. */
  public static final int SERVER_DEFAULT_REPLY_SIZE = 100;

  /** Lowest server binary export level that can serve binary result batches. */
  public static final int MIN_BINARY_EXPORT_LEVEL = 1;

  // Low-level MAPI commands
  public static final String CMD_AUTO_COMMIT = "Xauto_commit %d";
  public static final String CMD_REPLY_SIZE = "Xreply_size %d";
  public static final String CMD_SIZE_HEADER = "Xsizeheader %d";
  public static final String SET_TIME_ZONE_SQL = "SET TIME ZONE INTERVAL '%s' HOUR TO MINUTE;";
}
