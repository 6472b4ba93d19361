package org.monetdb.client.dbclient;

/**
 * Session options that can be set as part of the login handshake. The level numbers are the ones
 * the server uses to announce which options it understands; a server that announces level {@code
 * n} accepts every option with a lower level.
 */
public enum HandshakeOptionKey {
  AUTO_COMMIT(1, "auto_commit"),
  REPLY_SIZE(2, "reply_size"),
  SIZE_HEADER(3, "size_header"),
  TIME_ZONE(5, "time_zone");

  private final int level;
  private final String optionName;

  HandshakeOptionKey(int level, String optionName) {
    this.level = level;
    this.optionName = optionName;
  }

  public int getLevel() {
    return level;
  }

  public String getOptionName() {
    return optionName;
  }
}
