package org.monetdb.client.common;

/** Connection parameters understood by the client, with their default values. */
public enum MonetConnectionParams {
  BINARY("binary", "1"),
  REPLY_SIZE("replysize", String.valueOf(MonetClientConstants.DEFAULT_REPLY_SIZE)),
  MAX_PREFETCH("maxprefetch", String.valueOf(MonetClientConstants.DEFAULT_MAX_PREFETCH)),
  AUTO_COMMIT("autocommit", "false"),
  CONNECT_TIMEOUT("connect_timeout", "-1");

  private final String paramName;
  private final String defaultValue;

  MonetConnectionParams(String paramName, String defaultValue) {
    this.paramName = paramName;
    this.defaultValue = defaultValue;
  }

  public String getParamName() {
    return paramName;
  }

  public String getDefaultValue() {
    return defaultValue;
  }
}
