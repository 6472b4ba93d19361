package org.monetdb.client.api.impl;

import java.util.Map;
import java.util.Properties;
import org.monetdb.client.api.internal.IMonetConnectionContext;
import org.monetdb.client.common.MonetConnectionParams;
import org.monetdb.client.common.util.StringUtil;
import org.monetdb.client.common.util.ValidationUtil;
import org.monetdb.client.exception.MonetValidationException;
import org.monetdb.client.log.MonetLogger;
import org.monetdb.client.log.MonetLoggerFactory;

/**
 * Connection settings resolved from properties and URL options. Options in the URL query string
 * take precedence over properties; absent values fall back to the {@link MonetConnectionParams}
 * defaults.
 */
public class MonetConnectionContext implements IMonetConnectionContext {

  private static final MonetLogger LOGGER =
      MonetLoggerFactory.getLogger(MonetConnectionContext.class);

  private final String url;
  private final int binaryLevel;
  private final int replySize;
  private final int maxPrefetch;
  private final boolean autoCommit;
  private final int connectTimeout;

  private MonetConnectionContext(String url, Map<String, String> urlOptions, Properties properties)
      throws MonetValidationException {
    this.url = url;
    this.binaryLevel =
        ValidationUtil.parseInteger(
            StringUtil.normalizeBinaryLevel(
                resolve(MonetConnectionParams.BINARY, urlOptions, properties)),
            MonetConnectionParams.BINARY.getParamName());
    this.replySize = parseInt(MonetConnectionParams.REPLY_SIZE, urlOptions, properties);
    this.maxPrefetch = parseInt(MonetConnectionParams.MAX_PREFETCH, urlOptions, properties);
    this.autoCommit =
        Boolean.parseBoolean(resolve(MonetConnectionParams.AUTO_COMMIT, urlOptions, properties));
    this.connectTimeout = parseInt(MonetConnectionParams.CONNECT_TIMEOUT, urlOptions, properties);

    ValidationUtil.checkReplySize(replySize, MonetConnectionParams.REPLY_SIZE.getParamName());
    ValidationUtil.checkUnlimitedOrNonNegative(
        maxPrefetch, MonetConnectionParams.MAX_PREFETCH.getParamName());
  }

  /**
   * Builds a context from a MAPI URL and connection properties.
   *
   * @param url the MAPI URL, may be null
   * @param properties connection properties, may be null
   * @throws MonetValidationException if a value is malformed or out of range
   */
  public static MonetConnectionContext parse(String url, Properties properties)
      throws MonetValidationException {
    Properties props = properties != null ? properties : new Properties();
    MonetConnectionContext context =
        new MonetConnectionContext(url, StringUtil.parseUrlOptions(url), props);
    LOGGER.debug(
        "Connection context - binary={}, replysize={}, maxprefetch={}, autocommit={}",
        context.binaryLevel,
        context.replySize,
        context.maxPrefetch,
        context.autoCommit);
    return context;
  }

  private static String resolve(
      MonetConnectionParams param, Map<String, String> urlOptions, Properties properties) {
    String fromUrl = urlOptions.get(param.getParamName());
    if (fromUrl != null) {
      return fromUrl;
    }
    return properties.getProperty(param.getParamName(), param.getDefaultValue());
  }

  private static int parseInt(
      MonetConnectionParams param, Map<String, String> urlOptions, Properties properties)
      throws MonetValidationException {
    return ValidationUtil.parseInteger(
        resolve(param, urlOptions, properties), param.getParamName());
  }

  @Override
  public String getUrl() {
    return url;
  }

  @Override
  public int getBinaryLevel() {
    return binaryLevel;
  }

  @Override
  public int getReplySize() {
    return replySize;
  }

  @Override
  public int getMaxPrefetch() {
    return maxPrefetch;
  }

  @Override
  public boolean getAutoCommit() {
    return autoCommit;
  }

  @Override
  public int getConnectTimeout() {
    return connectTimeout;
  }
}
