package org.monetdb.client.api.impl;

import static org.monetdb.client.common.MonetClientConstants.CMD_AUTO_COMMIT;
import static org.monetdb.client.common.MonetClientConstants.CMD_REPLY_SIZE;
import static org.monetdb.client.common.MonetClientConstants.CMD_SIZE_HEADER;
import static org.monetdb.client.common.MonetClientConstants.MIN_BINARY_EXPORT_LEVEL;
import static org.monetdb.client.common.MonetClientConstants.SERVER_DEFAULT_REPLY_SIZE;
import static org.monetdb.client.common.MonetClientConstants.SET_TIME_ZONE_SQL;

import com.google.common.annotations.VisibleForTesting;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;
import org.monetdb.client.api.impl.fetch.BatchPolicy;
import org.monetdb.client.api.internal.IMonetConnectionContext;
import org.monetdb.client.common.util.StringUtil;
import org.monetdb.client.dbclient.HandshakeOption;
import org.monetdb.client.dbclient.HandshakeOptionKey;
import org.monetdb.client.dbclient.IMonetClient;
import org.monetdb.client.exception.MonetSQLException;
import org.monetdb.client.exception.MonetValidationException;
import org.monetdb.client.log.MonetLogger;
import org.monetdb.client.log.MonetLoggerFactory;
import org.monetdb.client.model.enums.MonetDriverErrorCode;

/**
 * A session with a MonetDB server.
 *
 * <p>The connection owns the transport and the connection wide {@link BatchPolicy}. Cursors copy
 * the policy when they are created, so the setters here only affect cursors created afterwards.
 * Only one cursor may have a request in flight on a connection at any time.
 */
public class MonetConnection implements AutoCloseable {

  private static final MonetLogger LOGGER = MonetLoggerFactory.getLogger(MonetConnection.class);

  private final IMonetConnectionContext connectionContext;
  private final BatchPolicy policy;
  private IMonetClient client;

  private boolean autoCommit;
  private boolean sizeHeader;
  private int currentReplySize = SERVER_DEFAULT_REPLY_SIZE;
  private int currentTimeZoneSecondsEast = 0;

  /**
   * Opens a session over the given transport and sets it up with the settings of the context.
   *
   * @throws MonetSQLException if the handshake or one of the session settings fails
   */
  public MonetConnection(IMonetClient client, IMonetConnectionContext connectionContext)
      throws MonetSQLException {
    this(client, connectionContext, localTimeZoneOffsetSeconds());
  }

  @VisibleForTesting
  MonetConnection(
      IMonetClient client, IMonetConnectionContext connectionContext, int timeZoneSecondsEast)
      throws MonetSQLException {
    this.client = client;
    this.connectionContext = connectionContext;
    this.autoCommit = connectionContext.getAutoCommit();

    this.policy = new BatchPolicy();
    policy.setBinaryEnabled(connectionContext.getBinaryLevel() > 0);
    policy.setReplySize(connectionContext.getReplySize());
    policy.setMaxPrefetch(connectionContext.getMaxPrefetch());

    int connectTimeout = connectionContext.getConnectTimeout();
    int sessionTimeout = 0;
    if (connectTimeout > 0) {
      sessionTimeout = client.getSocketTimeout();
      client.setSocketTimeout(connectTimeout);
    }

    int binaryExportLevel;
    Set<HandshakeOptionKey> accepted;
    try {
      binaryExportLevel = client.challenge();
      policy.setServerBinaryExportLevel(binaryExportLevel);
      policy.setServerSupportsBinary(binaryExportLevel >= MIN_BINARY_EXPORT_LEVEL);

      List<HandshakeOption> options = handshakeOptions(timeZoneSecondsEast);
      accepted = client.negotiate(options);
      for (HandshakeOption option : options) {
        applyHandshakeOption(option, accepted.contains(option.getKey()));
      }
    } finally {
      // the connect timeout only covers the handshake
      if (connectTimeout > 0 && !client.isClosed()) {
        client.setSocketTimeout(sessionTimeout);
      }
    }

    LOGGER.debug(
        "Connected - binaryExportLevel={}, replySize={}, handshakeAccepted={}",
        binaryExportLevel,
        currentReplySize,
        accepted);
  }

  /** The options sent with the login, in the order the server expects them. */
  private List<HandshakeOption> handshakeOptions(int timeZoneSecondsEast) {
    return List.of(
        new HandshakeOption(HandshakeOptionKey.AUTO_COMMIT, autoCommit),
        new HandshakeOption(HandshakeOptionKey.REPLY_SIZE, policy.handshakeReplySize()),
        new HandshakeOption(HandshakeOptionKey.SIZE_HEADER, true),
        new HandshakeOption(HandshakeOptionKey.TIME_ZONE, timeZoneSecondsEast));
  }

  /**
   * Records an option the server applied during the handshake, or applies it now with the
   * matching setter.
   */
  private void applyHandshakeOption(HandshakeOption option, boolean appliedByServer)
      throws MonetSQLException {
    switch (option.getKey()) {
      case AUTO_COMMIT:
        boolean requestedAutoCommit = (Boolean) option.getValue();
        if (appliedByServer) {
          autoCommit = requestedAutoCommit;
        } else {
          setAutoCommit(requestedAutoCommit);
        }
        break;
      case REPLY_SIZE:
        int requestedReplySize = (Integer) option.getValue();
        if (appliedByServer) {
          currentReplySize = requestedReplySize;
        } else {
          changeReplySize(requestedReplySize);
        }
        break;
      case SIZE_HEADER:
        boolean requestedSizeHeader = (Boolean) option.getValue();
        if (appliedByServer) {
          sizeHeader = requestedSizeHeader;
        } else {
          setSizeHeader(requestedSizeHeader);
        }
        break;
      case TIME_ZONE:
        int requestedOffset = (Integer) option.getValue();
        if (appliedByServer) {
          currentTimeZoneSecondsEast = requestedOffset;
        } else {
          setTimeZone(requestedOffset);
        }
        break;
      default:
        throw new MonetSQLException(
            "Unknown handshake option " + option.getKey(), MonetDriverErrorCode.HANDSHAKE_ERROR);
    }
  }

  /** Creates a cursor that works on a snapshot of the current fetch settings. */
  public MonetCursor cursor() throws MonetSQLException {
    checkOpen();
    return new MonetCursor(this);
  }

  /** Sends a low level command, e.g. {@code Xreply_size 100}, and returns the raw response. */
  public String command(String command) throws MonetSQLException {
    return checkOpen().command(command);
  }

  public void commit() throws MonetSQLException {
    runStatement("COMMIT");
  }

  public void rollback() throws MonetSQLException {
    runStatement("ROLLBACK");
  }

  /**
   * Closes the session. Pending changes are rolled back unless auto-commit is on. Closing a closed
   * connection does nothing.
   *
   * @throws MonetSQLException if the rollback or the transport fails
   */
  @Override
  public void close() throws MonetSQLException {
    if (client == null) {
      LOGGER.debug("Connection already closed");
      return;
    }
    try {
      if (!autoCommit) {
        rollback();
      }
    } finally {
      IMonetClient closing = client;
      client = null;
      closing.close();
      LOGGER.debug("Connection closed");
    }
  }

  public boolean isClosed() {
    return client == null;
  }

  public boolean getAutoCommit() {
    return autoCommit;
  }

  /** Switches auto-commit on the server and records the new value. */
  public void setAutoCommit(boolean autoCommit) throws MonetSQLException {
    command(String.format(CMD_AUTO_COMMIT, autoCommit ? 1 : 0));
    this.autoCommit = autoCommit;
  }

  public boolean getSizeHeader() {
    return sizeHeader;
  }

  /** Asks the server to announce column type sizes in result headers. */
  public void setSizeHeader(boolean sizeHeader) throws MonetSQLException {
    command(String.format(CMD_SIZE_HEADER, sizeHeader ? 1 : 0));
    this.sizeHeader = sizeHeader;
  }

  public int getTimeZoneSecondsEast() {
    return currentTimeZoneSecondsEast;
  }

  /** Sets the session time zone as an offset east of UTC. */
  public void setTimeZone(int secondsEastOfUtc) throws MonetSQLException {
    runStatement(
        String.format(SET_TIME_ZONE_SQL, StringUtil.formatTimeZoneOffset(secondsEastOfUtc)));
    this.currentTimeZoneSecondsEast = secondsEastOfUtc;
  }

  /** The reply size new cursors start with, -1 for unlimited. */
  public int getReplySize() {
    return policy.getReplySize();
  }

  /** Changes the reply size for cursors created from now on. Nothing is sent to the server. */
  public void setReplySize(int replySize) throws MonetValidationException {
    policy.setReplySize(replySize);
  }

  public int getMaxPrefetch() {
    return policy.getMaxPrefetch();
  }

  /** Changes the prefetch budget for cursors created from now on. */
  public void setMaxPrefetch(int maxPrefetch) throws MonetValidationException {
    policy.setMaxPrefetch(maxPrefetch);
  }

  public boolean getBinary() {
    return policy.isBinaryEnabled();
  }

  /** Allows or forbids binary result batches for cursors created from now on. */
  public void setBinary(boolean binary) {
    policy.setBinaryEnabled(binary);
  }

  public int getServerBinaryExportLevel() {
    return policy.getServerBinaryExportLevel();
  }

  public void setSocketTimeout(int timeoutMillis) throws MonetSQLException {
    checkOpen().setSocketTimeout(timeoutMillis);
  }

  public int getSocketTimeout() throws MonetSQLException {
    return checkOpen().getSocketTimeout();
  }

  public IMonetConnectionContext getConnectionContext() {
    return connectionContext;
  }

  /** The reply size the server currently uses for new queries. */
  int getCurrentReplySize() {
    return currentReplySize;
  }

  /** Changes the reply size the server uses for new queries. */
  void changeReplySize(int replySize) throws MonetSQLException {
    command(String.format(CMD_REPLY_SIZE, replySize));
    this.currentReplySize = replySize;
  }

  void updateServerSupportsBinary(boolean supportsBinary) {
    policy.setServerSupportsBinary(supportsBinary);
  }

  BatchPolicy getPolicy() {
    return policy;
  }

  IMonetClient checkOpen() throws MonetSQLException {
    if (client == null) {
      LOGGER.error("Attempted to use a closed connection");
      throw new MonetSQLException("Connection closed", MonetDriverErrorCode.CONNECTION_CLOSED);
    }
    return client;
  }

  private void runStatement(String sql) throws MonetSQLException {
    MonetCursor cursor = cursor();
    try {
      cursor.execute(sql);
    } finally {
      cursor.close();
    }
  }

  private static int localTimeZoneOffsetSeconds() {
    return ZoneId.systemDefault().getRules().getOffset(Instant.now()).getTotalSeconds();
  }
}
