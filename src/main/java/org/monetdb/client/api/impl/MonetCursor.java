package org.monetdb.client.api.impl;

import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import org.monetdb.client.api.impl.fetch.BatchPolicy;
import org.monetdb.client.api.impl.fetch.CursorFetchEngine;
import org.monetdb.client.api.impl.fetch.ScrollMode;
import org.monetdb.client.common.util.ValidationUtil;
import org.monetdb.client.dbclient.IMonetClient;
import org.monetdb.client.exception.MonetProtocolException;
import org.monetdb.client.exception.MonetSQLException;
import org.monetdb.client.exception.MonetValidationException;
import org.monetdb.client.log.MonetLogger;
import org.monetdb.client.log.MonetLoggerFactory;
import org.monetdb.client.model.core.QueryResponse;
import org.monetdb.client.model.enums.MonetDriverErrorCode;

/**
 * Runs queries on a connection and reads their results.
 *
 * <p>A cursor holds its own copy of the connection's fetch settings, taken when the cursor was
 * created. Each {@link #execute(String)} replaces the current result set.
 */
public class MonetCursor implements AutoCloseable {

  private static final MonetLogger LOGGER = MonetLoggerFactory.getLogger(MonetCursor.class);

  private final MonetConnection connection;
  private final BatchPolicy policy;
  private int arraySize;
  private CursorFetchEngine engine;
  private boolean closed;

  MonetCursor(MonetConnection connection) {
    this.connection = connection;
    this.policy = connection.getPolicy().copy();
    this.arraySize = policy.decideArraySize();
  }

  /**
   * Runs a query. Any previous result set of this cursor is closed first.
   *
   * @throws MonetSQLException if the cursor or connection is closed, or the query fails
   */
  public void execute(String sql) throws MonetSQLException {
    checkOpen();
    IMonetClient client = connection.checkOpen();
    closeResult();

    int queryReplySize = policy.newQuery();
    if (queryReplySize != connection.getCurrentReplySize()) {
      connection.changeReplySize(queryReplySize);
    }

    QueryResponse response = client.executeQuery(sql, queryReplySize);
    if (response == null) {
      LOGGER.error("No response for query");
      throw new MonetProtocolException("Server returned no response for query");
    }

    boolean supportsBinary = client.supportsBinary();
    policy.setServerSupportsBinary(supportsBinary);
    connection.updateServerSupportsBinary(supportsBinary);

    CursorFetchEngine newEngine = new CursorFetchEngine(client, policy);
    newEngine.open(
        response.getResultId(), response.getRowCount(), queryReplySize, response.getFirstBatch());
    engine = newEngine;
  }

  /** Returns the next row, or {@code null} when the result set is exhausted. */
  public Object[] fetchOne() throws MonetSQLException {
    return checkResult().fetchOne();
  }

  /** Returns the next {@link #getArraySize()} rows. */
  public List<Object[]> fetchMany() throws MonetSQLException {
    return fetchMany(arraySize);
  }

  /** Returns the next {@code size} rows; fewer at the end of the result set. */
  public List<Object[]> fetchMany(int size) throws MonetSQLException {
    return checkResult().fetchMany(size);
  }

  /** Returns all remaining rows. */
  public List<Object[]> fetchAll() throws MonetSQLException {
    return checkResult().fetchAll();
  }

  /** Moves the position relative to the current one. */
  public void scroll(long offset) throws MonetSQLException {
    scroll(offset, ScrollMode.RELATIVE);
  }

  public void scroll(long offset, ScrollMode mode) throws MonetSQLException {
    checkResult().scroll(offset, mode);
  }

  /** Row count of the current result set, -1 before the first query. */
  public long getRowCount() {
    return engine != null ? engine.getRowCount() : -1;
  }

  /** Index of the next row to be returned, -1 before the first query. */
  public long getPosition() {
    return engine != null ? engine.getPosition() : -1;
  }

  /** Whether supplemental batches of the current result set travel in binary form. */
  public boolean isBinaryActive() {
    return engine != null && engine.isBinaryActive();
  }

  public int getArraySize() {
    return arraySize;
  }

  public void setArraySize(int arraySize) throws MonetValidationException {
    ValidationUtil.checkIfPositive(arraySize, "arraysize");
    this.arraySize = arraySize;
  }

  /** Reply size for this cursor's next query, independent of the connection. */
  public void setReplySize(int replySize) throws MonetValidationException {
    policy.setReplySize(replySize);
  }

  public int getReplySize() {
    return policy.getReplySize();
  }

  /** Prefetch budget for this cursor's next query, independent of the connection. */
  public void setMaxPrefetch(int maxPrefetch) throws MonetValidationException {
    policy.setMaxPrefetch(maxPrefetch);
  }

  public int getMaxPrefetch() {
    return policy.getMaxPrefetch();
  }

  public MonetConnection getConnection() {
    return connection;
  }

  public boolean isClosed() {
    return closed;
  }

  /** Closes the cursor and its result set. Idempotent. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closeResult();
    closed = true;
  }

  @VisibleForTesting
  CursorFetchEngine getFetchEngine() {
    return engine;
  }

  private void closeResult() {
    if (engine != null) {
      engine.close();
      engine = null;
    }
  }

  private void checkOpen() throws MonetSQLException {
    if (closed) {
      LOGGER.error("Attempted to use a closed cursor");
      throw new MonetValidationException("Cursor is closed", MonetDriverErrorCode.CURSOR_CLOSED);
    }
  }

  private CursorFetchEngine checkResult() throws MonetSQLException {
    checkOpen();
    if (engine == null) {
      LOGGER.error("Attempted to fetch before a query was executed");
      throw new MonetValidationException(
          "No result set, execute a query first", MonetDriverErrorCode.INVALID_STATE);
    }
    return engine;
  }
}
