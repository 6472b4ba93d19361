package org.monetdb.client.api.impl.fetch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.monetdb.client.common.ResultEncoding;
import org.monetdb.client.dbclient.IMonetClient;
import org.monetdb.client.exception.MonetProtocolException;
import org.monetdb.client.exception.MonetSQLException;
import org.monetdb.client.exception.MonetTransportException;
import org.monetdb.client.exception.MonetValidationException;
import org.monetdb.client.log.MonetLogger;
import org.monetdb.client.log.MonetLoggerFactory;
import org.monetdb.client.model.core.RowBatch;
import org.monetdb.client.model.enums.MonetDriverErrorCode;

/**
 * Consumption state of one result set kept on the server.
 *
 * <p>The engine keeps a single {@link CacheWindow} of rows client side. Reads are served from the
 * window; when a read needs a row outside it, the engine asks its {@link BatchPolicy} how many rows
 * to request, performs one supplemental fetch starting at the current position and replaces the
 * window with the rows that came back. Rows outside the latest window are not retained.
 *
 * <p>Whether supplemental fetches use binary encoding is decided once, when the result set is
 * opened.
 *
 * <p>Not thread safe. Every fetch blocks until the transport returns the complete batch.
 */
public class CursorFetchEngine implements AutoCloseable {

  private static final MonetLogger LOGGER = MonetLoggerFactory.getLogger(CursorFetchEngine.class);

  private final IMonetClient client;
  private final BatchPolicy policy;

  private FetcherState state = FetcherState.UNOPENED;
  private int resultId = -1;
  private long rowCount;
  private long position;
  private CacheWindow window = CacheWindow.EMPTY;
  private boolean binaryActive;
  private boolean serverHoldsResult;

  private int supplementalFetchCount;
  private long totalRowsReceived;
  private final List<String> windowHistory = new ArrayList<>();

  /**
   * @param client the transport of the connection that ran the query
   * @param policy the cursor's own policy copy
   */
  public CursorFetchEngine(IMonetClient client, BatchPolicy policy) {
    if (client == null) {
      LOGGER.error("Cannot create CursorFetchEngine: client is null");
      throw new IllegalArgumentException("client cannot be null");
    }
    if (policy == null) {
      LOGGER.error("Cannot create CursorFetchEngine: policy is null");
      throw new IllegalArgumentException("policy cannot be null");
    }
    this.client = client;
    this.policy = policy;
  }

  /**
   * Starts consuming a result set.
   *
   * @param resultId server side id of the result set
   * @param rowCount total rows of the result set
   * @param initialReplySize the reply size the query was run with; -1 means the first batch holds
   *     every row
   * @param firstBatch the rows delivered together with the query response
   * @throws MonetSQLException if the engine was already opened, or the first batch does not match
   *     the reply size
   */
  public void open(int resultId, long rowCount, int initialReplySize, RowBatch firstBatch)
      throws MonetSQLException {
    if (state != FetcherState.UNOPENED) {
      LOGGER.error("Attempted to open a result set on an engine in state {}", state);
      throw new MonetValidationException(
          "Result set already opened", MonetDriverErrorCode.INVALID_STATE);
    }
    if (rowCount < 0) {
      LOGGER.error("Server reported negative row count {}", rowCount);
      throw new MonetProtocolException("Negative row count: " + rowCount);
    }

    long expectedEnd = initialReplySize > 0 ? Math.min(initialReplySize, rowCount) : rowCount;
    List<Object[]> rows = firstBatch != null ? firstBatch.getRows() : Collections.emptyList();
    long firstStart = firstBatch != null ? firstBatch.getStartRow() : 0;
    if (firstStart != 0 || rows.size() != expectedEnd) {
      LOGGER.error(
          "First batch of result {} covers ({},{}), expected (0,{})",
          resultId,
          firstStart,
          firstStart + rows.size(),
          expectedEnd);
      throw new MonetProtocolException(
          String.format(
              "Unexpected first batch: %d rows at %d, expected %d rows at 0",
              rows.size(), firstStart, expectedEnd));
    }

    this.resultId = resultId;
    this.rowCount = rowCount;
    this.position = 0;
    this.window = new CacheWindow(0, rows);
    windowHistory.add(window.toString());
    this.binaryActive = policy.useBinary();
    this.serverHoldsResult = expectedEnd < rowCount;
    this.state = FetcherState.ACTIVE;

    LOGGER.debug(
        "Opened result {} - rowCount={}, window={}, binary={}",
        resultId,
        rowCount,
        window,
        binaryActive);
  }

  /**
   * Returns the row at the current position and advances, or {@code null} at the end of the
   * result set.
   *
   * @throws MonetSQLException if the engine cannot be read from or a supplemental fetch fails
   */
  public Object[] fetchOne() throws MonetSQLException {
    checkReadable();
    if (position >= rowCount) {
      return null;
    }
    if (!window.contains(position)) {
      fillMiss(0, position + 1);
    }
    Object[] row = window.getRow(position);
    position++;
    return row;
  }

  /**
   * Returns up to {@code n} rows starting at the current position. Fewer rows are returned only at
   * the end of the result set.
   *
   * @throws MonetSQLException if {@code n} is negative, the engine cannot be read from or a
   *     supplemental fetch fails
   */
  public List<Object[]> fetchMany(long n) throws MonetSQLException {
    checkReadable();
    if (n < 0) {
      LOGGER.error("Negative fetch size {}", n);
      throw new MonetValidationException("Fetch size must not be negative: " + n);
    }
    long requestedEnd = n >= rowCount - position ? rowCount : position + n;
    if (requestedEnd <= position) {
      return Collections.emptyList();
    }

    List<Object[]> result = new ArrayList<>((int) Math.min(requestedEnd - position, 1 << 16));
    long alreadyUsed = 0;
    while (position < requestedEnd) {
      if (window.contains(position)) {
        long end = Math.min(requestedEnd, window.getEnd());
        result.addAll(window.copyRows(position, end));
        alreadyUsed += end - position;
        position = end;
      } else {
        fillMiss(alreadyUsed, requestedEnd);
      }
    }
    return result;
  }

  /** Returns every row from the current position to the end. */
  public List<Object[]> fetchAll() throws MonetSQLException {
    checkReadable();
    return fetchMany(rowCount - position);
  }

  /**
   * Moves the position. Never fetches; a read after the move may.
   *
   * @throws MonetValidationException if the new position would lie outside {@code [0, rowCount]};
   *     the position is left unchanged
   */
  public void scroll(long offset, ScrollMode mode) throws MonetSQLException {
    checkReadable();
    long target = mode == ScrollMode.ABSOLUTE ? offset : position + offset;
    if (target < 0 || target > rowCount) {
      LOGGER.error(
          "Scroll {} {} from {} leaves the result set (rowCount={})",
          mode,
          offset,
          position,
          rowCount);
      throw new MonetValidationException(
          String.format("Scroll target %d out of range [0, %d]", target, rowCount));
    }
    position = target;
  }

  /**
   * Drops the cached rows and releases the server side result set if it still holds rows that
   * were never part of the first response. Idempotent.
   */
  @Override
  public void close() {
    if (state == FetcherState.CLOSED) {
      return;
    }
    FetcherState previous = state;
    state = FetcherState.CLOSED;
    window = CacheWindow.EMPTY;

    if (previous != FetcherState.UNOPENED && serverHoldsResult && !client.isClosed()) {
      try {
        client.closeResult(resultId);
      } catch (MonetSQLException e) {
        LOGGER.warn("Error releasing result {} on the server: {}", resultId, e.getMessage(), e);
      }
    }
    LOGGER.debug(
        "Closed result {} - supplementalFetches={}, rowsReceived={}",
        resultId,
        supplementalFetchCount,
        totalRowsReceived);
  }

  private void fillMiss(long alreadyUsed, long requestedEnd) throws MonetSQLException {
    long size = policy.batchSize(alreadyUsed, position, requestedEnd, rowCount);
    ResultEncoding encoding = binaryActive ? ResultEncoding.BINARY : ResultEncoding.TEXT;

    RowBatch batch;
    try {
      batch = client.fetchRange(resultId, position, size, encoding);
    } catch (MonetSQLException e) {
      state = FetcherState.FAILED;
      LOGGER.error(
          e,
          "Fetching rows ({},{}) of result {} failed, last window {}",
          position,
          position + size,
          resultId,
          window);
      throw e;
    } catch (RuntimeException e) {
      state = FetcherState.FAILED;
      LOGGER.error(
          e,
          "Transport failed unexpectedly fetching rows ({},{}) of result {}",
          position,
          position + size,
          resultId);
      throw new MonetTransportException(
          String.format(
              "Fetching rows (%d,%d) of result %d failed", position, position + size, resultId),
          e);
    }

    if (batch == null || batch.getStartRow() != position || batch.size() != size) {
      state = FetcherState.FAILED;
      String got =
          batch == null ? "nothing" : "(" + batch.getStartRow() + "," + batch.getEndRow() + ")";
      LOGGER.error(
          "Server returned {} for rows ({},{}) of result {}",
          got,
          position,
          position + size,
          resultId);
      throw new MonetProtocolException(
          String.format(
              "Expected rows (%d,%d) of result %d, got %s",
              position, position + size, resultId, got));
    }

    window = new CacheWindow(position, batch.getRows());
    windowHistory.add(window.toString());
    supplementalFetchCount++;
    totalRowsReceived += size;
    LOGGER.debug("Result {} window now {} ({})", resultId, window, encoding);
  }

  private void checkReadable() throws MonetValidationException {
    switch (state) {
      case UNOPENED:
        LOGGER.error("Attempted to read before a result set was opened");
        throw new MonetValidationException(
            "No result set available", MonetDriverErrorCode.INVALID_STATE);
      case CLOSED:
        LOGGER.error("Attempted to read from closed result {}", resultId);
        throw new MonetValidationException(
            "Result set is closed", MonetDriverErrorCode.CURSOR_CLOSED);
      case FAILED:
        LOGGER.error("Attempted to read from result {} after a failed fetch", resultId);
        throw new MonetValidationException(
            "Result set is unusable after a failed fetch", MonetDriverErrorCode.INVALID_STATE);
      default:
        break;
    }
  }

  public FetcherState getState() {
    if (state == FetcherState.ACTIVE && position >= rowCount) {
      return FetcherState.EXHAUSTED;
    }
    return state;
  }

  public int getResultId() {
    return resultId;
  }

  public long getRowCount() {
    return rowCount;
  }

  /** Zero based index of the next row to be returned. */
  public long getPosition() {
    return position;
  }

  public CacheWindow getCacheWindow() {
    return window;
  }

  public boolean isBinaryActive() {
    return binaryActive;
  }

  public int getSupplementalFetchCount() {
    return supplementalFetchCount;
  }

  public long getTotalRowsReceived() {
    return totalRowsReceived;
  }

  /** Every window established for this result set, oldest first, as {@code (start,end)}. */
  public List<String> getWindowHistory() {
    return Collections.unmodifiableList(windowHistory);
  }
}
