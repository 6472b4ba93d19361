package org.monetdb.client.api.impl.fetch;

import static org.monetdb.client.common.MonetClientConstants.DEFAULT_ARRAY_SIZE;
import static org.monetdb.client.common.MonetClientConstants.DEFAULT_MAX_PREFETCH;
import static org.monetdb.client.common.MonetClientConstants.DEFAULT_REPLY_SIZE;
import static org.monetdb.client.common.MonetClientConstants.UNLIMITED;
import static org.monetdb.client.common.MonetClientConstants.UNLIMITED_BINARY_INITIAL_REPLY_SIZE;

import com.google.common.annotations.VisibleForTesting;
import org.monetdb.client.common.util.ValidationUtil;
import org.monetdb.client.exception.MonetValidationException;
import org.monetdb.client.log.MonetLogger;
import org.monetdb.client.log.MonetLoggerFactory;

/**
 * Decides how many rows to ask the server for.
 *
 * <p>A connection owns one policy and uses it to pick the reply size of the handshake. Every
 * cursor works on its own {@link #copy()}, so changing the connection settings never affects a
 * cursor that already exists.
 *
 * <p>Supplemental batches grow geometrically while a result set is being consumed, are aligned to
 * the size of the read that caused the miss, and are capped by the prefetch budget and by the end
 * of the result set. This class does no I/O and never fails on valid input.
 */
public class BatchPolicy {

  private static final MonetLogger LOGGER = MonetLoggerFactory.getLogger(BatchPolicy.class);

  private boolean binaryEnabled = true;
  private boolean serverSupportsBinary = false;
  private int serverBinaryExportLevel = 0;
  private int replySize = DEFAULT_REPLY_SIZE;
  private int maxPrefetch = DEFAULT_MAX_PREFETCH;

  // fixed once the policy is copied for a cursor
  private Integer frozenArraySize;

  // size of the previous batch of the current result set, the base for geometric growth
  private long lastBatchSize;

  public BatchPolicy() {}

  private BatchPolicy(BatchPolicy other) {
    this.binaryEnabled = other.binaryEnabled;
    this.serverSupportsBinary = other.serverSupportsBinary;
    this.serverBinaryExportLevel = other.serverBinaryExportLevel;
    this.replySize = other.replySize;
    this.maxPrefetch = other.maxPrefetch;
    this.lastBatchSize = other.lastBatchSize;
  }

  /**
   * Creates an independent copy for a new cursor. The array size of the copy is fixed to what
   * {@link #decideArraySize()} returns at this moment.
   */
  public BatchPolicy copy() {
    BatchPolicy copy = new BatchPolicy(this);
    copy.frozenArraySize = decideArraySize();
    return copy;
  }

  /** Whether both sides can use binary result batches. */
  public boolean useBinary() {
    return binaryEnabled && serverSupportsBinary;
  }

  /**
   * The reply size to announce when the session is set up. An unlimited reply size is replaced by
   * a small initial batch when the rest can be fetched in binary form.
   */
  public int handshakeReplySize() {
    if (replySize == UNLIMITED && useBinary()) {
      return UNLIMITED_BINARY_INITIAL_REPLY_SIZE;
    }
    return replySize;
  }

  /** The page size reported to bulk readers. Never unlimited. */
  public int decideArraySize() {
    if (frozenArraySize != null) {
      return frozenArraySize;
    }
    return replySize > 0 ? replySize : DEFAULT_ARRAY_SIZE;
  }

  /**
   * Starts a new result set and returns the number of rows the server should include in its first
   * response. Uses the same rule as {@link #handshakeReplySize()} with the current settings.
   */
  public int newQuery() {
    int initial = handshakeReplySize();
    lastBatchSize = Math.max(initial, 0);
    return initial;
  }

  /**
   * Computes the size of the next supplemental fetch. Called only when a read cannot be served
   * from the cached rows.
   *
   * @param alreadyUsed rows of the current read that were served from the cache
   * @param position row where the fetch starts
   * @param requestedEnd exclusive end of the current read, at most {@code rowCount}
   * @param rowCount total rows of the result set
   * @return rows to fetch starting at {@code position}; reaches at least {@code requestedEnd}
   */
  public long batchSize(long alreadyUsed, long position, long requestedEnd, long rowCount) {
    long remaining = rowCount - position;
    if (replySize == UNLIMITED) {
      lastBatchSize = remaining;
      return remaining;
    }

    long needed = requestedEnd - position;
    long requestStart = position - alreadyUsed;
    long stride = Math.max(requestedEnd - requestStart, 1);

    long target = Math.max(needed, 2 * lastBatchSize);
    long end = position + target;
    long strides = (end - requestStart + stride - 1) / stride;
    long size = requestStart + strides * stride - position;

    if (maxPrefetch != UNLIMITED) {
      size = Math.min(size, needed + maxPrefetch);
    }
    size = Math.min(size, remaining);

    LOGGER.debug(
        "Batch size {} at row {} (stride={}, needed={}, previous={}, rowCount={})",
        size,
        position,
        stride,
        needed,
        lastBatchSize,
        rowCount);
    lastBatchSize = size;
    return size;
  }

  public boolean isBinaryEnabled() {
    return binaryEnabled;
  }

  public void setBinaryEnabled(boolean binaryEnabled) {
    this.binaryEnabled = binaryEnabled;
  }

  public boolean isServerSupportsBinary() {
    return serverSupportsBinary;
  }

  public void setServerSupportsBinary(boolean serverSupportsBinary) {
    this.serverSupportsBinary = serverSupportsBinary;
  }

  public int getServerBinaryExportLevel() {
    return serverBinaryExportLevel;
  }

  public void setServerBinaryExportLevel(int serverBinaryExportLevel) {
    this.serverBinaryExportLevel = serverBinaryExportLevel;
  }

  public int getReplySize() {
    return replySize;
  }

  /**
   * @param replySize rows per round trip, or -1 for everything at once
   * @throws MonetValidationException if the value is 0 or below -1
   */
  public void setReplySize(int replySize) throws MonetValidationException {
    ValidationUtil.checkReplySize(replySize, "replysize");
    this.replySize = replySize;
  }

  public int getMaxPrefetch() {
    return maxPrefetch;
  }

  /**
   * @param maxPrefetch rows that may be fetched beyond the current read, -1 for no limit
   * @throws MonetValidationException if the value is below -1
   */
  public void setMaxPrefetch(int maxPrefetch) throws MonetValidationException {
    ValidationUtil.checkUnlimitedOrNonNegative(maxPrefetch, "maxprefetch");
    this.maxPrefetch = maxPrefetch;
  }

  @VisibleForTesting
  long getLastBatchSize() {
    return lastBatchSize;
  }
}
