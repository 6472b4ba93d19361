package org.monetdb.client.model.core;

import java.util.Collections;
import java.util.List;

/** A contiguous run of decoded rows, as returned by one round trip. */
public class RowBatch {

  private final long startRow;
  private final List<Object[]> rows;
  private final boolean binary;

  public RowBatch(long startRow, List<Object[]> rows, boolean binary) {
    this.startRow = startRow;
    this.rows = rows == null ? Collections.emptyList() : Collections.unmodifiableList(rows);
    this.binary = binary;
  }

  /** Index of the first row of this batch within its result set. */
  public long getStartRow() {
    return startRow;
  }

  /** Exclusive end index of this batch. */
  public long getEndRow() {
    return startRow + rows.size();
  }

  public List<Object[]> getRows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  /** Whether the batch travelled in binary encoding. */
  public boolean isBinary() {
    return binary;
  }
}
