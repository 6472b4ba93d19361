package org.monetdb.client.model.core;

/** Header of an executed query plus the rows that came with it. */
public class QueryResponse {

  private final int resultId;
  private final long rowCount;
  private final int columnCount;
  private final RowBatch firstBatch;

  public QueryResponse(int resultId, long rowCount, int columnCount, RowBatch firstBatch) {
    this.resultId = resultId;
    this.rowCount = rowCount;
    this.columnCount = columnCount;
    this.firstBatch = firstBatch;
  }

  public int getResultId() {
    return resultId;
  }

  /** Total rows of the result set; 0 for statements that produce no rows. */
  public long getRowCount() {
    return rowCount;
  }

  public int getColumnCount() {
    return columnCount;
  }

  public RowBatch getFirstBatch() {
    return firstBatch;
  }
}
