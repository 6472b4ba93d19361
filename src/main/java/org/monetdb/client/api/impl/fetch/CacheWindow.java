package org.monetdb.client.api.impl.fetch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The contiguous, half-open range of rows {@code [start, end)} currently held client side. */
public final class CacheWindow {

  static final CacheWindow EMPTY = new CacheWindow(0, Collections.emptyList());

  private final long start;
  private final List<Object[]> rows;

  CacheWindow(long start, List<Object[]> rows) {
    this.start = start;
    this.rows = rows;
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return start + rows.size();
  }

  public int size() {
    return rows.size();
  }

  boolean contains(long row) {
    return row >= start && row < getEnd();
  }

  Object[] getRow(long row) {
    return rows.get((int) (row - start));
  }

  /** Copies rows {@code [from, to)}; both bounds must lie inside the window. */
  List<Object[]> copyRows(long from, long to) {
    return new ArrayList<>(rows.subList((int) (from - start), (int) (to - start)));
  }

  @Override
  public String toString() {
    return "(" + start + "," + getEnd() + ")";
  }
}
