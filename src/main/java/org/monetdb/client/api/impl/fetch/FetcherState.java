package org.monetdb.client.api.impl.fetch;

/** Lifecycle of a {@link CursorFetchEngine}. */
public enum FetcherState {
  UNOPENED, // no result set yet
  ACTIVE, // rows left to read
  EXHAUSTED, // positioned at the end, a backward scroll makes it ACTIVE again
  FAILED, // a supplemental fetch failed, the result set cannot be read any further
  CLOSED
}
