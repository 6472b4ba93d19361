package org.monetdb.client.api.impl.fetch;

import java.util.Locale;

/** How {@link CursorFetchEngine#scroll(long, ScrollMode)} interprets its offset. */
public enum ScrollMode {
  ABSOLUTE,
  RELATIVE;

  /** Parses "absolute" or "relative", case insensitive. */
  public static ScrollMode fromString(String mode) {
    return ScrollMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
  }
}
