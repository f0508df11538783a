package ca.gc.cra.midscan.application.search;

import java.util.Locale;

/**
 * Header fields the {@code search} command can match on.
 *
 * @since 0.1.0
 */
public enum HeaderSearchField {
  FROM("From"),
  SUBJECT("Subject");

  private final String headerName;

  HeaderSearchField(String headerName) {
    this.headerName = headerName;
  }

  /**
   * Returns the header name sent in {@code SEARCH HEADER}.
   *
   * @return header name such as {@code From}
   */
  public String headerName() {
    return headerName;
  }

  /**
   * Returns the option key that selects this field ({@code from} or {@code subject}).
   *
   * @return lower-case option key
   */
  public String optionKey() {
    return name().toLowerCase(Locale.ROOT);
  }
}
