package ca.gc.cra.midscan.application.search;

/**
 * Textual encodings of a header search. Server dialects differ in which one they accept, so every logical header
 * query is tried with both.
 *
 * @since 0.1.0
 */
public enum SearchEncoding {
  /** Field name and value sent as separate protocol string arguments; the transport quotes them. */
  STRUCTURED,
  /** One parenthesised expression with the field name and value written as quoted strings. */
  QUOTED_LITERAL
}
