package ca.gc.cra.midscan.domain.message;

/**
 * <strong>What:</strong> Canonical form of an RFC 5322 {@code Message-ID} value.
 * <p><strong>Why:</strong> Servers disagree on whether the angle brackets are part of the searchable value, so every
 * lookup needs both the bare and the bracketed spelling derived from a single normalization.</p>
 * <p><strong>Role:</strong> Domain value object passed through every resolution stage.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class MessageIdentifier {
  private static final char OPEN = '<';
  private static final char CLOSE = '>';

  private final String bare;

  private MessageIdentifier(String bare) {
    this.bare = bare;
  }

  /**
   * Normalizes raw operator input.
   *
   * <p>Surrounding whitespace and one enclosing {@code <...>} pair are removed. Stray delimiter characters left
   * inside the value are dropped so the bare form never carries them. Syntax is not validated further; malformed
   * values simply fail to match later.</p>
   *
   * @param raw raw identifier text; {@code null} is treated as empty
   * @return normalized identifier, never {@code null}
   */
  public static MessageIdentifier parse(String raw) {
    if (raw == null) {
      return new MessageIdentifier("");
    }
    String value = raw.strip();
    if (value.length() >= 2 && value.charAt(0) == OPEN && value.charAt(value.length() - 1) == CLOSE) {
      value = value.substring(1, value.length() - 1).strip();
    }
    if (value.indexOf(OPEN) >= 0 || value.indexOf(CLOSE) >= 0) {
      StringBuilder sb = new StringBuilder(value.length());
      for (int i = 0; i < value.length(); i++) {
        char c = value.charAt(i);
        if (c != OPEN && c != CLOSE) {
          sb.append(c);
        }
      }
      value = sb.toString().strip();
    }
    return new MessageIdentifier(value);
  }

  /**
   * Returns the identifier without delimiters.
   *
   * @return bare form; empty when the input was blank
   */
  public String bare() {
    return bare;
  }

  /**
   * Returns the identifier wrapped in angle brackets.
   *
   * @return bracketed form
   */
  public String bracketed() {
    return OPEN + bare + CLOSE;
  }

  /**
   * Indicates whether normalization produced an empty value.
   *
   * @return {@code true} when the bare form is empty
   */
  public boolean isEmpty() {
    return bare.isEmpty();
  }

  /**
   * Checks whether raw header text carries this identifier in either form.
   *
   * @param headerText raw header text; {@code null} never matches
   * @return {@code true} if the text contains the bare or bracketed form
   */
  public boolean appearsIn(String headerText) {
    if (headerText == null || bare.isEmpty()) {
      return false;
    }
    return headerText.contains(bracketed()) || headerText.contains(bare);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MessageIdentifier that)) {
      return false;
    }
    return bare.equals(that.bare);
  }

  @Override
  public int hashCode() {
    return bare.hashCode();
  }

  @Override
  public String toString() {
    return bracketed();
  }
}
