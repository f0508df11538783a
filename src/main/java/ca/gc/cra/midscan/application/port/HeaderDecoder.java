package ca.gc.cra.midscan.application.port;

import java.util.function.UnaryOperator;

/**
 * Decodes header values for display, for example RFC 2047 encoded-words.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HeaderDecoder extends UnaryOperator<String> {

  /** Decoder that returns values unchanged. */
  HeaderDecoder IDENTITY = value -> value;
}
