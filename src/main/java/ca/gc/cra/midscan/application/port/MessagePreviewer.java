package ca.gc.cra.midscan.application.port;

import java.util.Optional;

/**
 * Renders a short plain-text preview of a matched message for operators.
 *
 * @since 0.1.0
 */
public interface MessagePreviewer {

  /**
   * Builds a preview from raw RFC 822 bytes.
   *
   * @param rawMessage complete message bytes
   * @return preview text, or empty when the message has no readable text part
   */
  Optional<String> preview(byte[] rawMessage);
}
