package ca.gc.cra.midscan.infrastructure.mime;

import ca.gc.cra.midscan.application.port.HeaderDecoder;
import jakarta.mail.internet.MimeUtility;
import java.io.UnsupportedEncodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes RFC 2047 encoded-words ({@code =?UTF-8?B?...?=}) with {@link MimeUtility#decodeText(String)}. Values
 * with unknown charsets are returned unchanged.
 *
 * @since 0.1.0
 */
public final class MimeHeaderDecoder implements HeaderDecoder {
  private static final Logger log = LoggerFactory.getLogger(MimeHeaderDecoder.class);

  @Override
  public String apply(String value) {
    if (value == null || value.isEmpty() || !value.contains("=?")) {
      return value;
    }
    try {
      return MimeUtility.decodeText(value);
    } catch (UnsupportedEncodingException ex) {
      log.debug("Leaving header undecoded: {}", ex.getMessage());
      return value;
    }
  }
}
