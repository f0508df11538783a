package ca.gc.cra.midscan.infrastructure.mime;

import ca.gc.cra.midscan.application.port.MessagePreviewer;
import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts a short plain-text snippet from a raw RFC 5322 message. The first {@code text/plain} part found in
 * depth-first order is used; attachments are skipped.
 *
 * @since 0.1.0
 */
public final class MimeMessagePreviewer implements MessagePreviewer {
  private static final Logger log = LoggerFactory.getLogger(MimeMessagePreviewer.class);
  /** Default snippet length in characters. */
  public static final int DEFAULT_LENGTH = 200;
  private static final String ELLIPSIS = "...";

  private final Session session = Session.getInstance(new Properties());
  private final int maxChars;

  public MimeMessagePreviewer() {
    this(DEFAULT_LENGTH);
  }

  /**
   * Creates a previewer.
   *
   * @param maxChars maximum snippet length before the ellipsis
   */
  public MimeMessagePreviewer(int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    this.maxChars = maxChars;
  }

  @Override
  public Optional<String> preview(byte[] rawMessage) {
    if (rawMessage == null || rawMessage.length == 0) {
      return Optional.empty();
    }
    try {
      MimeMessage message = new MimeMessage(session, new ByteArrayInputStream(rawMessage));
      return firstPlainText(message).map(this::shorten);
    } catch (MessagingException | IOException ex) {
      log.debug("Message body could not be parsed for preview: {}", ex.getMessage());
      return Optional.empty();
    }
  }

  private Optional<String> firstPlainText(Part part) throws MessagingException, IOException {
    if (Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition())) {
      return Optional.empty();
    }
    if (part.isMimeType("text/plain")) {
      Object content = part.getContent();
      return content instanceof String text ? Optional.of(text) : Optional.empty();
    }
    if (part.isMimeType("multipart/*") && part.getContent() instanceof Multipart multipart) {
      for (int i = 0; i < multipart.getCount(); i++) {
        BodyPart child = multipart.getBodyPart(i);
        Optional<String> text = firstPlainText(child);
        if (text.isPresent()) {
          return text;
        }
      }
    }
    return Optional.empty();
  }

  private String shorten(String text) {
    String compact = text.strip();
    if (compact.length() <= maxChars) {
      return compact;
    }
    return compact.substring(0, maxChars) + ELLIPSIS;
  }
}
