package ca.gc.cra.midscan.application.port;

/**
 * Base type for failures reported by a {@link MailSessionPort}.
 *
 * <p>Subtypes tell the resolver how far a failure reaches: {@link TransportException} ends the run,
 * {@link SelectionException} skips one mailbox and {@link SearchException} skips one attempt.</p>
 *
 * @since 0.1.0
 */
public abstract class MailSessionException extends Exception {
  private static final long serialVersionUID = 1L;

  protected MailSessionException(String message) {
    super(message);
  }

  protected MailSessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
