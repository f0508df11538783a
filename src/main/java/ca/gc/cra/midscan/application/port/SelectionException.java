package ca.gc.cra.midscan.application.port;

/**
 * A planned mailbox could not be selected (missing, permission denied, rejected by the server).
 *
 * @since 0.1.0
 */
public final class SelectionException extends MailSessionException {
  private static final long serialVersionUID = 1L;

  private final String mailbox;

  public SelectionException(String mailbox, String message) {
    super(message);
    this.mailbox = mailbox;
  }

  public SelectionException(String mailbox, String message, Throwable cause) {
    super(message, cause);
    this.mailbox = mailbox;
  }

  /**
   * Returns the mailbox that failed to open.
   *
   * @return mailbox name
   */
  public String mailbox() {
    return mailbox;
  }
}
