package ca.gc.cra.midscan.application.port;

/**
 * Connection, login or socket-level failure. Fatal to the whole run and never retried.
 *
 * @since 0.1.0
 */
public final class TransportException extends MailSessionException {
  private static final long serialVersionUID = 1L;

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
