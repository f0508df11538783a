package ca.gc.cra.midscan.application.port;

/**
 * A single search, list or fetch request failed or returned a response that could not be interpreted.
 *
 * @since 0.1.0
 */
public final class SearchException extends MailSessionException {
  private static final long serialVersionUID = 1L;

  public SearchException(String message) {
    super(message);
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
