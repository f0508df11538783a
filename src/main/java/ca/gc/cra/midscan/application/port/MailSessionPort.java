package ca.gc.cra.midscan.application.port;

import ca.gc.cra.midscan.application.search.SearchExpression;
import ca.gc.cra.midscan.domain.mailbox.MailboxDescriptor;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Port onto an authenticated, single-connection mailbox session.
 * <p><strong>Why:</strong> Keeps the resolution engine independent of the IMAP client library and lets tests script
 * server behaviour call by call.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code JakartaMailSessionAdapter} and test fakes.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Authenticate once per run.</li>
 *   <li>Enumerate mailboxes with their selectability.</li>
 *   <li>Select mailboxes read-only and run searches/fetches against the current selection.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. The selection is shared mutable session state; callers issue
 * one request at a time and never overlap requests.</p>
 * <p><strong>Observability:</strong> Implementations log protocol failures; the engine records metrics.</p>
 *
 * @since 0.1.0
 */
public interface MailSessionPort extends AutoCloseable {

  /**
   * Authenticates the session.
   *
   * @param user login name
   * @param secret password; implementations must not retain or log it
   * @throws TransportException if the connection or authentication fails
   */
  void login(String user, char[] secret) throws TransportException;

  /**
   * Lists every mailbox the server advertises, in server order.
   *
   * @return mailboxes with their selectable flag
   * @throws SearchException if the listing request fails
   * @throws TransportException if the connection is lost
   */
  List<MailboxDescriptor> listMailboxes() throws SearchException, TransportException;

  /**
   * Selects a mailbox read-only, replacing the previous selection.
   *
   * @param name mailbox name
   * @throws SelectionException if the server refuses the selection
   * @throws TransportException if the connection is lost
   */
  void selectReadOnly(String name) throws SelectionException, TransportException;

  /**
   * Returns the currently selected mailbox, if any.
   *
   * @return active mailbox name
   */
  Optional<String> activeMailbox();

  /**
   * Runs one search request against the current selection.
   *
   * @param expression rendered search request
   * @return matching sequence numbers in server order; empty when nothing matched
   * @throws SearchException if the server rejects the request or the response is malformed
   * @throws TransportException if the connection is lost or times out
   */
  List<Integer> search(SearchExpression expression) throws SearchException, TransportException;

  /**
   * Fetches selected header fields of one message without setting {@code \Seen}.
   *
   * @param sequenceRef sequence number in the current selection
   * @param fields header field names
   * @return raw header block; empty when the server returned nothing
   * @throws SearchException if the fetch fails
   * @throws TransportException if the connection is lost
   */
  String fetchHeaders(int sequenceRef, List<String> fields) throws SearchException, TransportException;

  /**
   * Fetches the complete RFC 822 message without setting {@code \Seen}.
   *
   * @param sequenceRef sequence number in the current selection
   * @return raw message bytes
   * @throws SearchException if the fetch fails
   * @throws TransportException if the connection is lost
   */
  byte[] fetchFullMessage(int sequenceRef) throws SearchException, TransportException;

  /**
   * Logs out and releases the connection.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
