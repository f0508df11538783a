package ca.gc.cra.midscan.infrastructure.imap;

import ca.gc.cra.midscan.application.port.MailSessionPort;
import ca.gc.cra.midscan.application.port.SearchException;
import ca.gc.cra.midscan.application.port.SelectionException;
import ca.gc.cra.midscan.application.port.TransportException;
import ca.gc.cra.midscan.application.search.SearchExpression;
import ca.gc.cra.midscan.domain.mailbox.MailboxDescriptor;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Folder;
import jakarta.mail.FolderClosedException;
import jakarta.mail.FolderNotFoundException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.StoreClosedException;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.eclipse.angus.mail.iap.Argument;
import org.eclipse.angus.mail.iap.ProtocolException;
import org.eclipse.angus.mail.iap.Response;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.eclipse.angus.mail.imap.protocol.BODY;
import org.eclipse.angus.mail.imap.protocol.IMAPProtocol;
import org.eclipse.angus.mail.imap.protocol.IMAPResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MailSessionPort} backed by a Jakarta Mail store and the Eclipse Angus IMAP provider.
 * <p><strong>Why:</strong> The resolver needs raw {@code SEARCH} commands in two syntaxes and non-marking header
 * peeks, which the high-level {@code Folder.search} API cannot express; Angus exposes the protocol through
 * {@link IMAPFolder#doCommand(IMAPFolder.ProtocolCommand)}.</p>
 * <p><strong>Role:</strong> Infrastructure adapter; owns one store connection and at most one open folder.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one command at a time.</p>
 *
 * @since 0.1.0
 */
public final class JakartaMailSessionAdapter implements MailSessionPort {
  private static final Logger log = LoggerFactory.getLogger(JakartaMailSessionAdapter.class);

  private final ImapConnectionSettings settings;
  private Store store;
  private IMAPFolder selected;

  /**
   * Creates an adapter; no connection is made until {@link #login(String, char[])}.
   *
   * @param settings connection settings
   */
  public JakartaMailSessionAdapter(ImapConnectionSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  public void login(String user, char[] secret) throws TransportException {
    Objects.requireNonNull(user, "user");
    Objects.requireNonNull(secret, "secret");
    try {
      Session session = Session.getInstance(settings.toMailProperties());
      Store candidate = session.getStore(settings.protocol());
      candidate.connect(settings.host(), settings.port(), user, new String(secret));
      store = candidate;
      log.info("Logged in to {}:{} as {}", settings.host(), settings.port(), user);
    } catch (AuthenticationFailedException ex) {
      throw new TransportException("Authentication failed for " + user + " at " + settings.host(), ex);
    } catch (MessagingException ex) {
      throw new TransportException("Cannot connect to " + settings.host() + ":" + settings.port()
          + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public List<MailboxDescriptor> listMailboxes() throws SearchException, TransportException {
    Store connected = requireStore();
    try {
      Folder[] folders = connected.getDefaultFolder().list("*");
      List<MailboxDescriptor> result = new ArrayList<>(folders.length);
      for (Folder folder : folders) {
        String name = folder.getFullName();
        if (name == null || name.isBlank()) {
          continue;
        }
        result.add(new MailboxDescriptor(name, isSelectable(folder)));
      }
      return result;
    } catch (StoreClosedException ex) {
      throw new TransportException("Connection closed while listing mailboxes", ex);
    } catch (MessagingException ex) {
      throw new SearchException("LIST failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void selectReadOnly(String name) throws SelectionException, TransportException {
    Store connected = requireStore();
    closeSelected();
    try {
      Folder folder = connected.getFolder(name);
      if (!(folder instanceof IMAPFolder imapFolder)) {
        throw new SelectionException(name, "Store did not return an IMAP folder for " + name);
      }
      imapFolder.open(Folder.READ_ONLY);
      selected = imapFolder;
      log.debug("Selected {} read-only ({} messages)", name, imapFolder.getMessageCount());
    } catch (FolderNotFoundException ex) {
      throw new SelectionException(name, "Mailbox does not exist: " + name, ex);
    } catch (StoreClosedException ex) {
      throw new TransportException("Connection closed while selecting " + name, ex);
    } catch (MessagingException ex) {
      if (!connected.isConnected()) {
        throw new TransportException("Connection lost while selecting " + name, ex);
      }
      throw new SelectionException(name, "Cannot select " + name + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public Optional<String> activeMailbox() {
    if (selected == null || !selected.isOpen()) {
      return Optional.empty();
    }
    return Optional.of(selected.getFullName());
  }

  @Override
  public List<Integer> search(SearchExpression expression) throws SearchException, TransportException {
    IMAPFolder folder = requireSelected();
    Argument args = null;
    if (!expression.arguments().isEmpty()) {
      args = new Argument();
      for (String value : expression.arguments()) {
        args.writeString(value, StandardCharsets.UTF_8);
      }
    }
    Argument finalArgs = args;
    try {
      return sequenceRefs(folder.doCommand(p -> runSearch(p, expression.command(), finalArgs)));
    } catch (FolderClosedException | StoreClosedException ex) {
      throw new TransportException("Connection closed during SEARCH", ex);
    } catch (MessagingException ex) {
      throw new SearchException(expression.describe() + " rejected: " + ex.getMessage(), ex);
    }
  }

  @Override
  public String fetchHeaders(int sequenceRef, List<String> fields) throws SearchException, TransportException {
    String section = "HEADER.FIELDS (" + String.join(" ", fields).toUpperCase(Locale.ROOT) + ")";
    return new String(peek(sequenceRef, section), StandardCharsets.UTF_8);
  }

  @Override
  public byte[] fetchFullMessage(int sequenceRef) throws SearchException, TransportException {
    return peek(sequenceRef, "");
  }

  @Override
  public void close() {
    closeSelected();
    if (store == null) {
      return;
    }
    try {
      store.close();
      log.debug("Logged out from {}", settings.host());
    } catch (MessagingException ex) {
      log.warn("Logout from {} did not complete cleanly: {}", settings.host(), ex.getMessage());
    } finally {
      store = null;
    }
  }

  private byte[] peek(int sequenceRef, String section) throws SearchException, TransportException {
    IMAPFolder folder = requireSelected();
    try {
      BODY body = (BODY) folder.doCommand(p -> p.peekBody(sequenceRef, section));
      if (body == null) {
        return new byte[0];
      }
      ByteArrayInputStream in = body.getByteArrayInputStream();
      return in == null ? new byte[0] : in.readAllBytes();
    } catch (FolderClosedException | StoreClosedException ex) {
      throw new TransportException("Connection closed during FETCH", ex);
    } catch (MessagingException ex) {
      throw new SearchException("FETCH " + sequenceRef + " BODY.PEEK[" + section + "] failed: "
          + ex.getMessage(), ex);
    }
  }

  static List<Integer> sequenceRefs(Object raw) {
    if (!(raw instanceof List<?> values)) {
      return List.of();
    }
    List<Integer> hits = new ArrayList<>(values.size());
    for (Object value : values) {
      hits.add((Integer) value);
    }
    return hits;
  }

  private static List<Integer> runSearch(IMAPProtocol p, String command, Argument args)
      throws ProtocolException {
    Response[] responses = p.command(command, args);
    Response result = responses[responses.length - 1];
    List<Integer> hits = new ArrayList<>();
    if (result.isOK()) {
      for (int i = 0; i < responses.length; i++) {
        if (!(responses[i] instanceof IMAPResponse ir) || !ir.keyEquals("SEARCH")) {
          continue;
        }
        int number;
        while ((number = ir.readNumber()) != -1) {
          hits.add(number);
        }
        responses[i] = null;
      }
    }
    p.notifyResponseHandlers(responses);
    p.handleResult(result);
    return hits;
  }

  private static boolean isSelectable(Folder folder) throws MessagingException {
    if ((folder.getType() & Folder.HOLDS_MESSAGES) == 0) {
      return false;
    }
    if (folder instanceof IMAPFolder imapFolder) {
      return Arrays.stream(imapFolder.getAttributes())
          .map(attr -> attr.toLowerCase(Locale.ROOT))
          .noneMatch(attr -> attr.equals("\\noselect") || attr.equals("\\nonexistent"));
    }
    return true;
  }

  private Store requireStore() throws TransportException {
    if (store == null || !store.isConnected()) {
      throw new TransportException("Not connected to " + settings.host());
    }
    return store;
  }

  private IMAPFolder requireSelected() throws SearchException, TransportException {
    requireStore();
    if (selected == null || !selected.isOpen()) {
      throw new SearchException("No mailbox selected");
    }
    return selected;
  }

  private void closeSelected() {
    if (selected == null) {
      return;
    }
    try {
      if (selected.isOpen()) {
        selected.close(false);
      }
    } catch (MessagingException ex) {
      log.debug("Closing {} failed: {}", selected.getFullName(), ex.getMessage());
    } finally {
      selected = null;
    }
  }
}
