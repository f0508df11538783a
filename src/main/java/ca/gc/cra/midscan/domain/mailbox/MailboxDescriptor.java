package ca.gc.cra.midscan.domain.mailbox;

import java.util.Objects;

/**
 * <strong>What:</strong> Mailbox name plus the selectability derived from its LIST attributes.
 * <p><strong>Why:</strong> Navigational containers flagged {@code \Noselect} must never be chosen as a search
 * target.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param name server-side mailbox name; never blank
 * @param selectable {@code false} when the server advertised the mailbox as not selectable
 * @since 0.1.0
 */
public record MailboxDescriptor(String name, boolean selectable) {

  /**
   * Validates the mailbox name.
   *
   * @throws IllegalArgumentException if {@code name} is blank
   */
  public MailboxDescriptor {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("mailbox name must not be blank");
    }
  }

  /**
   * Creates a selectable descriptor.
   *
   * @param name mailbox name
   * @return descriptor flagged selectable
   */
  public static MailboxDescriptor selectable(String name) {
    return new MailboxDescriptor(name, true);
  }

  /**
   * Creates a descriptor for a navigational container.
   *
   * @param name mailbox name
   * @return descriptor flagged not selectable
   */
  public static MailboxDescriptor noSelect(String name) {
    return new MailboxDescriptor(name, false);
  }
}
