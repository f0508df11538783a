package ca.gc.cra.midscan.config;

import ca.gc.cra.midscan.application.search.HeaderSearchField;
import ca.gc.cra.midscan.validation.Numbers;
import ca.gc.cra.midscan.validation.Strings;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated settings for the {@code search} command.
 *
 * @param account server and login settings
 * @param field header to match
 * @param value text the header must contain
 * @param mailbox mailbox to search
 * @param limit maximum number of messages listed
 * @since 0.1.0
 */
public record HeaderSearchConfig(
    ImapAccountConfig account, HeaderSearchField field, String value, String mailbox, int limit) {
  /** Default mailbox searched. */
  public static final String DEFAULT_MAILBOX = "INBOX";
  /** Default listing limit. */
  public static final int DEFAULT_LIMIT = 50;

  public HeaderSearchConfig {
    Objects.requireNonNull(account, "account");
    Objects.requireNonNull(field, "field");
    Strings.requireNonBlank("value", value);
    Strings.requireNonBlank("mailbox", mailbox);
    Numbers.requireRange("limit", limit, 1, 10_000);
  }

  /**
   * Builds settings from a merged flat map. Exactly one of {@code from=} and {@code subject=} must be set.
   *
   * @param args merged configuration
   * @param providers provider directory used for {@code provider=}
   * @return validated settings
   * @throws IllegalArgumentException when values are missing, ambiguous or invalid
   */
  public static HeaderSearchConfig fromMap(Map<String, String> args, ProviderDirectory providers) {
    Objects.requireNonNull(args, "args");
    ImapAccountConfig account = ImapAccountConfig.fromMap(args, providers);

    Optional<String> from = ImapAccountConfig.optional(args.get(HeaderSearchField.FROM.optionKey()));
    Optional<String> subject = ImapAccountConfig.optional(args.get(HeaderSearchField.SUBJECT.optionKey()));
    if (from.isPresent() == subject.isPresent()) {
      throw new IllegalArgumentException("give exactly one of from=TEXT or subject=TEXT");
    }
    HeaderSearchField field = from.isPresent() ? HeaderSearchField.FROM : HeaderSearchField.SUBJECT;
    String value = from.orElseGet(subject::get);

    String mailbox = ImapAccountConfig.optional(args.get("mailbox")).orElse(DEFAULT_MAILBOX);
    int limit = ImapAccountConfig.optional(args.get("limit"))
        .map(raw -> Numbers.parseInt("limit", raw, 1, 10_000))
        .orElse(DEFAULT_LIMIT);
    return new HeaderSearchConfig(account, field, value, mailbox, limit);
  }
}
