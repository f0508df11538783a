package ca.gc.cra.midscan.application.search;

import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Hint strategy that recognises a configured set of domains after the {@code @} of an identifier.
 *
 * <p>Identifiers generated by a provider's own mailer usually end in that provider's domain, and the sender header
 * of the stored copy normally shares it.</p>
 *
 * @since 0.1.0
 */
public final class SuffixDomainHints implements SenderDomainHints {
  private final List<String> domains;

  /**
   * Creates the strategy.
   *
   * @param domains candidate domains in priority order; blanks are ignored and case is folded
   */
  public SuffixDomainHints(List<String> domains) {
    List<String> cleaned = new ArrayList<>();
    for (String domain : domains) {
      if (domain == null) {
        continue;
      }
      String trimmed = domain.strip().toLowerCase(Locale.ROOT);
      if (trimmed.startsWith("@")) {
        trimmed = trimmed.substring(1);
      }
      if (!trimmed.isEmpty() && !cleaned.contains(trimmed)) {
        cleaned.add(trimmed);
      }
    }
    this.domains = List.copyOf(cleaned);
  }

  /**
   * Returns the configured domains after normalization.
   *
   * @return immutable domain list
   */
  public List<String> domains() {
    return domains;
  }

  @Override
  public Optional<String> hintFor(MessageIdentifier identifier) {
    String bare = identifier.bare().toLowerCase(Locale.ROOT);
    for (String domain : domains) {
      if (bare.contains("@" + domain)) {
        return Optional.of(domain);
      }
    }
    return Optional.empty();
  }
}
