package ca.gc.cra.midscan.config;

import ca.gc.cra.midscan.domain.mailbox.MailboxSource;
import ca.gc.cra.midscan.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated settings for the {@code resolve} command.
 *
 * @param account server and login settings
 * @param ids inline identifiers, unnormalized
 * @param idsFile optional identifier file
 * @param mailboxSource where candidate mailboxes come from
 * @param mailboxes explicit mailbox names for {@link MailboxSource#EXPLICIT}
 * @param startMailbox fixed first mailbox; empty follows the session's active mailbox
 * @param hintDomains domains recognised by the sender-hint strategy
 * @param out export file
 * @param format export format
 * @param preview whether matched messages get a body preview
 * @since 0.1.0
 */
public record ResolveConfig(
    ImapAccountConfig account,
    List<String> ids,
    Optional<Path> idsFile,
    MailboxSource mailboxSource,
    List<String> mailboxes,
    Optional<String> startMailbox,
    List<String> hintDomains,
    Path out,
    ExportFormat format,
    boolean preview) {
  /** Default export file name. */
  public static final String DEFAULT_OUT = "imap_messageid_matches.csv";

  public ResolveConfig {
    Objects.requireNonNull(account, "account");
    Objects.requireNonNull(mailboxSource, "mailboxSource");
    Objects.requireNonNull(out, "out");
    Objects.requireNonNull(format, "format");
    ids = List.copyOf(Objects.requireNonNullElse(ids, List.of()));
    idsFile = Objects.requireNonNullElse(idsFile, Optional.empty());
    mailboxes = List.copyOf(Objects.requireNonNullElse(mailboxes, List.of()));
    startMailbox = Objects.requireNonNullElse(startMailbox, Optional.empty());
    hintDomains = List.copyOf(Objects.requireNonNullElse(hintDomains, List.of()));
    if (ids.isEmpty() && idsFile.isEmpty()) {
      throw new IllegalArgumentException("no Message-IDs given; use ids=ID[,ID...] or idsFile=PATH");
    }
    if (mailboxSource == MailboxSource.EXPLICIT && mailboxes.isEmpty()) {
      throw new IllegalArgumentException("mailboxes must name at least one mailbox");
    }
  }

  /**
   * Builds settings from a merged flat map.
   *
   * @param args merged configuration (CLI over YAML over defaults)
   * @param providers provider directory used for {@code provider=}
   * @return validated settings
   * @throws IllegalArgumentException when values are missing or invalid
   */
  public static ResolveConfig fromMap(Map<String, String> args, ProviderDirectory providers) {
    Objects.requireNonNull(args, "args");
    ImapAccountConfig account = ImapAccountConfig.fromMap(args, providers);

    List<String> ids = Strings.splitList(args.get("ids"));
    Optional<Path> idsFile = ImapAccountConfig.optional(args.get("idsFile")).map(v -> toPath("idsFile", v));

    String mailboxesRaw = args.get("mailboxes");
    MailboxSource source = MailboxSource.fromOption(mailboxesRaw);
    List<String> mailboxes = source == MailboxSource.EXPLICIT ? Strings.splitList(mailboxesRaw) : List.of();

    Optional<String> start = ImapAccountConfig.optional(args.get("startMailbox"))
        .map(v -> Strings.requireNonBlank("startMailbox", v));
    List<String> hintDomains = Strings.splitList(args.get("hintDomains"));

    Path out = toPath("out", ImapAccountConfig.optional(args.get("out")).orElse(DEFAULT_OUT));
    ExportFormat format = ExportFormat.fromString(args.get("format"));
    boolean preview = ImapAccountConfig.optional(args.get("preview"))
        .map(ImapAccountConfig::parseBoolean)
        .orElse(false);

    return new ResolveConfig(account, ids, idsFile, source, mailboxes, start, hintDomains, out, format, preview);
  }

  private static Path toPath(String name, String raw) {
    try {
      return Path.of(Strings.requireNonBlank(name, raw));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }
}
