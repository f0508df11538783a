package ca.gc.cra.midscan.config;

import ca.gc.cra.midscan.application.pipeline.HeaderSearchUseCase;
import ca.gc.cra.midscan.application.pipeline.MailboxScanOrchestrator;
import ca.gc.cra.midscan.application.pipeline.ResolutionAggregator;
import ca.gc.cra.midscan.application.pipeline.ResolutionListener;
import ca.gc.cra.midscan.application.pipeline.ResolveUseCase;
import ca.gc.cra.midscan.application.pipeline.ScanPlanner;
import ca.gc.cra.midscan.application.port.ClockPort;
import ca.gc.cra.midscan.application.port.MailSessionPort;
import ca.gc.cra.midscan.application.port.MessagePreviewer;
import ca.gc.cra.midscan.application.port.MetricsPort;
import ca.gc.cra.midscan.application.port.ResultExportPort;
import ca.gc.cra.midscan.application.search.CandidateWindowScanner;
import ca.gc.cra.midscan.application.search.SearchAttemptRunner;
import ca.gc.cra.midscan.application.search.SenderDomainHints;
import ca.gc.cra.midscan.application.search.SuffixDomainHints;
import ca.gc.cra.midscan.application.search.TieredQueryBuilder;
import ca.gc.cra.midscan.infrastructure.export.CsvResultExportAdapter;
import ca.gc.cra.midscan.infrastructure.export.NdjsonResultExportAdapter;
import ca.gc.cra.midscan.infrastructure.imap.ImapConnectionSettings;
import ca.gc.cra.midscan.infrastructure.imap.JakartaMailSessionAdapter;
import ca.gc.cra.midscan.infrastructure.mime.MimeHeaderDecoder;
import ca.gc.cra.midscan.infrastructure.mime.MimeMessagePreviewer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Central composition root that wires MIDSCAN use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps configuration-to-object translation in one place so CLIs stay thin.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning session, search tiers, aggregation and export.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances and are not
 * synchronized.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.midscan.application.pipeline.ResolveUseCase
 */
public final class CompositionRoot {
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Function<ImapAccountConfig, MailSessionPort> sessionFactory;

  /**
   * Creates a composition root backed by the Jakarta Mail adapter.
   *
   * @param metrics metrics sink shared by constructed components; must not be {@code null}
   */
  public CompositionRoot(MetricsPort metrics) {
    this(metrics, ClockPort.SYSTEM, CompositionRoot::jakartaSession);
  }

  /**
   * Creates a composition root with an explicit session factory; used by tests to inject scripted sessions.
   *
   * @param metrics metrics sink; must not be {@code null}
   * @param clock clock for latency measurement; must not be {@code null}
   * @param sessionFactory builds an unauthenticated session for an account; must not be {@code null}
   */
  public CompositionRoot(
      MetricsPort metrics, ClockPort clock, Function<ImapAccountConfig, MailSessionPort> sessionFactory) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
  }

  /**
   * Returns the shared metrics sink.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Creates an unauthenticated session for {@code account}.
   *
   * @param account connection settings
   * @return new session; caller owns and closes it
   */
  public MailSessionPort mailSession(ImapAccountConfig account) {
    return sessionFactory.apply(Objects.requireNonNull(account, "account"));
  }

  /**
   * Opens the export sink for the configured format, truncating any existing file.
   *
   * @param out target file
   * @param format export format
   * @return open export port; caller closes it
   * @throws IOException if the file cannot be created
   */
  public ResultExportPort resultExport(Path out, ExportFormat format) throws IOException {
    Objects.requireNonNull(out, "out");
    return switch (Objects.requireNonNull(format, "format")) {
      case CSV -> new CsvResultExportAdapter(out);
      case NDJSON -> new NdjsonResultExportAdapter(out);
    };
  }

  /**
   * Builds the resolve pipeline over an authenticated session.
   *
   * @param config resolve settings
   * @param session authenticated session
   * @param export export sink
   * @param listener progress listener
   * @return ready use case
   */
  public ResolveUseCase resolveUseCase(
      ResolveConfig config, MailSessionPort session, ResultExportPort export, ResolutionListener listener) {
    Objects.requireNonNull(config, "config");
    SearchAttemptRunner runner = new SearchAttemptRunner(session, metrics);
    SenderDomainHints hints =
        config.hintDomains().isEmpty() ? SenderDomainHints.NONE : new SuffixDomainHints(config.hintDomains());
    MailboxScanOrchestrator orchestrator = new MailboxScanOrchestrator(
        session, new TieredQueryBuilder(runner), new CandidateWindowScanner(session, runner), hints, metrics);
    ScanPlanner planner = new ScanPlanner(
        config.mailboxSource(), config.mailboxes(), config.startMailbox().orElse(null));
    MessagePreviewer previewer = config.preview() ? new MimeMessagePreviewer() : null;
    return new ResolveUseCase(
        session,
        planner,
        orchestrator,
        new ResolutionAggregator(new MimeHeaderDecoder(), metrics),
        export,
        previewer,
        listener,
        metrics,
        clock);
  }

  /**
   * Builds the sender/subject listing over an authenticated session.
   *
   * @param session authenticated session
   * @return ready use case
   */
  public HeaderSearchUseCase headerSearchUseCase(MailSessionPort session) {
    return new HeaderSearchUseCase(session, new SearchAttemptRunner(session, metrics), new MimeHeaderDecoder());
  }

  /**
   * Builds the production Jakarta Mail session for an account.
   *
   * @param account connection settings
   * @return unauthenticated session
   */
  public static MailSessionPort jakartaSession(ImapAccountConfig account) {
    return new JakartaMailSessionAdapter(
        new ImapConnectionSettings(account.host(), account.port(), account.ssl(), account.timeout()));
  }
}
