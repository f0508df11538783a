package ca.gc.cra.midscan.application.pipeline;

import ca.gc.cra.midscan.application.port.ClockPort;
import ca.gc.cra.midscan.application.port.MailSessionPort;
import ca.gc.cra.midscan.application.port.MessagePreviewer;
import ca.gc.cra.midscan.application.port.MetricsPort;
import ca.gc.cra.midscan.application.port.ResultExportPort;
import ca.gc.cra.midscan.application.port.SearchException;
import ca.gc.cra.midscan.application.port.TransportException;
import ca.gc.cra.midscan.domain.mailbox.ScanPlan;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import ca.gc.cra.midscan.domain.resolve.ResolutionResult;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Resolves a batch of identifiers sequentially over one authenticated session.
 * <p><strong>Why:</strong> Operators usually hold a list of identifiers from bounce reports or audit trails and need
 * one exported record per identifier.</p>
 * <p><strong>Role:</strong> Application-layer use case driven by the {@code resolve} CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build a fresh scan plan for each identifier and run the orchestrator.</li>
 *   <li>Assemble results, optionally attach a body preview, and export each result as soon as it exists.</li>
 *   <li>Abort the batch only on transport loss.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one identifier finishes before the next begins.</p>
 * <p><strong>Observability:</strong> MDC key {@code identifier}; histogram {@code resolve.identifier.latencyMillis}.</p>
 *
 * @since 0.1.0
 */
public final class ResolveUseCase {
  private static final Logger log = LoggerFactory.getLogger(ResolveUseCase.class);

  private final MailSessionPort session;
  private final ScanPlanner planner;
  private final MailboxScanOrchestrator orchestrator;
  private final ResolutionAggregator aggregator;
  private final ResultExportPort export;
  private final MessagePreviewer previewer;
  private final ResolutionListener listener;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates the use case.
   *
   * @param session authenticated session; must not be {@code null}
   * @param planner scan planner; must not be {@code null}
   * @param orchestrator mailbox scan orchestrator; must not be {@code null}
   * @param aggregator result aggregator; must not be {@code null}
   * @param export export sink receiving each result; must not be {@code null}
   * @param previewer body previewer, or {@code null} to disable previews
   * @param listener progress listener; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param clock clock used for latency measurement; must not be {@code null}
   */
  public ResolveUseCase(
      MailSessionPort session,
      ScanPlanner planner,
      MailboxScanOrchestrator orchestrator,
      ResolutionAggregator aggregator,
      ResultExportPort export,
      MessagePreviewer previewer,
      ResolutionListener listener,
      MetricsPort metrics,
      ClockPort clock) {
    this.session = Objects.requireNonNull(session, "session");
    this.planner = Objects.requireNonNull(planner, "planner");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.export = Objects.requireNonNull(export, "export");
    this.previewer = previewer;
    this.listener = Objects.requireNonNull(listener, "listener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Resolves every identifier in order.
   *
   * @param identifiers identifiers in input order
   * @return batch totals
   * @throws TransportException if the session is lost; results exported so far remain written
   * @throws IOException if the export sink fails
   */
  public ResolveSummary run(List<MessageIdentifier> identifiers) throws TransportException, IOException {
    long started = clock.nowMillis();
    int matched = 0;
    int processed = 0;
    log.info("Resolving {} identifier(s)", identifiers.size());
    for (MessageIdentifier identifier : identifiers) {
      ResolutionResult result;
      Optional<String> preview;
      String previousIdentifier = MDC.get("identifier");
      MDC.put("identifier", identifier.bare());
      try {
        listener.onStarted(identifier);
        long t0 = clock.nowMillis();
        ScanPlan plan = planner.plan(session);
        result = aggregator.assemble(identifier, orchestrator.scan(identifier, plan));
        preview = preview(result);
        metrics.observe("resolve.identifier.latencyMillis", clock.nowMillis() - t0);
      } catch (TransportException ex) {
        log.error("Connection lost while resolving {} ({} of {} done)", identifier, processed, identifiers.size());
        throw ex;
      } finally {
        if (previousIdentifier == null) {
          MDC.remove("identifier");
        } else {
          MDC.put("identifier", previousIdentifier);
        }
      }
      export.write(result);
      listener.onResolved(result, preview);
      processed++;
      if (result.matched()) {
        matched++;
      }
    }
    long elapsed = clock.nowMillis() - started;
    log.info("Resolved {} identifier(s): {} matched, {} not found in {} ms",
        processed, matched, processed - matched, elapsed);
    return new ResolveSummary(processed, matched, elapsed);
  }

  private Optional<String> preview(ResolutionResult result) throws TransportException {
    if (previewer == null || !(result instanceof ResolutionResult.Matched match)) {
      return Optional.empty();
    }
    // The matched mailbox is still selected, so its sequence number is valid.
    try {
      return previewer.preview(session.fetchFullMessage(match.sequenceRef()));
    } catch (SearchException ex) {
      log.warn("Preview unavailable for seq {} in {}: {}", match.sequenceRef(), match.mailbox(), ex.getMessage());
      return Optional.empty();
    }
  }
}
