package ca.gc.cra.midscan.application.pipeline;

import ca.gc.cra.midscan.application.port.HeaderDecoder;
import ca.gc.cra.midscan.application.port.MetricsPort;
import ca.gc.cra.midscan.domain.message.HeaderSnapshot;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import ca.gc.cra.midscan.domain.resolve.ResolutionResult;
import ca.gc.cra.midscan.logging.Logs;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the terminal state of a mailbox scan into an immutable {@link ResolutionResult}.
 *
 * @since 0.1.0
 */
public final class ResolutionAggregator {
  private static final Logger log = LoggerFactory.getLogger(ResolutionAggregator.class);
  private static final int MAX_SUBJECT_LOG_BYTES = 160;

  private final HeaderDecoder decoder;
  private final MetricsPort metrics;

  /**
   * Creates an aggregator.
   *
   * @param decoder decoder applied to reported header values
   * @param metrics metrics sink for per-outcome counters
   */
  public ResolutionAggregator(HeaderDecoder decoder, MetricsPort metrics) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Assembles the result for one identifier.
   *
   * @param identifier resolved identifier
   * @param hit terminal scan state; empty means the plan was exhausted
   * @return matched or not-found result
   */
  public ResolutionResult assemble(MessageIdentifier identifier, Optional<MailboxHit> hit) {
    if (hit.isEmpty()) {
      metrics.increment("resolve.identifier.notFound");
      return new ResolutionResult.NotFound(identifier);
    }
    MailboxHit found = hit.get();
    metrics.increment("resolve.identifier.matched");
    metrics.increment("resolve.tier." + found.match().tier().label() + ".matched");
    HeaderSnapshot headers = HeaderSnapshot.parse(found.rawHeaders()).decode(decoder);
    log.debug("Subject of {}: {}", identifier, Logs.truncate(headers.subject(), MAX_SUBJECT_LOG_BYTES));
    return new ResolutionResult.Matched(
        identifier, found.mailbox(), found.match().tier(), found.match().firstSequenceRef(), headers);
  }
}
