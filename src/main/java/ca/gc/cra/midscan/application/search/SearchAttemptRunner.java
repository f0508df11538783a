package ca.gc.cra.midscan.application.search;

import ca.gc.cra.midscan.application.port.MailSessionPort;
import ca.gc.cra.midscan.application.port.MetricsPort;
import ca.gc.cra.midscan.application.port.SearchException;
import ca.gc.cra.midscan.application.port.TransportException;
import ca.gc.cra.midscan.logging.Logs;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes exactly one remote search per call and converts the response into an {@link AttemptOutcome}.
 *
 * <p>Only {@link TransportException} propagates; every other failure becomes {@link AttemptOutcome.Failed} so
 * the fallback ladder can move on.</p>
 *
 * @since 0.1.0
 */
public final class SearchAttemptRunner {
  private static final Logger log = LoggerFactory.getLogger(SearchAttemptRunner.class);
  private static final int MAX_RESPONSE_LOG_BYTES = 256;

  private final MailSessionPort session;
  private final MetricsPort metrics;

  /**
   * Creates a runner bound to a session.
   *
   * @param session mail session; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public SearchAttemptRunner(MailSessionPort session, MetricsPort metrics) {
    this.session = Objects.requireNonNull(session, "session");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Renders and sends one query.
   *
   * @param query query to run
   * @return outcome of the request
   * @throws TransportException if the session is lost
   */
  public AttemptOutcome run(SearchQuery query) throws TransportException {
    metrics.increment("resolve.search.attempts");
    SearchExpression expression;
    try {
      expression = SearchExpressions.render(query);
    } catch (IllegalArgumentException ex) {
      metrics.increment("resolve.search.failures");
      log.debug("Search query {} cannot be encoded: {}", query, ex.getMessage());
      return new AttemptOutcome.Failed(ex.getMessage());
    }
    try {
      List<Integer> hits = session.search(expression);
      if (hits == null || hits.isEmpty()) {
        log.debug("{} -> no hits", expression.describe());
        return AttemptOutcome.NO_HITS;
      }
      log.debug("{} -> {} hit(s)", expression.describe(), hits.size());
      return new AttemptOutcome.Hits(hits);
    } catch (SearchException ex) {
      metrics.increment("resolve.search.failures");
      log.debug("{} failed: {}", expression.describe(), Logs.truncate(ex.getMessage(), MAX_RESPONSE_LOG_BYTES));
      return new AttemptOutcome.Failed(ex.getMessage());
    }
  }
}
