package ca.gc.cra.midscan.application.pipeline;

/**
 * Totals for one batch run.
 *
 * @param identifiers identifiers processed
 * @param matched identifiers located
 * @param elapsedMillis wall time spent resolving
 * @since 0.1.0
 */
public record ResolveSummary(int identifiers, int matched, long elapsedMillis) {

  /**
   * Returns identifiers that were not located.
   *
   * @return not-found count
   */
  public int notFound() {
    return identifiers - matched;
  }
}
