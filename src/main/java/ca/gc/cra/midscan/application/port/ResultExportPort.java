package ca.gc.cra.midscan.application.port;

import ca.gc.cra.midscan.domain.resolve.ResolutionResult;
import java.io.IOException;

/**
 * <strong>What:</strong> Output port receiving one {@link ResolutionResult} per identifier.
 * <p><strong>Role:</strong> Sink-side port implemented by CSV and NDJSON adapters.</p>
 * <p><strong>Thread-safety:</strong> Single-threaded use; results arrive in input order.</p>
 *
 * @since 0.1.0
 */
public interface ResultExportPort extends AutoCloseable {

  /**
   * Writes one result as one record.
   *
   * @param result result to export; must not be {@code null}
   * @throws IOException if the record cannot be written
   */
  void write(ResolutionResult result) throws IOException;

  /**
   * Flushes and releases the sink.
   *
   * @throws IOException if flushing fails
   */
  @Override
  default void close() throws IOException {}

  /**
   * Export port that discards every result.
   */
  ResultExportPort DISCARD = result -> {};
}
