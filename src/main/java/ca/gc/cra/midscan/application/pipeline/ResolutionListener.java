package ca.gc.cra.midscan.application.pipeline;

import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import ca.gc.cra.midscan.domain.resolve.ResolutionResult;
import java.util.Optional;

/**
 * Receives progress callbacks from {@link ResolveUseCase}.
 *
 * @since 0.1.0
 */
public interface ResolutionListener {

  /**
   * Called before an identifier's scan starts.
   *
   * @param identifier identifier about to be resolved
   */
  default void onStarted(MessageIdentifier identifier) {}

  /**
   * Called once the identifier has a result.
   *
   * @param result resolution result
   * @param preview body preview for matched messages when previews are enabled
   */
  default void onResolved(ResolutionResult result, Optional<String> preview) {}

  /** Listener that ignores every callback. */
  ResolutionListener NONE = new ResolutionListener() {};
}
