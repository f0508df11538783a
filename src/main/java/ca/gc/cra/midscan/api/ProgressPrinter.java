package ca.gc.cra.midscan.api;

import ca.gc.cra.midscan.application.pipeline.ResolutionListener;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import ca.gc.cra.midscan.domain.resolve.ResolutionResult;
import java.util.Optional;

/**
 * Prints per-identifier progress lines for the resolve command.
 */
final class ProgressPrinter implements ResolutionListener {

  @Override
  public void onStarted(MessageIdentifier identifier) {
    CliPrinter.println("== Searching Message-ID: " + identifier + " ==");
  }

  @Override
  public void onResolved(ResolutionResult result, Optional<String> preview) {
    if (result instanceof ResolutionResult.Matched matched) {
      CliPrinter.println("  - " + matched.mailbox() + ": seq " + matched.sequenceRef()
          + " | " + matched.headers().date() + " | " + matched.headers().subject());
      preview.ifPresent(text -> CliPrinter.println("    " + text));
    } else {
      CliPrinter.println("  (not found)");
    }
  }
}
