package ca.gc.cra.midscan.application.search;

import java.util.List;
import java.util.Objects;

/**
 * Rendered search request: command text followed by string arguments the transport writes as IMAP astrings.
 *
 * @param command command text, e.g. {@code SEARCH HEADER} or {@code SEARCH (HEADER "Message-ID" "<x@y>")}
 * @param arguments trailing string arguments; empty for fully literal commands
 * @since 0.1.0
 */
public record SearchExpression(String command, List<String> arguments) {

  public SearchExpression {
    Objects.requireNonNull(command, "command");
    arguments = arguments == null ? List.of() : List.copyOf(arguments);
  }

  /**
   * Returns a single-line rendering for logs, with arguments shown quoted. Line breaks inside arguments are shown
   * as {@code \r} and {@code \n}.
   *
   * @return human-readable request text
   */
  public String describe() {
    if (arguments.isEmpty()) {
      return command;
    }
    StringBuilder sb = new StringBuilder(command);
    for (String argument : arguments) {
      sb.append(' ').append(SearchExpressions.quote(argument.replace("\r", "\\r").replace("\n", "\\n")));
    }
    return sb.toString();
  }
}
