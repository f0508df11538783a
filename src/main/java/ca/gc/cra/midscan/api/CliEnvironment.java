package ca.gc.cra.midscan.api;

import ca.gc.cra.midscan.application.port.MailSessionPort;
import ca.gc.cra.midscan.config.CompositionRoot;
import ca.gc.cra.midscan.config.ImapAccountConfig;
import java.io.Console;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Process-level collaborators a command needs: environment variables, session construction and the password
 * prompt. Tests substitute scripted versions.
 *
 * @param variables environment variables
 * @param sessions builds an unauthenticated session for an account
 * @param passwordPrompt interactive password prompt; returns {@code null} when no console is available
 * @since 0.1.0
 */
record CliEnvironment(
    Map<String, String> variables,
    Function<ImapAccountConfig, MailSessionPort> sessions,
    Supplier<char[]> passwordPrompt) {

  CliEnvironment {
    variables = Map.copyOf(Objects.requireNonNull(variables, "variables"));
    Objects.requireNonNull(sessions, "sessions");
    Objects.requireNonNull(passwordPrompt, "passwordPrompt");
  }

  static CliEnvironment system() {
    return new CliEnvironment(System.getenv(), CompositionRoot::jakartaSession, CliEnvironment::consolePrompt);
  }

  private static char[] consolePrompt() {
    Console console = System.console();
    if (console == null) {
      return null;
    }
    return console.readPassword("IMAP password: ");
  }
}
