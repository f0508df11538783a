package ca.gc.cra.midscan.api;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the login password: {@code IMAP_PASS} or {@code IMAP_PASSWORD} first, then a {@code password=}
 * argument, then an interactive prompt. The value is never logged.
 */
final class SecretResolver {
  private static final Logger log = LoggerFactory.getLogger(SecretResolver.class);
  static final String ENV_PASS = "IMAP_PASS";
  static final String ENV_PASSWORD = "IMAP_PASSWORD";

  private final Map<String, String> env;
  private final Supplier<char[]> prompt;

  SecretResolver(Map<String, String> env, Supplier<char[]> prompt) {
    this.env = Objects.requireNonNull(env, "env");
    this.prompt = Objects.requireNonNull(prompt, "prompt");
  }

  /**
   * Resolves the password.
   *
   * @param argument value of {@code password=}, or {@code null}
   * @return password characters, or empty when none could be obtained
   */
  Optional<char[]> resolve(String argument) {
    for (String name : new String[] {ENV_PASS, ENV_PASSWORD}) {
      String value = env.get(name);
      if (value != null && !value.isEmpty()) {
        log.debug("Using password from {}", name);
        return Optional.of(value.toCharArray());
      }
    }
    if (argument != null && !argument.isEmpty()) {
      log.warn("password= on the command line is visible to other processes; prefer {}", ENV_PASS);
      return Optional.of(argument.toCharArray());
    }
    char[] typed = prompt.get();
    if (typed == null || typed.length == 0) {
      return Optional.empty();
    }
    return Optional.of(typed);
  }
}
