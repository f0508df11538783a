package ca.gc.cra.midscan.api;

import ca.gc.cra.midscan.application.pipeline.HeaderSearchHit;
import ca.gc.cra.midscan.application.pipeline.HeaderSearchResult;
import ca.gc.cra.midscan.application.port.ClockPort;
import ca.gc.cra.midscan.application.port.MailSessionPort;
import ca.gc.cra.midscan.application.port.MetricsPort;
import ca.gc.cra.midscan.application.port.SelectionException;
import ca.gc.cra.midscan.application.port.TransportException;
import ca.gc.cra.midscan.config.CompositionRoot;
import ca.gc.cra.midscan.config.ConfigMerger;
import ca.gc.cra.midscan.config.DefaultsForMode;
import ca.gc.cra.midscan.config.HeaderSearchConfig;
import ca.gc.cra.midscan.config.YamlConfigLoader;
import ca.gc.cra.midscan.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the messages of one mailbox whose sender or subject contains a value.
 *
 * @since 0.1.0
 */
public final class SearchCli {
  private static final Logger log = LoggerFactory.getLogger(SearchCli.class);
  private static final String MODE = "search";
  private static final String SUMMARY_USAGE =
      "usage: search (host=HOST|provider=NAME) user=USER (from=TEXT|subject=TEXT) [mailbox=NAME] [limit=N] "
          + "[port=N] [ssl=true|false] [timeoutSeconds=N] [providersFile=PATH] [config=PATH]";
  private static final String HELP_TEXT = """
      MIDSCAN search

      Usage:
        search provider=gmail user=me@gmail.com from=billing@example.com
        search provider=gmail user=me@gmail.com subject="Quarterly report" mailbox=Archive

      Options:
        host=HOST | provider=NAME  Server host, or a named provider
        user=USER                  Login name (default IMAP_USER)
        from=TEXT                  Match messages whose From header contains TEXT
        subject=TEXT               Match messages whose Subject header contains TEXT
        mailbox=NAME               Mailbox to search (default INBOX)
        limit=N                    List at most the newest N matches (default 50)
        port=N                     Server port (default 993)
        ssl=true|false             Implicit TLS (default true)
        timeoutSeconds=N           Socket timeout (default 60)
        providersFile=PATH         JSON file adding or overriding providers
        config=PATH                YAML file with common/search sections
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private SearchCli() {}

  /**
   * Executes the search command.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, CliEnvironment.system());
  }

  static ExitCode run(String[] args, CliEnvironment environment) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String passwordArg = kv.remove("password");

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    HeaderSearchConfig config;
    try {
      Optional<Map<String, String>> yamlConfig = Optional.empty();
      if (configPath != null) {
        Path yamlPath = Path.of(configPath);
        if (!Files.exists(yamlPath)) {
          throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
        }
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      }
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE, environment.variables()), log::warn);
      config = HeaderSearchConfig.fromMap(effective, ConfigCliUtils.providers(effective));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid search arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    }

    Optional<char[]> secret = new SecretResolver(environment.variables(), environment.passwordPrompt())
        .resolve(passwordArg);
    if (secret.isEmpty()) {
      log.error("No password available; set {} or run interactively", SecretResolver.ENV_PASS);
      return ExitCode.INVALID_ARGS;
    }

    CompositionRoot root = new CompositionRoot(MetricsPort.NO_OP, ClockPort.SYSTEM, environment.sessions());
    try (MailSessionPort session = root.mailSession(config.account())) {
      session.login(config.account().user(), secret.get());
      HeaderSearchResult result = root.headerSearchUseCase(session)
          .run(config.mailbox(), config.field(), config.value(), config.limit());
      print(result);
      return ExitCode.SUCCESS;
    } catch (TransportException ex) {
      log.error("IMAP connection failed: {}", ex.getMessage(), ex);
      return ExitCode.TRANSPORT_FAILURE;
    } catch (SelectionException ex) {
      log.error("Cannot select mailbox {}: {}", ex.mailbox(), ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while searching", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception while searching", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      Arrays.fill(secret.get(), '\0');
    }
  }

  private static void print(HeaderSearchResult result) {
    CliPrinter.println(result.totalHits() + " message(s) found in " + result.mailbox());
    if (result.truncated()) {
      CliPrinter.println("showing the newest " + result.hits().size());
    }
    for (HeaderSearchHit hit : result.hits()) {
      CliPrinter.println("  - seq " + hit.sequenceRef() + " | " + hit.headers().date()
          + " | " + hit.headers().from() + " | " + hit.headers().subject());
    }
  }
}
