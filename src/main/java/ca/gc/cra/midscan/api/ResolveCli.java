package ca.gc.cra.midscan.api;

import ca.gc.cra.midscan.application.pipeline.ResolveSummary;
import ca.gc.cra.midscan.application.pipeline.ResolveUseCase;
import ca.gc.cra.midscan.application.port.ClockPort;
import ca.gc.cra.midscan.application.port.MailSessionPort;
import ca.gc.cra.midscan.application.port.ResultExportPort;
import ca.gc.cra.midscan.application.port.TransportException;
import ca.gc.cra.midscan.config.CompositionRoot;
import ca.gc.cra.midscan.config.ConfigMerger;
import ca.gc.cra.midscan.config.DefaultsForMode;
import ca.gc.cra.midscan.config.ImapAccountConfig;
import ca.gc.cra.midscan.config.ProviderDirectory;
import ca.gc.cra.midscan.config.ResolveConfig;
import ca.gc.cra.midscan.config.YamlConfigLoader;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import ca.gc.cra.midscan.infrastructure.input.IdentifierListLoader;
import ca.gc.cra.midscan.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.midscan.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.midscan.logging.LoggingConfigurator;
import ca.gc.cra.midscan.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for resolving Message-IDs to mailbox locations.
 *
 * @since 0.1.0
 */
public final class ResolveCli {
  private static final Logger log = LoggerFactory.getLogger(ResolveCli.class);
  private static final String MODE = "resolve";
  private static final String SUMMARY_USAGE =
      "usage: resolve (host=HOST|provider=NAME) user=USER (ids=ID[,ID...]|idsFile=PATH) "
          + "[port=N] [ssl=true|false] [mailboxes=DEFAULT|*|A,B,C] [startMailbox=NAME] "
          + "[hintDomains=D[,D...]] [out=PATH] [format=csv|ndjson] [preview=true|false] "
          + "[timeoutSeconds=N] [providersFile=PATH] [config=PATH] [--dry-run] [--allow-overwrite] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      MIDSCAN resolve

      Usage:
        resolve host=imap.example.com user=me@example.com ids='<abc@example.com>' [options]

      Required:
        host=HOST | provider=NAME  Server host, or a named provider (gmail, outlook, yahoo, providersFile entries)
        user=USER                  Login name (default IMAP_USER)
        ids=ID[,ID...]             Message-IDs, brackets optional; may repeat
        idsFile=PATH               File with one Message-ID per line (alternative or addition to ids=)

      Optional:
        port=N                     Server port (default IMAP_PORT, provider port, or 993)
        ssl=true|false             Implicit TLS (default true)
        mailboxes=DEFAULT|*|A,B,C  Candidate mailboxes: built-in list, every server mailbox, or explicit list
        startMailbox=NAME          First mailbox to search (default: active mailbox, else INBOX)
        hintDomains=D[,D...]       Sender domains used to narrow time-window candidates
        out=PATH                   Result file (default imap_messageid_matches.csv)
        format=csv|ndjson          Result file format (default csv)
        preview=true|false         Print a short body preview for matches (default false)
        timeoutSeconds=N           Socket timeout (default 60)
        providersFile=PATH         JSON file adding or overriding providers
        config=PATH                YAML file with common/resolve sections
        password=SECRET            Discouraged; prefer IMAP_PASS or the interactive prompt
        --dry-run                  Validate inputs and print the plan without connecting
        --allow-overwrite          Permit replacing an existing result file
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        Precedence is CLI over YAML over environment defaults.
        Mailboxes are opened read-only; messages are never marked seen.
      """;

  private ResolveCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the resolve command.
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
      log.debug("Verbose logging enabled for resolve CLI");
    }

    boolean dryRunFlag = input.hasFlag("--dry-run");
    boolean allowOverwriteFlag = input.hasFlag("--allow-overwrite");

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
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> defaults = DefaultsForMode.asFlatMap(MODE, environment.variables());
    Map<String, String> effective;
    ResolveConfig config;
    TelemetrySettings telemetry;
    try {
      effective = ConfigMerger.buildEffectiveConfig(MODE, yamlConfig, kv, defaults, log::warn);
      telemetry = TelemetryConfigurator.settings(effective);
      ProviderDirectory providers = ConfigCliUtils.providers(effective);
      config = ResolveConfig.fromMap(effective, providers);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid resolve arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    boolean dryRun = dryRunFlag || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite = allowOverwriteFlag || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Path out;
    List<MessageIdentifier> identifiers;
    try {
      out = Paths.validateOutputFile(config.out(), allowOverwrite);
      Path idsFile = config.idsFile().map(Paths::validateReadableFile).orElse(null);
      identifiers = IdentifierListLoader.load(config.ids(), idsFile);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid resolve path configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read identifier file {}", config.idsFile().orElse(null), ex);
      return ExitCode.IO_ERROR;
    }
    if (identifiers.isEmpty()) {
      log.error("No Message-IDs provided after normalization");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, out, identifiers, allowOverwrite, telemetry);
      return ExitCode.SUCCESS;
    }

    Optional<char[]> secret = new SecretResolver(environment.variables(), environment.passwordPrompt())
        .resolve(passwordArg);
    if (secret.isEmpty()) {
      log.error("No password available; set {} or run interactively", SecretResolver.ENV_PASS);
      return ExitCode.INVALID_ARGS;
    }

    ImapAccountConfig account = config.account();
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(telemetry)) {
      CompositionRoot root = new CompositionRoot(metrics, ClockPort.SYSTEM, environment.sessions());
      try (MailSessionPort session = root.mailSession(account);
           ResultExportPort export = root.resultExport(out, config.format())) {
        log.info("Connecting to {}:{} as {} (ssl={}, metricsExporter={})",
            account.host(), account.port(), account.user(), account.ssl(), telemetry.exporter());
        session.login(account.user(), secret.get());
        ResolveUseCase useCase = root.resolveUseCase(config, session, export, new ProgressPrinter());
        ResolveSummary summary = useCase.run(identifiers);
        CliPrinter.println(String.format(Locale.ROOT, "Done. Found %d matches in %.1fs. Output -> %s",
            summary.matched(), summary.elapsedMillis() / 1000.0, out));
        return ExitCode.SUCCESS;
      }
    } catch (TransportException ex) {
      log.error("IMAP connection failed: {}", ex.getMessage(), ex);
      return ExitCode.TRANSPORT_FAILURE;
    } catch (IllegalArgumentException ex) {
      log.error("Resolve configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Resolve I/O failure while writing {}", out, ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Resolve interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in resolve pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in resolve pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      Arrays.fill(secret.get(), '\0');
    }
  }

  private static void printDryRunPlan(
      ResolveConfig config,
      Path out,
      List<MessageIdentifier> identifiers,
      boolean allowOverwrite,
      TelemetrySettings telemetry) {
    ImapAccountConfig account = config.account();
    CliPrinter.printLines(
        "Resolve dry-run: no connection will be made.",
        " Server            : " + account.host() + ":" + account.port() + (account.ssl() ? " (ssl)" : ""),
        " Provider          : " + account.provider().orElse("<none>"),
        " User              : " + account.user(),
        " Identifiers       : " + identifiers.size(),
        " Mailbox source    : " + config.mailboxSource()
            + (config.mailboxes().isEmpty() ? "" : " " + config.mailboxes()),
        " Start mailbox     : " + config.startMailbox().orElse("<active or INBOX>"),
        " Hint domains      : " + (config.hintDomains().isEmpty() ? "<none>" : config.hintDomains()),
        " Output            : " + out + " (" + config.format().name().toLowerCase(Locale.ROOT) + ")",
        " Preview           : " + config.preview(),
        " Timeout           : " + account.timeout().toSeconds() + "s",
        " Allow overwrite   : " + allowOverwrite,
        " Metrics exporter  : " + telemetry.exporter(),
        " Re-run without --dry-run to search.");
  }
}
