package ca.gc.cra.midscan.api;

import ca.gc.cra.midscan.config.ProviderDirectory;
import ca.gc.cra.midscan.config.ProviderEndpoint;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the effective provider directory.
 *
 * @since 0.1.0
 */
public final class ProvidersCli {
  private static final Logger log = LoggerFactory.getLogger(ProvidersCli.class);
  private static final String SUMMARY_USAGE = "usage: providers [providersFile=PATH]";

  private ProvidersCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    ProviderDirectory directory = ConfigCliUtils.providers(kv);
    List<ProviderEndpoint> endpoints = directory.endpoints().stream()
        .sorted(Comparator.comparing(ProviderEndpoint::name))
        .collect(Collectors.toList());
    for (ProviderEndpoint endpoint : endpoints) {
      CliPrinter.println(String.format(Locale.ROOT, "%-12s %s:%d%s",
          endpoint.name(), endpoint.host(), endpoint.port(), endpoint.ssl() ? " (ssl)" : ""));
    }
    return ExitCode.SUCCESS;
  }
}
