package io.webber.api;

import io.webber.domain.pkg.AppIdentifier;
import io.webber.domain.pkg.HostResolution;
import io.webber.logging.LoggingConfigurator;
import io.webber.validation.Fields;
import java.io.PrintWriter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code identify url=URL}: prints the application identifier {@code build} would use for a URL.
 *
 * @since 0.1.0
 */
final class IdentifyCli {
  private static final Logger log = LoggerFactory.getLogger(IdentifyCli.class);
  private static final String SUMMARY_USAGE = "usage: identify url=URL [--verbose]";
  private static final String HELP_TEXT = """
      webber identify

      Usage:
        identify url=https://example.com

      Prints the identifier (e.g. webapp-example-com) that build would use.
      """;

  private IdentifyCli() {}

  static ExitCode run(List<String> args, PrintWriter out) {
    String url;
    try {
      CommandArgs command = CommandArgs.parse(args);
      if (command.help()) {
        out.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      if (command.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
      }
      if (command.dryRun()) {
        throw new IllegalArgumentException("identify does not take --dry-run");
      }
      url = Fields.required(command.settings(), "url");
    } catch (IllegalArgumentException ex) {
      log.error("Rejected identify arguments: {}", ex.getMessage());
      out.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (HostResolution.of(url).isFallback()) {
      log.warn("URL has no parsable host; identifier derived from the raw string");
    }
    out.println(AppIdentifier.fromUrl(url).value());
    return ExitCode.SUCCESS;
  }
}
