package io.webber.api;

import io.webber.application.pipeline.BuildPackageUseCase;
import io.webber.application.pipeline.BuildResult;
import io.webber.application.pipeline.PackageBuildException;
import io.webber.config.BuildConfig;
import io.webber.config.CompositionRoot;
import io.webber.config.ConfigMerger;
import io.webber.config.Defaults;
import io.webber.config.MetricsSettings;
import io.webber.config.YamlConfigLoader;
import io.webber.domain.icon.IconSource;
import io.webber.domain.pkg.AppIdentifier;
import io.webber.logging.LoggingConfigurator;
import io.webber.logging.Logs;
import io.webber.validation.Fields;
import io.webber.validation.Paths;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code build}: packages a web site as {@code <stagingRoot>/shortcut.click} and prints its path.
 *
 * <p>Settings come from the command line, an optional {@code config=FILE.yaml} and
 * {@link Defaults}, in that order of precedence. Failures map to {@link ExitCode}s:</p>
 * <ul>
 *   <li>bad settings: {@link ExitCode#INVALID_ARGS}</li>
 *   <li>unreadable or malformed config file: {@link ExitCode#CONFIG_ERROR} or {@link ExitCode#IO_ERROR}</li>
 *   <li>build failures by {@link PackageBuildException.Kind}</li>
 * </ul>
 *
 * @since 0.1.0
 */
final class BuildCli {
  private static final Logger log = LoggerFactory.getLogger(BuildCli.class);
  private static final int LOG_VALUE_BYTES = 256;
  private static final String SUMMARY_USAGE =
      "usage: build url=URL name=NAME [themeColor=COLOR] [iconUrl=URL] [urlPatterns=EXPR] "
          + "[stagingRoot=PATH] [iconTimeoutSeconds=N] [config=FILE.yaml] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      webber build

      Usage:
        build url=https://example.com name="Example" [options]

      Required:
        url=URL                  Web site the shortcut opens
        name=NAME                Title shown in the launcher

      Optional:
        themeColor=COLOR         Splash screen color (default #FFFFFF)
        iconUrl=URL              Icon to download; empty uses the bundled icon
        urlPatterns=EXPR         URL patterns kept inside the app (default https?://<host>/*)
        stagingRoot=PATH         Build directory, wiped on every build
                                 (default $XDG_CACHE_HOME/webber.timsueberkrueb/click-build)
        iconTimeoutSeconds=N     Icon download timeout, 0 for none (default 30)
        config=FILE.yaml         YAML file with common/build sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP endpoint (default $OTEL_EXPORTER_OTLP_ENDPOINT
                                   or http://localhost:4317)
        --dry-run                Validate inputs and print the plan without building
        --verbose                Enable DEBUG logging
        --help                   Show this message

      The package is written to <stagingRoot>/shortcut.click.
      """;

  private BuildCli() {}

  static ExitCode run(List<String> args, PrintWriter out) {
    CommandArgs command;
    try {
      command = CommandArgs.parse(args);
    } catch (IllegalArgumentException ex) {
      return reject(out, ExitCode.INVALID_ARGS, ex.getMessage());
    }
    if (command.help()) {
      out.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (command.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> cli = new LinkedHashMap<>(command.settings());
    String configFile = cli.remove("config");
    Map<String, String> yaml;
    try {
      yaml = configFile == null || configFile.isEmpty()
          ? Map.of()
          : YamlConfigLoader.load(Path.of(configFile), "build");
    } catch (NoSuchFileException ex) {
      return reject(out, ExitCode.CONFIG_ERROR, "configuration file not found: " + configFile);
    } catch (IllegalArgumentException ex) {
      return reject(out, ExitCode.CONFIG_ERROR, ex.getMessage());
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configFile, ex);
      return ExitCode.IO_ERROR;
    }

    BuildConfig config;
    MetricsSettings metricsSettings;
    Path stagingRoot;
    boolean dryRun;
    try {
      Map<String, String> effective = ConfigMerger.merge(Defaults.forBuild(), yaml, cli,
          key -> log.warn("CLI overrides YAML for key: {}", key));
      config = BuildConfig.fromMap(effective);
      metricsSettings = MetricsSettings.fromMap(effective);
      stagingRoot = Paths.validateStagingRoot(config.stagingRoot());
      dryRun = command.dryRun() || Boolean.parseBoolean(Fields.optional(effective, "dryRun"));
    } catch (IllegalArgumentException ex) {
      return reject(out, ExitCode.INVALID_ARGS, ex.getMessage());
    }

    if (dryRun) {
      printPlan(out, config, stagingRoot, metricsSettings);
      return ExitCode.SUCCESS;
    }
    log.info("Building url={} name={} in {}",
        Logs.truncate(config.url(), LOG_VALUE_BYTES),
        Logs.truncate(config.name(), LOG_VALUE_BYTES),
        stagingRoot);
    try (CompositionRoot root = new CompositionRoot(metricsSettings)) {
      BuildResult result = root.buildUseCase(config).build(config.toRequest(), stagingRoot);
      out.println(result.packageFile());
      return ExitCode.SUCCESS;
    } catch (PackageBuildException ex) {
      if (Thread.currentThread().isInterrupted()) {
        log.error("Build interrupted during {}", ex.operation());
        return ExitCode.INTERRUPTED;
      }
      log.error("Build failed during {}: {}", ex.operation(), ex.getMessage());
      return switch (ex.kind()) {
        case FILESYSTEM -> ExitCode.IO_ERROR;
        case NETWORK -> ExitCode.NETWORK_ERROR;
        case ARCHIVE -> ExitCode.ARCHIVE_ERROR;
      };
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while building", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode reject(PrintWriter out, ExitCode code, String problem) {
    log.error("Rejected build arguments: {}", problem);
    out.println(SUMMARY_USAGE);
    return code;
  }

  private static void printPlan(
      PrintWriter out, BuildConfig config, Path stagingRoot, MetricsSettings metricsSettings) {
    AppIdentifier id = AppIdentifier.fromUrl(config.url());
    IconSource icon = IconSource.fromUrl(config.iconUrl());
    String iconOrigin = icon instanceof IconSource.Remote remote ? remote.uri().toString() : "<bundled>";
    String exporter = metricsSettings.exporting()
        ? metricsSettings.exporter() + " -> " + metricsSettings.endpoint()
        : metricsSettings.exporter();
    out.println("Build dry-run: no files will be written.");
    out.println(" Identifier        : " + id);
    out.println(" Package name      : " + id.packageName());
    out.println(" URL               : " + config.url());
    out.println(" Title             : " + config.name());
    out.println(" URL patterns      : " + config.urlPatterns());
    out.println(" Theme color       : " + config.themeColor());
    out.println(" Icon              : " + iconOrigin + " -> " + icon.fileName());
    out.println(" Icon timeout      : " + config.iconTimeout().map(d -> d.toSeconds() + "s").orElse("<none>"));
    out.println(" Staging root      : " + stagingRoot);
    out.println(" Package file      : " + stagingRoot.resolve(BuildPackageUseCase.PACKAGE_FILE));
    out.println(" Metrics exporter  : " + exporter);
  }
}
