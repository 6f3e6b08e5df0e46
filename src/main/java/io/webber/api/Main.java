package io.webber.api;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code webber} entry point. The first argument names the command; the rest belong to it.
 *
 * <p>Results and usage text go to stdout, logs to stderr.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: webber <build|identify> [options]";
  private static final String HELP_TEXT = """
      webber: turn a web site into an installable click package

      Usage:
        webber <command> [options]

      Commands:
        build       Build <stagingRoot>/shortcut.click (build --help for details)
        identify    Print the application identifier for a URL

      Global flags:
        --help      Show this message
      """;

  private Main() {}

  public static void main(String[] args) {
    PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
    ExitCode exit = run(args, out);
    out.flush();
    System.exit(exit.code());
  }

  static ExitCode run(String[] args, PrintWriter out) {
    if (args == null || args.length == 0 || args[0] == null || args[0].isBlank()) {
      log.error("No command given");
      out.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    List<String> rest = Arrays.asList(args).subList(1, args.length);
    String command = args[0].trim().toLowerCase(Locale.ROOT);
    switch (command) {
      case "build":
        return BuildCli.run(rest, out);
      case "identify":
        return IdentifyCli.run(rest, out);
      case "help":
      case "--help":
      case "-h":
        out.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      default:
        log.error("Unknown command '{}'", command);
        out.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
    }
  }
}
