package io.webber.api;

import io.webber.validation.Fields;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Arguments of one subcommand: {@code key=value} settings plus the {@code --help},
 * {@code --verbose} and {@code --dry-run} switches.
 *
 * @param settings settings in argument order; a repeated key keeps its last value
 * @param help usage text was requested
 * @param verbose DEBUG logging was requested
 * @param dryRun the build should only print its plan
 * @since 0.1.0
 */
record CommandArgs(Map<String, String> settings, boolean help, boolean verbose, boolean dryRun) {
  private static final Set<String> HELP = Set.of("--help", "-h", "help");
  private static final Pattern SETTING_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9]*");

  CommandArgs {
    settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
  }

  /**
   * Parses subcommand arguments. A help switch anywhere wins over everything else.
   *
   * @param args arguments after the command name; {@code null} and blank entries are skipped
   * @return parsed arguments
   * @throws IllegalArgumentException for an unknown switch, a missing {@code '='}, a bad setting
   *     name or a value containing control characters
   */
  static CommandArgs parse(List<String> args) {
    if (args.stream().filter(Objects::nonNull).anyMatch(a -> HELP.contains(a.trim().toLowerCase(Locale.ROOT)))) {
      return new CommandArgs(Map.of(), true, false, false);
    }
    Map<String, String> settings = new LinkedHashMap<>();
    boolean verbose = false;
    boolean dryRun = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      if (arg.startsWith("-")) {
        switch (arg.toLowerCase(Locale.ROOT)) {
          case "--verbose", "-v" -> verbose = true;
          case "--dry-run" -> dryRun = true;
          default -> throw new IllegalArgumentException("unknown switch " + arg);
        }
        continue;
      }
      int eq = arg.indexOf('=');
      if (eq < 0) {
        throw new IllegalArgumentException("expected key=value but got '" + arg + "'");
      }
      String key = arg.substring(0, eq).trim();
      if (!SETTING_NAME.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid setting name '" + key + "'");
      }
      settings.put(key, Fields.singleLine(key, arg.substring(eq + 1).trim()));
    }
    return new CommandArgs(settings, false, verbose, dryRun);
  }
}
