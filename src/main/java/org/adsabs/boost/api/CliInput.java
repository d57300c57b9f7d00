package org.adsabs.boost.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command line split into the switches every boost command understands and the remaining
 * {@code key=value} settings.
 *
 * <p>Recognised switches: {@code --help}/{@code -h}/{@code help}, {@code --verbose}/{@code -v}/
 * {@code --debug} and {@code --dry-run}. Any other argument starting with {@code -} and lacking an
 * {@code =} is rejected so a mistyped switch never turns into a silent no-op.</p>
 *
 * @param settings arguments left for {@link CliArgsParser}, in command line order
 * @param help whether usage text was requested
 * @param verbose whether DEBUG logging was requested
 * @param dryRun whether the command should print its effective configuration and stop
 * @since 0.1.0
 */
record CliInput(List<String> settings, boolean help, boolean verbose, boolean dryRun) {

  CliInput {
    settings = List.copyOf(settings);
  }

  /**
   * Splits raw arguments; {@code null} and blank entries are skipped.
   *
   * @param args raw arguments, may be {@code null}
   * @return parsed switches and settings
   * @throws IllegalArgumentException if an unknown switch is present
   */
  static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    boolean dryRun = false;
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        switch (arg.toLowerCase(Locale.ROOT)) {
          case "--help", "-h", "help" -> help = true;
          case "--verbose", "-v", "--debug" -> verbose = true;
          case "--dry-run" -> dryRun = true;
          default -> {
            if (arg.startsWith("-") && !arg.contains("=")) {
              throw new IllegalArgumentException("unknown option " + arg);
            }
            settings.add(arg);
          }
        }
      }
    }
    return new CliInput(settings, help, verbose, dryRun);
  }

  String[] settingsArray() {
    return settings.toArray(String[]::new);
  }
}
