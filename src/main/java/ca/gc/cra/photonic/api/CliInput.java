package ca.gc.cra.photonic.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into {@code --flags} and {@code key=value} pairs.
 *
 * <p>Help, verbose, and quiet switches are recognised in all their spellings; any other token starting with
 * a dash and lacking {@code =} is kept as a lower-cased flag.
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Set<String> QUIET_FLAGS = Set.of("--quiet", "-q");

  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(String[] keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Splits raw arguments.
   *
   * @param args raw arguments; may be {@code null}
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of());
    }

    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (QUIET_FLAGS.contains(lower)) {
        flags.add("--quiet");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags));
  }

  /** @return non-flag arguments in their original order */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /** @return whether help was requested */
  public boolean help() {
    return flags.contains("--help");
  }

  /** @return whether DEBUG logging was requested */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /** @return whether only warnings and errors should be logged */
  public boolean quiet() {
    return flags.contains("--quiet");
  }

  /**
   * Checks for a flag, case-insensitively.
   *
   * @param flag flag including its dashes
   * @return {@code true} when present
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /** @return every flag seen */
  public Set<String> flags() {
    return flags;
  }
}
