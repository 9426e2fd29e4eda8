package ca.gc.cra.photonic.api;

import ca.gc.cra.photonic.domain.job.JobType;
import ca.gc.cra.photonic.logging.LoggingConfigurator;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code photonic} command dispatcher; the first argument names the job type.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: photonic <scan|timelapse|panoramic|stack|align|raw-convert> in=PATH [out=PATH] [options]";
  private static final String HELP_TEXT = """
      photonic photo processing pipeline

      Usage:
        photonic <command> in=PATH [out=PATH] [key=value...] [flags]

      Commands:
        scan         Group the images under a directory into timelapse, panorama, and stack candidates
        timelapse    Encode a directory of frames into one or more video formats
        panoramic    Stitch a directory of overlapping images into a panorama
        stack        Combine a directory of exposures with a statistical stacking method
        align        Align images to a common reference
        raw-convert  Convert one RAW file or every RAW file in a directory

      Global flags:
        --help      Show this message (photonic <command> --help for command options)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

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
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the job type)
   * @return exit code reported by the job command
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = args[0] == null ? "" : args[0].trim();
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);
    if (command.startsWith("-")) {
      CliInput input = CliInput.parse(new String[] {command});
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      if (input.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
        log.debug("Verbose logging enabled for dispatcher");
        return run(delegateArgs);
      }
      log.error("Unknown global flag: {}", command);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (command.equalsIgnoreCase("help")) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    JobType type;
    try {
      type = JobType.fromWireName(command);
    } catch (IllegalArgumentException ex) {
      log.error("Unknown command: {}", command);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    return JobCli.run(type, delegateArgs);
  }
}
