package ca.gc.cra.photonic.infrastructure.raw;

import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolRunner;
import ca.gc.cra.photonic.domain.raw.RawConvertRequest;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts with {@code rawtherapee-cli}, optionally applying a processing profile.
 *
 * @since 0.1.0
 */
public final class RawTherapeeRawProcessor extends CommandLineRawProcessor {
  public static final String NAME = "rawtherapee";

  private final String processingProfile;
  private final String outputProfile;

  /**
   * @param enabled configuration switch
   * @param processingProfile {@code .pp3} profile for {@code -p}; blank to omit
   * @param outputProfile second {@code .pp3} profile applied after {@code processingProfile}; blank to omit
   * @param runner subprocess runner
   */
  public RawTherapeeRawProcessor(
      boolean enabled, String processingProfile, String outputProfile, ToolRunner runner) {
    super(NAME, enabled, List.of("rawtherapee-cli"), runner);
    this.processingProfile = processingProfile == null ? "" : processingProfile.trim();
    this.outputProfile = outputProfile == null ? "" : outputProfile.trim();
  }

  @Override
  protected List<ToolCommand> commands(RawConvertRequest request, Path scratch) {
    List<String> argv = new ArrayList<>(List.of("rawtherapee-cli", "-o", request.output().toString(), "-Y"));
    if (!processingProfile.isEmpty()) {
      argv.add("-p");
      argv.add(processingProfile);
    }
    if (!outputProfile.isEmpty()) {
      argv.add("-p");
      argv.add(outputProfile);
    }
    // -c must come last: everything after it is an input file
    argv.add("-c");
    argv.add(request.input().toString());
    return List.of(ToolCommand.of(argv));
  }
}
