package ca.gc.cra.photonic.infrastructure.raw;

import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolRunner;
import ca.gc.cra.photonic.domain.raw.RawConvertRequest;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Decodes with {@code dcraw -c} into a scratch PPM, then encodes the target format with {@code convert}.
 *
 * @since 0.1.0
 */
public final class DcrawRawProcessor extends CommandLineRawProcessor {
  public static final String NAME = "dcraw";

  /**
   * dcraw switches.
   *
   * @param whiteBalance {@code auto} ({@code -a}), {@code camera} ({@code -w}), or blank
   * @param colorMatrix output colour space for {@code -o}; zero to omit
   * @param gamma {@code -g} argument such as {@code "2.222 4.5"}; blank to omit
   * @param brightness {@code -b} multiplier; zero to omit
   */
  public record Settings(String whiteBalance, int colorMatrix, String gamma, double brightness) {
    public Settings {
      whiteBalance = whiteBalance == null ? "" : whiteBalance.trim().toLowerCase(Locale.ROOT);
      gamma = gamma == null ? "" : gamma.trim();
    }

    public static Settings defaults() {
      return new Settings("camera", 0, "", 0d);
    }
  }

  private final Settings settings;

  public DcrawRawProcessor(boolean enabled, Settings settings, ToolRunner runner) {
    super(NAME, enabled, List.of("dcraw", "convert"), runner);
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  protected List<ToolCommand> commands(RawConvertRequest request, Path scratch) {
    List<String> argv = new ArrayList<>();
    argv.add("dcraw");
    argv.add("-c");
    switch (settings.whiteBalance()) {
      case "auto" -> argv.add("-a");
      case "camera" -> argv.add("-w");
      default -> { }
    }
    if (settings.colorMatrix() > 0) {
      argv.add("-o");
      argv.add(Integer.toString(settings.colorMatrix()));
    }
    if (!settings.gamma().isEmpty()) {
      argv.add("-g");
      argv.addAll(List.of(settings.gamma().split("\\s+")));
    }
    if (settings.brightness() != 0d) {
      argv.add("-b");
      argv.add(String.format(Locale.ROOT, "%.2f", settings.brightness()));
    }
    argv.add(request.input().toString());

    Path decoded = scratch.resolve("decoded.ppm");
    return List.of(
        ToolCommand.of(argv).redirectStdoutTo(decoded),
        ToolCommand.of(
            "convert", decoded.toString(), "-quality", Integer.toString(request.quality()), request.output().toString()));
  }
}
