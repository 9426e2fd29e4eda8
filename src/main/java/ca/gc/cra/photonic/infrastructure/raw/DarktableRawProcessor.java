package ca.gc.cra.photonic.infrastructure.raw;

import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolRunner;
import ca.gc.cra.photonic.application.util.ImageFiles;
import ca.gc.cra.photonic.domain.raw.RawConvertRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts with {@code darktable-cli}. A sidecar {@code <file>.xmp} or {@code <stem>.xmp} next to the RAW
 * file is passed through so edits made in darktable are honoured.
 *
 * @since 0.1.0
 */
public final class DarktableRawProcessor extends CommandLineRawProcessor {
  public static final String NAME = "darktable";

  /**
   * darktable-cli switches.
   *
   * @param applyPresets when {@code false}, passes {@code --apply-custom-presets false}
   * @param highQuality passes {@code --hq true}
   * @param width maximum export width; zero for none
   * @param height maximum export height; zero for none
   */
  public record Settings(boolean applyPresets, boolean highQuality, int width, int height) {
    public static Settings defaults() {
      return new Settings(true, true, 0, 0);
    }
  }

  private final Settings settings;

  public DarktableRawProcessor(boolean enabled, Settings settings, ToolRunner runner) {
    super(NAME, enabled, List.of("darktable-cli"), runner);
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  protected List<ToolCommand> commands(RawConvertRequest request, Path scratch) {
    List<String> argv = new ArrayList<>();
    argv.add("darktable-cli");
    argv.add(request.input().toString());
    sidecar(request.input()).ifPresent(xmp -> argv.add(xmp.toString()));
    argv.add(outputDirectory(request).toString());
    if (!settings.applyPresets()) {
      argv.add("--apply-custom-presets");
      argv.add("false");
    }
    if (settings.highQuality()) {
      argv.add("--hq");
      argv.add("true");
    }
    if (settings.width() > 0) {
      argv.add("--width");
      argv.add(Integer.toString(settings.width()));
    }
    if (settings.height() > 0) {
      argv.add("--height");
      argv.add(Integer.toString(settings.height()));
    }
    argv.add("--out-ext");
    argv.add(extension(request));
    argv.add("--core");
    argv.add("--configdir");
    argv.add(scratch.resolve("darktable-config").toString());
    return List.of(ToolCommand.of(argv));
  }

  @Override
  protected Optional<Path> locateOutput(RawConvertRequest request) {
    Optional<Path> exact = super.locateOutput(request);
    if (exact.isPresent()) {
      return exact;
    }
    Path expected = outputDirectory(request).resolve(ImageFiles.stem(request.input()) + "." + extension(request));
    return Files.isRegularFile(expected) ? Optional.of(expected) : Optional.empty();
  }

  static Optional<Path> sidecar(Path input) {
    Path full = input.resolveSibling(input.getFileName() + ".xmp");
    if (Files.isRegularFile(full)) {
      return Optional.of(full);
    }
    Path stem = input.resolveSibling(ImageFiles.stem(input) + ".xmp");
    return Files.isRegularFile(stem) ? Optional.of(stem) : Optional.empty();
  }

  private static Path outputDirectory(RawConvertRequest request) {
    Path parent = request.output().toAbsolutePath().getParent();
    return parent == null ? request.output().toAbsolutePath() : parent;
  }

  private static String extension(RawConvertRequest request) {
    String ext = ImageFiles.extension(request.output());
    return ext.isEmpty() ? "jpg" : ext;
  }
}
