package ca.gc.cra.photonic.infrastructure.raw;

import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolRunner;
import ca.gc.cra.photonic.domain.raw.RawConvertRequest;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts RAW files with ImageMagick {@code convert}, auto-orienting and re-encoding at the requested
 * quality.
 *
 * @since 0.1.0
 */
public final class ImageMagickRawProcessor extends CommandLineRawProcessor {
  public static final String NAME = "imagemagick";

  private final String resize;

  /**
   * @param enabled configuration switch
   * @param resize optional {@code -resize} geometry, blank for none
   * @param runner subprocess runner
   */
  public ImageMagickRawProcessor(boolean enabled, String resize, ToolRunner runner) {
    super(NAME, enabled, List.of("convert"), runner);
    this.resize = resize == null ? "" : resize.trim();
  }

  @Override
  protected List<ToolCommand> commands(RawConvertRequest request, Path scratch) {
    List<String> argv = new ArrayList<>();
    argv.add("convert");
    argv.add(request.input().toString());
    argv.add("-auto-orient");
    argv.add("-colorspace");
    argv.add("sRGB");
    if (!resize.isEmpty()) {
      argv.add("-resize");
      argv.add(resize);
    }
    argv.add("-quality");
    argv.add(Integer.toString(request.quality()));
    argv.add(request.output().toString());
    return List.of(ToolCommand.of(argv));
  }
}
