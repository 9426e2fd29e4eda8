package ca.gc.cra.photonic.testutil;

import ca.gc.cra.photonic.application.port.ImageCodec;
import ca.gc.cra.photonic.domain.image.ImageFormat;
import ca.gc.cra.photonic.domain.image.PixelBuffer;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Image codec keeping buffers in memory, keyed by path. */
public final class InMemoryImageCodec implements ImageCodec {
  private final Map<Path, PixelBuffer> images = new ConcurrentHashMap<>();
  private final Map<Path, ImageFormat> formats = new ConcurrentHashMap<>();

  public InMemoryImageCodec put(Path file, PixelBuffer image) {
    images.put(file, image);
    return this;
  }

  public PixelBuffer written(Path file) {
    return images.get(file);
  }

  public ImageFormat formatOf(Path file) {
    return formats.get(file);
  }

  @Override
  public PixelBuffer read(Path file) throws IOException {
    PixelBuffer image = images.get(file);
    if (image == null) {
      throw new NoSuchFileException(file.toString());
    }
    return image;
  }

  @Override
  public void write(PixelBuffer image, Path file, ImageFormat format) {
    images.put(file, image);
    formats.put(file, format);
  }
}
