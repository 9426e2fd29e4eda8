package ca.gc.cra.photonic.infrastructure.image;

import ca.gc.cra.photonic.application.port.ImageCodec;
import ca.gc.cra.photonic.domain.image.ImageFormat;
import ca.gc.cra.photonic.domain.image.PixelBuffer;
import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

/**
 * <strong>What:</strong> {@link ImageCodec} backed by {@code javax.imageio}.
 * <p>Reads 8- and 16-bit component images (TIFF, PNG, JPEG) into normalized float samples; alpha is
 * dropped and palette images are expanded to RGB. Writes 16-bit TIFF/PNG through a
 * {@link DataBuffer#TYPE_USHORT} component model and 8-bit JPEG at quality 0.95.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each call obtains its own reader or writer.</p>
 *
 * @since 0.1.0
 */
public final class ImageIoCodec implements ImageCodec {
  private static final float JPEG_QUALITY = 0.95f;

  @Override
  public PixelBuffer read(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    if (!Files.isRegularFile(file)) {
      throw new IOException("image not found: " + file);
    }
    BufferedImage image = ImageIO.read(file.toFile());
    if (image == null) {
      throw new IOException("unsupported image format: " + file);
    }
    ColorModel model = image.getColorModel();
    Raster raster = image.getRaster();
    int transfer = raster.getTransferType();
    boolean component =
        !(model instanceof IndexColorModel)
            && (transfer == DataBuffer.TYPE_BYTE || transfer == DataBuffer.TYPE_USHORT);
    return component ? readComponents(image, model, raster) : readPacked(image);
  }

  private static PixelBuffer readComponents(BufferedImage image, ColorModel model, Raster raster) {
    int width = image.getWidth();
    int height = image.getHeight();
    int channels = model.getNumColorComponents();
    float scale = raster.getTransferType() == DataBuffer.TYPE_USHORT ? 65535f : 255f;
    float[] samples = new float[width * height * channels];
    int i = 0;
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        for (int c = 0; c < channels; c++) {
          samples[i++] = raster.getSample(x, y, c) / scale;
        }
      }
    }
    return new PixelBuffer(width, height, channels, samples);
  }

  private static PixelBuffer readPacked(BufferedImage image) {
    int width = image.getWidth();
    int height = image.getHeight();
    float[] samples = new float[width * height * 3];
    int i = 0;
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int rgb = image.getRGB(x, y);
        samples[i++] = ((rgb >> 16) & 0xFF) / 255f;
        samples[i++] = ((rgb >> 8) & 0xFF) / 255f;
        samples[i++] = (rgb & 0xFF) / 255f;
      }
    }
    return new PixelBuffer(width, height, 3, samples);
  }

  @Override
  public void write(PixelBuffer image, Path file, ImageFormat format) throws IOException {
    Objects.requireNonNull(image, "image");
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(format, "format");
    BufferedImage encoded = format == ImageFormat.JPEG ? toEightBit(image) : toSixteenBit(image);
    String formatName =
        switch (format) {
          case TIFF16 -> "tiff";
          case PNG16 -> "png";
          case JPEG -> "jpeg";
        };
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.deleteIfExists(file);

    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(formatName);
    if (!writers.hasNext()) {
      throw new IOException("no ImageIO writer for the '" + formatName + "' format");
    }
    ImageWriter writer = writers.next();
    try (ImageOutputStream out = ImageIO.createImageOutputStream(file.toFile())) {
      if (out == null) {
        throw new IOException("cannot open " + file + " for writing");
      }
      writer.setOutput(out);
      if (format == ImageFormat.JPEG) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(JPEG_QUALITY);
        writer.write(null, new IIOImage(encoded, null, null), param);
      } else {
        writer.write(encoded);
      }
    } finally {
      writer.dispose();
    }
  }

  private static BufferedImage toSixteenBit(PixelBuffer image) {
    int bands = image.channels() >= 3 ? 3 : 1;
    ColorSpace space = ColorSpace.getInstance(bands == 3 ? ColorSpace.CS_sRGB : ColorSpace.CS_GRAY);
    ComponentColorModel model =
        new ComponentColorModel(space, false, false, Transparency.OPAQUE, DataBuffer.TYPE_USHORT);
    WritableRaster raster = model.createCompatibleWritableRaster(image.width(), image.height());
    fill(image, raster, bands, 65535);
    return new BufferedImage(model, raster, false, null);
  }

  private static BufferedImage toEightBit(PixelBuffer image) {
    int bands = image.channels() >= 3 ? 3 : 1;
    BufferedImage out =
        new BufferedImage(
            image.width(), image.height(), bands == 3 ? BufferedImage.TYPE_3BYTE_BGR : BufferedImage.TYPE_BYTE_GRAY);
    fill(image, out.getRaster(), bands, 255);
    return out;
  }

  private static void fill(PixelBuffer image, WritableRaster raster, int bands, int max) {
    float[] samples = image.samples();
    int channels = image.channels();
    for (int y = 0; y < image.height(); y++) {
      for (int x = 0; x < image.width(); x++) {
        int base = (y * image.width() + x) * channels;
        for (int b = 0; b < bands; b++) {
          float v = samples[base + b];
          float clamped = v < 0f ? 0f : (v > 1f ? 1f : v);
          raster.setSample(x, y, b, Math.round(clamped * max));
        }
      }
    }
  }
}
