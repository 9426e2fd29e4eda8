package ca.gc.cra.photonic.application.align;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.photonic.domain.image.PixelBuffer;
import ca.gc.cra.photonic.domain.image.StarPoint;
import java.util.List;
import org.junit.jupiter.api.Test;

class StarDetectorTest {

  @Test
  void detectsStarsBrightestFirst() {
    PixelBuffer sky = StarField.render(32, 32, new int[][] {{20, 10}, {8, 8}, {12, 24}}, 0.6f, 1.0f, 0.8f);
    StarDetector detector = new StarDetector(StarDetector.DetectionSettings.withSensitivity(2d));

    List<StarPoint> stars = detector.detect(sky);

    assertEquals(3, stars.size());
    assertEquals(8d, stars.get(0).x(), 1e-6);
    assertEquals(8d, stars.get(0).y(), 1e-6);
    assertEquals(12d, stars.get(1).x(), 1e-6);
    assertEquals(24d, stars.get(1).y(), 1e-6);
    assertEquals(20d, stars.get(2).x(), 1e-6);
    assertTrue(stars.get(0).intensity() > stars.get(1).intensity());
  }

  @Test
  void isolatedHotPixelIsRemovedByOpening() {
    float[] samples = new float[16 * 16];
    samples[5 * 16 + 5] = 1f;
    PixelBuffer image = new PixelBuffer(16, 16, 1, samples);

    List<StarPoint> stars = new StarDetector(StarDetector.DetectionSettings.withSensitivity(1d)).detect(image);

    assertTrue(stars.isEmpty());
  }

  @Test
  void flatImageHasNoStars() {
    PixelBuffer flat = new PixelBuffer(8, 8, 1, filled(64, 0.4f));

    assertTrue(new StarDetector(StarDetector.DetectionSettings.withSensitivity(0.5d)).detect(flat).isEmpty());
  }

  @Test
  void maxStarsCapsResult() {
    PixelBuffer sky = StarField.render(32, 32, new int[][] {{20, 10}, {8, 8}, {12, 24}}, 0.6f, 1.0f, 0.8f);
    StarDetector detector = new StarDetector(new StarDetector.DetectionSettings(2d, 2, 1000, 2));

    List<StarPoint> stars = detector.detect(sky);

    assertEquals(2, stars.size());
    assertEquals(8d, stars.get(0).x(), 1e-6);
  }

  @Test
  void settingsRejectInvalidBlobBand() {
    assertThrows(IllegalArgumentException.class, () -> new StarDetector.DetectionSettings(2d, 10, 5, 100));
    assertThrows(IllegalArgumentException.class, () -> new StarDetector.DetectionSettings(Double.NaN, 2, 5, 100));
  }

  private static float[] filled(int size, float value) {
    float[] samples = new float[size];
    java.util.Arrays.fill(samples, value);
    return samples;
  }
}
