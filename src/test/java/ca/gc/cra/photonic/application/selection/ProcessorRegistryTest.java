package ca.gc.cra.photonic.application.selection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.photonic.application.port.ProcessorDescriptor;
import ca.gc.cra.photonic.domain.error.NoProcessorAvailableException;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.stack.StackMethod;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ProcessorRegistryTest {
  private static final List<Path> INPUTS = List.of(Path.of("a.tif"), Path.of("b.tif"));

  private final Stub statistical = new Stub("native", true, 0.8d, EnumSet.complementOf(EnumSet.of(StackMethod.HDR)));
  private final Stub enfuse = new Stub("enfuse", true, 0.9d, EnumSet.of(StackMethod.HDR, StackMethod.MEAN));
  private final Stub offline = new Stub("offline", false, 1.0d, EnumSet.allOf(StackMethod.class));

  @Test
  void picksHighestQualityAmongCapableProcessors() throws Exception {
    ProcessorRegistry<StackMethod, Stub> registry = registry("");

    assertSame(enfuse, registry.select(StackMethod.MEAN, INPUTS, ""));
    assertSame(statistical, registry.select(StackMethod.MEDIAN, INPUTS, null));
    assertSame(enfuse, registry.select(StackMethod.HDR, INPUTS, "auto"));
  }

  @Test
  void explicitChoiceWinsWhenUsable() throws Exception {
    assertSame(statistical, registry("").select(StackMethod.MEAN, INPUTS, "native"));
  }

  @Test
  void explicitChoiceThatCannotServeIsAnError() {
    ProcessorRegistry<StackMethod, Stub> registry = registry("");

    NoProcessorAvailableException ex = assertThrows(NoProcessorAvailableException.class,
        () -> registry.select(StackMethod.MEDIAN, INPUTS, "enfuse"));
    assertEquals("no stacking processor available for type median", ex.getMessage());
    assertThrows(NoProcessorAvailableException.class, () -> registry.select(StackMethod.MEAN, INPUTS, "offline"));
    assertThrows(NoProcessorAvailableException.class, () -> registry.select(StackMethod.MEAN, INPUTS, "missing"));
  }

  @Test
  void configuredDefaultBeatsQualityRanking() throws Exception {
    ProcessorRegistry<StackMethod, Stub> registry = registry("native");

    assertSame(statistical, registry.select(StackMethod.MEAN, INPUTS, ""));
    assertSame(enfuse, registry.select(StackMethod.HDR, INPUTS, ""));
  }

  @Test
  void failedQualityEstimateSkipsProcessor() throws Exception {
    Stub broken = new Stub("broken", true, Double.NaN, EnumSet.allOf(StackMethod.class));
    ProcessorRegistry<StackMethod, Stub> registry =
        new ProcessorRegistry<StackMethod, Stub>("stacking", "").register(broken).register(statistical);

    assertSame(statistical, registry.select(StackMethod.MEAN, INPUTS, ""));
  }

  @Test
  void noCapableProcessorIsAnError() {
    ProcessorRegistry<StackMethod, Stub> registry =
        new ProcessorRegistry<StackMethod, Stub>("stacking", "").register(statistical).register(offline);

    assertThrows(NoProcessorAvailableException.class, () -> registry.select(StackMethod.HDR, INPUTS, ""));
  }

  @Test
  void equalQualityKeepsFirstRegistered() throws Exception {
    Stub first = new Stub("first", true, 0.5d, EnumSet.of(StackMethod.MEAN));
    Stub second = new Stub("second", true, 0.5d, EnumSet.of(StackMethod.MEAN));

    assertSame(first, new ProcessorRegistry<StackMethod, Stub>("stacking", "")
        .register(first).register(second).select(StackMethod.MEAN, INPUTS, ""));
    assertSame(second, new ProcessorRegistry<StackMethod, Stub>("stacking", "")
        .register(second).register(first).select(StackMethod.MEAN, INPUTS, ""));
  }

  @Test
  void duplicateNameIsRejected() {
    ProcessorRegistry<StackMethod, Stub> registry = registry("");
    Stub impostor = new Stub("native", true, 2.0d, EnumSet.allOf(StackMethod.class));

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> registry.register(impostor));
    assertEquals("stacking processor native is already registered", ex.getMessage());
    assertSame(statistical, registry.get("native").orElseThrow());
  }

  @Test
  void availableListsUsableProcessorsInRegistrationOrder() {
    ProcessorRegistry<StackMethod, Stub> registry = registry("");

    assertEquals(List.of(statistical, enfuse), registry.available(StackMethod.MEAN));
    assertEquals(List.of("native", "enfuse", "offline"), registry.names());
    assertEquals(true, registry.get("offline").isPresent());
  }

  private ProcessorRegistry<StackMethod, Stub> registry(String defaultName) {
    return new ProcessorRegistry<StackMethod, Stub>("stacking", defaultName)
        .register(statistical)
        .register(enfuse)
        .register(offline);
  }

  private static final class Stub implements ProcessorDescriptor<StackMethod> {
    private final String name;
    private final boolean available;
    private final double quality;
    private final Set<StackMethod> methods;

    Stub(String name, boolean available, double quality, Set<StackMethod> methods) {
      this.name = name;
      this.available = available;
      this.quality = quality;
      this.methods = methods;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public boolean isAvailable() {
      return available;
    }

    @Override
    public boolean supports(StackMethod method) {
      return methods.contains(method);
    }

    @Override
    public double estimateQuality(List<Path> inputs) throws ProcessingException {
      if (Double.isNaN(quality)) {
        throw new ProcessingException("cannot inspect " + inputs.size() + " inputs");
      }
      return quality;
    }
  }
}
