package ca.gc.cra.photonic.config;

import ca.gc.cra.photonic.application.align.StarAlignmentProcessor;
import ca.gc.cra.photonic.application.pipeline.JobPipeline;
import ca.gc.cra.photonic.application.pipeline.JobRouter;
import ca.gc.cra.photonic.application.port.AlignmentProcessor;
import ca.gc.cra.photonic.application.port.ClockPort;
import ca.gc.cra.photonic.application.port.ImageCodec;
import ca.gc.cra.photonic.application.port.MetricsPort;
import ca.gc.cra.photonic.application.port.PersistencePort;
import ca.gc.cra.photonic.application.port.StackingProcessor;
import ca.gc.cra.photonic.application.port.ToolRunner;
import ca.gc.cra.photonic.application.scan.ImageScanner;
import ca.gc.cra.photonic.application.selection.ProcessorRegistry;
import ca.gc.cra.photonic.application.selection.RawProcessorRegistry;
import ca.gc.cra.photonic.application.stack.NativeStackingProcessor;
import ca.gc.cra.photonic.application.stack.StatisticalStackingEngine;
import ca.gc.cra.photonic.domain.align.AlignmentType;
import ca.gc.cra.photonic.domain.stack.StackMethod;
import ca.gc.cra.photonic.infrastructure.align.AlignImageStackProcessor;
import ca.gc.cra.photonic.infrastructure.exec.ProcessToolRunner;
import ca.gc.cra.photonic.infrastructure.image.ImageIoCodec;
import ca.gc.cra.photonic.infrastructure.media.FfmpegTimelapseBuilder;
import ca.gc.cra.photonic.infrastructure.media.HuginPanoramaAssembler;
import ca.gc.cra.photonic.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.photonic.infrastructure.persistence.JsonlJobJournalAdapter;
import ca.gc.cra.photonic.infrastructure.raw.DarktableRawProcessor;
import ca.gc.cra.photonic.infrastructure.raw.DcrawRawProcessor;
import ca.gc.cra.photonic.infrastructure.raw.ImageMagickRawProcessor;
import ca.gc.cra.photonic.infrastructure.raw.RawTherapeeRawProcessor;
import ca.gc.cra.photonic.infrastructure.stack.EnfuseStackingProcessor;
import ca.gc.cra.photonic.infrastructure.time.SystemClockAdapter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the job pipeline to concrete adapters.
 * <p><strong>Why:</strong> Processor registries are built exactly once per process from configuration and
 * handed to the router; nothing else constructs adapters or looks them up globally.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning RAW conversion, alignment, stacking, and media.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Register the enabled RAW converters in fallback order.</li>
 *   <li>Register the native and external aligners and stackers.</li>
 *   <li>Build the {@link JobRouter} and hand out pipelines bound to it.</li>
 *   <li>Expose shared adapters such as metrics, clock, and the job journal.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct on one thread during startup; the built graph is shared
 * read-only by pipeline workers.</p>
 * <p><strong>Observability:</strong> Logs registered processor names at DEBUG.</p>
 *
 * @since 0.1.0
 * @see JobPipeline
 * @see JobRouter
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final PipelineConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ToolRunner toolRunner;
  private final ImageCodec imageCodec;
  private final RawProcessorRegistry rawProcessors;
  private final ProcessorRegistry<AlignmentType, AlignmentProcessor> alignmentProcessors;
  private final ProcessorRegistry<StackMethod, StackingProcessor> stackingProcessors;
  private final JobRouter jobRouter;

  /**
   * Creates a composition root using subprocess tools from {@code PATH} and the configured metrics exporter.
   *
   * @param config validated configuration; must not be {@code null}
   */
  public CompositionRoot(PipelineConfig config) {
    this(
        config,
        Objects.requireNonNull(config, "config").metricsDisabled()
            ? MetricsPort.NO_OP
            : new OpenTelemetryMetricsAdapter(),
        new ProcessToolRunner(),
        new SystemClockAdapter());
  }

  /**
   * Creates a composition root with explicit adapters, typically from tests.
   *
   * @param config validated configuration
   * @param metrics metrics sink shared by every component
   * @param toolRunner subprocess runner shared by every external-tool adapter
   * @param clock wall clock for the job journal
   */
  public CompositionRoot(PipelineConfig config, MetricsPort metrics, ToolRunner toolRunner, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.toolRunner = Objects.requireNonNull(toolRunner, "toolRunner");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.imageCodec = new ImageIoCodec();
    this.rawProcessors = buildRawProcessors();
    this.alignmentProcessors = buildAlignmentProcessors();
    this.stackingProcessors = buildStackingProcessors();
    this.jobRouter = new JobRouter(
        new ImageScanner(),
        rawProcessors,
        alignmentProcessors,
        stackingProcessors,
        new FfmpegTimelapseBuilder(toolRunner),
        new HuginPanoramaAssembler(toolRunner));
    log.debug(
        "Registered processors raw={} alignment={} stacking={}",
        rawProcessors.names(),
        alignmentProcessors.names(),
        stackingProcessors.names());
  }

  /** @return configuration this root was built from */
  public PipelineConfig config() {
    return config;
  }

  /** @return shared metrics sink */
  public MetricsPort metrics() {
    return metrics;
  }

  /** @return shared clock */
  public ClockPort clock() {
    return clock;
  }

  /** @return RAW converters in registration order */
  public RawProcessorRegistry rawProcessors() {
    return rawProcessors;
  }

  /** @return alignment processors */
  public ProcessorRegistry<AlignmentType, AlignmentProcessor> alignmentProcessors() {
    return alignmentProcessors;
  }

  /** @return stacking processors */
  public ProcessorRegistry<StackMethod, StackingProcessor> stackingProcessors() {
    return stackingProcessors;
  }

  /** @return router dispatching every job type */
  public JobRouter jobRouter() {
    return jobRouter;
  }

  /**
   * Opens the configured job journal.
   *
   * @return JSON-lines journal, or {@link PersistencePort#NONE} when none is configured
   */
  public PersistencePort persistence() {
    return config.journal()
        .<PersistencePort>map(directory -> new JsonlJobJournalAdapter(directory, clock))
        .orElse(PersistencePort.NONE);
  }

  /**
   * Builds an unstarted pipeline bound to the shared router.
   *
   * @return new pipeline; the caller starts and stops it
   */
  public JobPipeline newPipeline() {
    return new JobPipeline(jobRouter, config.pipelineSettings(), persistence(), metrics);
  }

  private RawProcessorRegistry buildRawProcessors() {
    RawConfig raw = config.raw();
    return new RawProcessorRegistry(raw.defaultTool(), metrics)
        .register(new ImageMagickRawProcessor(raw.imagemagickEnabled(), raw.imagemagickResize(), toolRunner))
        .register(new DarktableRawProcessor(raw.darktableEnabled(), raw.darktable(), toolRunner))
        .register(new DcrawRawProcessor(raw.dcrawEnabled(), raw.dcraw(), toolRunner))
        .register(new RawTherapeeRawProcessor(
            raw.rawtherapeeEnabled(), raw.rawtherapeeProfile(), raw.rawtherapeeOutputProfile(), toolRunner));
  }

  private ProcessorRegistry<AlignmentType, AlignmentProcessor> buildAlignmentProcessors() {
    AlignmentConfig alignment = config.alignment();
    ProcessorRegistry<AlignmentType, AlignmentProcessor> registry =
        new ProcessorRegistry<>("alignment", alignment.defaultProcessor());
    if (alignment.astroEnabled()) {
      registry.register(new StarAlignmentProcessor(imageCodec, metrics));
    }
    registry.register(new AlignImageStackProcessor(alignment.externalTypes(), toolRunner));
    return registry;
  }

  private ProcessorRegistry<StackMethod, StackingProcessor> buildStackingProcessors() {
    return new ProcessorRegistry<StackMethod, StackingProcessor>("stacking", config.stackingDefaultProcessor())
        .register(new NativeStackingProcessor(imageCodec, new StatisticalStackingEngine(), metrics))
        .register(new EnfuseStackingProcessor(toolRunner));
  }
}
