package ca.gc.cra.mergeflow.config;

import ca.gc.cra.mergeflow.application.pipeline.MergeUseCase;
import ca.gc.cra.mergeflow.application.port.MetricsPort;
import ca.gc.cra.mergeflow.application.port.RecordDecoder;
import ca.gc.cra.mergeflow.application.port.SourceStreamFactory;
import ca.gc.cra.mergeflow.infrastructure.csv.DelimitedRecordDecoder;
import ca.gc.cra.mergeflow.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.mergeflow.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.mergeflow.infrastructure.mux.SourceMultiplexer;
import ca.gc.cra.mergeflow.infrastructure.source.SourceRegistry;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires MERGEFLOW use cases to concrete adapters from a {@link MergeConfig}.
 * <p><strong>Why:</strong> Keeps configuration-to-adapter translation in one place.</p>
 * <p><strong>Role:</strong> Composition root spanning resolve, multiplex and decode stages.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration; factory methods create new adapters and
 * are not synchronized.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter; {@link #close()} flushes it.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MergeConfig config;
  private final Path baseDirectory;
  private final MetricsPort metrics;

  /**
   * Creates a composition root resolving relative locations against the working directory.
   *
   * @param config merge configuration
   */
  public CompositionRoot(MergeConfig config) {
    this(config, Path.of(""));
  }

  /**
   * Creates a composition root.
   *
   * @param config merge configuration
   * @param baseDirectory directory relative source locations are resolved against
   */
  public CompositionRoot(MergeConfig config, Path baseDirectory) {
    this(config, baseDirectory, config.metricsEnabled() ? new OpenTelemetryMetricsAdapter() : new NoOpMetricsAdapter());
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param config merge configuration
   * @param baseDirectory directory relative source locations are resolved against
   * @param metrics metrics adapter used by every constructed component
   */
  public CompositionRoot(MergeConfig config, Path baseDirectory, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    log.debug("Composition root created for {} sources (metrics {})",
        config.sources().size(), config.metricsEnabled() ? "enabled" : "disabled");
  }

  public MergeConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public SourceRegistry sourceRegistry() {
    return SourceRegistry.withDefaults(baseDirectory);
  }

  public SourceStreamFactory streamFactory() {
    return sources -> SourceMultiplexer.start(sources, config.multiplexer(), metrics);
  }

  public RecordDecoder recordDecoder() {
    return new DelimitedRecordDecoder(config.decoder(), metrics);
  }

  /**
   * Builds the merge use case over the configured sources.
   *
   * @return merge use case
   */
  public MergeUseCase mergeUseCase() {
    return new MergeUseCase(config.sources(), sourceRegistry(), streamFactory(), recordDecoder(), metrics);
  }

  /** Flushes and releases the metrics adapter when it owns exporter resources. */
  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
