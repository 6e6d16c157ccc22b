package ca.gc.cra.mergeflow.config;

import ca.gc.cra.mergeflow.infrastructure.csv.DecoderOptions;
import ca.gc.cra.mergeflow.infrastructure.mux.MultiplexerSettings;
import ca.gc.cra.mergeflow.validation.Numbers;
import ca.gc.cra.mergeflow.validation.Strings;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable configuration for a merge run.
 * <p><strong>Role:</strong> Bound from flattened YAML by {@link #fromMap(Map)} and consumed by
 * {@link CompositionRoot}.</p>
 * <p><strong>Keys:</strong> {@code sources.N}, {@code multiplexer.chunkBytes}, {@code multiplexer.handoffDepth},
 * {@code decoder.delimiter}, {@code decoder.header.N}, {@code decoder.charset},
 * {@code decoder.trimLeadingWhitespace}, {@code metrics.enabled}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable.</p>
 *
 * @param sources ordered source specifications
 * @param multiplexer multiplexer tuning
 * @param decoder decoder options
 * @param metricsEnabled whether metrics are exported through OpenTelemetry
 * @since 0.1.0
 */
public record MergeConfig(
    List<String> sources,
    MultiplexerSettings multiplexer,
    DecoderOptions decoder,
    boolean metricsEnabled) {
  private static final Logger log = LoggerFactory.getLogger(MergeConfig.class);
  private static final Pattern INDEXED = Pattern.compile("(sources|decoder\\.header)\\.\\d+");
  private static final Set<String> SCALAR_KEYS = Set.of(
      "multiplexer.chunkBytes",
      "multiplexer.handoffDepth",
      "decoder.delimiter",
      "decoder.charset",
      "decoder.trimLeadingWhitespace",
      "metrics.enabled");

  public MergeConfig {
    sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
    Objects.requireNonNull(multiplexer, "multiplexer");
    Objects.requireNonNull(decoder, "decoder");
  }

  /**
   * Default configuration: no sources, default multiplexer and decoder, metrics disabled.
   *
   * @return default configuration
   */
  public static MergeConfig defaults() {
    return new MergeConfig(List.of(), MultiplexerSettings.defaults(), DecoderOptions.defaults(), false);
  }

  /**
   * Loads configuration from YAML, falling back to {@link #defaults()} when the file is absent.
   *
   * @param path YAML location
   * @return bound configuration
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the YAML or a value is invalid
   */
  public static MergeConfig load(Path path) throws IOException {
    return YamlConfigLoader.load(path).map(MergeConfig::fromMap).orElseGet(() -> {
      log.info("No configuration at {}; using defaults", path);
      return defaults();
    });
  }

  /**
   * Binds flattened configuration keys.
   *
   * @param values flattened keys as produced by {@link YamlConfigLoader}
   * @return bound configuration
   * @throws IllegalArgumentException if a value is invalid
   */
  public static MergeConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    for (String key : values.keySet()) {
      if (!SCALAR_KEYS.contains(key) && !INDEXED.matcher(key).matches()) {
        log.warn("Ignoring unknown configuration key {}", key);
      }
    }

    List<String> sources = new ArrayList<>();
    for (String spec : indexed(values, "sources")) {
      sources.add(Strings.requireNonBlank("sources", spec));
    }

    MultiplexerSettings multiplexer = MultiplexerSettings.defaults();
    String chunk = values.get("multiplexer.chunkBytes");
    if (chunk != null) {
      multiplexer = multiplexer.withChunkSize(Numbers.parseIntInRange(
          "multiplexer.chunkBytes", chunk, 1, MultiplexerSettings.MAX_CHUNK_SIZE));
    }
    String depth = values.get("multiplexer.handoffDepth");
    if (depth != null) {
      multiplexer = multiplexer.withHandoffDepth(Numbers.parseIntInRange(
          "multiplexer.handoffDepth", depth, 1, MultiplexerSettings.MAX_HANDOFF_DEPTH));
    }

    DecoderOptions decoder = DecoderOptions.defaults();
    String delimiter = values.get("decoder.delimiter");
    if (delimiter != null) {
      decoder = decoder.withDelimiter(Strings.requireDelimiter("decoder.delimiter", delimiter));
    }
    List<String> header = indexed(values, "decoder.header");
    if (!header.isEmpty()) {
      decoder = decoder.withHeader(header);
    }
    String charset = values.get("decoder.charset");
    if (charset != null) {
      decoder = decoder.withCharset(parseCharset(charset));
    }
    String trim = values.get("decoder.trimLeadingWhitespace");
    if (trim != null) {
      decoder = decoder.withTrimLeadingWhitespace(parseBoolean("decoder.trimLeadingWhitespace", trim));
    }

    boolean metrics = parseBoolean("metrics.enabled", values.getOrDefault("metrics.enabled", "false"));
    return new MergeConfig(sources, multiplexer, decoder, metrics);
  }

  private static List<String> indexed(Map<String, String> values, String prefix) {
    List<String> items = new ArrayList<>();
    for (int i = 0; values.containsKey(prefix + '.' + i); i++) {
      items.add(values.get(prefix + '.' + i));
    }
    return items;
  }

  private static boolean parseBoolean(String name, String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was '" + raw + "')");
    };
  }

  private static Charset parseCharset(String raw) {
    String name = Strings.requireNonBlank("decoder.charset", raw);
    try {
      return Charset.forName(name);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("decoder.charset is not a supported charset (was '" + raw + "')", ex);
    }
  }
}
