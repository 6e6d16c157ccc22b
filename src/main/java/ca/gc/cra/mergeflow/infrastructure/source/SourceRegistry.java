package ca.gc.cra.mergeflow.infrastructure.source;

import ca.gc.cra.mergeflow.application.port.Source;
import ca.gc.cra.mergeflow.application.port.SourceResolver;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable scheme-to-resolver mapping that turns source specifications into sources.
 * <p><strong>Why:</strong> Keeps scheme wiring explicit and fixed at construction rather than in process-wide
 * mutable registration state.</p>
 * <p><strong>Scheme detection:</strong> {@code file://} URLs and specifications without {@code ://} use the
 * {@code file} scheme; otherwise the lower-cased prefix before {@code ://} names the scheme.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built.</p>
 *
 * @since 0.1.0
 */
public final class SourceRegistry implements SourceResolver {
  private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);
  private static final Pattern SCHEME_NAME = Pattern.compile("[a-z][a-z0-9+.-]*");

  /** Scheme used by bare paths and {@code file:} URLs. */
  public static final String FILE_SCHEME = "file";

  private final Map<String, SourceResolver> resolvers;

  private SourceRegistry(Map<String, SourceResolver> resolvers) {
    this.resolvers = Map.copyOf(resolvers);
  }

  /**
   * Creates a registry that resolves the {@code file} scheme relative to {@code baseDirectory}.
   *
   * @param baseDirectory directory for relative paths
   * @return registry with the file resolver
   */
  public static SourceRegistry withDefaults(Path baseDirectory) {
    return builder().register(FILE_SCHEME, new FileSourceResolver(baseDirectory)).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Resolves a specification through the resolver registered for its scheme.
   *
   * @param spec source specification
   * @return ordered sources
   * @throws IOException if the scheme is malformed, has no resolver, or resolution fails
   */
  @Override
  public List<Source> resolve(String spec) throws IOException {
    Objects.requireNonNull(spec, "spec");
    String scheme = detectScheme(spec);
    if (scheme == null) {
      throw new IOException("unknown scheme for \"" + spec.trim() + "\"");
    }
    SourceResolver resolver = resolvers.get(scheme);
    if (resolver == null) {
      throw new IOException(
          "no source resolver registered for scheme \"" + scheme + "\" (spec \"" + spec.trim() + "\")");
    }
    List<Source> sources = resolver.resolve(spec);
    log.debug("Scheme {} resolved {} into {} sources", scheme, spec.trim(), sources.size());
    return sources;
  }

  /**
   * Resolves several specifications and concatenates the results in order.
   *
   * @param specs ordered specifications
   * @return concatenated sources
   * @throws IOException if any specification fails to resolve
   */
  public List<Source> resolveAll(List<String> specs) throws IOException {
    Objects.requireNonNull(specs, "specs");
    List<Source> sources = new ArrayList<>();
    for (String spec : specs) {
      sources.addAll(resolve(spec));
    }
    return List.copyOf(sources);
  }

  public Set<String> schemes() {
    return resolvers.keySet();
  }

  /**
   * Detects the scheme of a specification.
   *
   * @param spec source specification
   * @return lower-case scheme, or {@code null} when the prefix before {@code ://} is not a valid scheme
   */
  static String detectScheme(String spec) {
    String normalized = spec.trim().toLowerCase(Locale.ROOT);
    int separator = normalized.indexOf("://");
    if (separator < 0 || normalized.startsWith("file://")) {
      return FILE_SCHEME;
    }
    String scheme = normalized.substring(0, separator);
    return SCHEME_NAME.matcher(scheme).matches() ? scheme : null;
  }

  /** Collects scheme registrations; rejects duplicates. */
  public static final class Builder {
    private final Map<String, SourceResolver> resolvers = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Registers a resolver.
     *
     * @param scheme scheme name, case-insensitive
     * @param resolver resolver for the scheme
     * @return this builder
     * @throws IllegalArgumentException if the scheme is malformed or already registered
     */
    public Builder register(String scheme, SourceResolver resolver) {
      Objects.requireNonNull(scheme, "scheme");
      Objects.requireNonNull(resolver, "resolver");
      String normalized = scheme.trim().toLowerCase(Locale.ROOT);
      if (!SCHEME_NAME.matcher(normalized).matches()) {
        throw new IllegalArgumentException("scheme must match [a-z][a-z0-9+.-]* (was '" + scheme + "')");
      }
      if (resolvers.putIfAbsent(normalized, resolver) != null) {
        throw new IllegalArgumentException("resolver for scheme \"" + normalized + "\" already registered");
      }
      return this;
    }

    public SourceRegistry build() {
      return new SourceRegistry(resolvers);
    }
  }
}
