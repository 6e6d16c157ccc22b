package ca.gc.cra.mergeflow.infrastructure.source;

import ca.gc.cra.mergeflow.application.port.Source;
import ca.gc.cra.mergeflow.application.port.SourceResolver;
import ca.gc.cra.mergeflow.validation.Strings;
import java.io.File;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves file specifications into {@link FileSource}s.
 * <p><strong>Accepted forms:</strong>
 * <ul>
 *   <li>plain paths and globs ({@code data/*.csv}, {@code /logs/**}{@code /*.psv}); relative paths resolve against
 *   the base directory</li>
 *   <li>hierarchical file URLs ({@code file:///tmp/a%20b.csv}) and UNC-style URLs ({@code file://server/share})</li>
 *   <li>opaque file URLs ({@code file:/tmp/x.csv}, {@code file:./rel.csv})</li>
 *   <li>Windows drive ({@code C:\data\x.csv}) and UNC ({@code \\server\share\x.csv}) paths, taken verbatim</li>
 * </ul>
 * <p>Matches are returned sorted by path. Any other URL scheme is rejected.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class FileSourceResolver implements SourceResolver {
  private static final Logger log = LoggerFactory.getLogger(FileSourceResolver.class);
  private static final Pattern SCHEME = Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]*):");
  private static final String GLOB_META = "*?[{";

  private final Path baseDirectory;

  /** Creates a resolver for paths relative to the working directory. */
  public FileSourceResolver() {
    this(Path.of(""));
  }

  /**
   * Creates a resolver for paths relative to {@code baseDirectory}.
   *
   * @param baseDirectory directory against which relative specifications resolve
   */
  public FileSourceResolver(Path baseDirectory) {
    this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory").toAbsolutePath().normalize();
  }

  @Override
  public List<Source> resolve(String spec) throws IOException {
    String location = normalize(spec);
    List<Path> matches = expand(location);
    if (matches.isEmpty()) {
      throw new IOException("no files matched: \"" + location + "\"");
    }
    log.debug("Resolved {} to {} files", spec.trim(), matches.size());
    List<Source> sources = new ArrayList<>(matches.size());
    for (Path match : matches) {
      sources.add(new FileSource(match));
    }
    return List.copyOf(sources);
  }

  /**
   * Converts a user-facing specification into a filesystem location or glob.
   *
   * @param spec raw specification
   * @return location with file URLs decoded; drive and UNC paths unchanged
   * @throws IOException if the specification uses another scheme or is a malformed file URL
   */
  static String normalize(String spec) throws IOException {
    String trimmed = Strings.requireNonBlank("source spec", spec);
    Matcher scheme = SCHEME.matcher(trimmed);
    if (scheme.find() && !isWindowsDrivePath(trimmed)) {
      String name = scheme.group(1);
      if (!name.toLowerCase(Locale.ROOT).equals("file")) {
        throw new IOException("unsupported scheme \"" + name + "\" in " + trimmed);
      }
      return normalizeFileUrl(trimmed);
    }
    return trimmed;
  }

  static boolean isWindowsDrivePath(String spec) {
    if (spec.length() < 2 || !isAsciiLetter(spec.charAt(0)) || spec.charAt(1) != ':') {
      return false;
    }
    return spec.length() == 2 || spec.charAt(2) == '\\' || spec.charAt(2) == '/';
  }

  static boolean isUncPath(String spec) {
    return spec.startsWith("\\\\");
  }

  private static String normalizeFileUrl(String spec) throws IOException {
    String rest = spec.substring("file:".length());
    String path;
    if (rest.startsWith("//")) {
      int slash = rest.indexOf('/', 2);
      String host = slash < 0 ? rest.substring(2) : rest.substring(2, slash);
      String hostPath = slash < 0 ? "" : rest.substring(slash);
      path = host.isEmpty() || host.equalsIgnoreCase("localhost") ? hostPath : "//" + host + hostPath;
    } else {
      path = rest;
    }
    try {
      path = URLDecoder.decode(path.replace("+", "%2B"), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      throw new IOException("malformed file URL " + spec + ": " + ex.getMessage(), ex);
    }
    if (path.length() >= 3 && path.charAt(0) == '/' && path.charAt(2) == ':') {
      path = path.substring(1);
    }
    if (path.isEmpty()) {
      throw new IOException("empty file URL: \"" + spec + "\"");
    }
    return path.replace('/', File.separatorChar);
  }

  private List<Path> expand(String location) throws IOException {
    FileSystem fs = baseDirectory.getFileSystem();
    Path target;
    try {
      target = baseDirectory.resolve(fs.getPath(location)).normalize();
    } catch (InvalidPathException ex) {
      throw new IOException("invalid path \"" + location + "\": " + ex.getReason(), ex);
    }
    int firstGlob = firstGlobElement(target);
    if (firstGlob < 0) {
      return Files.isRegularFile(target) ? List.of(target) : List.of();
    }

    Path base = target.getRoot() == null ? Path.of("") : target.getRoot();
    for (int i = 0; i < firstGlob; i++) {
      base = base.resolve(target.getName(i));
    }
    Path patternPath = target.subpath(firstGlob, target.getNameCount());
    String pattern = patternPath.toString();
    PathMatcher matcher;
    try {
      matcher = fs.getPathMatcher("glob:" + pattern);
    } catch (PatternSyntaxException ex) {
      throw new IOException("bad glob pattern \"" + location + "\": " + ex.getDescription(), ex);
    }
    if (!Files.isDirectory(base)) {
      return List.of();
    }
    int depth = pattern.contains("**") ? Integer.MAX_VALUE : patternPath.getNameCount();
    Path root = base;
    try (Stream<Path> walk = Files.walk(root, depth)) {
      return walk
          .filter(Files::isRegularFile)
          .filter(candidate -> matcher.matches(root.relativize(candidate)))
          .sorted(Comparator.comparing(Path::toString))
          .collect(Collectors.toList());
    }
  }

  private static int firstGlobElement(Path path) {
    for (int i = 0; i < path.getNameCount(); i++) {
      String element = path.getName(i).toString();
      for (int c = 0; c < element.length(); c++) {
        if (GLOB_META.indexOf(element.charAt(c)) >= 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private static boolean isAsciiLetter(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
  }
}
