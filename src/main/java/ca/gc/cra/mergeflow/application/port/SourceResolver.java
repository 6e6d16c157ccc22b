package ca.gc.cra.mergeflow.application.port;

import java.io.IOException;
import java.util.List;

/**
 * Resolves a textual source specification (path, glob, URL) into an ordered list of sources.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SourceResolver {
  /**
   * Resolves a specification.
   *
   * @param spec source specification
   * @return ordered, non-empty list of sources
   * @throws IOException if the specification matches nothing or cannot be resolved
   */
  List<Source> resolve(String spec) throws IOException;
}
