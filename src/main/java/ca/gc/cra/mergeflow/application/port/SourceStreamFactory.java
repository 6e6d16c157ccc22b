package ca.gc.cra.mergeflow.application.port;

import java.util.List;

/**
 * Starts a merged, source-aware stream over an ordered list of sources.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SourceStreamFactory {
  /**
   * Starts streaming. Sources are opened lazily, one at a time, in list order.
   *
   * @param sources ordered sources; may be empty
   * @return running stream; the caller must close it
   */
  SourceAwareStream open(List<? extends Source> sources);
}
