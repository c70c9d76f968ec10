package org.astro.doppler.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port merging vector documents into one.
 * <p><strong>Role:</strong> System boundary; the shipped adapter runs an external process synchronously.</p>
 *
 * @since 0.1.0
 */
public interface DocumentCombiner {
  /**
   * Merges {@code inputs} in order into {@code output}.
   *
   * @param inputs documents to merge, in page order
   * @param output combined document
   * @throws IOException when the merge fails, including a non-zero tool exit
   * @throws InterruptedException if interrupted while waiting for the tool
   */
  void combine(List<Path> inputs, Path output) throws IOException, InterruptedException;
}
