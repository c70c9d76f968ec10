package org.astro.doppler.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.astro.doppler.domain.fit.ParameterTable;
import org.astro.doppler.domain.output.BundlePart;

/**
 * <strong>What:</strong> Port serializing tables and arrays into a self-describing multi-part container file.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@link #writeTable} creates the container with its first table.</li>
 *   <li>{@link #appendParts} reopens it, appends parts in order and rewrites it in place.</li>
 * </ul>
 * <p>Implementations release every file handle before returning, including on failure.</p>
 *
 * @since 0.1.0
 */
public interface ContainerWriter {
  /**
   * Creates {@code path} holding {@code table} as its first data part.
   *
   * @param path container file; must not exist
   * @param table primary table
   * @throws IOException on write failure
   */
  void writeTable(Path path, ParameterTable table) throws IOException;

  /**
   * Appends {@code parts} after the existing content of {@code path}.
   *
   * @param path existing container
   * @param parts parts to append, in order
   * @throws IOException on read or write failure
   */
  void appendParts(Path path, List<BundlePart> parts) throws IOException;
}
