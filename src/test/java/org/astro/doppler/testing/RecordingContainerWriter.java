package org.astro.doppler.testing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.astro.doppler.application.port.ContainerWriter;
import org.astro.doppler.domain.fit.ParameterTable;
import org.astro.doppler.domain.output.BundlePart;

/**
 * Keeps written parts in memory and touches the target file so existence checks behave.
 */
public final class RecordingContainerWriter implements ContainerWriter {
  private final Map<Path, List<BundlePart>> written = new LinkedHashMap<>();

  @Override
  public void writeTable(Path path, ParameterTable table) throws IOException {
    if (Files.exists(path)) {
      throw new IOException("refusing to overwrite " + path);
    }
    Files.createFile(path);
    List<BundlePart> parts = new ArrayList<>();
    parts.add(new BundlePart.TablePart(table));
    written.put(path, parts);
  }

  @Override
  public void appendParts(Path path, List<BundlePart> parts) throws IOException {
    List<BundlePart> existing = written.get(path);
    if (existing == null) {
      throw new IOException("no table written to " + path);
    }
    existing.addAll(parts);
  }

  public List<BundlePart> partsOf(Path path) {
    return List.copyOf(written.getOrDefault(path, List.of()));
  }

  public Map<Path, List<BundlePart>> written() {
    return Map.copyOf(written);
  }
}
