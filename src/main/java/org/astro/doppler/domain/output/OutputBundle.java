package org.astro.doppler.domain.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.astro.doppler.domain.fit.ParameterTable;

/**
 * <strong>What:</strong> Ordered, append-only sequence of parts serialized as one container file.
 * <p><strong>Why:</strong> Part position is meaningful to downstream readers: part 0 is always the primary
 * table and arrays follow in spectrum-input order.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; built by a single driver and then written once.</p>
 *
 * @since 0.1.0
 */
public final class OutputBundle {
  private final List<BundlePart> parts = new ArrayList<>();

  private OutputBundle(ParameterTable primary) {
    parts.add(new BundlePart.TablePart(primary));
  }

  /**
   * Starts a bundle whose first part is {@code primary}.
   *
   * @param primary table written first, creating the container
   * @return bundle holding one part
   */
  public static OutputBundle startingWith(ParameterTable primary) {
    return new OutputBundle(Objects.requireNonNull(primary, "primary"));
  }

  public OutputBundle appendTable(ParameterTable table) {
    parts.add(new BundlePart.TablePart(table));
    return this;
  }

  public OutputBundle appendArray(double[] data) {
    parts.add(new BundlePart.ArrayPart(data));
    return this;
  }

  /** Read-only view of all parts in write order. */
  public List<BundlePart> parts() {
    return Collections.unmodifiableList(parts);
  }

  /** The table that creates the container. */
  public ParameterTable primary() {
    return ((BundlePart.TablePart) parts.get(0)).table();
  }

  /** Parts appended after the primary table, in order. */
  public List<BundlePart> remainder() {
    return Collections.unmodifiableList(parts.subList(1, parts.size()));
  }

  public int size() {
    return parts.size();
  }
}
