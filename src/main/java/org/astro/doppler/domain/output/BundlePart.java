package org.astro.doppler.domain.output;

import java.util.Arrays;
import java.util.Objects;
import org.astro.doppler.domain.fit.ParameterTable;

/**
 * One typed part of an {@link OutputBundle}.
 *
 * @since 0.1.0
 */
public sealed interface BundlePart permits BundlePart.TablePart, BundlePart.ArrayPart {

  /**
   * Tabular part; written as a binary table.
   *
   * @param table rows to persist
   */
  record TablePart(ParameterTable table) implements BundlePart {
    public TablePart {
      Objects.requireNonNull(table, "table");
    }
  }

  /**
   * One-dimensional array part with no metadata beyond what the container requires.
   *
   * @param data samples to persist
   */
  record ArrayPart(double[] data) implements BundlePart {
    public ArrayPart {
      data = Objects.requireNonNull(data, "data").clone();
    }

    @Override
    public double[] data() {
      return data.clone();
    }

    @Override
    public boolean equals(Object other) {
      return this == other || (other instanceof ArrayPart that && Arrays.equals(data, that.data));
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
      return "ArrayPart{length=" + data.length + "}";
    }
  }
}
