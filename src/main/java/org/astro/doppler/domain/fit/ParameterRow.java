package org.astro.doppler.domain.fit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One flat record of named fit parameters, in column order.
 *
 * <p>Values are restricted to {@link Double}, {@link Long}, {@link Integer}, {@link Boolean} and
 * {@link String} so every row maps onto a binary-table column without further conversion.</p>
 *
 * @since 0.1.0
 */
public final class ParameterRow {
  private static final Set<Class<?>> SUPPORTED =
      Set.of(Double.class, Long.class, Integer.class, Boolean.class, String.class);

  private final Map<String, Object> values;

  private ParameterRow(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /**
   * Creates a row from an ordered map of column name to value.
   *
   * @param values column values; iteration order defines column order
   * @return immutable row
   * @throws IllegalArgumentException if a column name is blank or a value has an unsupported type
   */
  public static ParameterRow of(Map<String, ?> values) {
    Objects.requireNonNull(values, "values");
    LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      String name = entry.getKey();
      Object value = entry.getValue();
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("parameter name must not be blank");
      }
      if (value == null || !SUPPORTED.contains(value.getClass())) {
        throw new IllegalArgumentException("parameter " + name + " has unsupported value "
            + (value == null ? "null" : value.getClass().getSimpleName()));
      }
      copy.put(name, value);
    }
    if (copy.isEmpty()) {
      throw new IllegalArgumentException("parameter row must have at least one column");
    }
    return new ParameterRow(copy);
  }

  /** Starts an ordered builder. */
  public static Builder builder() {
    return new Builder();
  }

  public List<String> columns() {
    return List.copyOf(values.keySet());
  }

  public Object get(String column) {
    return values.get(column);
  }

  @Override
  public boolean equals(Object other) {
    return this == other || (other instanceof ParameterRow that && values.equals(that.values));
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "ParameterRow" + values;
  }

  /** Ordered builder for {@link ParameterRow}. */
  public static final class Builder {
    private final LinkedHashMap<String, Object> values = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String name, double value) {
      values.put(name, value);
      return this;
    }

    public Builder put(String name, long value) {
      values.put(name, value);
      return this;
    }

    public Builder put(String name, int value) {
      values.put(name, value);
      return this;
    }

    public Builder put(String name, boolean value) {
      values.put(name, value);
      return this;
    }

    public Builder put(String name, String value) {
      values.put(name, value);
      return this;
    }

    public ParameterRow build() {
      return ParameterRow.of(values);
    }
  }
}
