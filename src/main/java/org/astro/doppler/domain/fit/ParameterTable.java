package org.astro.doppler.domain.fit;

import java.util.List;
import java.util.Objects;

/**
 * Ordered rows sharing one column layout; serialized as a single table part.
 *
 * @param columns column names, in order
 * @param rows rows in input-spectrum order
 * @since 0.1.0
 */
public record ParameterTable(List<String> columns, List<ParameterRow> rows) {

  public ParameterTable {
    rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    if (rows.isEmpty()) {
      throw new IllegalArgumentException("parameter table must have at least one row");
    }
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    for (int i = 0; i < rows.size(); i++) {
      ParameterRow row = rows.get(i);
      if (!row.columns().equals(columns)) {
        throw new IllegalArgumentException(
            "row " + i + " columns " + row.columns() + " do not match table columns " + columns);
      }
      for (String column : columns) {
        Class<?> expected = rows.get(0).get(column).getClass();
        if (!expected.equals(row.get(column).getClass())) {
          throw new IllegalArgumentException("row " + i + " column " + column + " is "
              + row.get(column).getClass().getSimpleName() + ", expected " + expected.getSimpleName());
        }
      }
    }
  }

  /**
   * Table holding a single row, as produced for one individually fitted spectrum.
   *
   * @param row fit parameters
   * @return one-row table
   */
  public static ParameterTable single(ParameterRow row) {
    return of(List.of(row));
  }

  /**
   * Table whose layout is taken from the first row.
   *
   * @param rows one or more rows with identical columns
   * @return table
   */
  public static ParameterTable of(List<ParameterRow> rows) {
    Objects.requireNonNull(rows, "rows");
    if (rows.isEmpty()) {
      throw new IllegalArgumentException("parameter table must have at least one row");
    }
    return new ParameterTable(rows.get(0).columns(), rows);
  }

  public int size() {
    return rows.size();
  }

  public ParameterRow row(int index) {
    return rows.get(index);
  }
}
