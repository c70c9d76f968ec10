package org.astro.doppler.infrastructure.container;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.util.BufferedDataOutputStream;
import org.astro.doppler.application.port.ContainerWriter;
import org.astro.doppler.domain.fit.ParameterRow;
import org.astro.doppler.domain.fit.ParameterTable;
import org.astro.doppler.domain.output.BundlePart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ContainerWriter} producing FITS files with nom-tam-fits.
 * <p><strong>Layout:</strong> an empty primary HDU, then one binary-table HDU per table part (named columns,
 * one row per parameter row) and one image HDU per array part.</p>
 * <p><strong>Resource handling:</strong> {@link #appendParts} reads the whole file into memory and closes it
 * before rewriting, so no handle is held across the read and write steps.</p>
 *
 * @since 0.1.0
 */
public final class FitsContainerWriter implements ContainerWriter {
  private static final Logger log = LoggerFactory.getLogger(FitsContainerWriter.class);

  @Override
  public void writeTable(Path path, ParameterTable table) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(table, "table");
    if (Files.exists(path)) {
      throw new IOException("Refusing to create container over existing file " + path);
    }
    try (Fits fits = new Fits()) {
      fits.addHDU(BasicHDU.getDummyHDU());
      fits.addHDU(toTableHdu(table));
      write(fits, path);
    } catch (FitsException ex) {
      throw new IOException("Failed to write FITS table to " + path, ex);
    }
    log.debug("Created {} with a {}-row table", path, table.size());
  }

  @Override
  public void appendParts(Path path, List<BundlePart> parts) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(parts, "parts");
    BasicHDU<?>[] existing;
    try (InputStream in = Files.newInputStream(path);
        Fits reader = new Fits(in)) {
      existing = reader.read();
    } catch (FitsException ex) {
      throw new IOException("Failed to read FITS container " + path, ex);
    }
    if (existing == null || existing.length == 0) {
      throw new IOException("FITS container " + path + " has no HDUs");
    }

    try (Fits fits = new Fits()) {
      for (BasicHDU<?> hdu : existing) {
        fits.addHDU(hdu);
      }
      for (BundlePart part : parts) {
        fits.addHDU(toHdu(part));
      }
      write(fits, path);
    } catch (FitsException ex) {
      throw new IOException("Failed to append " + parts.size() + " parts to " + path, ex);
    }
    log.debug("Appended {} parts to {}", parts.size(), path);
  }

  private static void write(Fits fits, Path path) throws IOException, FitsException {
    try (BufferedDataOutputStream out = new BufferedDataOutputStream(Files.newOutputStream(path))) {
      fits.write(out);
    }
  }

  private static BasicHDU<?> toHdu(BundlePart part) throws FitsException {
    if (part instanceof BundlePart.TablePart tablePart) {
      return toTableHdu(tablePart.table());
    }
    if (part instanceof BundlePart.ArrayPart arrayPart) {
      return Fits.makeHDU(arrayPart.data());
    }
    throw new IllegalArgumentException("Unsupported bundle part " + part);
  }

  static BinaryTableHDU toTableHdu(ParameterTable table) throws FitsException {
    BinaryTable data = new BinaryTable();
    List<String> columns = table.columns();
    for (String column : columns) {
      data.addColumn(columnData(table, column));
    }
    BinaryTableHDU hdu = new BinaryTableHDU(BinaryTableHDU.manufactureHeader(data), data);
    for (int i = 0; i < columns.size(); i++) {
      hdu.setColumnName(i, columns.get(i), null);
    }
    return hdu;
  }

  private static Object columnData(ParameterTable table, String column) {
    List<ParameterRow> rows = table.rows();
    Object first = rows.get(0).get(column);
    int n = rows.size();
    if (first instanceof Double) {
      double[] values = new double[n];
      for (int i = 0; i < n; i++) {
        values[i] = (Double) rows.get(i).get(column);
      }
      return values;
    }
    if (first instanceof Long) {
      long[] values = new long[n];
      for (int i = 0; i < n; i++) {
        values[i] = (Long) rows.get(i).get(column);
      }
      return values;
    }
    if (first instanceof Integer) {
      int[] values = new int[n];
      for (int i = 0; i < n; i++) {
        values[i] = (Integer) rows.get(i).get(column);
      }
      return values;
    }
    if (first instanceof Boolean) {
      boolean[] values = new boolean[n];
      for (int i = 0; i < n; i++) {
        values[i] = (Boolean) rows.get(i).get(column);
      }
      return values;
    }
    String[] values = new String[n];
    for (int i = 0; i < n; i++) {
      values[i] = rows.get(i).get(column).toString();
    }
    return values;
  }
}
