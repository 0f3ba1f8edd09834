/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.reader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import dev.fitsio.engine.FitsEngine;
import dev.fitsio.engine.Status;
import dev.fitsio.errors.EngineException;
import dev.fitsio.errors.ErrorTranslator;
import dev.fitsio.errors.FitsException;
import dev.fitsio.errors.UsageException;
import dev.fitsio.range.Range;
import dev.fitsio.range.RangeTranslator;
import dev.fitsio.schema.ConcreteColumnDescription;
import dev.fitsio.schema.HduInfo;
import dev.fitsio.types.ColumnType;
import dev.fitsio.types.EngineTarget;
import dev.fitsio.types.FitsType;
import dev.fitsio.types.HeaderValue;
import dev.fitsio.types.KeyType;
import dev.fitsio.types.PixelType;

/**
 * Handle to one HDU of a {@link FitsFile}.
 * <p>
 * A handle holds the HDU's position and a snapshot of its layout taken when the
 * handle was created. Operations that change the layout return a new handle;
 * the old one keeps its outdated snapshot. After {@link #delete()} the handle
 * must not be used any more.
 * </p>
 * <p>
 * Rows, pixels and columns are addressed with 0-based indexes and half-open
 * ranges. Image shapes and regions are in row-major order.
 * </p>
 */
public final class FitsHdu {

    private static final System.Logger LOG = System.getLogger(FitsHdu.class.getName());

    private final FitsFile fitsFile;
    private final int index;
    private final HduInfo info;

    FitsHdu(FitsFile fitsFile, int index, HduInfo info) {
        this.fitsFile = fitsFile;
        this.index = index;
        this.info = info;
    }

    public int index() {
        return index;
    }

    public HduInfo info() {
        return info;
    }

    public boolean isImage() {
        return info instanceof HduInfo.ImageInfo;
    }

    public boolean isTable() {
        return info instanceof HduInfo.TableInfo;
    }

    /**
     * The HDU's EXTNAME, or an empty string if it has none.
     */
    public String name() throws FitsException {
        try {
            return readKey(FitsType.STRING, "EXTNAME");
        }
        catch (EngineException e) {
            if (e.status() == Status.KEY_NO_EXIST) {
                return "";
            }
            throw e;
        }
    }

    // header keywords

    public <T> T readKey(KeyType<T> type, String name) throws FitsException {
        return readKeyWithComment(type, name).value();
    }

    public <T> HeaderValue<T> readKeyWithComment(KeyType<T> type, String name) throws FitsException {
        return type.readKey(enter(), name);
    }

    public <T> void writeKey(KeyType<T> type, String name, T value) throws FitsException {
        writeKey(type, name, value, null);
    }

    public <T> void writeKey(KeyType<T> type, String name, T value, String comment) throws FitsException {
        fitsFile.checkAccess();
        fitsFile.requireWritable();
        type.writeKey(enter(), name, value, comment);
    }

    // table columns

    public <T> List<T> readCol(ColumnType<T> type, String name) throws FitsException {
        return readCol(type, ColumnLocator.name(name));
    }

    public <T> List<T> readCol(ColumnType<T> type, int column) throws FitsException {
        return readCol(type, ColumnLocator.index(column));
    }

    public <T> List<T> readCol(ColumnType<T> type, ColumnLocator column) throws FitsException {
        HduInfo.TableInfo table = requireTable();
        return readColRange(type, column, new Range(0, table.rowCount()));
    }

    public <T> List<T> readColRange(ColumnType<T> type, String name, Range rows) throws FitsException {
        return readColRange(type, ColumnLocator.name(name), rows);
    }

    public <T> List<T> readColRange(ColumnType<T> type, int column, Range rows) throws FitsException {
        return readColRange(type, ColumnLocator.index(column), rows);
    }

    public <T> List<T> readColRange(ColumnType<T> type, ColumnLocator column, Range rows) throws FitsException {
        HduInfo.TableInfo table = requireTable();
        EngineTarget target = enter();
        int resolved = ColumnAddressResolver.resolve(target, table, column);
        return type.readColumn(target, resolved, rows);
    }

    public <T> T readCellValue(ColumnType<T> type, String name, long row) throws FitsException {
        return readColRange(type, name, Range.single(row)).get(0);
    }

    public <T> T readCellValue(ColumnType<T> type, int column, long row) throws FitsException {
        return readColRange(type, column, Range.single(row)).get(0);
    }

    /**
     * Write {@code data} to the column starting at the first row.
     *
     * @return a handle with the row count updated if the table grew
     */
    public <T> FitsHdu writeCol(ColumnType<T> type, String name, List<? extends T> data) throws FitsException {
        return writeColRange(type, ColumnLocator.name(name), data, new Range(0, data.size()));
    }

    public <T> FitsHdu writeCol(ColumnType<T> type, int column, List<? extends T> data) throws FitsException {
        return writeColRange(type, ColumnLocator.index(column), data, new Range(0, data.size()));
    }

    public <T> FitsHdu writeColRange(ColumnType<T> type, String name, List<? extends T> data, Range rows)
            throws FitsException {
        return writeColRange(type, ColumnLocator.name(name), data, rows);
    }

    public <T> FitsHdu writeColRange(ColumnType<T> type, int column, List<? extends T> data, Range rows)
            throws FitsException {
        return writeColRange(type, ColumnLocator.index(column), data, rows);
    }

    /**
     * Write the first {@code rows.length()} elements of {@code data} to the given
     * rows. Writing past the last row extends the table.
     *
     * @return a handle with the row count updated if the table grew
     */
    public <T> FitsHdu writeColRange(ColumnType<T> type, ColumnLocator column, List<? extends T> data, Range rows)
            throws FitsException {
        HduInfo.TableInfo table = requireTable();
        fitsFile.requireWritable();
        if (data.size() < rows.length()) {
            throw new UsageException("Writing " + rows.length() + " rows needs as many values, got " + data.size());
        }
        EngineTarget target = enter();
        int resolved = ColumnAddressResolver.resolve(target, table, column);
        type.writeColumn(target, resolved, data, rows);
        return rows.end() > table.rowCount() ? fitsFile.hdu(index) : this;
    }

    /**
     * Read every column in full, typed by its declared data type.
     */
    public List<Column<?>> columns() throws FitsException {
        HduInfo.TableInfo table = requireTable();
        Range rows = new Range(0, table.rowCount());
        List<Column<?>> columns = new ArrayList<>(table.columns().size());
        for (int i = 0; i < table.columns().size(); i++) {
            columns.add(readDeclared(table.columns().get(i), i, rows));
        }
        return columns;
    }

    /**
     * Read one row, keyed by column name in column order. Each value is typed by
     * its column's declared data type; vector columns give their first element.
     * If several columns share a name, the first one is kept.
     */
    public Map<String, Object> row(long index) throws FitsException {
        HduInfo.TableInfo table = requireTable();
        Range rows = Range.single(index);
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < table.columns().size(); i++) {
            ConcreteColumnDescription column = table.columns().get(i);
            if (!row.containsKey(column.name())) {
                row.put(column.name(), readDeclared(column, i, rows).values().get(0));
            }
        }
        return Collections.unmodifiableMap(row);
    }

    /**
     * Read one row and convert it with {@code mapper}.
     */
    public <R> R row(long index, FitsFunction<Map<String, Object>, R> mapper) throws FitsException {
        return mapper.apply(row(index));
    }

    private Column<?> readDeclared(ConcreteColumnDescription column, int i, Range rows) throws FitsException {
        return switch (column.dataType().type()) {
            case LOGICAL -> column(FitsType.BOOLEAN, i, column.name(), rows);
            case BYTE -> column(FitsType.UINT8, i, column.name(), rows);
            case SHORT -> column(FitsType.INT16, i, column.name(), rows);
            case INT -> column(FitsType.INT32, i, column.name(), rows);
            case LONG -> column(FitsType.INT64, i, column.name(), rows);
            case FLOAT -> column(FitsType.FLOAT32, i, column.name(), rows);
            case DOUBLE -> column(FitsType.FLOAT64, i, column.name(), rows);
            case TEXT -> column(FitsType.STRING, i, column.name(), rows);
        };
    }

    private <T, C extends FitsType<T> & ColumnType<T>> Column<T> column(C type, int column, String name, Range rows)
            throws FitsException {
        return new Column<>(name, type, readColRange(type, column, rows));
    }

    // image pixels

    /**
     * Read the pixels {@code [start, end)} of the flattened image.
     */
    public <T> List<T> readSection(PixelType<T> type, long start, long end) throws FitsException {
        requireImage();
        Range pixels = Range.of(start, end);
        return type.readPixels(enter(), pixels);
    }

    /**
     * Read {@code numRows} whole rows of a two-dimensional image.
     */
    public <T> List<T> readRows(PixelType<T> type, long startRow, long numRows) throws FitsException {
        HduInfo.ImageInfo image = requireImage();
        Range pixels = RangeTranslator.rows(image.shape(), startRow, numRows);
        return type.readPixels(enter(), pixels);
    }

    public <T> List<T> readRow(PixelType<T> type, long row) throws FitsException {
        return readRows(type, row, 1);
    }

    /**
     * Read a rectangular region, given as one range per axis.
     */
    public <T> List<T> readRegion(PixelType<T> type, List<Range> region) throws FitsException {
        HduInfo.ImageInfo image = requireImage();
        checkDimensions(image, region);
        return type.readRegion(enter(), region);
    }

    public <T> List<T> readRegion(PixelType<T> type, Range... region) throws FitsException {
        return readRegion(type, Arrays.asList(region));
    }

    public <T> List<T> readImage(PixelType<T> type) throws FitsException {
        HduInfo.ImageInfo image = requireImage();
        return type.readPixels(enter(), new Range(0, image.pixelCount()));
    }

    public <T> void writeSection(PixelType<T> type, long start, long end, List<? extends T> data)
            throws FitsException {
        requireImage();
        fitsFile.requireWritable();
        Range pixels = Range.of(start, end);
        type.writePixels(enter(), pixels, data);
    }

    public <T> void writeRegion(PixelType<T> type, List<Range> region, List<? extends T> data)
            throws FitsException {
        HduInfo.ImageInfo image = requireImage();
        fitsFile.requireWritable();
        checkDimensions(image, region);
        type.writeRegion(enter(), region, data);
    }

    /**
     * Write pixels from the start of the image. More values than the image holds
     * are rejected.
     */
    public <T> void writeImage(PixelType<T> type, List<? extends T> data) throws FitsException {
        HduInfo.ImageInfo image = requireImage();
        fitsFile.requireWritable();
        if (data.size() > image.pixelCount()) {
            throw new UsageException("Cannot write " + data.size() + " values to an image of "
                    + image.pixelCount() + " pixels");
        }
        type.writePixels(enter(), new Range(0, data.size()), data);
    }

    // structure

    /**
     * Change the image's shape, keeping its pixel type.
     *
     * @param shape the new shape in row-major order
     */
    public FitsHdu resize(List<Long> shape) throws FitsException {
        HduInfo.ImageInfo image = requireImage();
        fitsFile.requireWritable();
        EngineTarget target = enter();
        FitsEngine engine = target.engine();
        ErrorTranslator.check(engine, engine.resizeImage(target.file(), image.pixelType().bitpix(),
                FitsFile.engineAxes(shape)));
        LOG.log(System.Logger.Level.DEBUG, "Resized HDU {0} from {1} to {2}", index, image.shape(), shape);
        return fitsFile.hdu(index);
    }

    /**
     * Insert a column before the column at {@code position}.
     */
    public FitsHdu insertColumn(int position, ConcreteColumnDescription column) throws FitsException {
        HduInfo.TableInfo table = requireTable();
        fitsFile.requireWritable();
        if (table.column(column.name()).isPresent()) {
            throw new UsageException("Column '" + column.name() + "' already exists");
        }
        EngineTarget target = enter();
        FitsEngine engine = target.engine();
        ErrorTranslator.check(engine, engine.insertColumn(target.file(), position + 1, column.name(),
                column.dataType().toTypeCode()));
        LOG.log(System.Logger.Level.DEBUG, "Inserted column ''{0}'' at position {1} of HDU {2}",
                column.name(), position, index);
        return fitsFile.hdu(index);
    }

    public FitsHdu appendColumn(ConcreteColumnDescription column) throws FitsException {
        HduInfo.TableInfo table = requireTable();
        return insertColumn(table.columns().size(), column);
    }

    public FitsHdu deleteColumn(String name) throws FitsException {
        return deleteColumn(ColumnLocator.name(name));
    }

    public FitsHdu deleteColumn(int column) throws FitsException {
        return deleteColumn(ColumnLocator.index(column));
    }

    public FitsHdu deleteColumn(ColumnLocator column) throws FitsException {
        HduInfo.TableInfo table = requireTable();
        fitsFile.requireWritable();
        EngineTarget target = enter();
        int resolved = ColumnAddressResolver.resolve(target, table, column);
        FitsEngine engine = target.engine();
        ErrorTranslator.check(engine, engine.deleteColumn(target.file(), resolved + 1));
        LOG.log(System.Logger.Level.DEBUG, "Deleted column {0} of HDU {1}", resolved, index);
        return fitsFile.hdu(index);
    }

    /**
     * Append a copy of this HDU to another file.
     */
    public void copyTo(FitsFile destination) throws FitsException {
        fitsFile.checkAccess();
        destination.checkAccess();
        destination.requireWritable();
        if (destination.engine().getClass() != fitsFile.engine().getClass()) {
            throw new UsageException("Cannot copy between files of different engines");
        }
        EngineTarget target = enter();
        FitsEngine engine = target.engine();
        ErrorTranslator.check(engine, engine.copyHdu(target.file(), destination.engineFile()));
        destination.syncCursor();
        LOG.log(System.Logger.Level.DEBUG, "Copied HDU {0} of ''{1}'' to ''{2}''", index, fitsFile.path(),
                destination.path());
    }

    /**
     * Remove this HDU from the file. Deleting the primary HDU leaves an empty one
     * in its place.
     */
    public void delete() throws FitsException {
        fitsFile.checkAccess();
        fitsFile.requireWritable();
        EngineTarget target = enter();
        FitsEngine engine = target.engine();
        int[] type = new int[1];
        ErrorTranslator.check(engine, engine.deleteHdu(target.file(), type));
        fitsFile.syncCursor();
        LOG.log(System.Logger.Level.DEBUG, "Deleted HDU {0} of ''{1}''", index, fitsFile.path());
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "FitsHdu[%d, %s]", index, info);
    }

    private EngineTarget enter() throws FitsException {
        fitsFile.makeCurrent(index);
        return fitsFile.target();
    }

    private HduInfo.TableInfo requireTable() throws UsageException {
        fitsFile.checkAccess();
        if (info instanceof HduInfo.TableInfo table) {
            return table;
        }
        throw new UsageException("HDU " + index + " is an image, not a table");
    }

    private HduInfo.ImageInfo requireImage() throws UsageException {
        fitsFile.checkAccess();
        if (info instanceof HduInfo.ImageInfo image) {
            return image;
        }
        throw new UsageException("HDU " + index + " is a table, not an image");
    }

    private static void checkDimensions(HduInfo.ImageInfo image, List<Range> region) throws UsageException {
        if (region.size() != image.shape().size()) {
            throw new UsageException("Region has " + region.size() + " axes but the image has "
                    + image.shape().size());
        }
    }
}
