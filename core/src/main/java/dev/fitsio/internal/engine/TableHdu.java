/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import java.lang.reflect.Array;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import dev.fitsio.engine.HduType;
import dev.fitsio.engine.Status;
import dev.fitsio.engine.TypeTag;

/**
 * A BINTABLE extension with fixed-width columns. Rows are stored back to back.
 */
final class TableHdu extends Hdu {

    private static final Pattern INDEXED_KEYWORD = Pattern.compile("(TTYPE|TFORM|TUNIT|TSCAL|TZERO|TNULL|TDISP|TDIM)(\\d+)");

    private List<TableColumn> columns;
    private long rowCount;
    private int rowWidth;

    private TableHdu(Header header, byte[] data, List<TableColumn> columns, long rowCount) {
        super(header, data);
        this.columns = columns;
        this.rowCount = rowCount;
        this.rowWidth = widthOf(columns);
    }

    static TableHdu create(String[] ttype, String[] tform, String extname) throws StatusException {
        if (ttype.length != tform.length) {
            throw new StatusException(Status.BAD_TFIELDS);
        }
        Header header = new Header();
        for (int i = 0; i < tform.length; i++) {
            TableColumn.parseFormat(tform[i]);
            header.set(new HeaderCard("TTYPE" + (i + 1), CardValues.formatString(ttype[i]), "label for field " + (i + 1)));
            header.set(new HeaderCard("TFORM" + (i + 1), CardValues.formatString(tform[i]), "data format of field"));
        }
        if (extname != null && !extname.isEmpty()) {
            header.set(new HeaderCard("EXTNAME", CardValues.formatString(extname), "name of this binary table extension"));
        }
        TableHdu hdu = new TableHdu(header, new byte[0], readColumns(header, tform.length), 0);
        hdu.syncHeader(false);
        return hdu;
    }

    static TableHdu read(Header header, byte[] data) throws StatusException {
        if (header.requireLong("NAXIS", Status.BAD_NAXIS) != 2) {
            throw new StatusException(Status.BAD_NAXIS);
        }
        long width = header.requireLong("NAXIS1", Status.BAD_NAXES);
        long rows = header.requireLong("NAXIS2", Status.BAD_NAXES);
        if (rows < 0) {
            throw new StatusException(Status.NEG_ROWS);
        }
        if (header.longValue("PCOUNT", 0L) != 0) {
            throw new StatusException(Status.BAD_BTABLE_FORMAT);
        }
        long fields = header.requireLong("TFIELDS", Status.BAD_TFIELDS);
        if (fields < 0 || fields > 999) {
            throw new StatusException(Status.BAD_TFIELDS);
        }
        List<TableColumn> columns = readColumns(header, (int) fields);
        if (widthOf(columns) != width) {
            throw new StatusException(Status.BAD_ROW_WIDTH);
        }
        return new TableHdu(header, data, columns, rows);
    }

    static long dataSize(Header header) throws StatusException {
        return header.requireLong("NAXIS1", Status.BAD_NAXES) * header.requireLong("NAXIS2", Status.BAD_NAXES);
    }

    private static List<TableColumn> readColumns(Header header, int count) throws StatusException {
        List<TableColumn> columns = new ArrayList<>(count);
        int offset = 0;
        for (int n = 1; n <= count; n++) {
            String tform = header.stringValue("TFORM" + n);
            if (tform == null) {
                throw new StatusException(Status.BAD_TFORM);
            }
            TableColumn.Format format = TableColumn.parseFormat(tform);
            String name = header.stringValue("TTYPE" + n);
            columns.add(new TableColumn(name == null ? "" : name.trim(), tform.trim(), format.storage(), format.repeat(),
                    offset, header.doubleValue("TSCAL" + n, 1.0), header.doubleValue("TZERO" + n, 0.0)));
            offset += format.byteWidth();
        }
        return columns;
    }

    private static int widthOf(List<TableColumn> columns) {
        int width = 0;
        for (TableColumn column : columns) {
            width += column.byteWidth();
        }
        return width;
    }

    @Override
    int typeCode() {
        return HduType.BINARY_TABLE.code();
    }

    @Override
    TableHdu copy() {
        return new TableHdu(header.copy(), data.clone(), columns, rowCount);
    }

    List<TableColumn> columns() {
        return columns;
    }

    long rowCount() {
        return rowCount;
    }

    TableColumn column(int colnum) throws StatusException {
        if (colnum < 1 || colnum > columns.size()) {
            throw new StatusException(Status.BAD_COL_NUM);
        }
        return columns.get(colnum - 1);
    }

    /**
     * Returns the 1-based numbers of all columns whose name matches the
     * template. {@code *} matches any sequence, {@code ?} one character and
     * {@code #} a run of digits.
     */
    List<Integer> findColumns(String template, boolean caseSensitive) {
        StringBuilder regex = new StringBuilder();
        for (char c : template.trim().toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '#' -> regex.append("\\d+");
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        Pattern pattern = Pattern.compile(regex.toString(), caseSensitive ? 0 : Pattern.CASE_INSENSITIVE);
        List<Integer> matches = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            if (pattern.matcher(columns.get(i).name()).matches()) {
                matches.add(i + 1);
            }
        }
        return matches;
    }

    void read(int colnum, int tag, long firstRow, long firstElem, long count, Object nullValue, Object array)
            throws StatusException {
        TableColumn column = column(colnum);
        if (tag == TypeTag.TSTRING.code()) {
            checkStrings(column, firstRow, firstElem, count, array);
            if (firstRow + count - 1 > rowCount) {
                throw new StatusException(Status.BAD_ROW_NUM);
            }
            readStrings(column, firstRow, (int) count, (byte[][]) array);
            return;
        }

        TagCodec codec = codec(column, tag, count, array);
        long first = checkElements(column, firstRow, firstElem);
        if (count > 0 && (first + count - 1) / column.repeat() + 1 > rowCount) {
            throw new StatusException(Status.BAD_ROW_NUM);
        }
        ByteBuffer buffer = ByteBuffer.wrap(data);
        ValueConverter converter = column.converter();
        boolean overflow = false;
        for (int i = 0; i < count; i++) {
            if (!converter.read(buffer, position(column, first + i), codec, array, i, nullValue)) {
                overflow = true;
            }
        }
        if (overflow) {
            throw new StatusException(Status.NUM_OVERFLOW);
        }
    }

    /**
     * Writes values, adding rows when the write runs past the last row.
     */
    void write(int colnum, int tag, long firstRow, long firstElem, long count, Object array) throws StatusException {
        TableColumn column = column(colnum);
        if (tag == TypeTag.TSTRING.code()) {
            checkStrings(column, firstRow, firstElem, count, array);
            ensureRows(firstRow + count - 1);
            writeStrings(column, firstRow, (int) count, (byte[][]) array);
            return;
        }

        TagCodec codec = codec(column, tag, count, array);
        long first = checkElements(column, firstRow, firstElem);
        if (count > 0) {
            ensureRows((first + count - 1) / column.repeat() + 1);
        }
        ByteBuffer buffer = ByteBuffer.wrap(data);
        ValueConverter converter = column.converter();
        boolean overflow = false;
        for (int i = 0; i < count; i++) {
            if (!converter.write(buffer, position(column, first + i), codec, array, i)) {
                overflow = true;
            }
        }
        if (overflow) {
            throw new StatusException(Status.NUM_OVERFLOW);
        }
    }

    void insertColumn(int colnum, String ttype, String tform) throws StatusException {
        if (colnum < 1 || colnum > columns.size() + 1) {
            throw new StatusException(Status.BAD_COL_NUM);
        }
        TableColumn.Format format = TableColumn.parseFormat(tform);
        int insertAt = colnum <= columns.size() ? columns.get(colnum - 1).offset() : rowWidth;
        int width = format.byteWidth();
        int newRowWidth = rowWidth + width;
        byte[] newData = new byte[checkedSize(rowCount * newRowWidth)];
        for (long row = 0; row < rowCount; row++) {
            int from = (int) (row * rowWidth);
            int to = (int) (row * newRowWidth);
            System.arraycopy(data, from, newData, to, insertAt);
            System.arraycopy(data, from + insertAt, newData, to + insertAt + width, rowWidth - insertAt);
        }

        renumber(colnum, 1);
        header.set(new HeaderCard("TTYPE" + colnum, CardValues.formatString(ttype), "label for field " + colnum));
        header.set(new HeaderCard("TFORM" + colnum, CardValues.formatString(tform), "data format of field"));
        data = newData;
        relayout(columns.size() + 1);
    }

    void deleteColumn(int colnum) throws StatusException {
        TableColumn column = column(colnum);
        int removeAt = column.offset();
        int width = column.byteWidth();
        int newRowWidth = rowWidth - width;
        byte[] newData = new byte[checkedSize(rowCount * newRowWidth)];
        for (long row = 0; row < rowCount; row++) {
            int from = (int) (row * rowWidth);
            int to = (int) (row * newRowWidth);
            System.arraycopy(data, from, newData, to, removeAt);
            System.arraycopy(data, from + removeAt + width, newData, to + removeAt, rowWidth - removeAt - width);
        }

        header.removeIf(card -> indexOf(card) == colnum);
        renumber(colnum + 1, -1);
        data = newData;
        relayout(columns.size() - 1);
    }

    @Override
    void syncHeader(boolean primary) {
        List<HeaderCard> leading = List.of(
                new HeaderCard("XTENSION", "'BINTABLE'", "binary table extension"),
                new HeaderCard("BITPIX", "8", "8-bit bytes"),
                new HeaderCard("NAXIS", "2", "2-dimensional binary table"),
                new HeaderCard("NAXIS1", Integer.toString(rowWidth), "width of table in bytes"),
                new HeaderCard("NAXIS2", Long.toString(rowCount), "number of rows in table"),
                new HeaderCard("PCOUNT", "0", "size of special data area"),
                new HeaderCard("GCOUNT", "1", "one data group (required keyword)"),
                new HeaderCard("TFIELDS", Integer.toString(columns.size()), "number of fields in each row"));
        header.removeIf(card -> card.keyword().equals("SIMPLE") || card.keyword().equals("EXTEND"));
        header.setLeading(leading);
    }

    private void relayout(int count) throws StatusException {
        columns = readColumns(header, count);
        rowWidth = widthOf(columns);
        syncHeader(false);
    }

    private void ensureRows(long rows) throws StatusException {
        if (rows <= rowCount) {
            return;
        }
        byte[] grown = new byte[checkedSize(rows * rowWidth)];
        System.arraycopy(data, 0, grown, 0, data.length);
        data = grown;
        rowCount = rows;
        syncHeader(false);
    }

    /**
     * Shifts the index of all column keywords numbered {@code from} or higher.
     */
    private void renumber(int from, int delta) {
        List<HeaderCard> cards = header.cards();
        for (int i = 0; i < cards.size(); i++) {
            HeaderCard card = cards.get(i);
            int index = indexOf(card);
            if (index >= from) {
                Matcher matcher = INDEXED_KEYWORD.matcher(card.keyword());
                matcher.matches();
                cards.set(i, new HeaderCard(matcher.group(1) + (index + delta), card.value(), card.comment()));
            }
        }
    }

    private static int indexOf(HeaderCard card) {
        Matcher matcher = INDEXED_KEYWORD.matcher(card.keyword());
        return card.hasValue() && matcher.matches() ? Integer.parseInt(matcher.group(2)) : -1;
    }

    private TagCodec codec(TableColumn column, int tag, long count, Object array) throws StatusException {
        TagCodec codec = TagCodec.forCode(tag);
        if (codec == null || !codec.accepts(array) || column.storage() == StorageType.CHAR) {
            throw new StatusException(Status.BAD_DATATYPE);
        }
        if (count < 0 || Array.getLength(array) < count) {
            throw new StatusException(Status.BAD_ELEM_NUM);
        }
        return codec;
    }

    /**
     * Returns the 0-based index of the first element across all rows.
     */
    private long checkElements(TableColumn column, long firstRow, long firstElem) throws StatusException {
        if (firstRow < 1) {
            throw new StatusException(Status.BAD_ROW_NUM);
        }
        if (firstElem < 1 || firstElem > column.repeat()) {
            throw new StatusException(Status.BAD_ELEM_NUM);
        }
        return (firstRow - 1) * column.repeat() + firstElem - 1;
    }

    private static void checkStrings(TableColumn column, long firstRow, long firstElem, long count, Object array)
            throws StatusException {
        if (column.storage() != StorageType.CHAR) {
            throw new StatusException(Status.NOT_ASCII_COL);
        }
        if (!(array instanceof byte[][] cells)) {
            throw new StatusException(Status.BAD_DATATYPE);
        }
        if (firstRow < 1) {
            throw new StatusException(Status.BAD_ROW_NUM);
        }
        if (firstElem != 1 || count < 0 || cells.length < count) {
            throw new StatusException(Status.BAD_ELEM_NUM);
        }
    }

    private int position(TableColumn column, long element) {
        long row = element / column.repeat();
        long index = element % column.repeat();
        return (int) (row * rowWidth + column.offset() + index * column.storage().size());
    }

    private void readStrings(TableColumn column, long firstRow, int count, byte[][] cells) {
        for (int i = 0; i < count; i++) {
            byte[] cell = cells[i];
            int start = (int) ((firstRow - 1 + i) * rowWidth + column.offset());
            int length = 0;
            while (length < column.repeat() && length < cell.length - 1 && data[start + length] != 0) {
                cell[length] = data[start + length];
                length++;
            }
            cell[length] = 0;
        }
    }

    private void writeStrings(TableColumn column, long firstRow, int count, byte[][] cells) {
        for (int i = 0; i < count; i++) {
            byte[] cell = cells[i];
            int start = (int) ((firstRow - 1 + i) * rowWidth + column.offset());
            int length = 0;
            while (length < column.repeat() && length < cell.length && cell[length] != 0) {
                data[start + length] = cell[length];
                length++;
            }
            for (int k = length; k < column.repeat(); k++) {
                data[start + k] = ' ';
            }
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "TableHdu[%s, %d columns, %d rows]", extname(), columns.size(), rowCount);
    }
}
