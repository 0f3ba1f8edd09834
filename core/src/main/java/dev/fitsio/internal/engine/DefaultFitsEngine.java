/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import java.io.IOException;
import java.lang.reflect.Array;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import dev.fitsio.engine.EngineFile;
import dev.fitsio.engine.FileMode;
import dev.fitsio.engine.FitsEngine;
import dev.fitsio.engine.HduType;
import dev.fitsio.engine.Status;
import dev.fitsio.engine.TypeTag;

/**
 * Pure-Java {@link FitsEngine} for uncompressed FITS files with IMAGE and
 * BINTABLE extensions.
 * <p>
 * A file is loaded into memory completely when it is opened and written back
 * as a whole when it is closed, if it was opened read-write and changed.
 * </p>
 */
public final class DefaultFitsEngine implements FitsEngine {

    private static final System.Logger LOG = System.getLogger(DefaultFitsEngine.class.getName());

    private static final Set<String> RESERVED_KEYWORDS = Set.of("SIMPLE", "XTENSION", "BITPIX", "NAXIS", "EXTEND",
            "PCOUNT", "GCOUNT", "TFIELDS", "END");

    private static final String INDEXED_RESERVED = "(NAXIS|TTYPE|TFORM)\\d+";

    @FunctionalInterface
    private interface Action {
        void run() throws StatusException;
    }

    // files

    @Override
    public int open(Path path, int mode, EngineFile[] file) {
        FileMode fileMode;
        try {
            fileMode = FileMode.fromCode(mode);
        }
        catch (IllegalArgumentException e) {
            return Status.FILE_NOT_OPENED;
        }
        if (fileMode == FileMode.READWRITE && !Files.isWritable(path)) {
            return Status.FILE_NOT_OPENED;
        }

        ByteBuffer contents;
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size > Hdu.MAX_DATA_SIZE) {
                return Status.MEMORY_ALLOCATION;
            }
            contents = ByteBuffer.allocate((int) size);
            while (contents.hasRemaining()) {
                if (channel.read(contents) < 0) {
                    return Status.READ_ERROR;
                }
            }
            contents.flip();
        }
        catch (IOException e) {
            LOG.log(System.Logger.Level.DEBUG, "Cannot read ''{0}'': {1}", path, e.getMessage());
            return Status.FILE_NOT_OPENED;
        }

        return run(() -> {
            List<Hdu> hdus = FitsFileReader.read(contents);
            file[0] = new FileState(path, fileMode, hdus);
            LOG.log(System.Logger.Level.DEBUG, "Loaded {0} HDUs from ''{1}''", hdus.size(), path);
        });
    }

    @Override
    public int create(Path path, EngineFile[] file) {
        List<Hdu> hdus = List.of(ImageHdu.emptyPrimary());
        try {
            FitsFileWriter.write(path, hdus, StandardOpenOption.WRITE, StandardOpenOption.CREATE_NEW);
        }
        catch (IOException e) {
            LOG.log(System.Logger.Level.DEBUG, "Cannot create ''{0}'': {1}", path, e.getMessage());
            return Status.FILE_NOT_CREATED;
        }
        FileState state = new FileState(path, FileMode.READWRITE, hdus);
        state.markModified();
        file[0] = state;
        return Status.OK;
    }

    @Override
    public int close(EngineFile file) {
        FileState state = state(file);
        if (state == null) {
            return Status.BAD_FILEPTR;
        }
        state.markClosed();
        if (state.mode() != FileMode.READWRITE || !state.isModified()) {
            return Status.OK;
        }
        try {
            FitsFileWriter.write(state.path(), state.hdus(), StandardOpenOption.WRITE, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING);
            LOG.log(System.Logger.Level.DEBUG, "Wrote {0} HDUs to ''{1}''", state.hdus().size(), state.path());
            return Status.OK;
        }
        catch (NoSuchFileException e) {
            return Status.FILE_NOT_CLOSED;
        }
        catch (IOException e) {
            LOG.log(System.Logger.Level.DEBUG, "Cannot write ''{0}'': {1}", state.path(), e.getMessage());
            return Status.WRITE_ERROR;
        }
    }

    @Override
    public int fileMode(EngineFile file, int[] mode) {
        return withFile(file, state -> mode[0] = state.mode().code());
    }

    // HDU cursor

    @Override
    public int moveAbsolute(EngineFile file, int hduNum, int[] hduType) {
        return withFile(file, state -> {
            if (hduNum < 1) {
                throw new StatusException(Status.BAD_HDU_NUM);
            }
            if (hduNum > state.hdus().size()) {
                throw new StatusException(Status.END_OF_FILE);
            }
            state.moveTo(hduNum - 1);
            if (hduType != null && hduType.length > 0) {
                hduType[0] = state.currentHdu().typeCode();
            }
        });
    }

    @Override
    public int moveByName(EngineFile file, int hduType, String name, int version) {
        return withFile(file, state -> {
            List<Hdu> hdus = state.hdus();
            for (int i = 0; i < hdus.size(); i++) {
                Hdu hdu = hdus.get(i);
                if (hduType != HduType.ANY.code() && hdu.typeCode() != hduType) {
                    continue;
                }
                if (hdu.extname().equalsIgnoreCase(name.trim()) && (version == 0 || hdu.extver() == version)) {
                    state.moveTo(i);
                    return;
                }
            }
            throw new StatusException(Status.BAD_HDU_NUM);
        });
    }

    @Override
    public int currentHdu(EngineFile file, int[] hduNum) {
        return withFile(file, state -> hduNum[0] = state.current() + 1);
    }

    @Override
    public int hduCount(EngineFile file, int[] count) {
        return withFile(file, state -> count[0] = state.hdus().size());
    }

    @Override
    public int hduType(EngineFile file, int[] hduType) {
        return withFile(file, state -> hduType[0] = state.currentHdu().typeCode());
    }

    // image metadata

    @Override
    public int imageDimensions(EngineFile file, int[] naxis) {
        return withFile(file, state -> naxis[0] = state.currentImage().naxes().length);
    }

    @Override
    public int imageShape(EngineFile file, long[] naxes) {
        return withFile(file, state -> {
            long[] axes = state.currentImage().naxes();
            System.arraycopy(axes, 0, naxes, 0, Math.min(axes.length, naxes.length));
        });
    }

    @Override
    public int imageEquivalentType(EngineFile file, int[] bitpix) {
        return withFile(file, state -> bitpix[0] = state.currentImage().equivalentBitpix());
    }

    // table metadata

    @Override
    public int rowCount(EngineFile file, long[] rows) {
        return withFile(file, state -> rows[0] = state.currentTable().rowCount());
    }

    @Override
    public int columnCount(EngineFile file, int[] columns) {
        return withFile(file, state -> columns[0] = state.currentTable().columns().size());
    }

    @Override
    public int columnInfo(EngineFile file, int colnum, byte[] name, byte[] tform) {
        return withFile(file, state -> {
            TableColumn column = state.currentTable().column(colnum);
            copyText(column.name(), name);
            copyText(column.tform(), tform);
        });
    }

    @Override
    public int columnDisplayWidth(EngineFile file, int colnum, int[] width) {
        return withFile(file, state -> width[0] = state.currentTable().column(colnum).displayWidth());
    }

    @Override
    public int columnNumber(EngineFile file, boolean caseSensitive, String template, int[] colnum) {
        return withFile(file, state -> {
            List<Integer> matches = state.currentTable().findColumns(template, caseSensitive);
            if (matches.isEmpty()) {
                throw new StatusException(Status.COL_NOT_FOUND);
            }
            colnum[0] = matches.get(0);
            if (matches.size() > 1) {
                throw new StatusException(Status.COL_NOT_UNIQUE);
            }
        });
    }

    // header keywords

    @Override
    public int readKey(EngineFile file, int tag, String name, Object value, byte[] comment) {
        return withFile(file, state -> {
            HeaderCard card = state.currentHdu().header().find(name);
            if (card == null) {
                throw new StatusException(Status.KEY_NO_EXIST);
            }
            if (card.value().isEmpty()) {
                throw new StatusException(Status.VALUE_UNDEFINED);
            }
            readValue(card.value(), tag, value);
            if (comment != null && comment.length > 0) {
                copyText(card.comment() == null ? "" : card.comment(), comment);
            }
        });
    }

    @Override
    public int writeKey(EngineFile file, int tag, String name, Object value, String comment) {
        return withFile(file, state -> {
            state.checkWritable();
            String keyword = checkKeyword(name);
            Header header = state.currentHdu().header();
            String text = formatValue(tag, value);
            String newComment = comment;
            if (newComment == null) {
                HeaderCard existing = header.find(keyword);
                newComment = existing == null ? null : existing.comment();
            }
            header.set(new HeaderCard(keyword, text, newComment));
            state.markModified();
        });
    }

    // column data

    @Override
    public int readColumn(EngineFile file, int tag, int colnum, long firstRow, long firstElem, long count,
                          Object nullValue, Object array) {
        return withFile(file, state -> state.currentTable().read(colnum, tag, firstRow, firstElem, count, nullValue,
                array));
    }

    @Override
    public int writeColumn(EngineFile file, int tag, int colnum, long firstRow, long firstElem, long count,
                           Object array) {
        return withFile(file, state -> {
            state.checkWritable();
            state.currentTable().write(colnum, tag, firstRow, firstElem, count, array);
            state.markModified();
        });
    }

    // pixel data

    @Override
    public int readPixels(EngineFile file, int tag, long firstPixel, long count, Object nullValue, Object array) {
        return withFile(file, state -> {
            ImageHdu image = state.currentImage();
            TagCodec codec = pixelCodec(tag, array, count);
            checkPixels(image, firstPixel, count);
            ByteBuffer data = ByteBuffer.wrap(image.data());
            ValueConverter converter = image.converter();
            int size = image.storage().size();
            boolean overflow = false;
            for (int i = 0; i < count; i++) {
                if (!converter.read(data, (int) ((firstPixel - 1 + i) * size), codec, array, i, nullValue)) {
                    overflow = true;
                }
            }
            if (overflow) {
                throw new StatusException(Status.NUM_OVERFLOW);
            }
        });
    }

    @Override
    public int writePixels(EngineFile file, int tag, long firstPixel, long count, Object array) {
        return withFile(file, state -> {
            state.checkWritable();
            ImageHdu image = state.currentImage();
            TagCodec codec = pixelCodec(tag, array, count);
            checkPixels(image, firstPixel, count);
            ByteBuffer data = ByteBuffer.wrap(image.data());
            ValueConverter converter = image.converter();
            int size = image.storage().size();
            boolean overflow = false;
            for (int i = 0; i < count; i++) {
                if (!converter.write(data, (int) ((firstPixel - 1 + i) * size), codec, array, i)) {
                    overflow = true;
                }
            }
            state.markModified();
            if (overflow) {
                throw new StatusException(Status.NUM_OVERFLOW);
            }
        });
    }

    @Override
    public int readSubset(EngineFile file, int tag, long[] fpixel, long[] lpixel, long[] inc, Object nullValue,
                          Object array) {
        return withFile(file, state -> {
            ImageHdu image = state.currentImage();
            long[] offsets = subsetOffsets(image, fpixel, lpixel, inc);
            TagCodec codec = pixelCodec(tag, array, offsets.length);
            ByteBuffer data = ByteBuffer.wrap(image.data());
            ValueConverter converter = image.converter();
            int size = image.storage().size();
            boolean overflow = false;
            for (int i = 0; i < offsets.length; i++) {
                if (!converter.read(data, (int) (offsets[i] * size), codec, array, i, nullValue)) {
                    overflow = true;
                }
            }
            if (overflow) {
                throw new StatusException(Status.NUM_OVERFLOW);
            }
        });
    }

    @Override
    public int writeSubset(EngineFile file, int tag, long[] fpixel, long[] lpixel, Object array) {
        return withFile(file, state -> {
            state.checkWritable();
            ImageHdu image = state.currentImage();
            long[] inc = new long[fpixel.length];
            Arrays.fill(inc, 1L);
            long[] offsets = subsetOffsets(image, fpixel, lpixel, inc);
            TagCodec codec = pixelCodec(tag, array, offsets.length);
            ByteBuffer data = ByteBuffer.wrap(image.data());
            ValueConverter converter = image.converter();
            int size = image.storage().size();
            boolean overflow = false;
            for (int i = 0; i < offsets.length; i++) {
                if (!converter.write(data, (int) (offsets[i] * size), codec, array, i)) {
                    overflow = true;
                }
            }
            state.markModified();
            if (overflow) {
                throw new StatusException(Status.NUM_OVERFLOW);
            }
        });
    }

    // structure

    @Override
    public int createImage(EngineFile file, int bitpix, long[] naxes) {
        return withFile(file, state -> {
            state.checkWritable();
            state.append(ImageHdu.create(bitpix, naxes));
        });
    }

    @Override
    public int createTable(EngineFile file, String[] ttype, String[] tform, String extname) {
        return withFile(file, state -> {
            state.checkWritable();
            state.append(TableHdu.create(ttype, tform, extname));
        });
    }

    @Override
    public int resizeImage(EngineFile file, int bitpix, long[] naxes) {
        return withFile(file, state -> {
            state.checkWritable();
            ImageHdu image = state.currentImage();
            image.reshape(bitpix, naxes);
            image.syncHeader(state.current() == 0);
            state.markModified();
        });
    }

    @Override
    public int insertColumn(EngineFile file, int colnum, String ttype, String tform) {
        return withFile(file, state -> {
            state.checkWritable();
            state.currentTable().insertColumn(colnum, ttype, tform);
            state.markModified();
        });
    }

    @Override
    public int deleteColumn(EngineFile file, int colnum) {
        return withFile(file, state -> {
            state.checkWritable();
            state.currentTable().deleteColumn(colnum);
            state.markModified();
        });
    }

    @Override
    public int copyHdu(EngineFile source, EngineFile destination) {
        FileState target = state(destination);
        if (target == null || target.isClosed()) {
            return Status.BAD_FILEPTR;
        }
        return withFile(source, state -> {
            target.checkWritable();
            Hdu copy = state.currentHdu().copy();
            copy.syncHeader(false);
            target.append(copy);
        });
    }

    @Override
    public int deleteHdu(EngineFile file, int[] hduType) {
        return withFile(file, state -> {
            state.checkWritable();
            List<Hdu> hdus = state.hdus();
            int current = state.current();
            if (current == 0) {
                hdus.set(0, ImageHdu.emptyPrimary());
            }
            else {
                hdus.remove(current);
                state.moveTo(Math.min(current, hdus.size() - 1));
            }
            state.markModified();
            if (hduType != null && hduType.length > 0) {
                hduType[0] = state.currentHdu().typeCode();
            }
        });
    }

    @Override
    public String statusText(int status) {
        return StatusMessages.text(status);
    }

    // helpers

    private static FileState state(EngineFile file) {
        return file instanceof FileState state ? state : null;
    }

    private interface StateAction {
        void run(FileState state) throws StatusException;
    }

    private static int withFile(EngineFile file, StateAction action) {
        FileState state = state(file);
        if (state == null || state.isClosed()) {
            return Status.BAD_FILEPTR;
        }
        return run(() -> action.run(state));
    }

    private static int run(Action action) {
        try {
            action.run();
            return Status.OK;
        }
        catch (StatusException e) {
            return e.status();
        }
    }

    private static String checkKeyword(String name) throws StatusException {
        String keyword = name.trim().toUpperCase(Locale.ROOT);
        if (keyword.isEmpty() || keyword.length() > 8) {
            throw new StatusException(Status.BAD_KEYCHAR);
        }
        for (char c : keyword.toCharArray()) {
            if (!(c >= 'A' && c <= 'Z') && !(c >= '0' && c <= '9') && c != '_' && c != '-') {
                throw new StatusException(Status.BAD_KEYCHAR);
            }
        }
        if (RESERVED_KEYWORDS.contains(keyword) || keyword.matches(INDEXED_RESERVED)) {
            throw new StatusException(Status.BAD_ORDER);
        }
        return keyword;
    }

    private static void readValue(String raw, int tag, Object value) throws StatusException {
        if (tag == TypeTag.TSTRING.code()) {
            if (!(value instanceof byte[] buffer)) {
                throw new StatusException(Status.BAD_DATATYPE);
            }
            copyText(CardValues.isString(raw) ? CardValues.parseString(raw) : raw, buffer);
            return;
        }
        TagCodec codec = TagCodec.forCode(tag);
        if (codec == null || !codec.accepts(value) || Array.getLength(value) < 1) {
            throw new StatusException(Status.BAD_DATATYPE);
        }
        if (codec == TagCodec.LOGICAL) {
            codec.setLong(value, 0, CardValues.parseLogical(raw) ? 1 : 0);
            return;
        }
        if (codec == TagCodec.ULONGLONG) {
            Long bits = CardValues.parseUnsigned(raw);
            if (bits != null) {
                codec.setUnsigned(value, 0, bits);
                return;
            }
        }
        Number number = CardValues.parseNumber(raw, codec.isFloating()
                ? (codec == TagCodec.FLOAT ? Status.BAD_FLOATKEY : Status.BAD_DOUBLEKEY)
                : Status.BAD_INTKEY);
        boolean stored = number instanceof Long
                ? codec.setLong(value, 0, number.longValue())
                : codec.setDouble(value, 0, number.doubleValue());
        if (!stored) {
            throw new StatusException(Status.NUM_OVERFLOW);
        }
    }

    private static String formatValue(int tag, Object value) throws StatusException {
        if (tag == TypeTag.TSTRING.code()) {
            if (!(value instanceof byte[] buffer)) {
                throw new StatusException(Status.BAD_DATATYPE);
            }
            int length = 0;
            while (length < buffer.length && buffer[length] != 0) {
                if ((buffer[length] & 0xFF) < ' ') {
                    throw new StatusException(Status.BAD_KEYCHAR);
                }
                length++;
            }
            return CardValues.formatString(new String(buffer, 0, length, StandardCharsets.ISO_8859_1));
        }
        TagCodec codec = TagCodec.forCode(tag);
        if (codec == null || !codec.accepts(value) || Array.getLength(value) < 1) {
            throw new StatusException(Status.BAD_DATATYPE);
        }
        return switch (codec) {
            case LOGICAL -> CardValues.formatLogical(codec.getLong(value, 0) != 0);
            case FLOAT -> Float.toString(((float[]) value)[0]);
            case DOUBLE -> Double.toString(((double[]) value)[0]);
            case ULONGLONG -> Long.toUnsignedString(codec.getLong(value, 0));
            default -> Long.toString(codec.getLong(value, 0));
        };
    }

    private static TagCodec pixelCodec(int tag, Object array, long count) throws StatusException {
        TagCodec codec = TagCodec.forCode(tag);
        if (codec == null || codec == TagCodec.LOGICAL || !codec.accepts(array)) {
            throw new StatusException(Status.BAD_DATATYPE);
        }
        if (count < 0 || Array.getLength(array) < count) {
            throw new StatusException(Status.BAD_ELEM_NUM);
        }
        return codec;
    }

    private static void checkPixels(ImageHdu image, long firstPixel, long count) throws StatusException {
        if (firstPixel < 1 || (count > 0 && firstPixel - 1 + count > image.pixelCount())) {
            throw new StatusException(Status.BAD_ELEM_NUM);
        }
    }

    /**
     * Lists the flat pixel offsets of a region, fastest varying axis first.
     */
    private static long[] subsetOffsets(ImageHdu image, long[] fpixel, long[] lpixel, long[] inc)
            throws StatusException {
        long[] naxes = image.naxes();
        int naxis = naxes.length;
        if (naxis == 0 || fpixel.length != naxis || lpixel.length != naxis || inc.length != naxis) {
            throw new StatusException(Status.BAD_DIMEN);
        }
        long count = 1;
        long[] strides = new long[naxis];
        long stride = 1;
        for (int k = 0; k < naxis; k++) {
            if (fpixel[k] < 1 || lpixel[k] > naxes[k] || fpixel[k] > lpixel[k] || inc[k] < 1) {
                throw new StatusException(Status.BAD_PIX_NUM);
            }
            strides[k] = stride;
            stride *= naxes[k];
            count *= (lpixel[k] - fpixel[k]) / inc[k] + 1;
        }

        long[] offsets = new long[Hdu.checkedSize(count)];
        long[] position = fpixel.clone();
        for (int i = 0; i < offsets.length; i++) {
            long offset = 0;
            for (int k = 0; k < naxis; k++) {
                offset += (position[k] - 1) * strides[k];
            }
            offsets[i] = offset;
            for (int k = 0; k < naxis; k++) {
                position[k] += inc[k];
                if (position[k] <= lpixel[k]) {
                    break;
                }
                position[k] = fpixel[k];
            }
        }
        return offsets;
    }

    private static void copyText(String text, byte[] buffer) {
        byte[] bytes = text.getBytes(StandardCharsets.ISO_8859_1);
        int length = Math.min(bytes.length, buffer.length - 1);
        System.arraycopy(bytes, 0, buffer, 0, length);
        buffer[length] = 0;
    }
}
