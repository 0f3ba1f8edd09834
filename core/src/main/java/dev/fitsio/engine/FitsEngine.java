/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.engine;

import java.nio.file.Path;

/**
 * Contract of the stateful FITS format engine the typed layer sits in front of.
 * <p>
 * Every method returns a status code, {@link Status#OK} on success, and writes its
 * results into caller-supplied arrays. Unit, column, row, element and pixel
 * positions are 1-indexed. Methods operating on an {@link EngineFile} act on the
 * file's current HDU, which is changed only by the move, create, copy and delete
 * calls.
 * </p>
 * <p>
 * Buffers passed as {@code Object} are primitive arrays whose component type is
 * determined by the {@link TypeTag} code given alongside them. Text values are
 * passed as NUL-terminated {@code byte[]} buffers, text columns as {@code byte[][]}.
 * </p>
 * <p>
 * Implementations are not required to be thread-safe.
 * </p>
 */
public interface FitsEngine {

    // files

    int open(Path path, int mode, EngineFile[] file);

    int create(Path path, EngineFile[] file);

    int close(EngineFile file);

    int fileMode(EngineFile file, int[] mode);

    // HDU cursor

    int moveAbsolute(EngineFile file, int hduNum, int[] hduType);

    int moveByName(EngineFile file, int hduType, String name, int version);

    int currentHdu(EngineFile file, int[] hduNum);

    int hduCount(EngineFile file, int[] count);

    int hduType(EngineFile file, int[] hduType);

    // image metadata

    int imageDimensions(EngineFile file, int[] naxis);

    /**
     * Writes the image axis lengths in FITS order, fastest varying axis first.
     */
    int imageShape(EngineFile file, long[] naxes);

    int imageEquivalentType(EngineFile file, int[] bitpix);

    // table metadata

    int rowCount(EngineFile file, long[] rows);

    int columnCount(EngineFile file, int[] columns);

    int columnInfo(EngineFile file, int colnum, byte[] name, byte[] tform);

    int columnDisplayWidth(EngineFile file, int colnum, int[] width);

    /**
     * Looks up a column by name template. {@code *}, {@code ?} and {@code #} act as
     * wildcards; a template matching more than one column fails with
     * {@link Status#COL_NOT_UNIQUE}.
     */
    int columnNumber(EngineFile file, boolean caseSensitive, String template, int[] colnum);

    // header keywords

    int readKey(EngineFile file, int tag, String name, Object value, byte[] comment);

    int writeKey(EngineFile file, int tag, String name, Object value, String comment);

    // column data

    int readColumn(EngineFile file, int tag, int colnum, long firstRow, long firstElem, long count,
                   Object nullValue, Object array);

    int writeColumn(EngineFile file, int tag, int colnum, long firstRow, long firstElem, long count,
                    Object array);

    // pixel data

    int readPixels(EngineFile file, int tag, long firstPixel, long count, Object nullValue, Object array);

    int writePixels(EngineFile file, int tag, long firstPixel, long count, Object array);

    int readSubset(EngineFile file, int tag, long[] fpixel, long[] lpixel, long[] inc,
                   Object nullValue, Object array);

    int writeSubset(EngineFile file, int tag, long[] fpixel, long[] lpixel, Object array);

    // structure

    int createImage(EngineFile file, int bitpix, long[] naxes);

    int createTable(EngineFile file, String[] ttype, String[] tform, String extname);

    int resizeImage(EngineFile file, int bitpix, long[] naxes);

    int insertColumn(EngineFile file, int colnum, String ttype, String tform);

    int deleteColumn(EngineFile file, int colnum);

    int copyHdu(EngineFile source, EngineFile destination);

    int deleteHdu(EngineFile file, int[] hduType);

    /**
     * Returns the short text describing a status code, at most 30 characters.
     */
    String statusText(int status);
}
