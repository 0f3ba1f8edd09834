/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.fitsio.engine.EngineFile;
import dev.fitsio.engine.FileMode;
import dev.fitsio.engine.HduType;
import dev.fitsio.engine.Status;
import dev.fitsio.engine.TypeTag;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Status-level tests of the bundled engine.
 */
public class DefaultFitsEngineTest {

    @TempDir
    Path tempDir;

    private final DefaultFitsEngine engine = new DefaultFitsEngine();

    private EngineFile create(Path path) {
        EngineFile[] file = new EngineFile[1];
        assertThat(engine.create(path, file)).isEqualTo(Status.OK);
        return file[0];
    }

    private EngineFile open(Path path, FileMode mode) {
        EngineFile[] file = new EngineFile[1];
        assertThat(engine.open(path, mode.code(), file)).isEqualTo(Status.OK);
        return file[0];
    }

    @Test
    void testCreateWritesBlockAlignedFile() throws Exception {
        Path path = tempDir.resolve("empty.fits");
        EngineFile file = create(path);

        assertThat(Files.size(path)).isEqualTo(FitsFileReader.BLOCK_SIZE);
        assertThat(engine.close(file)).isEqualTo(Status.OK);
        assertThat(Files.size(path) % FitsFileReader.BLOCK_SIZE).isZero();

        EngineFile[] again = new EngineFile[1];
        assertThat(engine.create(path, again)).isEqualTo(Status.FILE_NOT_CREATED);
    }

    @Test
    void testFileModeReflectsHowFileWasOpened() throws Exception {
        Path path = tempDir.resolve("mode.fits");
        EngineFile created = create(path);
        int[] mode = new int[1];
        assertThat(engine.fileMode(created, mode)).isEqualTo(Status.OK);
        assertThat(mode[0]).isEqualTo(FileMode.READWRITE.code());
        assertThat(engine.close(created)).isEqualTo(Status.OK);

        EngineFile readOnly = open(path, FileMode.READONLY);
        assertThat(engine.fileMode(readOnly, mode)).isEqualTo(Status.OK);
        assertThat(mode[0]).isEqualTo(FileMode.READONLY.code());
        assertThat(engine.close(readOnly)).isEqualTo(Status.OK);

        assertThat(engine.fileMode(readOnly, mode)).isEqualTo(Status.BAD_FILEPTR);
    }

    @Test
    void testCursorMoves() throws Exception {
        Path path = tempDir.resolve("cursor.fits");
        EngineFile file = create(path);
        assertThat(engine.createTable(file, new String[]{ "A" }, new String[]{ "1J" }, "first")).isEqualTo(Status.OK);
        assertThat(engine.createImage(file, 16, new long[]{ 5 })).isEqualTo(Status.OK);

        int[] count = new int[1];
        int[] hduNum = new int[1];
        int[] type = new int[1];
        assertThat(engine.hduCount(file, count)).isEqualTo(Status.OK);
        assertThat(count[0]).isEqualTo(3);
        assertThat(engine.currentHdu(file, hduNum)).isEqualTo(Status.OK);
        assertThat(hduNum[0]).isEqualTo(3);

        assertThat(engine.moveAbsolute(file, 2, type)).isEqualTo(Status.OK);
        assertThat(type[0]).isEqualTo(HduType.BINARY_TABLE.code());
        assertThat(engine.moveAbsolute(file, 0, type)).isEqualTo(Status.BAD_HDU_NUM);
        assertThat(engine.moveAbsolute(file, 4, type)).isEqualTo(Status.END_OF_FILE);

        assertThat(engine.moveByName(file, HduType.ANY.code(), "FIRST", 0)).isEqualTo(Status.OK);
        assertThat(engine.moveByName(file, HduType.IMAGE.code(), "first", 0)).isEqualTo(Status.BAD_HDU_NUM);
        assertThat(engine.moveByName(file, HduType.ANY.code(), "first", 2)).isEqualTo(Status.BAD_HDU_NUM);

        int[] naxis = new int[1];
        assertThat(engine.imageDimensions(file, naxis)).isEqualTo(Status.NOT_IMAGE);
        assertThat(engine.close(file)).isEqualTo(Status.OK);
        assertThat(engine.hduCount(file, count)).isEqualTo(Status.BAD_FILEPTR);
    }

    @Test
    void testKeywordRules() throws Exception {
        EngineFile file = create(tempDir.resolve("keys.fits"));
        int[] value = { 7 };

        assertThat(engine.writeKey(file, TypeTag.TINT.code(), "lower", value, "c")).isEqualTo(Status.OK);
        assertThat(engine.writeKey(file, TypeTag.TINT.code(), "BAD KEY", value, null)).isEqualTo(Status.BAD_KEYCHAR);
        assertThat(engine.writeKey(file, TypeTag.TINT.code(), "BITPIX", value, null)).isEqualTo(Status.BAD_ORDER);
        assertThat(engine.writeKey(file, TypeTag.TINT.code(), "NAXIS3", value, null)).isEqualTo(Status.BAD_ORDER);
        assertThat(engine.writeKey(file, TypeTag.TSTRING.code(), "TEXT", new byte[]{ 'a', '\n', 0 }, null))
                .isEqualTo(Status.BAD_KEYCHAR);

        int[] read = new int[1];
        byte[] comment = new byte[73];
        assertThat(engine.readKey(file, TypeTag.TINT.code(), "LOWER", read, comment)).isEqualTo(Status.OK);
        assertThat(read[0]).isEqualTo(7);
        assertThat(comment[0]).isEqualTo((byte) 'c');
        assertThat(comment[1]).isZero();

        assertThat(engine.readKey(file, TypeTag.TINT.code(), "MISSING", read, comment)).isEqualTo(Status.KEY_NO_EXIST);
        assertThat(engine.readKey(file, TypeTag.TINT.code(), "LOWER", new long[1], comment)).isEqualTo(Status.BAD_DATATYPE);
        engine.close(file);
    }

    @Test
    void testColumnLookup() throws Exception {
        EngineFile file = create(tempDir.resolve("columns.fits"));
        engine.createTable(file, new String[]{ "TIME", "RATE1", "RATE2" }, new String[]{ "1D", "1E", "1E" }, "rates");

        int[] colnum = new int[1];
        assertThat(engine.columnNumber(file, false, "time", colnum)).isEqualTo(Status.OK);
        assertThat(colnum[0]).isEqualTo(1);
        assertThat(engine.columnNumber(file, true, "time", colnum)).isEqualTo(Status.COL_NOT_FOUND);
        assertThat(engine.columnNumber(file, false, "RATE#", colnum)).isEqualTo(Status.COL_NOT_UNIQUE);
        assertThat(engine.columnNumber(file, false, "RATE?2", colnum)).isEqualTo(Status.COL_NOT_FOUND);
        assertThat(engine.columnNumber(file, false, "R*2", colnum)).isEqualTo(Status.OK);
        assertThat(colnum[0]).isEqualTo(3);

        int[] width = new int[1];
        assertThat(engine.columnDisplayWidth(file, 1, width)).isEqualTo(Status.OK);
        assertThat(width[0]).isEqualTo(23);
        assertThat(engine.columnDisplayWidth(file, 4, width)).isEqualTo(Status.BAD_COL_NUM);
        engine.close(file);
    }

    @Test
    void testTableRowsPersist() throws Exception {
        Path path = tempDir.resolve("rows.fits");
        EngineFile file = create(path);
        engine.createTable(file, new String[]{ "N", "V" }, new String[]{ "1K", "3I" }, "t");
        assertThat(engine.writeColumn(file, TypeTag.TLONGLONG.code(), 1, 1, 1, 4, new long[]{ 1, 2, 3, 4 }))
                .isEqualTo(Status.OK);
        // a vector column is traversed element by element
        assertThat(engine.writeColumn(file, TypeTag.TSHORT.code(), 2, 1, 1, 6, new short[]{ 1, 2, 3, 4, 5, 6 }))
                .isEqualTo(Status.OK);
        assertThat(engine.close(file)).isEqualTo(Status.OK);

        EngineFile reopened = open(path, FileMode.READONLY);
        int[] type = new int[1];
        engine.moveAbsolute(reopened, 2, type);
        long[] rows = new long[1];
        assertThat(engine.rowCount(reopened, rows)).isEqualTo(Status.OK);
        assertThat(rows[0]).isEqualTo(4);

        double[] values = new double[4];
        assertThat(engine.readColumn(reopened, TypeTag.TDOUBLE.code(), 1, 1, 1, 4, 0.0, values)).isEqualTo(Status.OK);
        assertThat(values).containsExactly(1.0, 2.0, 3.0, 4.0);

        short[] vector = new short[3];
        assertThat(engine.readColumn(reopened, TypeTag.TSHORT.code(), 2, 2, 1, 3, (short) 0, vector))
                .isEqualTo(Status.OK);
        assertThat(vector).containsExactly((short) 4, (short) 5, (short) 6);

        assertThat(engine.readColumn(reopened, TypeTag.TDOUBLE.code(), 1, 3, 1, 4, 0.0, values))
                .isEqualTo(Status.BAD_ROW_NUM);
        assertThat(engine.writeColumn(reopened, TypeTag.TDOUBLE.code(), 1, 1, 1, 1, values))
                .isEqualTo(Status.READONLY_FILE);
        assertThat(engine.close(reopened)).isEqualTo(Status.OK);
    }

    @Test
    void testPixelBoundsAndOverflow() throws Exception {
        EngineFile file = create(tempDir.resolve("pixels.fits"));
        engine.createImage(file, 8, new long[]{ 3, 2 });

        assertThat(engine.writePixels(file, TypeTag.TINT.code(), 1, 6, new int[]{ 0, 1, 2, 253, 254, 255 }))
                .isEqualTo(Status.OK);
        assertThat(engine.writePixels(file, TypeTag.TINT.code(), 1, 1, new int[]{ 256 })).isEqualTo(Status.NUM_OVERFLOW);
        assertThat(engine.writePixels(file, TypeTag.TINT.code(), 6, 2, new int[2])).isEqualTo(Status.BAD_ELEM_NUM);

        short[] pixels = new short[2];
        assertThat(engine.readSubset(file, TypeTag.TSHORT.code(), new long[]{ 3, 1 }, new long[]{ 3, 2 },
                new long[]{ 1, 1 }, (short) 0, pixels)).isEqualTo(Status.OK);
        assertThat(pixels).containsExactly((short) 2, (short) 255);

        assertThat(engine.readSubset(file, TypeTag.TSHORT.code(), new long[]{ 1 }, new long[]{ 3 },
                new long[]{ 1 }, (short) 0, pixels)).isEqualTo(Status.BAD_DIMEN);
        assertThat(engine.readSubset(file, TypeTag.TSHORT.code(), new long[]{ 1, 1 }, new long[]{ 4, 1 },
                new long[]{ 1, 1 }, (short) 0, new short[4])).isEqualTo(Status.BAD_PIX_NUM);

        byte[] signed = new byte[6];
        assertThat(engine.readPixels(file, TypeTag.TSBYTE.code(), 1, 6, (byte) 0, signed)).isEqualTo(Status.NUM_OVERFLOW);
        engine.close(file);
    }

    @Test
    void testStatusText() {
        assertThat(engine.statusText(Status.FILE_NOT_CREATED)).isEqualTo("couldn't create the named file");
        assertThat(engine.statusText(Status.BAD_ROW_NUM)).isEqualTo("bad first row number");
        assertThat(engine.statusText(-42)).isEqualTo("unknown error status");
        for (int status : new int[]{ 104, 105, 106, 107, 202, 219, 237, 301, 307, 308, 412 }) {
            assertThat(engine.statusText(status)).hasSizeLessThanOrEqualTo(30);
        }
    }
}
