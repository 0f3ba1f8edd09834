/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.reader;

import java.util.ArrayList;
import java.util.List;

import dev.fitsio.engine.EngineFile;
import dev.fitsio.engine.FitsEngine;
import dev.fitsio.engine.HduType;
import dev.fitsio.engine.Status;
import dev.fitsio.errors.EngineException;
import dev.fitsio.errors.ErrorTranslator;
import dev.fitsio.errors.FitsException;
import dev.fitsio.errors.UsageException;
import dev.fitsio.schema.ColumnDataDescription;
import dev.fitsio.schema.ConcreteColumnDescription;
import dev.fitsio.schema.HduInfo;
import dev.fitsio.schema.ImageType;
import dev.fitsio.types.TextCodec;

/**
 * Reads the layout of the engine's current HDU.
 */
final class HduCatalog {

    // TTYPEn and TFORMn values, plus terminator
    private static final int NAME_BUFFER_LENGTH = 71;

    private HduCatalog() {
    }

    static HduInfo fetch(FitsEngine engine, EngineFile file) throws FitsException {
        int[] type = new int[1];
        ErrorTranslator.check(engine, engine.hduType(file, type));

        if (HduType.fromCode(type[0]) == HduType.IMAGE) {
            return fetchImage(engine, file);
        }
        return fetchTable(engine, file);
    }

    private static HduInfo.ImageInfo fetchImage(FitsEngine engine, EngineFile file) throws FitsException {
        int[] naxis = new int[1];
        ErrorTranslator.check(engine, engine.imageDimensions(file, naxis));

        long[] naxes = new long[naxis[0]];
        ErrorTranslator.check(engine, engine.imageShape(file, naxes));

        int[] bitpix = new int[1];
        ErrorTranslator.check(engine, engine.imageEquivalentType(file, bitpix));

        // the engine reports the fastest varying axis first
        List<Long> shape = new ArrayList<>(naxes.length);
        for (int i = naxes.length - 1; i >= 0; i--) {
            shape.add(naxes[i]);
        }

        ImageType pixelType;
        try {
            pixelType = ImageType.fromBitpix(bitpix[0]);
        }
        catch (IllegalArgumentException e) {
            EngineException error = ErrorTranslator.engineError(engine, Status.BAD_BITPIX);
            error.initCause(e);
            throw error;
        }
        return new HduInfo.ImageInfo(shape, pixelType);
    }

    private static HduInfo.TableInfo fetchTable(FitsEngine engine, EngineFile file) throws FitsException {
        long[] rows = new long[1];
        ErrorTranslator.check(engine, engine.rowCount(file, rows));

        int[] count = new int[1];
        ErrorTranslator.check(engine, engine.columnCount(file, count));

        List<ConcreteColumnDescription> columns = new ArrayList<>(count[0]);
        for (int colnum = 1; colnum <= count[0]; colnum++) {
            byte[] name = new byte[NAME_BUFFER_LENGTH];
            byte[] tform = new byte[NAME_BUFFER_LENGTH];
            ErrorTranslator.check(engine, engine.columnInfo(file, colnum, name, tform));

            String columnName = TextCodec.decode(name, "name of column " + colnum);
            ColumnDataDescription dataType;
            try {
                dataType = ColumnDataDescription.parse(TextCodec.decode(tform, "type of column " + colnum));
            }
            catch (UsageException e) {
                EngineException error = ErrorTranslator.engineError(engine, Status.BAD_TFORM_DTYPE);
                error.initCause(e);
                throw error;
            }
            columns.add(new ConcreteColumnDescription(columnName, dataType));
        }
        return new HduInfo.TableInfo(columns, rows[0]);
    }
}
