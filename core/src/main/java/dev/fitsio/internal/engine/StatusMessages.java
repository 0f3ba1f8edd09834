/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import java.util.HashMap;
import java.util.Map;

import dev.fitsio.engine.Status;

/**
 * Short texts for engine status codes, none longer than 30 characters.
 */
final class StatusMessages {

    private static final Map<Integer, String> MESSAGES = new HashMap<>();

    static {
        MESSAGES.put(Status.OK, "OK - no error");
        MESSAGES.put(Status.FILE_NOT_OPENED, "could not open the named file");
        MESSAGES.put(Status.FILE_NOT_CREATED, "couldn't create the named file");
        MESSAGES.put(Status.WRITE_ERROR, "error writing to FITS file");
        MESSAGES.put(Status.END_OF_FILE, "tried to move past end of file");
        MESSAGES.put(Status.READ_ERROR, "error reading from FITS file");
        MESSAGES.put(Status.FILE_NOT_CLOSED, "could not close the file");
        MESSAGES.put(Status.READONLY_FILE, "cannot write to readonly file");
        MESSAGES.put(Status.MEMORY_ALLOCATION, "could not allocate memory");
        MESSAGES.put(Status.BAD_FILEPTR, "invalid fitsfile pointer");
        MESSAGES.put(Status.NULL_INPUT_PTR, "NULL input pointer");
        MESSAGES.put(Status.KEY_NO_EXIST, "keyword not found in header");
        MESSAGES.put(Status.VALUE_UNDEFINED, "keyword value field is blank");
        MESSAGES.put(Status.NO_QUOTE, "string missing closing quote");
        MESSAGES.put(Status.BAD_KEYCHAR, "illegal character in keyword");
        MESSAGES.put(Status.BAD_ORDER, "required keywords out of order");
        MESSAGES.put(Status.NOT_POS_INT, "keyword value not positive int");
        MESSAGES.put(Status.NO_END, "couldn't find END keyword");
        MESSAGES.put(Status.BAD_BITPIX, "illegal BITPIX keyword value");
        MESSAGES.put(Status.BAD_NAXIS, "illegal NAXIS keyword value");
        MESSAGES.put(Status.BAD_NAXES, "illegal NAXISn keyword value");
        MESSAGES.put(Status.BAD_PCOUNT, "illegal PCOUNT keyword value");
        MESSAGES.put(Status.BAD_GCOUNT, "illegal GCOUNT keyword value");
        MESSAGES.put(Status.BAD_TFIELDS, "illegal TFIELDS keyword value");
        MESSAGES.put(Status.NEG_ROWS, "negative number of rows");
        MESSAGES.put(Status.COL_NOT_FOUND, "named column not found");
        MESSAGES.put(Status.BAD_SIMPLE, "illegal SIMPLE keyword value");
        MESSAGES.put(Status.NO_SIMPLE, "first keyword not SIMPLE");
        MESSAGES.put(Status.NO_XTENSION, "first keyword not XTENSION");
        MESSAGES.put(Status.NOT_IMAGE, "not an IMAGE extension");
        MESSAGES.put(Status.NOT_TABLE, "not a TABLE extension");
        MESSAGES.put(Status.COL_NOT_UNIQUE, "more than 1 column name match");
        MESSAGES.put(Status.BAD_ROW_WIDTH, "sum of col widths not = NAXIS1");
        MESSAGES.put(Status.UNKNOWN_EXT, "unknown type of extension");
        MESSAGES.put(Status.UNKNOWN_REC, "unknown record type");
        MESSAGES.put(Status.BAD_TFORM, "illegal TFORM format code");
        MESSAGES.put(Status.BAD_TFORM_DTYPE, "unknown TFORM datatype code");
        MESSAGES.put(Status.BAD_HDU_NUM, "illegal HDU number");
        MESSAGES.put(Status.BAD_COL_NUM, "column number < 1 or > tfields");
        MESSAGES.put(Status.BAD_ROW_NUM, "bad first row number");
        MESSAGES.put(Status.BAD_ELEM_NUM, "bad first element number");
        MESSAGES.put(Status.NOT_ASCII_COL, "not an ASCII (A) column");
        MESSAGES.put(Status.BAD_BTABLE_FORMAT, "illegal BINTABLE format");
        MESSAGES.put(Status.BAD_DIMEN, "illegal number of dimensions");
        MESSAGES.put(Status.BAD_PIX_NUM, "first pixel > last pixel");
        MESSAGES.put(Status.NEG_AXIS, "illegal axis length < 1");
        MESSAGES.put(Status.BAD_INTKEY, "can't convert to integer");
        MESSAGES.put(Status.BAD_LOGICALKEY, "can't convert to logical");
        MESSAGES.put(Status.BAD_FLOATKEY, "can't convert to float");
        MESSAGES.put(Status.BAD_DOUBLEKEY, "can't convert to double");
        MESSAGES.put(Status.BAD_DATATYPE, "bad keyword datatype code");
        MESSAGES.put(Status.NUM_OVERFLOW, "overflow during conversion");
    }

    private StatusMessages() {
    }

    static String text(int status) {
        return MESSAGES.getOrDefault(status, "unknown error status");
    }
}
