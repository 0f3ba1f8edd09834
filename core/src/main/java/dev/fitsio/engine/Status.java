/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.engine;

/**
 * Status codes returned by engine calls. Zero means success; the texts for all
 * codes come from {@link FitsEngine#statusText(int)}.
 */
public final class Status {

    public static final int OK = 0;

    public static final int FILE_NOT_OPENED = 104;
    public static final int FILE_NOT_CREATED = 105;
    public static final int WRITE_ERROR = 106;
    public static final int END_OF_FILE = 107;
    public static final int READ_ERROR = 108;
    public static final int FILE_NOT_CLOSED = 110;
    public static final int READONLY_FILE = 112;
    public static final int MEMORY_ALLOCATION = 113;
    public static final int BAD_FILEPTR = 114;
    public static final int NULL_INPUT_PTR = 115;

    public static final int KEY_NO_EXIST = 202;
    public static final int VALUE_UNDEFINED = 204;
    public static final int NO_QUOTE = 205;
    public static final int BAD_KEYCHAR = 207;
    public static final int BAD_ORDER = 208;
    public static final int NOT_POS_INT = 209;
    public static final int NO_END = 210;
    public static final int BAD_BITPIX = 211;
    public static final int BAD_NAXIS = 212;
    public static final int BAD_NAXES = 213;
    public static final int BAD_PCOUNT = 214;
    public static final int BAD_GCOUNT = 215;
    public static final int BAD_TFIELDS = 216;
    public static final int NEG_ROWS = 218;
    public static final int COL_NOT_FOUND = 219;
    public static final int BAD_SIMPLE = 220;
    public static final int NO_SIMPLE = 221;
    public static final int NO_XTENSION = 225;
    public static final int NOT_IMAGE = 233;
    public static final int NOT_TABLE = 235;
    public static final int COL_NOT_UNIQUE = 237;
    public static final int BAD_ROW_WIDTH = 241;
    public static final int UNKNOWN_EXT = 251;
    public static final int UNKNOWN_REC = 252;
    public static final int BAD_TFORM = 261;
    public static final int BAD_TFORM_DTYPE = 262;

    public static final int BAD_HDU_NUM = 301;
    public static final int BAD_COL_NUM = 302;
    public static final int BAD_ROW_NUM = 307;
    public static final int BAD_ELEM_NUM = 308;
    public static final int NOT_ASCII_COL = 309;
    public static final int BAD_BTABLE_FORMAT = 312;
    public static final int BAD_DIMEN = 320;
    public static final int BAD_PIX_NUM = 321;
    public static final int NEG_AXIS = 323;

    public static final int BAD_INTKEY = 403;
    public static final int BAD_LOGICALKEY = 404;
    public static final int BAD_FLOATKEY = 405;
    public static final int BAD_DOUBLEKEY = 406;
    public static final int BAD_DATATYPE = 410;
    public static final int NUM_OVERFLOW = 412;

    private Status() {
    }
}
