/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import dev.fitsio.engine.TypeTag;

/**
 * Access to caller buffers by type tag. Unsigned tags use the next wider
 * signed array type; {@link #ULONGLONG} holds the unsigned bit pattern.
 */
enum TagCodec {
    SBYTE(TypeTag.TSBYTE, byte[].class, Byte.MIN_VALUE, Byte.MAX_VALUE),
    UBYTE(TypeTag.TBYTE, short[].class, 0, 255),
    SHORT(TypeTag.TSHORT, short[].class, Short.MIN_VALUE, Short.MAX_VALUE),
    USHORT(TypeTag.TUSHORT, int[].class, 0, 65535),
    INT(TypeTag.TINT, int[].class, Integer.MIN_VALUE, Integer.MAX_VALUE),
    UINT(TypeTag.TUINT, long[].class, 0, 0xFFFF_FFFFL),
    ULONG(TypeTag.TULONG, long[].class, 0, 0xFFFF_FFFFL),
    LONG(TypeTag.TLONG, long[].class, Long.MIN_VALUE, Long.MAX_VALUE),
    LONGLONG(TypeTag.TLONGLONG, long[].class, Long.MIN_VALUE, Long.MAX_VALUE),
    ULONGLONG(TypeTag.TULONGLONG, long[].class, 0, Long.MAX_VALUE),
    FLOAT(TypeTag.TFLOAT, float[].class, 0, 0),
    DOUBLE(TypeTag.TDOUBLE, double[].class, 0, 0),
    LOGICAL(TypeTag.TLOGICAL, boolean[].class, 0, 1);

    private static final double TWO_TO_63 = 9.223372036854775808E18;

    private final TypeTag tag;
    private final Class<?> arrayType;
    private final long min;
    private final long max;

    TagCodec(TypeTag tag, Class<?> arrayType, long min, long max) {
        this.tag = tag;
        this.arrayType = arrayType;
        this.min = min;
        this.max = max;
    }

    /**
     * Returns the codec for a numeric or logical tag code, or {@code null}.
     */
    static TagCodec forCode(int code) {
        for (TagCodec codec : values()) {
            if (codec.tag.code() == code) {
                return codec;
            }
        }
        return null;
    }

    boolean accepts(Object array) {
        return arrayType.isInstance(array);
    }

    boolean isFloating() {
        return this == FLOAT || this == DOUBLE;
    }

    /**
     * Whether the unsigned value at {@code i} is beyond {@link Long#MAX_VALUE}.
     */
    boolean exceedsLong(Object array, int i) {
        return this == ULONGLONG && ((long[]) array)[i] < 0;
    }

    long getLong(Object array, int i) {
        return switch (this) {
            case SBYTE -> ((byte[]) array)[i];
            case UBYTE, SHORT -> ((short[]) array)[i];
            case USHORT, INT -> ((int[]) array)[i];
            case UINT, ULONG, LONG, LONGLONG, ULONGLONG -> ((long[]) array)[i];
            case FLOAT -> (long) ((float[]) array)[i];
            case DOUBLE -> (long) ((double[]) array)[i];
            case LOGICAL -> ((boolean[]) array)[i] ? 1 : 0;
        };
    }

    double getDouble(Object array, int i) {
        return switch (this) {
            case FLOAT -> ((float[]) array)[i];
            case DOUBLE -> ((double[]) array)[i];
            case ULONGLONG -> {
                long bits = ((long[]) array)[i];
                yield bits >= 0 ? bits : (bits & Long.MAX_VALUE) + TWO_TO_63;
            }
            default -> getLong(array, i);
        };
    }

    /**
     * Stores an integer value, returning {@code false} if it is out of range.
     */
    boolean setLong(Object array, int i, long value) {
        if (!isFloating() && this != LOGICAL && (value < min || value > max)) {
            return false;
        }
        switch (this) {
            case SBYTE -> ((byte[]) array)[i] = (byte) value;
            case UBYTE, SHORT -> ((short[]) array)[i] = (short) value;
            case USHORT, INT -> ((int[]) array)[i] = (int) value;
            case UINT, ULONG, LONG, LONGLONG, ULONGLONG -> ((long[]) array)[i] = value;
            case FLOAT -> ((float[]) array)[i] = value;
            case DOUBLE -> ((double[]) array)[i] = value;
            case LOGICAL -> ((boolean[]) array)[i] = value != 0;
        }
        return true;
    }

    /**
     * Stores an unsigned 64-bit value given as its bit pattern.
     */
    boolean setUnsigned(Object array, int i, long bits) {
        if (bits >= 0) {
            return setLong(array, i, bits);
        }
        if (this == ULONGLONG) {
            ((long[]) array)[i] = bits;
            return true;
        }
        if (isFloating()) {
            return setDouble(array, i, (bits & Long.MAX_VALUE) + TWO_TO_63);
        }
        return false;
    }

    /**
     * Stores a floating point value, truncating it for integer buffers. Returns
     * {@code false} if it is out of range.
     */
    boolean setDouble(Object array, int i, double value) {
        return switch (this) {
            case FLOAT -> {
                ((float[]) array)[i] = (float) value;
                yield true;
            }
            case DOUBLE -> {
                ((double[]) array)[i] = value;
                yield true;
            }
            case LOGICAL -> {
                ((boolean[]) array)[i] = value != 0;
                yield true;
            }
            case ULONGLONG -> {
                if (Double.isNaN(value) || value <= -1 || value >= 2 * TWO_TO_63) {
                    yield false;
                }
                ((long[]) array)[i] = value >= TWO_TO_63 ? (long) (value - TWO_TO_63) | Long.MIN_VALUE : (long) value;
                yield true;
            }
            default -> {
                double truncated = value < 0 ? Math.ceil(value) : Math.floor(value);
                if (Double.isNaN(value) || truncated < min || truncated > max) {
                    yield false;
                }
                yield setLong(array, i, (long) truncated);
            }
        };
    }
}
