/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.engine;

/**
 * Numeric type tags understood by the engine. The tag tells the engine which
 * kind of Java array a buffer argument is and how to convert stored values into it.
 */
public enum TypeTag {
    TBIT(1),
    TBYTE(11),
    TSBYTE(12),
    TLOGICAL(14),
    TSTRING(16),
    TUSHORT(20),
    TSHORT(21),
    TUINT(30),
    TINT(31),
    TULONG(40),
    TLONG(41),
    TFLOAT(42),
    TULONGLONG(80),
    TLONGLONG(81),
    TDOUBLE(82);

    private final int code;

    TypeTag(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Returns the tag for the given code, or {@code null} if the code is unknown.
     */
    public static TypeTag fromCode(int code) {
        for (TypeTag tag : values()) {
            if (tag.code == code) {
                return tag;
            }
        }
        return null;
    }
}
