/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.schema;

/**
 * Element types of binary table columns with their TFORM letters.
 */
public enum ColumnDataType {
    LOGICAL('L'),
    BYTE('B'),
    SHORT('I'),
    INT('J'),
    LONG('K'),
    FLOAT('E'),
    DOUBLE('D'),
    TEXT('A');

    private final char letter;

    ColumnDataType(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    /**
     * Returns the type for a TFORM letter, or {@code null} if it is not supported.
     */
    public static ColumnDataType fromLetter(char letter) {
        for (ColumnDataType type : values()) {
            if (type.letter == letter) {
                return type;
            }
        }
        return null;
    }
}
