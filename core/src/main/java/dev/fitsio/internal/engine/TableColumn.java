/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import dev.fitsio.engine.Status;

/**
 * Layout of one binary table column within a row.
 *
 * @param offset byte offset of the column within each row
 */
record TableColumn(String name, String tform, StorageType storage, int repeat, int offset, double scale,
                   double zero) {

    record Format(StorageType storage, int repeat) {

        int byteWidth() {
            return storage.size() * repeat;
        }
    }

    /**
     * Parses a TFORM value of the form {@code [r]t[w]}.
     */
    static Format parseFormat(String tform) throws StatusException {
        String code = tform.trim();
        int pos = 0;
        while (pos < code.length() && Character.isDigit(code.charAt(pos))) {
            pos++;
        }
        if (pos == code.length()) {
            throw new StatusException(Status.BAD_TFORM);
        }
        int repeat;
        try {
            repeat = pos == 0 ? 1 : Integer.parseInt(code.substring(0, pos));
        }
        catch (NumberFormatException e) {
            throw new StatusException(Status.BAD_TFORM);
        }
        char letter = Character.toUpperCase(code.charAt(pos));
        StorageType storage = StorageType.forLetter(letter);
        if (storage == null) {
            throw new StatusException(Status.BAD_TFORM_DTYPE);
        }
        String rest = code.substring(pos + 1);
        if (!rest.isEmpty() && (letter != 'A' || !rest.chars().allMatch(Character::isDigit))) {
            throw new StatusException(Status.BAD_TFORM);
        }
        return new Format(storage, repeat);
    }

    int byteWidth() {
        return storage.size() * repeat;
    }

    /**
     * Width of the column's values when rendered as text.
     */
    int displayWidth() {
        return switch (storage) {
            case CHAR -> repeat;
            case LOGICAL -> 1;
            case UNSIGNED_BYTE -> 4;
            case SHORT -> 6;
            case INT -> 11;
            case LONG -> 20;
            case FLOAT -> 15;
            case DOUBLE -> 23;
        };
    }

    ValueConverter converter() {
        return new ValueConverter(storage, scale, zero);
    }
}
