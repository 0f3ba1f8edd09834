/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import java.nio.ByteBuffer;

/**
 * On-disk element types of image pixels and table cells, all big-endian.
 */
enum StorageType {
    UNSIGNED_BYTE(1, 0, 255),
    SHORT(2, Short.MIN_VALUE, Short.MAX_VALUE),
    INT(4, Integer.MIN_VALUE, Integer.MAX_VALUE),
    LONG(8, Long.MIN_VALUE, Long.MAX_VALUE),
    FLOAT(4, 0, 0),
    DOUBLE(8, 0, 0),
    LOGICAL(1, 0, 0),
    CHAR(1, 0, 0);

    private final int size;
    private final long min;
    private final long max;

    StorageType(int size, long min, long max) {
        this.size = size;
        this.min = min;
        this.max = max;
    }

    int size() {
        return size;
    }

    boolean isInteger() {
        return this == UNSIGNED_BYTE || this == SHORT || this == INT || this == LONG;
    }

    boolean fits(long value) {
        return value >= min && value <= max;
    }

    boolean fits(double value) {
        return value >= min && value <= max;
    }

    int bitpix() {
        return switch (this) {
            case UNSIGNED_BYTE -> 8;
            case SHORT -> 16;
            case INT -> 32;
            case LONG -> 64;
            case FLOAT -> -32;
            case DOUBLE -> -64;
            default -> throw new IllegalStateException("No BITPIX for " + this);
        };
    }

    /**
     * Returns the storage type for a native BITPIX value, or {@code null}.
     */
    static StorageType forBitpix(int bitpix) {
        return switch (bitpix) {
            case 8 -> UNSIGNED_BYTE;
            case 16 -> SHORT;
            case 32 -> INT;
            case 64 -> LONG;
            case -32 -> FLOAT;
            case -64 -> DOUBLE;
            default -> null;
        };
    }

    /**
     * Returns the storage type for a TFORM letter, or {@code null} if unsupported.
     */
    static StorageType forLetter(char letter) {
        return switch (letter) {
            case 'L' -> LOGICAL;
            case 'B' -> UNSIGNED_BYTE;
            case 'I' -> SHORT;
            case 'J' -> INT;
            case 'K' -> LONG;
            case 'E' -> FLOAT;
            case 'D' -> DOUBLE;
            case 'A' -> CHAR;
            default -> null;
        };
    }

    long readLong(ByteBuffer buffer, int position) {
        return switch (this) {
            case UNSIGNED_BYTE, LOGICAL, CHAR -> buffer.get(position) & 0xFF;
            case SHORT -> buffer.getShort(position);
            case INT -> buffer.getInt(position);
            case LONG -> buffer.getLong(position);
            case FLOAT -> (long) buffer.getFloat(position);
            case DOUBLE -> (long) buffer.getDouble(position);
        };
    }

    double readDouble(ByteBuffer buffer, int position) {
        return switch (this) {
            case FLOAT -> buffer.getFloat(position);
            case DOUBLE -> buffer.getDouble(position);
            default -> readLong(buffer, position);
        };
    }

    void writeLong(ByteBuffer buffer, int position, long value) {
        switch (this) {
            case UNSIGNED_BYTE, LOGICAL, CHAR -> buffer.put(position, (byte) value);
            case SHORT -> buffer.putShort(position, (short) value);
            case INT -> buffer.putInt(position, (int) value);
            case LONG -> buffer.putLong(position, value);
            case FLOAT -> buffer.putFloat(position, value);
            case DOUBLE -> buffer.putDouble(position, value);
        }
    }

    void writeDouble(ByteBuffer buffer, int position, double value) {
        switch (this) {
            case FLOAT -> buffer.putFloat(position, (float) value);
            case DOUBLE -> buffer.putDouble(position, value);
            default -> writeLong(buffer, position, (long) value);
        }
    }
}
