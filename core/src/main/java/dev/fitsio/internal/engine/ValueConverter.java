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
 * Converts single values between their stored form and caller buffers,
 * applying the linear scaling {@code physical = stored * scale + zero}.
 */
final class ValueConverter {

    private static final double TWO_TO_63 = 9.223372036854775808E18;

    private final StorageType storage;
    private final double scale;
    private final double zero;
    private final boolean integral;
    private final boolean unsignedLong;

    ValueConverter(StorageType storage, double scale, double zero) {
        this.storage = storage;
        this.scale = scale;
        this.zero = zero;
        this.unsignedLong = storage == StorageType.LONG && scale == 1.0 && zero == TWO_TO_63;
        this.integral = storage.isInteger() && scale == 1.0 && zero == Math.rint(zero)
                && Math.abs(zero) < TWO_TO_63;
    }

    /**
     * Reads the value at {@code position} into {@code array[i]}.
     *
     * @return {@code false} if the value does not fit the buffer type
     */
    boolean read(ByteBuffer data, int position, TagCodec codec, Object array, int i, Object nullValue) {
        if (storage == StorageType.LOGICAL) {
            byte value = data.get(position);
            if (value == 'T' || value == 'F') {
                return codec.setLong(array, i, value == 'T' ? 1 : 0);
            }
            if (codec == TagCodec.LOGICAL && nullValue instanceof Boolean b) {
                return codec.setLong(array, i, b ? 1 : 0);
            }
            return codec.setLong(array, i, 0);
        }
        if (unsignedLong) {
            return codec.setUnsigned(array, i, storage.readLong(data, position) ^ Long.MIN_VALUE);
        }
        if (integral) {
            return codec.setLong(array, i, storage.readLong(data, position) + (long) zero);
        }
        return codec.setDouble(array, i, storage.readDouble(data, position) * scale + zero);
    }

    /**
     * Writes {@code array[i]} to {@code position}.
     *
     * @return {@code false} if the value does not fit the storage type
     */
    boolean write(ByteBuffer data, int position, TagCodec codec, Object array, int i) {
        if (storage == StorageType.LOGICAL) {
            boolean value = codec.isFloating() ? codec.getDouble(array, i) != 0 : codec.getLong(array, i) != 0;
            data.put(position, (byte) (value ? 'T' : 'F'));
            return true;
        }
        if (unsignedLong && !codec.isFloating()) {
            if (codec.exceedsLong(array, i)) {
                storage.writeLong(data, position, codec.getLong(array, i) ^ Long.MIN_VALUE);
                return true;
            }
            long value = codec.getLong(array, i);
            if (value < 0) {
                return false;
            }
            storage.writeLong(data, position, value ^ Long.MIN_VALUE);
            return true;
        }
        if (integral && !codec.isFloating()) {
            if (codec.exceedsLong(array, i)) {
                return false;
            }
            long stored = codec.getLong(array, i) - (long) zero;
            if (!storage.fits(stored)) {
                return false;
            }
            storage.writeLong(data, position, stored);
            return true;
        }

        double stored = (codec.getDouble(array, i) - zero) / scale;
        if (storage.isInteger()) {
            if (Double.isNaN(stored)) {
                return false;
            }
            double rounded = stored < 0 ? Math.ceil(stored - 0.5) : Math.floor(stored + 0.5);
            if (!storage.fits(rounded)) {
                return false;
            }
            storage.writeLong(data, position, (long) rounded);
            return true;
        }
        storage.writeDouble(data, position, stored);
        return true;
    }
}
