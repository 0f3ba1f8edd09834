/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.types;

import java.util.Arrays;
import java.util.List;

import dev.fitsio.errors.UsageException;

/**
 * One NUL-terminated buffer per row for a text column write. Closing the
 * array drops all buffers; it must not be used afterwards.
 */
final class CStringArray implements AutoCloseable {

    private byte[][] buffers;

    private CStringArray(byte[][] buffers) {
        this.buffers = buffers;
    }

    static CStringArray of(List<? extends String> values, int count) throws UsageException {
        byte[][] buffers = new byte[count][];
        for (int i = 0; i < count; i++) {
            String value = values.get(i);
            if (value == null) {
                throw new UsageException("Null text value at index " + i);
            }
            buffers[i] = TextCodec.encode(value);
        }
        return new CStringArray(buffers);
    }

    byte[][] buffers() {
        if (buffers == null) {
            throw new IllegalStateException("String array already released");
        }
        return buffers;
    }

    @Override
    public void close() {
        if (buffers != null) {
            Arrays.fill(buffers, null);
            buffers = null;
        }
    }
}
