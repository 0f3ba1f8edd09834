/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.range;

import dev.fitsio.errors.UsageException;

/**
 * Half-open, 0-indexed range {@code [start, end)} over rows, elements or
 * pixels along one axis.
 */
public record Range(long start, long end) {

    /**
     * Creates a range, rejecting negative starts and inverted bounds.
     */
    public static Range of(long start, long end) throws UsageException {
        if (start < 0) {
            throw new UsageException("Range start must not be negative: " + start);
        }
        if (end < start) {
            throw new UsageException("Range end " + end + " is before its start " + start);
        }
        return new Range(start, end);
    }

    /**
     * The one-element range {@code [index, index + 1)}.
     */
    public static Range single(long index) throws UsageException {
        return of(index, index + 1);
    }

    public long length() {
        return end - start;
    }

    public boolean isEmpty() {
        return end <= start;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
