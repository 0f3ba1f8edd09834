/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.range;

/**
 * A rectangular region in engine terms. The arrays are in FITS axis order
 * (fastest varying axis first) and hold 1-indexed inclusive bounds.
 */
public record RegionSpan(long[] fpixel, long[] lpixel, long[] inc, int count) {

    public boolean isEmpty() {
        return count == 0;
    }
}
