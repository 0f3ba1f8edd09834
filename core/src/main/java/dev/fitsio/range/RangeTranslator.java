/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.range;

import java.util.Arrays;
import java.util.List;

import dev.fitsio.errors.UsageException;

/**
 * Converts 0-indexed half-open host ranges into the 1-indexed inclusive
 * positions the engine expects.
 */
public final class RangeTranslator {

    private RangeTranslator() {
    }

    public static LinearSpan linear(Range range) throws UsageException {
        validate(range);
        return new LinearSpan(range.start() + 1, range.end(), toCount(range.length()));
    }

    /**
     * Translates one range per axis, given in row-major order, into a region with
     * the axes reversed.
     */
    public static RegionSpan region(List<Range> ranges) throws UsageException {
        if (ranges.isEmpty()) {
            throw new UsageException("A region needs at least one axis range");
        }
        int naxis = ranges.size();
        long[] fpixel = new long[naxis];
        long[] lpixel = new long[naxis];
        long[] inc = new long[naxis];
        Arrays.fill(inc, 1L);

        long count = 1;
        for (int i = 0; i < naxis; i++) {
            Range range = ranges.get(naxis - 1 - i);
            validate(range);
            fpixel[i] = range.start() + 1;
            lpixel[i] = range.end();
            count = checkedProduct(count, range.length(), ranges);
        }
        return new RegionSpan(fpixel, lpixel, inc, toCount(count));
    }

    /**
     * Maps whole rows of a two-dimensional {@code [rows, columns]} image onto a
     * linear pixel range.
     */
    public static Range rows(List<Long> shape, long startRow, long numRows) throws UsageException {
        if (shape.size() != 2) {
            throw new UsageException("Row access needs a two-dimensional image, got shape " + shape);
        }
        long width = shape.get(1);
        try {
            return Range.of(Math.multiplyExact(startRow, width),
                    Math.multiplyExact(Math.addExact(startRow, numRows), width));
        }
        catch (ArithmeticException e) {
            throw new UsageException("Rows " + startRow + " + " + numRows + " of width " + width
                    + " exceed the addressable pixel range");
        }
    }

    public static long elementCount(List<Long> shape) {
        long count = 1;
        for (long axis : shape) {
            count *= axis;
        }
        return count;
    }

    private static void validate(Range range) throws UsageException {
        if (range.start() < 0 || range.end() < range.start()) {
            throw new UsageException("Invalid range " + range);
        }
    }

    private static long checkedProduct(long count, long length, List<Range> ranges) throws UsageException {
        try {
            return Math.multiplyExact(count, length);
        }
        catch (ArithmeticException e) {
            throw new UsageException("Region " + ranges + " has too many elements");
        }
    }

    private static int toCount(long count) throws UsageException {
        if (count > Integer.MAX_VALUE - 8) {
            throw new UsageException("Range of " + count + " elements is too large for a single buffer");
        }
        return (int) count;
    }
}
