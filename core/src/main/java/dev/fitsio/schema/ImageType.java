/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.schema;

/**
 * Pixel storage types of FITS images, keyed by their BITPIX code. Codes other
 * than the six native ones denote types stored with a BZERO offset.
 */
public enum ImageType {
    UNSIGNED_BYTE(8),
    BYTE(10),
    SHORT(16),
    UNSIGNED_SHORT(20),
    LONG(32),
    UNSIGNED_LONG(40),
    LONG_LONG(64),
    FLOAT(-32),
    DOUBLE(-64);

    private final int bitpix;

    ImageType(int bitpix) {
        this.bitpix = bitpix;
    }

    public int bitpix() {
        return bitpix;
    }

    public static ImageType fromBitpix(int bitpix) {
        for (ImageType type : values()) {
            if (type.bitpix == bitpix) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown BITPIX value: " + bitpix);
    }
}
