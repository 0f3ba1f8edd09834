/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import java.util.List;

import dev.fitsio.engine.Status;

/**
 * One header-data unit held in memory: its header records and its data bytes
 * without block padding.
 */
abstract sealed class Hdu permits ImageHdu, TableHdu {

    // more than a Java array can hold
    static final long MAX_DATA_SIZE = Integer.MAX_VALUE - 8;

    protected final Header header;
    protected byte[] data;

    protected Hdu(Header header, byte[] data) {
        this.header = header;
        this.data = data;
    }

    Header header() {
        return header;
    }

    byte[] data() {
        return data;
    }

    abstract int typeCode();

    abstract Hdu copy();

    /**
     * Rewrites the mandatory leading records from the HDU's current layout.
     *
     * @param primary whether the HDU is the first one of its file
     */
    abstract void syncHeader(boolean primary);

    String extname() {
        String name = header.stringValue("EXTNAME");
        if (name == null) {
            name = header.stringValue("HDUNAME");
        }
        return name == null ? "" : name.trim();
    }

    long extver() throws StatusException {
        return header.longValue("EXTVER", 1L);
    }

    static int checkedSize(long size) throws StatusException {
        if (size < 0 || size > MAX_DATA_SIZE) {
            throw new StatusException(Status.MEMORY_ALLOCATION);
        }
        return (int) size;
    }

    static List<HeaderCard> axisCards(long[] naxes) {
        HeaderCard[] cards = new HeaderCard[naxes.length];
        for (int i = 0; i < naxes.length; i++) {
            cards[i] = new HeaderCard("NAXIS" + (i + 1), Long.toString(naxes[i]), null);
        }
        return List.of(cards);
    }
}
