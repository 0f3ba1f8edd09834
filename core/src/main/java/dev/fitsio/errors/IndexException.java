/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.errors;

import dev.fitsio.range.Range;

/**
 * A row or element range outside the bounds of the addressed column.
 */
public final class IndexException extends FitsException {

    private static final long serialVersionUID = 1L;

    private final Range requestedRange;

    public IndexException(String message, Range requestedRange) {
        super(message + ": " + requestedRange);
        this.requestedRange = requestedRange;
    }

    public Range requestedRange() {
        return requestedRange;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INDEX;
    }
}
