/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

/**
 * Carries a status code out of nested engine internals; converted back to the
 * plain code at the {@link DefaultFitsEngine} boundary.
 */
final class StatusException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int status;

    StatusException(int status) {
        super(StatusMessages.text(status), null, false, false);
        this.status = status;
    }

    int status() {
        return status;
    }
}
