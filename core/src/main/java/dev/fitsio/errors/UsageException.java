/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.errors;

/**
 * A logic error on the caller's side, detected before the engine is called.
 */
public final class UsageException extends FitsException {

    private static final long serialVersionUID = 1L;

    public UsageException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.USAGE;
    }
}
