/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.errors;

import java.io.IOException;

/**
 * Base class of all failures reported by the typed FITS layer.
 */
public abstract sealed class FitsException extends IOException
        permits EngineException, IndexException, AddressException, TextDecodeException, UsageException {

    private static final long serialVersionUID = 1L;

    protected FitsException(String message) {
        super(message);
    }

    protected FitsException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
