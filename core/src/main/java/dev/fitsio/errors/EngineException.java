/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.errors;

/**
 * A non-zero status returned by the engine, with the engine's own text for it.
 */
public final class EngineException extends FitsException {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final String statusText;

    public EngineException(int status, String statusText) {
        super("FITS engine error " + status + ": " + statusText);
        this.status = status;
        this.statusText = statusText;
    }

    public int status() {
        return status;
    }

    public String statusText() {
        return statusText;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ENGINE;
    }
}
