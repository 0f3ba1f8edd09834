/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.errors;

import java.nio.charset.CharacterCodingException;

/**
 * Bytes returned by the engine for a text value that are not valid UTF-8.
 */
public final class TextDecodeException extends FitsException {

    private static final long serialVersionUID = 1L;

    public TextDecodeException(String message, CharacterCodingException cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TEXT_DECODE;
    }
}
