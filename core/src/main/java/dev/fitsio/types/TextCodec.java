/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.types;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import dev.fitsio.errors.TextDecodeException;
import dev.fitsio.errors.UsageException;

/**
 * Conversion between Java strings and the NUL-terminated byte buffers used by
 * the engine for text.
 */
public final class TextCodec {

    private TextCodec() {
    }

    /**
     * Decodes a NUL-terminated buffer as UTF-8, dropping trailing blanks.
     *
     * @param what describes the value for the error message
     */
    public static String decode(byte[] buffer, String what) throws TextDecodeException {
        int end = 0;
        while (end < buffer.length && buffer[end] != 0) {
            end++;
        }
        while (end > 0 && buffer[end - 1] == ' ') {
            end--;
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(buffer, 0, end)).toString();
        }
        catch (CharacterCodingException e) {
            throw new TextDecodeException("Invalid UTF-8 in " + what, e);
        }
    }

    /**
     * Encodes a string as UTF-8 followed by a terminating NUL.
     */
    public static byte[] encode(String value) throws UsageException {
        if (value.indexOf('\0') >= 0) {
            throw new UsageException("Text values must not contain NUL characters");
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        byte[] buffer = new byte[bytes.length + 1];
        System.arraycopy(bytes, 0, buffer, 0, bytes.length);
        return buffer;
    }
}
