/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import dev.fitsio.engine.Status;

/**
 * Formatting and parsing of header value fields.
 */
final class CardValues {

    // value field of 70 characters, minus the enclosing quotes
    private static final int MAX_STRING_LENGTH = 68;
    private static final int MIN_STRING_LENGTH = 8;

    private CardValues() {
    }

    static String formatString(String text) {
        String value = text;
        String escaped = value.replace("'", "''");
        while (escaped.length() > MAX_STRING_LENGTH) {
            value = value.substring(0, value.length() - 1);
            escaped = value.replace("'", "''");
        }
        StringBuilder sb = new StringBuilder("'").append(escaped);
        while (sb.length() < MIN_STRING_LENGTH + 1) {
            sb.append(' ');
        }
        return sb.append('\'').toString();
    }

    static String formatLogical(boolean value) {
        return value ? "T" : "F";
    }

    static boolean isString(String raw) {
        return raw.startsWith("'");
    }

    /**
     * Returns the text of a quoted value, without trailing blanks.
     */
    static String parseString(String raw) {
        String inner = raw.substring(1, raw.length() - 1).replace("''", "'");
        return inner.stripTrailing();
    }

    /**
     * Parses a value as a number. Logical values read as 1 and 0.
     */
    static Number parseNumber(String raw, int failureStatus) throws StatusException {
        String text = isString(raw) ? parseString(raw).trim() : raw.trim();
        if (text.equals("T")) {
            return 1L;
        }
        if (text.equals("F")) {
            return 0L;
        }
        try {
            return Long.parseLong(text);
        }
        catch (NumberFormatException e) {
            // not an integer, try the other forms below
        }
        try {
            return Double.parseDouble(text.replace('D', 'E').replace('d', 'e'));
        }
        catch (NumberFormatException e) {
            throw new StatusException(failureStatus);
        }
    }

    /**
     * Parses an unsigned 64-bit integer, returning its bit pattern, or
     * {@code null} if the value is not one.
     */
    static Long parseUnsigned(String raw) {
        String text = isString(raw) ? parseString(raw).trim() : raw.trim();
        try {
            return Long.parseUnsignedLong(text.startsWith("+") ? text.substring(1) : text);
        }
        catch (NumberFormatException e) {
            return null;
        }
    }

    static boolean parseLogical(String raw) throws StatusException {
        String text = raw.trim();
        if (text.equals("T")) {
            return true;
        }
        if (text.equals("F")) {
            return false;
        }
        Number number = parseNumber(raw, Status.BAD_LOGICALKEY);
        return number.doubleValue() != 0;
    }
}
