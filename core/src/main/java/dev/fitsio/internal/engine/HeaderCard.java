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
 * One 80-character header record. {@code value} holds the raw value field text,
 * including quotes for strings, or {@code null} for commentary records.
 */
record HeaderCard(String keyword, String value, String comment) {

    static final int LENGTH = 80;

    private static final int VALUE_START = 10;
    private static final int FIXED_VALUE_END = 30;

    static HeaderCard commentary(String keyword, String text) {
        return new HeaderCard(keyword, null, text);
    }

    boolean hasValue() {
        return value != null;
    }

    static HeaderCard parse(String record) throws StatusException {
        String keyword = record.substring(0, Math.min(8, record.length())).trim();
        if (record.length() < VALUE_START || !record.startsWith("= ", 8) || keyword.equals("COMMENT")
                || keyword.equals("HISTORY")) {
            String text = record.length() > 8 ? record.substring(8).stripTrailing() : "";
            return commentary(keyword, text);
        }

        String field = record.substring(VALUE_START);
        int pos = 0;
        while (pos < field.length() && field.charAt(pos) == ' ') {
            pos++;
        }

        String value;
        int rest;
        if (pos < field.length() && field.charAt(pos) == '\'') {
            int end = pos + 1;
            while (true) {
                if (end >= field.length()) {
                    throw new StatusException(Status.NO_QUOTE);
                }
                if (field.charAt(end) == '\'') {
                    if (end + 1 < field.length() && field.charAt(end + 1) == '\'') {
                        end += 2;
                        continue;
                    }
                    break;
                }
                end++;
            }
            value = field.substring(pos, end + 1);
            rest = end + 1;
        }
        else {
            int slash = field.indexOf('/', pos);
            int end = slash < 0 ? field.length() : slash;
            value = field.substring(pos, end).trim();
            rest = end;
        }

        String comment = null;
        int slash = field.indexOf('/', rest);
        if (slash >= 0) {
            comment = field.substring(slash + 1).trim();
        }
        return new HeaderCard(keyword, value, comment);
    }

    /**
     * Renders the card as exactly 80 characters. Strings start right after the
     * value indicator, other values are right-aligned to column 30.
     */
    String format() {
        StringBuilder sb = new StringBuilder(LENGTH);
        sb.append(keyword);
        pad(sb, 8);
        if (value == null) {
            if (comment != null) {
                sb.append(comment);
            }
        }
        else {
            sb.append("= ");
            if (!value.startsWith("'")) {
                pad(sb, FIXED_VALUE_END - value.length());
            }
            sb.append(value);
            if (comment != null && !comment.isEmpty()) {
                sb.append(" / ").append(comment);
            }
        }
        if (sb.length() > LENGTH) {
            sb.setLength(LENGTH);
        }
        pad(sb, LENGTH);
        return sb.toString();
    }

    private static void pad(StringBuilder sb, int length) {
        while (sb.length() < length) {
            sb.append(' ');
        }
    }
}
