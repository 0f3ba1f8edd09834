/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.schema;

import dev.fitsio.errors.UsageException;

/**
 * Data layout of a table column: element type, repeat count and display width,
 * convertible to and from the TFORM code stored in the header.
 */
public record ColumnDataDescription(ColumnDataType type, int repeat, int width) {

    public static ColumnDataDescription scalar(ColumnDataType type) {
        return new ColumnDataDescription(type, 1, 1);
    }

    public static ColumnDataDescription vector(ColumnDataType type, int repeat) {
        return new ColumnDataDescription(type, repeat, 1);
    }

    public ColumnDataDescription withRepeat(int repeat) throws UsageException {
        if (repeat <= 0) {
            throw new UsageException("Repeat count must be positive: " + repeat);
        }
        return new ColumnDataDescription(type, repeat, width);
    }

    public ColumnDataDescription withWidth(int width) throws UsageException {
        if (width <= 0) {
            throw new UsageException("Width must be positive: " + width);
        }
        return new ColumnDataDescription(type, repeat, width);
    }

    /**
     * Renders the TFORM code, e.g. {@code 5J} or, for text with a width, {@code 1A100}.
     */
    public String toTypeCode() {
        if (type == ColumnDataType.TEXT && width > 1) {
            return "" + repeat + type.letter() + width;
        }
        return "" + repeat + type.letter();
    }

    /**
     * Parses a TFORM code of the form {@code [repeat]letter[width]}.
     */
    public static ColumnDataDescription parse(String code) throws UsageException {
        String trimmed = code.trim();
        int pos = 0;
        while (pos < trimmed.length() && Character.isDigit(trimmed.charAt(pos))) {
            pos++;
        }
        if (pos == trimmed.length()) {
            throw new UsageException("Missing data type in column type code '" + code + "'");
        }
        int repeat = pos == 0 ? 1 : parseCount(trimmed.substring(0, pos), code);

        ColumnDataType type = ColumnDataType.fromLetter(trimmed.charAt(pos));
        if (type == null) {
            throw new UsageException("Unsupported data type '" + trimmed.charAt(pos) + "' in column type code '" + code + "'");
        }

        String rest = trimmed.substring(pos + 1);
        int width = 1;
        if (!rest.isEmpty()) {
            if (!rest.chars().allMatch(Character::isDigit)) {
                throw new UsageException("Malformed column type code '" + code + "'");
            }
            width = parseCount(rest, code);
        }
        return new ColumnDataDescription(type, repeat, width);
    }

    private static int parseCount(String digits, String code) throws UsageException {
        try {
            return Integer.parseInt(digits);
        }
        catch (NumberFormatException e) {
            throw new UsageException("Count out of range in column type code '" + code + "'");
        }
    }
}
