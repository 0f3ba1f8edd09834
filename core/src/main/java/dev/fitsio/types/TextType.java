/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import dev.fitsio.engine.FitsEngine;
import dev.fitsio.engine.TypeTag;
import dev.fitsio.errors.ErrorTranslator;
import dev.fitsio.errors.FitsException;
import dev.fitsio.errors.UsageException;
import dev.fitsio.range.LinearSpan;
import dev.fitsio.range.Range;
import dev.fitsio.range.RangeTranslator;

/**
 * Strings, exchanged with the engine as NUL-terminated UTF-8 buffers. Trailing
 * blanks are not significant in FITS and are dropped on read.
 */
public final class TextType implements FitsType<String>, KeyType<String>, ColumnType<String> {

    // FITS header value field, plus terminator
    private static final int KEY_VALUE_LENGTH = 71;
    private static final int KEY_COMMENT_LENGTH = 73;
    private static final byte[] EMPTY = new byte[1];

    TextType() {
    }

    @Override
    public String name() {
        return "STRING";
    }

    @Override
    public Class<String> javaType() {
        return String.class;
    }

    @Override
    public TypeTag tag() {
        return TypeTag.TSTRING;
    }

    @Override
    public HeaderValue<String> readKey(EngineTarget target, String key) throws FitsException {
        FitsEngine engine = target.engine();
        byte[] value = new byte[KEY_VALUE_LENGTH];
        byte[] comment = new byte[KEY_COMMENT_LENGTH];
        int status = engine.readKey(target.file(), TypeTag.TSTRING.code(), key, value, comment);
        ErrorTranslator.check(engine, status);
        return new HeaderValue<>(TextCodec.decode(value, "value of keyword " + key),
                TextCodec.decode(comment, "comment of keyword " + key));
    }

    @Override
    public void writeKey(EngineTarget target, String key, String value, String comment) throws FitsException {
        FitsEngine engine = target.engine();
        if (value == null) {
            throw new UsageException("Header values must not be null");
        }
        byte[] buffer = TextCodec.encode(value);
        ErrorTranslator.check(engine, engine.writeKey(target.file(), TypeTag.TSTRING.code(), key, buffer, comment));
    }

    @Override
    public List<String> readColumn(EngineTarget target, int column, Range rows) throws FitsException {
        if (rows.isEmpty()) {
            return List.of();
        }
        FitsEngine engine = target.engine();
        LinearSpan span = RangeTranslator.linear(rows);

        int[] width = new int[1];
        ErrorTranslator.check(engine, engine.columnDisplayWidth(target.file(), column + 1, width));

        byte[][] cells = new byte[span.count()][width[0] + 1];
        int status = engine.readColumn(target.file(), TypeTag.TSTRING.code(), column + 1, span.first(), 1,
                span.count(), EMPTY, cells);
        ErrorTranslator.check(engine, status, rows);

        List<String> values = new ArrayList<>(cells.length);
        for (int i = 0; i < cells.length; i++) {
            values.add(TextCodec.decode(cells[i], "row " + (rows.start() + i) + " of column " + (column + 1)));
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public void writeColumn(EngineTarget target, int column, List<? extends String> data, Range rows)
            throws FitsException {
        if (rows.isEmpty()) {
            return;
        }
        FitsEngine engine = target.engine();
        LinearSpan span = RangeTranslator.linear(rows);
        if (data.size() < span.count()) {
            throw new UsageException("Expected at least " + span.count() + " values, got " + data.size());
        }
        try (CStringArray strings = CStringArray.of(data, span.count())) {
            int status = engine.writeColumn(target.file(), TypeTag.TSTRING.code(), column + 1, span.first(), 1,
                    span.count(), strings.buffers());
            ErrorTranslator.check(engine, status, rows);
        }
    }

    @Override
    public String toString() {
        return name();
    }
}
