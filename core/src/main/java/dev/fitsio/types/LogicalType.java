/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.types;

import java.util.List;

import dev.fitsio.engine.FitsEngine;
import dev.fitsio.engine.TypeTag;
import dev.fitsio.errors.ErrorTranslator;
import dev.fitsio.errors.FitsException;
import dev.fitsio.range.LinearSpan;
import dev.fitsio.range.Range;
import dev.fitsio.range.RangeTranslator;

/**
 * Booleans, stored as FITS logical values ({@code T}/{@code F}). Undefined
 * logical cells read as {@code false}.
 */
public final class LogicalType implements FitsType<Boolean>, KeyType<Boolean>, ColumnType<Boolean> {

    LogicalType() {
    }

    @Override
    public String name() {
        return "BOOLEAN";
    }

    @Override
    public Class<Boolean> javaType() {
        return Boolean.class;
    }

    @Override
    public TypeTag tag() {
        return TypeTag.TLOGICAL;
    }

    @Override
    public HeaderValue<Boolean> readKey(EngineTarget target, String key) throws FitsException {
        FitsEngine engine = target.engine();
        boolean[] value = new boolean[1];
        byte[] comment = new byte[73];
        int status = engine.readKey(target.file(), TypeTag.TLOGICAL.code(), key, value, comment);
        ErrorTranslator.check(engine, status);
        return new HeaderValue<>(value[0], TextCodec.decode(comment, "comment of keyword " + key));
    }

    @Override
    public void writeKey(EngineTarget target, String key, Boolean value, String comment) throws FitsException {
        FitsEngine engine = target.engine();
        Object buffer = PrimitiveBuffer.BOOLEAN.single(value);
        ErrorTranslator.check(engine, engine.writeKey(target.file(), TypeTag.TLOGICAL.code(), key, buffer, comment));
    }

    @Override
    public List<Boolean> readColumn(EngineTarget target, int column, Range rows) throws FitsException {
        if (rows.isEmpty()) {
            return List.of();
        }
        FitsEngine engine = target.engine();
        LinearSpan span = RangeTranslator.linear(rows);
        boolean[] buffer = new boolean[span.count()];
        int status = engine.readColumn(target.file(), TypeTag.TLOGICAL.code(), column + 1, span.first(), 1,
                span.count(), Boolean.FALSE, buffer);
        ErrorTranslator.check(engine, status, rows);
        return PrimitiveBuffer.BOOLEAN.toList(buffer);
    }

    @Override
    public void writeColumn(EngineTarget target, int column, List<? extends Boolean> data, Range rows)
            throws FitsException {
        if (rows.isEmpty()) {
            return;
        }
        FitsEngine engine = target.engine();
        LinearSpan span = RangeTranslator.linear(rows);
        Object buffer = PrimitiveBuffer.BOOLEAN.fromList(data, span.count());
        int status = engine.writeColumn(target.file(), TypeTag.TLOGICAL.code(), column + 1, span.first(), 1,
                span.count(), buffer);
        ErrorTranslator.check(engine, status, rows);
    }

    @Override
    public String toString() {
        return name();
    }
}
