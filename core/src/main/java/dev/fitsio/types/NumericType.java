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
import dev.fitsio.range.RegionSpan;

/**
 * A numeric type, usable for keywords, columns and pixels. Each instance pairs a
 * boxed Java type with the primitive buffer handed to the engine.
 */
public final class NumericType<T> implements FitsType<T>, KeyType<T>, ColumnType<T>, PixelType<T> {

    private final String name;
    private final Class<T> javaType;
    private final PrimitiveBuffer<T> buffers;
    private final TypeTag tag;
    private final T nullValue;

    NumericType(String name, Class<T> javaType, PrimitiveBuffer<T> buffers, TypeTag tag, T nullValue) {
        this.name = name;
        this.javaType = javaType;
        this.buffers = buffers;
        this.tag = tag;
        this.nullValue = nullValue;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<T> javaType() {
        return javaType;
    }

    @Override
    public TypeTag tag() {
        return tag;
    }

    public T nullValue() {
        return nullValue;
    }

    @Override
    public HeaderValue<T> readKey(EngineTarget target, String key) throws FitsException {
        FitsEngine engine = target.engine();
        Object value = buffers.allocate(1, nullValue);
        byte[] comment = new byte[73];
        int status = engine.readKey(target.file(), tag.code(), key, value, comment);
        ErrorTranslator.check(engine, status);
        return new HeaderValue<>(buffers.get(value, 0),
                TextCodec.decode(comment, "comment of keyword " + key));
    }

    @Override
    public void writeKey(EngineTarget target, String key, T value, String comment) throws FitsException {
        FitsEngine engine = target.engine();
        Object buffer = buffers.single(value);
        ErrorTranslator.check(engine, engine.writeKey(target.file(), tag.code(), key, buffer, comment));
    }

    @Override
    public List<T> readColumn(EngineTarget target, int column, Range rows) throws FitsException {
        if (rows.isEmpty()) {
            return List.of();
        }
        FitsEngine engine = target.engine();
        LinearSpan span = RangeTranslator.linear(rows);
        Object buffer = buffers.allocate(span.count(), nullValue);
        int status = engine.readColumn(target.file(), tag.code(), column + 1, span.first(), 1, span.count(),
                nullValue, buffer);
        ErrorTranslator.check(engine, status, rows);
        return buffers.toList(buffer);
    }

    @Override
    public void writeColumn(EngineTarget target, int column, List<? extends T> data, Range rows) throws FitsException {
        if (rows.isEmpty()) {
            return;
        }
        FitsEngine engine = target.engine();
        LinearSpan span = RangeTranslator.linear(rows);
        Object buffer = buffers.fromList(data, span.count());
        int status = engine.writeColumn(target.file(), tag.code(), column + 1, span.first(), 1, span.count(), buffer);
        ErrorTranslator.check(engine, status, rows);
    }

    @Override
    public List<T> readPixels(EngineTarget target, Range pixels) throws FitsException {
        if (pixels.isEmpty()) {
            return List.of();
        }
        FitsEngine engine = target.engine();
        LinearSpan span = RangeTranslator.linear(pixels);
        Object buffer = buffers.allocate(span.count(), nullValue);
        int status = engine.readPixels(target.file(), tag.code(), span.first(), span.count(), nullValue, buffer);
        ErrorTranslator.check(engine, status);
        return buffers.toList(buffer);
    }

    @Override
    public List<T> readRegion(EngineTarget target, List<Range> region) throws FitsException {
        RegionSpan span = RangeTranslator.region(region);
        if (span.isEmpty()) {
            return List.of();
        }
        FitsEngine engine = target.engine();
        Object buffer = buffers.allocate(span.count(), nullValue);
        int status = engine.readSubset(target.file(), tag.code(), span.fpixel(), span.lpixel(), span.inc(),
                nullValue, buffer);
        ErrorTranslator.check(engine, status);
        return buffers.toList(buffer);
    }

    @Override
    public void writePixels(EngineTarget target, Range pixels, List<? extends T> data) throws FitsException {
        if (pixels.isEmpty()) {
            return;
        }
        FitsEngine engine = target.engine();
        LinearSpan span = RangeTranslator.linear(pixels);
        Object buffer = buffers.fromList(data, span.count());
        ErrorTranslator.check(engine, engine.writePixels(target.file(), tag.code(), span.first(), span.count(), buffer));
    }

    @Override
    public void writeRegion(EngineTarget target, List<Range> region, List<? extends T> data) throws FitsException {
        RegionSpan span = RangeTranslator.region(region);
        if (span.isEmpty()) {
            return;
        }
        FitsEngine engine = target.engine();
        Object buffer = buffers.fromList(data, span.count());
        ErrorTranslator.check(engine, engine.writeSubset(target.file(), tag.code(), span.fpixel(), span.lpixel(), buffer));
    }

    @Override
    public String toString() {
        return name;
    }
}
