/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.types;

import java.util.List;

import dev.fitsio.engine.TypeTag;

/**
 * The closed set of Java types the typed layer can move in and out of the
 * engine.
 * <p>
 * Unsigned FITS types are widened to the next larger signed Java type;
 * {@link #UINT64} keeps the unsigned bit pattern in a {@code long}.
 * Booleans and strings are supported for header keywords and table columns
 * only, the numeric types for pixels as well.
 * </p>
 */
public sealed interface FitsType<T> permits NumericType, LogicalType, TextType {

    NumericType<Byte> INT8 = new NumericType<>("INT8", Byte.class, PrimitiveBuffer.BYTE, TypeTag.TSBYTE, (byte) 0);
    NumericType<Short> UINT8 = new NumericType<>("UINT8", Short.class, PrimitiveBuffer.SHORT, TypeTag.TBYTE, (short) 0);
    NumericType<Short> INT16 = new NumericType<>("INT16", Short.class, PrimitiveBuffer.SHORT, TypeTag.TSHORT, (short) 0);
    NumericType<Integer> UINT16 = new NumericType<>("UINT16", Integer.class, PrimitiveBuffer.INT, TypeTag.TUSHORT, 0);
    NumericType<Integer> INT32 = new NumericType<>("INT32", Integer.class, PrimitiveBuffer.INT, TypeTag.TINT, 0);
    NumericType<Long> UINT32 = new NumericType<>("UINT32", Long.class, PrimitiveBuffer.LONG, TypeTag.TUINT, 0L);
    NumericType<Long> INT64 = new NumericType<>("INT64", Long.class, PrimitiveBuffer.LONG, TypeTag.TLONGLONG, 0L);
    NumericType<Long> UINT64 = new NumericType<>("UINT64", Long.class, PrimitiveBuffer.LONG, TypeTag.TULONGLONG, 0L);
    NumericType<Float> FLOAT32 = new NumericType<>("FLOAT32", Float.class, PrimitiveBuffer.FLOAT, TypeTag.TFLOAT, 0.0f);
    NumericType<Double> FLOAT64 = new NumericType<>("FLOAT64", Double.class, PrimitiveBuffer.DOUBLE, TypeTag.TDOUBLE, 0.0d);
    LogicalType BOOLEAN = new LogicalType();
    TextType STRING = new TextType();

    String name();

    Class<T> javaType();

    TypeTag tag();

    static List<FitsType<?>> values() {
        return List.of(INT8, UINT8, INT16, UINT16, INT32, UINT32, INT64, UINT64, FLOAT32, FLOAT64, BOOLEAN, STRING);
    }
}
