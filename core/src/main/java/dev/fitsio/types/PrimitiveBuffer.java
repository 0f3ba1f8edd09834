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

import dev.fitsio.errors.UsageException;

/**
 * Typed access to the primitive arrays handed to the engine, one instance per
 * primitive type.
 */
abstract class PrimitiveBuffer<T> {

    static final PrimitiveBuffer<Byte> BYTE = new PrimitiveBuffer<>() {

        @Override
        Object newArray(int length) {
            return new byte[length];
        }

        @Override
        int length(Object buffer) {
            return ((byte[]) buffer).length;
        }

        @Override
        Byte get(Object buffer, int index) {
            return ((byte[]) buffer)[index];
        }

        @Override
        void set(Object buffer, int index, Byte value) {
            ((byte[]) buffer)[index] = value;
        }
    };

    static final PrimitiveBuffer<Short> SHORT = new PrimitiveBuffer<>() {

        @Override
        Object newArray(int length) {
            return new short[length];
        }

        @Override
        int length(Object buffer) {
            return ((short[]) buffer).length;
        }

        @Override
        Short get(Object buffer, int index) {
            return ((short[]) buffer)[index];
        }

        @Override
        void set(Object buffer, int index, Short value) {
            ((short[]) buffer)[index] = value;
        }
    };

    static final PrimitiveBuffer<Integer> INT = new PrimitiveBuffer<>() {

        @Override
        Object newArray(int length) {
            return new int[length];
        }

        @Override
        int length(Object buffer) {
            return ((int[]) buffer).length;
        }

        @Override
        Integer get(Object buffer, int index) {
            return ((int[]) buffer)[index];
        }

        @Override
        void set(Object buffer, int index, Integer value) {
            ((int[]) buffer)[index] = value;
        }
    };

    static final PrimitiveBuffer<Long> LONG = new PrimitiveBuffer<>() {

        @Override
        Object newArray(int length) {
            return new long[length];
        }

        @Override
        int length(Object buffer) {
            return ((long[]) buffer).length;
        }

        @Override
        Long get(Object buffer, int index) {
            return ((long[]) buffer)[index];
        }

        @Override
        void set(Object buffer, int index, Long value) {
            ((long[]) buffer)[index] = value;
        }
    };

    static final PrimitiveBuffer<Float> FLOAT = new PrimitiveBuffer<>() {

        @Override
        Object newArray(int length) {
            return new float[length];
        }

        @Override
        int length(Object buffer) {
            return ((float[]) buffer).length;
        }

        @Override
        Float get(Object buffer, int index) {
            return ((float[]) buffer)[index];
        }

        @Override
        void set(Object buffer, int index, Float value) {
            ((float[]) buffer)[index] = value;
        }
    };

    static final PrimitiveBuffer<Double> DOUBLE = new PrimitiveBuffer<>() {

        @Override
        Object newArray(int length) {
            return new double[length];
        }

        @Override
        int length(Object buffer) {
            return ((double[]) buffer).length;
        }

        @Override
        Double get(Object buffer, int index) {
            return ((double[]) buffer)[index];
        }

        @Override
        void set(Object buffer, int index, Double value) {
            ((double[]) buffer)[index] = value;
        }
    };

    static final PrimitiveBuffer<Boolean> BOOLEAN = new PrimitiveBuffer<>() {

        @Override
        Object newArray(int length) {
            return new boolean[length];
        }

        @Override
        int length(Object buffer) {
            return ((boolean[]) buffer).length;
        }

        @Override
        Boolean get(Object buffer, int index) {
            return ((boolean[]) buffer)[index];
        }

        @Override
        void set(Object buffer, int index, Boolean value) {
            ((boolean[]) buffer)[index] = value;
        }
    };

    abstract Object newArray(int length);

    abstract int length(Object buffer);

    abstract T get(Object buffer, int index);

    abstract void set(Object buffer, int index, T value);

    Object allocate(int length, T fill) {
        Object buffer = newArray(length);
        for (int i = 0; i < length; i++) {
            set(buffer, i, fill);
        }
        return buffer;
    }

    List<T> toList(Object buffer) {
        int length = length(buffer);
        List<T> values = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            values.add(get(buffer, i));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Copies the first {@code count} values into a new primitive buffer.
     */
    Object fromList(List<? extends T> values, int count) throws UsageException {
        if (values.size() < count) {
            throw new UsageException("Expected at least " + count + " values, got " + values.size());
        }
        Object buffer = newArray(count);
        for (int i = 0; i < count; i++) {
            T value = values.get(i);
            if (value == null) {
                throw new UsageException("Null value at index " + i);
            }
            set(buffer, i, value);
        }
        return buffer;
    }

    Object single(T value) throws UsageException {
        if (value == null) {
            throw new UsageException("Header values must not be null");
        }
        Object buffer = newArray(1);
        set(buffer, 0, value);
        return buffer;
    }
}
