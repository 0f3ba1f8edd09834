/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import org.junit.jupiter.api.Test;

import dev.fitsio.engine.TypeTag;

import static org.assertj.core.api.Assertions.assertThat;

public class TagCodecTest {

    @Test
    void testGetDouble() {
        assertThat(TagCodec.FLOAT.getDouble(new float[]{ 1.5f }, 0)).isEqualTo(1.5);
        assertThat(TagCodec.DOUBLE.getDouble(new double[]{ -0.25 }, 0)).isEqualTo(-0.25);
        assertThat(TagCodec.SHORT.getDouble(new short[]{ -7 }, 0)).isEqualTo(-7.0);
        assertThat(TagCodec.ULONGLONG.getDouble(new long[]{ 5L }, 0)).isEqualTo(5.0);
        assertThat(TagCodec.ULONGLONG.getDouble(new long[]{ -1L }, 0)).isEqualTo(1.8446744073709552E19);
    }

    @Test
    void testSetDoubleOnFloatingAndLogicalBuffers() {
        float[] floats = new float[1];
        assertThat(TagCodec.FLOAT.setDouble(floats, 0, 2.5)).isTrue();
        assertThat(floats[0]).isEqualTo(2.5f);

        double[] doubles = new double[1];
        assertThat(TagCodec.DOUBLE.setDouble(doubles, 0, Double.MAX_VALUE)).isTrue();
        assertThat(doubles[0]).isEqualTo(Double.MAX_VALUE);

        boolean[] flags = new boolean[]{ true };
        assertThat(TagCodec.LOGICAL.setDouble(flags, 0, 0.0)).isTrue();
        assertThat(flags[0]).isFalse();
    }

    @Test
    void testSetDoubleOnUnsignedLong() {
        long[] values = new long[1];
        assertThat(TagCodec.ULONGLONG.setDouble(values, 0, 1.5e19)).isTrue();
        assertThat(Long.toUnsignedString(values[0])).isEqualTo("15000000000000000000");
        assertThat(TagCodec.ULONGLONG.setDouble(values, 0, 42.0)).isTrue();
        assertThat(values[0]).isEqualTo(42L);

        assertThat(TagCodec.ULONGLONG.setDouble(values, 0, -1.0)).isFalse();
        assertThat(TagCodec.ULONGLONG.setDouble(values, 0, 2e19)).isFalse();
        assertThat(TagCodec.ULONGLONG.setDouble(values, 0, Double.NaN)).isFalse();
    }

    @Test
    void testSetDoubleTruncatesIntoIntegerBuffers() {
        int[] ints = new int[1];
        assertThat(TagCodec.INT.setDouble(ints, 0, 2.9)).isTrue();
        assertThat(ints[0]).isEqualTo(2);
        assertThat(TagCodec.INT.setDouble(ints, 0, -2.9)).isTrue();
        assertThat(ints[0]).isEqualTo(-2);
        assertThat(TagCodec.INT.setDouble(ints, 0, 3e9)).isFalse();
        assertThat(TagCodec.INT.setDouble(ints, 0, Double.NaN)).isFalse();

        byte[] bytes = new byte[1];
        assertThat(TagCodec.SBYTE.setDouble(bytes, 0, 127.5)).isTrue();
        assertThat(bytes[0]).isEqualTo((byte) 127);
        assertThat(TagCodec.SBYTE.setDouble(bytes, 0, 128.0)).isFalse();
    }

    @Test
    void testLookupByTag() {
        assertThat(TagCodec.forCode(TypeTag.TDOUBLE.code())).isSameAs(TagCodec.DOUBLE);
        assertThat(TagCodec.forCode(TypeTag.TSTRING.code())).isNull();
    }
}
