/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.types;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import dev.fitsio.errors.UsageException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PrimitiveBufferTest {

    @Test
    void testAllocateGivesTypedFilledArrays() {
        assertThat(PrimitiveBuffer.BYTE.allocate(3, (byte) -1)).isEqualTo(new byte[]{ -1, -1, -1 });
        assertThat(PrimitiveBuffer.SHORT.allocate(2, (short) 7)).isEqualTo(new short[]{ 7, 7 });
        assertThat(PrimitiveBuffer.INT.allocate(2, 0)).isEqualTo(new int[]{ 0, 0 });
        assertThat(PrimitiveBuffer.LONG.allocate(1, Long.MIN_VALUE)).isEqualTo(new long[]{ Long.MIN_VALUE });
        assertThat(PrimitiveBuffer.FLOAT.allocate(2, 0.5f)).isEqualTo(new float[]{ 0.5f, 0.5f });
        assertThat(PrimitiveBuffer.DOUBLE.allocate(0, 1.0)).isEqualTo(new double[0]);
        assertThat(PrimitiveBuffer.BOOLEAN.allocate(2, true)).isEqualTo(new boolean[]{ true, true });
    }

    @Test
    void testListConversions() throws Exception {
        Object buffer = PrimitiveBuffer.LONG.fromList(List.of(1L, -2L, 3L, 4L), 3);
        assertThat(buffer).isEqualTo(new long[]{ 1L, -2L, 3L });
        assertThat(PrimitiveBuffer.LONG.toList(buffer)).containsExactly(1L, -2L, 3L);

        assertThat(PrimitiveBuffer.SHORT.toList(new short[]{ Short.MIN_VALUE, Short.MAX_VALUE }))
                .containsExactly(Short.MIN_VALUE, Short.MAX_VALUE);
        assertThat(PrimitiveBuffer.BOOLEAN.single(true)).isEqualTo(new boolean[]{ true });
        assertThatThrownBy(() -> PrimitiveBuffer.INT.toList(new int[]{ 1 }).add(2))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testInvalidInput() {
        assertThatThrownBy(() -> PrimitiveBuffer.INT.fromList(List.of(1, 2), 3))
                .isInstanceOf(UsageException.class)
                .hasMessageContaining("at least 3");
        assertThatThrownBy(() -> PrimitiveBuffer.DOUBLE.fromList(Arrays.asList(1.0, null), 2))
                .isInstanceOf(UsageException.class)
                .hasMessageContaining("index 1");
        assertThatThrownBy(() -> PrimitiveBuffer.FLOAT.single(null))
                .isInstanceOf(UsageException.class);
    }
}
