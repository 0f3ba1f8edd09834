/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.range;

import java.util.List;

import org.junit.jupiter.api.Test;

import dev.fitsio.errors.UsageException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RangeTranslatorTest {

    @Test
    void testLinearIsOneBasedInclusive() throws Exception {
        LinearSpan span = RangeTranslator.linear(new Range(0, 10));

        assertThat(span.first()).isEqualTo(1);
        assertThat(span.last()).isEqualTo(10);
        assertThat(span.count()).isEqualTo(10);
    }

    @Test
    void testRegionReversesAxes() throws Exception {
        RegionSpan span = RangeTranslator.region(List.of(Range.of(0, 11), Range.of(2, 5)));

        assertThat(span.fpixel()).containsExactly(3, 1);
        assertThat(span.lpixel()).containsExactly(5, 11);
        assertThat(span.inc()).containsExactly(1, 1);
        assertThat(span.count()).isEqualTo(33);
    }

    @Test
    void testEmptyRegion() {
        assertThatThrownBy(() -> RangeTranslator.region(List.of()))
                .isInstanceOf(UsageException.class);
    }

    @Test
    void testRowsOfTwoDimensionalImage() throws Exception {
        assertThat(RangeTranslator.rows(List.of(100L, 50L), 2, 3)).isEqualTo(new Range(100, 250));
        assertThatThrownBy(() -> RangeTranslator.rows(List.of(2L, 3L, 4L), 0, 1))
                .isInstanceOf(UsageException.class)
                .hasMessageContaining("two-dimensional");
    }

    @Test
    void testOverflowingSizesAreRejected() throws Exception {
        Range huge = Range.of(0, 1L << 40);
        assertThatThrownBy(() -> RangeTranslator.region(List.of(huge, huge, huge)))
                .isInstanceOf(UsageException.class)
                .hasMessageContaining("too many elements");
        assertThatThrownBy(() -> RangeTranslator.region(List.of(huge, Range.of(0, 1024))))
                .isInstanceOf(UsageException.class)
                .hasMessageContaining("too large");

        assertThatThrownBy(() -> RangeTranslator.rows(List.of(4L, 1L << 40), 1L << 30, 1))
                .isInstanceOf(UsageException.class)
                .hasMessageContaining("addressable");
        assertThatThrownBy(() -> RangeTranslator.rows(List.of(4L, 8L), Long.MAX_VALUE, 1))
                .isInstanceOf(UsageException.class)
                .hasMessageContaining("addressable");
    }

    @Test
    void testElementCount() {
        assertThat(RangeTranslator.elementCount(List.of(3L, 4L, 5L))).isEqualTo(60);
    }

    @Test
    void testRangeValidation() throws Exception {
        assertThatThrownBy(() -> Range.of(5, 2)).isInstanceOf(UsageException.class);
        assertThatThrownBy(() -> Range.of(-1, 2)).isInstanceOf(UsageException.class);
        assertThatThrownBy(() -> RangeTranslator.linear(new Range(4, 1))).isInstanceOf(UsageException.class);

        Range range = Range.single(7);
        assertThat(range.length()).isEqualTo(1);
        assertThat(range).hasToString("[7, 8)");
        assertThat(new Range(3, 3).isEmpty()).isTrue();
    }
}
