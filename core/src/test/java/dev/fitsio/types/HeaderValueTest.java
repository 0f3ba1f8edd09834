/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.types;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import dev.fitsio.errors.TextDecodeException;
import dev.fitsio.errors.UsageException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HeaderValueTest {

    @Test
    void testEqualityIgnoresComment() {
        assertThat(new HeaderValue<>(42, "answer")).isEqualTo(HeaderValue.of(42));
        assertThat(new HeaderValue<>(42, "answer")).hasSameHashCodeAs(HeaderValue.of(42));
        assertThat(HeaderValue.of(41)).isNotEqualTo(HeaderValue.of(42));
    }

    @Test
    void testEmptyCommentIsAbsent() {
        assertThat(new HeaderValue<>("x", "").comment()).isEmpty();
        assertThat(new HeaderValue<>("x", "note").comment()).contains("note");
    }

    @Test
    void testMapKeepsComment() {
        HeaderValue<Integer> mapped = new HeaderValue<>("42", "answer").map(Integer::parseInt);

        assertThat(mapped.value()).isEqualTo(42);
        assertThat(mapped.comment()).contains("answer");
    }

    @Test
    void testDecodeStopsAtNulAndStripsPadding() throws Exception {
        byte[] buffer = "abc  \0xyz".getBytes(StandardCharsets.US_ASCII);

        assertThat(TextCodec.decode(buffer, "test")).isEqualTo("abc");
    }

    @Test
    void testDecodeRejectsInvalidUtf8() {
        byte[] buffer = { 'a', (byte) 0xFF, 0 };

        assertThatThrownBy(() -> TextCodec.decode(buffer, "test"))
                .isInstanceOf(TextDecodeException.class);
    }

    @Test
    void testEncodeAppendsNul() throws Exception {
        byte[] encoded = TextCodec.encode("hé");

        assertThat(encoded).containsExactly('h', 0xC3, 0xA9, 0);
        assertThatThrownBy(() -> TextCodec.encode("a\0b")).isInstanceOf(UsageException.class);
    }
}
