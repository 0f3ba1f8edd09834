/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.types;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A header keyword value together with its optional comment.
 * <p>
 * Two header values are equal if their values are equal; comments are not
 * compared.
 * </p>
 */
public final class HeaderValue<T> {

    private final T value;
    private final String comment;

    public HeaderValue(T value, String comment) {
        this.value = value;
        this.comment = comment == null || comment.isEmpty() ? null : comment;
    }

    public static <T> HeaderValue<T> of(T value) {
        return new HeaderValue<>(value, null);
    }

    public T value() {
        return value;
    }

    public Optional<String> comment() {
        return Optional.ofNullable(comment);
    }

    /**
     * Transforms the value, keeping the comment.
     */
    public <U> HeaderValue<U> map(Function<? super T, ? extends U> mapper) {
        return new HeaderValue<>(mapper.apply(value), comment);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HeaderValue<?> other)) {
            return false;
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return comment == null ? String.valueOf(value) : value + " / " + comment;
    }
}
