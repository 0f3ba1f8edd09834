/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.reader;

import dev.fitsio.errors.FitsException;

/**
 * A function that may fail with a {@link FitsException}.
 */
@FunctionalInterface
public interface FitsFunction<T, R> {

    R apply(T t) throws FitsException;
}
