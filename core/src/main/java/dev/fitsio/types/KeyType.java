/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.types;

import dev.fitsio.errors.FitsException;

/**
 * Types that can be read from and written to header keywords.
 */
public interface KeyType<T> {

    HeaderValue<T> readKey(EngineTarget target, String name) throws FitsException;

    /**
     * @param comment the keyword comment, or {@code null} for none
     */
    void writeKey(EngineTarget target, String name, T value, String comment) throws FitsException;
}
