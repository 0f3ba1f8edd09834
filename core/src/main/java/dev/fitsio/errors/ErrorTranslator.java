/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.errors;

import dev.fitsio.engine.FitsEngine;
import dev.fitsio.engine.Status;
import dev.fitsio.range.Range;

/**
 * Turns engine status codes into exceptions. This is the only place where
 * status codes are interpreted.
 */
public final class ErrorTranslator {

    private ErrorTranslator() {
    }

    /**
     * Returns normally for {@link Status#OK}, throws an {@link EngineException} otherwise.
     */
    public static void check(FitsEngine engine, int status) throws FitsException {
        if (status != Status.OK) {
            throw engineError(engine, status);
        }
    }

    /**
     * Like {@link #check(FitsEngine, int)}, but reports out-of-range row numbers as
     * an {@link IndexException} carrying the requested range.
     */
    public static void check(FitsEngine engine, int status, Range requested) throws FitsException {
        if (status == Status.BAD_ROW_NUM && requested != null) {
            throw new IndexException("given indices out of range", requested);
        }
        check(engine, status);
    }

    public static <T> T translate(FitsEngine engine, int status, T value) throws FitsException {
        check(engine, status);
        return value;
    }

    public static EngineException engineError(FitsEngine engine, int status) {
        return new EngineException(status, engine.statusText(status));
    }
}
