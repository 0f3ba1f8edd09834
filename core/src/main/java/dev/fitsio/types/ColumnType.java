/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.types;

import java.util.List;

import dev.fitsio.errors.FitsException;
import dev.fitsio.range.Range;

/**
 * Types that can be read from and written to binary table columns. Column
 * indexes are 0-based.
 */
public interface ColumnType<T> {

    List<T> readColumn(EngineTarget target, int column, Range rows) throws FitsException;

    /**
     * Writes the first {@code rows.length()} values of {@code data}. Writing past
     * the last row extends the table.
     */
    void writeColumn(EngineTarget target, int column, List<? extends T> data, Range rows) throws FitsException;
}
