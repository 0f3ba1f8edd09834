/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.reader;

import java.util.List;

import dev.fitsio.types.FitsType;

/**
 * The contents of one table column, typed by the column's declared data type.
 */
public record Column<T>(String name, FitsType<T> type, List<T> values) {

    public Column {
        values = List.copyOf(values);
    }
}
