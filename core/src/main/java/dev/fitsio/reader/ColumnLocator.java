/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.reader;

/**
 * Identifies a table column, either by its 0-based position or by name.
 */
public sealed interface ColumnLocator permits ColumnLocator.ByIndex, ColumnLocator.ByName {

    static ColumnLocator index(int index) {
        return new ByIndex(index);
    }

    static ColumnLocator name(String name) {
        return new ByName(name);
    }

    record ByIndex(int index) implements ColumnLocator {
    }

    record ByName(String name) implements ColumnLocator {
    }
}
