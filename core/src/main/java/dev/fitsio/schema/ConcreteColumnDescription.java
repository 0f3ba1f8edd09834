/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.schema;

/**
 * A fully specified column: its name and data layout.
 */
public record ConcreteColumnDescription(String name, ColumnDataDescription dataType) {
}
