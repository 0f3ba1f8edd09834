/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.schema;

import dev.fitsio.errors.UsageException;

/**
 * Builder for new table columns.
 *
 * <pre>{@code
 * ConcreteColumnDescription column = ColumnDescription.named("flux")
 *         .withType(ColumnDataType.DOUBLE)
 *         .thatRepeats(3)
 *         .create();
 * }</pre>
 */
public final class ColumnDescription {

    private final String name;
    private ColumnDataType type;
    private int repeat = 1;
    private int width = 1;

    private ColumnDescription(String name) {
        this.name = name;
    }

    public static ColumnDescription named(String name) {
        return new ColumnDescription(name);
    }

    public ColumnDescription withType(ColumnDataType type) {
        this.type = type;
        return this;
    }

    public ColumnDescription thatRepeats(int repeat) {
        this.repeat = repeat;
        return this;
    }

    public ColumnDescription withWidth(int width) {
        this.width = width;
        return this;
    }

    public ConcreteColumnDescription create() throws UsageException {
        if (type == null) {
            throw new UsageException("No data type given for column '" + name + "', call withType() first");
        }
        if (name == null || name.isBlank()) {
            throw new UsageException("Column name must not be blank");
        }
        ColumnDataDescription dataType = ColumnDataDescription.scalar(type)
                .withRepeat(repeat)
                .withWidth(width);
        return new ConcreteColumnDescription(name, dataType);
    }
}
