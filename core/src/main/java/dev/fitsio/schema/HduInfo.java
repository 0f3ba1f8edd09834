/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.schema;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of the layout of one HDU, taken when its handle was created.
 */
public sealed interface HduInfo permits HduInfo.ImageInfo, HduInfo.TableInfo {

    /**
     * An image, with its shape in row-major order. The primary HDU of a new file
     * is an image with an empty shape.
     */
    record ImageInfo(List<Long> shape, ImageType pixelType) implements HduInfo {

        public ImageInfo {
            shape = List.copyOf(shape);
        }

        public long pixelCount() {
            if (shape.isEmpty()) {
                return 0;
            }
            long count = 1;
            for (long axis : shape) {
                count *= axis;
            }
            return count;
        }
    }

    /**
     * A binary table, with its columns in order.
     */
    record TableInfo(List<ConcreteColumnDescription> columns, long rowCount) implements HduInfo {

        public TableInfo {
            columns = List.copyOf(columns);
        }

        public Optional<ConcreteColumnDescription> column(String name) {
            return columns.stream()
                    .filter(c -> c.name().equalsIgnoreCase(name))
                    .findFirst();
        }
    }
}
