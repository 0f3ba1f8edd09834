/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.schema;

import java.util.List;

/**
 * Description of a new image: its pixel type and its shape in row-major order,
 * slowest varying axis first.
 */
public record ImageDescription(ImageType dataType, List<Long> dimensions) {

    public ImageDescription {
        dimensions = List.copyOf(dimensions);
    }
}
