/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.reader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import dev.fitsio.schema.ImageDescription;

/**
 * Options for creating a new FITS file.
 *
 * <pre>{@code
 * FitsFile file = FitsFile.builder(path)
 *         .overwrite()
 *         .withCustomPrimary(new ImageDescription(ImageType.DOUBLE, List.of(100L, 100L)))
 *         .create();
 * }</pre>
 */
public final class FitsFileBuilder {

    private static final System.Logger LOG = System.getLogger(FitsFileBuilder.class.getName());

    private final Path path;
    private final FitsContext context;
    private boolean overwrite;
    private ImageDescription primary;

    FitsFileBuilder(Path path, FitsContext context) {
        this.path = path;
        this.context = context;
    }

    /**
     * Replace the file if it already exists.
     */
    public FitsFileBuilder overwrite() {
        this.overwrite = true;
        return this;
    }

    /**
     * Give the primary HDU an image instead of leaving it empty.
     */
    public FitsFileBuilder withCustomPrimary(ImageDescription description) {
        this.primary = description;
        return this;
    }

    public FitsFile create() throws IOException {
        if (overwrite && Files.deleteIfExists(path)) {
            LOG.log(System.Logger.Level.DEBUG, "Removed existing file ''{0}''", path);
        }
        return FitsFile.create(path, context, primary);
    }
}
