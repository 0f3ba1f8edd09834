/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import dev.fitsio.engine.EngineFile;
import dev.fitsio.engine.FileMode;
import dev.fitsio.engine.Status;

/**
 * In-memory state of a file opened by {@link DefaultFitsEngine}: all HDUs, the
 * current HDU and whether anything changed since the file was loaded.
 */
final class FileState implements EngineFile {

    private final Path path;
    private final FileMode mode;
    private final List<Hdu> hdus;
    private int current;
    private boolean modified;
    private boolean closed;

    FileState(Path path, FileMode mode, List<Hdu> hdus) {
        this.path = path;
        this.mode = mode;
        this.hdus = new ArrayList<>(hdus);
    }

    Path path() {
        return path;
    }

    FileMode mode() {
        return mode;
    }

    List<Hdu> hdus() {
        return hdus;
    }

    int current() {
        return current;
    }

    void moveTo(int index) {
        this.current = index;
    }

    Hdu currentHdu() {
        return hdus.get(current);
    }

    ImageHdu currentImage() throws StatusException {
        if (currentHdu() instanceof ImageHdu image) {
            return image;
        }
        throw new StatusException(Status.NOT_IMAGE);
    }

    TableHdu currentTable() throws StatusException {
        if (currentHdu() instanceof TableHdu table) {
            return table;
        }
        throw new StatusException(Status.NOT_TABLE);
    }

    void checkWritable() throws StatusException {
        if (mode != FileMode.READWRITE) {
            throw new StatusException(Status.READONLY_FILE);
        }
    }

    /**
     * Append an HDU and make it the current one.
     */
    void append(Hdu hdu) {
        hdus.add(hdu);
        current = hdus.size() - 1;
        modified = true;
    }

    boolean isModified() {
        return modified;
    }

    void markModified() {
        modified = true;
    }

    boolean isClosed() {
        return closed;
    }

    void markClosed() {
        closed = true;
    }
}
