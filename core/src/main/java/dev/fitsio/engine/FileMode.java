/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.engine;

/**
 * Access mode of an engine file.
 */
public enum FileMode {
    READONLY(0),
    READWRITE(1);

    private final int code;

    FileMode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static FileMode fromCode(int code) {
        for (FileMode mode : values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown file mode: " + code);
    }
}
