/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.engine;

/**
 * Kinds of header-data units as reported by the engine.
 */
public enum HduType {
    IMAGE(0),
    ASCII_TABLE(1),
    BINARY_TABLE(2),
    ANY(-1); // only valid as a lookup filter

    private final int code;

    HduType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isTable() {
        return this == ASCII_TABLE || this == BINARY_TABLE;
    }

    public static HduType fromCode(int code) {
        for (HduType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown HDU type: " + code);
    }
}
