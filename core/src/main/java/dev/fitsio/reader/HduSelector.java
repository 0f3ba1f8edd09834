/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.reader;

/**
 * Identifies an HDU, either by its 0-based position or by its EXTNAME.
 */
public sealed interface HduSelector permits HduSelector.ByIndex, HduSelector.ByName {

    static HduSelector index(int index) {
        return new ByIndex(index);
    }

    static HduSelector name(String name) {
        return new ByName(name, 0);
    }

    /**
     * @param version the EXTVER to match, 0 for any
     */
    static HduSelector name(String name, int version) {
        return new ByName(name, version);
    }

    record ByIndex(int index) implements HduSelector {

        @Override
        public String toString() {
            return "HDU #" + index;
        }
    }

    record ByName(String name, int version) implements HduSelector {

        @Override
        public String toString() {
            return version == 0 ? name : name + " (version " + version + ")";
        }
    }
}
