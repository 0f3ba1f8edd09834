/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.errors;

/**
 * Category of a {@link FitsException}, for matching without instanceof chains.
 */
public enum ErrorKind {
    ENGINE,
    INDEX,
    ADDRESS,
    TEXT_DECODE,
    USAGE
}
