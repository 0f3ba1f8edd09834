/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.range;

/**
 * A range in engine terms: 1-indexed inclusive first and last position plus
 * the element count.
 */
public record LinearSpan(long first, long last, int count) {
}
