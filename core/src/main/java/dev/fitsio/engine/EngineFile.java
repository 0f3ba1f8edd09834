/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.engine;

/**
 * Opaque handle to a file opened by a {@link FitsEngine}. Only the engine that
 * produced a handle knows how to interpret it.
 */
public interface EngineFile {
}
