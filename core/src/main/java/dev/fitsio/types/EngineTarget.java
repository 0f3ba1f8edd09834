/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.types;

import dev.fitsio.engine.EngineFile;
import dev.fitsio.engine.FitsEngine;

/**
 * The engine and file a typed operation is dispatched to. The file's current
 * HDU must already be the one the operation is meant for.
 */
public record EngineTarget(FitsEngine engine, EngineFile file) {
}
