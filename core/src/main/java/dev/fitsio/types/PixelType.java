/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.types;

import java.util.List;

import dev.fitsio.errors.FitsException;
import dev.fitsio.range.Range;

/**
 * Types that can be read from and written to image pixels. Linear ranges index
 * the flattened image in row-major order; regions take one range per axis,
 * also in row-major order.
 */
public interface PixelType<T> {

    List<T> readPixels(EngineTarget target, Range pixels) throws FitsException;

    List<T> readRegion(EngineTarget target, List<Range> region) throws FitsException;

    void writePixels(EngineTarget target, Range pixels, List<? extends T> data) throws FitsException;

    void writeRegion(EngineTarget target, List<Range> region, List<? extends T> data) throws FitsException;
}
