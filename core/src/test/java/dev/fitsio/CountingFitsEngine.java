/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import dev.fitsio.engine.EngineFile;
import dev.fitsio.engine.FitsEngine;
import dev.fitsio.internal.engine.DefaultFitsEngine;

/**
 * Delegates to the bundled engine and counts calls per method name.
 */
public class CountingFitsEngine implements FitsEngine {

    private final FitsEngine delegate = new DefaultFitsEngine();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

    public int calls(String method) {
        AtomicInteger count = calls.get(method);
        return count == null ? 0 : count.get();
    }

    /**
     * Number of calls to any method that changes a file.
     */
    public int mutatingCalls() {
        return calls("writeKey") + calls("writeColumn") + calls("writePixels") + calls("writeSubset")
                + calls("createImage") + calls("createTable") + calls("resizeImage") + calls("insertColumn")
                + calls("deleteColumn") + calls("copyHdu") + calls("deleteHdu");
    }

    private void count(String method) {
        calls.computeIfAbsent(method, m -> new AtomicInteger()).incrementAndGet();
    }

    @Override
    public int open(Path path, int mode, EngineFile[] file) {
        count("open");
        return delegate.open(path, mode, file);
    }

    @Override
    public int create(Path path, EngineFile[] file) {
        count("create");
        return delegate.create(path, file);
    }

    @Override
    public int close(EngineFile file) {
        count("close");
        return delegate.close(file);
    }

    @Override
    public int fileMode(EngineFile file, int[] mode) {
        count("fileMode");
        return delegate.fileMode(file, mode);
    }

    @Override
    public int moveAbsolute(EngineFile file, int hduNum, int[] hduType) {
        count("moveAbsolute");
        return delegate.moveAbsolute(file, hduNum, hduType);
    }

    @Override
    public int moveByName(EngineFile file, int hduType, String name, int version) {
        count("moveByName");
        return delegate.moveByName(file, hduType, name, version);
    }

    @Override
    public int currentHdu(EngineFile file, int[] hduNum) {
        count("currentHdu");
        return delegate.currentHdu(file, hduNum);
    }

    @Override
    public int hduCount(EngineFile file, int[] count) {
        count("hduCount");
        return delegate.hduCount(file, count);
    }

    @Override
    public int hduType(EngineFile file, int[] hduType) {
        count("hduType");
        return delegate.hduType(file, hduType);
    }

    @Override
    public int imageDimensions(EngineFile file, int[] naxis) {
        count("imageDimensions");
        return delegate.imageDimensions(file, naxis);
    }

    @Override
    public int imageShape(EngineFile file, long[] naxes) {
        count("imageShape");
        return delegate.imageShape(file, naxes);
    }

    @Override
    public int imageEquivalentType(EngineFile file, int[] bitpix) {
        count("imageEquivalentType");
        return delegate.imageEquivalentType(file, bitpix);
    }

    @Override
    public int rowCount(EngineFile file, long[] rows) {
        count("rowCount");
        return delegate.rowCount(file, rows);
    }

    @Override
    public int columnCount(EngineFile file, int[] columns) {
        count("columnCount");
        return delegate.columnCount(file, columns);
    }

    @Override
    public int columnInfo(EngineFile file, int colnum, byte[] name, byte[] tform) {
        count("columnInfo");
        return delegate.columnInfo(file, colnum, name, tform);
    }

    @Override
    public int columnDisplayWidth(EngineFile file, int colnum, int[] width) {
        count("columnDisplayWidth");
        return delegate.columnDisplayWidth(file, colnum, width);
    }

    @Override
    public int columnNumber(EngineFile file, boolean caseSensitive, String template, int[] colnum) {
        count("columnNumber");
        return delegate.columnNumber(file, caseSensitive, template, colnum);
    }

    @Override
    public int readKey(EngineFile file, int tag, String name, Object value, byte[] comment) {
        count("readKey");
        return delegate.readKey(file, tag, name, value, comment);
    }

    @Override
    public int writeKey(EngineFile file, int tag, String name, Object value, String comment) {
        count("writeKey");
        return delegate.writeKey(file, tag, name, value, comment);
    }

    @Override
    public int readColumn(EngineFile file, int tag, int colnum, long firstRow, long firstElem, long count,
                          Object nullValue, Object array) {
        count("readColumn");
        return delegate.readColumn(file, tag, colnum, firstRow, firstElem, count, nullValue, array);
    }

    @Override
    public int writeColumn(EngineFile file, int tag, int colnum, long firstRow, long firstElem, long count,
                           Object array) {
        count("writeColumn");
        return delegate.writeColumn(file, tag, colnum, firstRow, firstElem, count, array);
    }

    @Override
    public int readPixels(EngineFile file, int tag, long firstPixel, long count, Object nullValue, Object array) {
        count("readPixels");
        return delegate.readPixels(file, tag, firstPixel, count, nullValue, array);
    }

    @Override
    public int writePixels(EngineFile file, int tag, long firstPixel, long count, Object array) {
        count("writePixels");
        return delegate.writePixels(file, tag, firstPixel, count, array);
    }

    @Override
    public int readSubset(EngineFile file, int tag, long[] fpixel, long[] lpixel, long[] inc, Object nullValue,
                          Object array) {
        count("readSubset");
        return delegate.readSubset(file, tag, fpixel, lpixel, inc, nullValue, array);
    }

    @Override
    public int writeSubset(EngineFile file, int tag, long[] fpixel, long[] lpixel, Object array) {
        count("writeSubset");
        return delegate.writeSubset(file, tag, fpixel, lpixel, array);
    }

    @Override
    public int createImage(EngineFile file, int bitpix, long[] naxes) {
        count("createImage");
        return delegate.createImage(file, bitpix, naxes);
    }

    @Override
    public int createTable(EngineFile file, String[] ttype, String[] tform, String extname) {
        count("createTable");
        return delegate.createTable(file, ttype, tform, extname);
    }

    @Override
    public int resizeImage(EngineFile file, int bitpix, long[] naxes) {
        count("resizeImage");
        return delegate.resizeImage(file, bitpix, naxes);
    }

    @Override
    public int insertColumn(EngineFile file, int colnum, String ttype, String tform) {
        count("insertColumn");
        return delegate.insertColumn(file, colnum, ttype, tform);
    }

    @Override
    public int deleteColumn(EngineFile file, int colnum) {
        count("deleteColumn");
        return delegate.deleteColumn(file, colnum);
    }

    @Override
    public int copyHdu(EngineFile source, EngineFile destination) {
        count("copyHdu");
        return delegate.copyHdu(source, destination);
    }

    @Override
    public int deleteHdu(EngineFile file, int[] hduType) {
        count("deleteHdu");
        return delegate.deleteHdu(file, hduType);
    }

    @Override
    public String statusText(int status) {
        return delegate.statusText(status);
    }
}
