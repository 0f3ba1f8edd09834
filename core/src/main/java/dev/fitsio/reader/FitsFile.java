/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.reader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import dev.fitsio.engine.EngineFile;
import dev.fitsio.engine.FileMode;
import dev.fitsio.engine.FitsEngine;
import dev.fitsio.engine.HduType;
import dev.fitsio.engine.Status;
import dev.fitsio.engine.TypeTag;
import dev.fitsio.errors.AddressException;
import dev.fitsio.errors.ErrorTranslator;
import dev.fitsio.errors.FitsException;
import dev.fitsio.errors.UsageException;
import dev.fitsio.schema.ConcreteColumnDescription;
import dev.fitsio.schema.HduInfo;
import dev.fitsio.schema.ImageDescription;
import dev.fitsio.types.EngineTarget;
import dev.fitsio.types.TextCodec;

/**
 * An open FITS file.
 * <p>
 * The engine keeps a single current HDU per file. {@link FitsHdu} handles only
 * remember their position, and every operation on a handle first moves the
 * engine back to it, so any number of handles can be used in any order.
 * </p>
 * <pre>{@code
 * try (FitsFile file = FitsFile.open(path)) {
 *     FitsHdu table = file.hdu("EVENTS");
 *     List<Double> energies = table.readCol(FitsType.FLOAT64, "ENERGY");
 * }
 * }</pre>
 * <p>
 * A file may only be used by the thread that opened it. Use {@link #threadsafe()}
 * to share it between threads.
 * </p>
 */
public final class FitsFile implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(FitsFile.class.getName());

    private final Path path;
    private final FitsEngine engine;
    private final EngineFile file;
    private final FileMode mode;
    private final boolean threadConfinement;

    private volatile Thread owner;
    private volatile boolean closed;
    private boolean shared;
    private int currentIndex;

    private FitsFile(Path path, FitsContext context, EngineFile file, FileMode mode) {
        this.path = path;
        this.engine = context.engine();
        this.file = file;
        this.mode = mode;
        this.threadConfinement = context.threadConfinement();
        this.owner = Thread.currentThread();
    }

    /**
     * Open an existing file for reading.
     */
    public static FitsFile open(Path path) throws FitsException {
        return open(path, FitsContext.create());
    }

    public static FitsFile open(Path path, FitsContext context) throws FitsException {
        return open(path, context, FileMode.READONLY);
    }

    /**
     * Open an existing file for reading and writing.
     */
    public static FitsFile edit(Path path) throws FitsException {
        return edit(path, FitsContext.create());
    }

    public static FitsFile edit(Path path, FitsContext context) throws FitsException {
        return open(path, context, FileMode.READWRITE);
    }

    /**
     * Create a new file with an empty primary HDU. Fails if the file exists.
     */
    public static FitsFile create(Path path) throws IOException {
        return builder(path).create();
    }

    public static FitsFile create(Path path, FitsContext context) throws IOException {
        return builder(path, context).create();
    }

    public static FitsFileBuilder builder(Path path) {
        return builder(path, FitsContext.create());
    }

    public static FitsFileBuilder builder(Path path, FitsContext context) {
        return new FitsFileBuilder(path, context);
    }

    private static FitsFile open(Path path, FitsContext context, FileMode mode) throws FitsException {
        FitsEngine engine = context.engine();
        EngineFile[] handle = new EngineFile[1];
        ErrorTranslator.check(engine, engine.open(path, mode.code(), handle));

        FitsFile fitsFile = new FitsFile(path, context, handle[0], mode);
        try {
            fitsFile.syncCursor();
        }
        catch (FitsException e) {
            fitsFile.closeAfterFailure(e);
            throw e;
        }
        LOG.log(System.Logger.Level.DEBUG, "Opened ''{0}'' ({1})", path, mode);
        return fitsFile;
    }

    static FitsFile create(Path path, FitsContext context, ImageDescription primary) throws FitsException {
        FitsEngine engine = context.engine();
        EngineFile[] handle = new EngineFile[1];
        ErrorTranslator.check(engine, engine.create(path, handle));

        FitsFile fitsFile = new FitsFile(path, context, handle[0], FileMode.READWRITE);
        try {
            if (primary != null) {
                int[] type = new int[1];
                ErrorTranslator.check(engine, engine.moveAbsolute(handle[0], 1, type));
                ErrorTranslator.check(engine, engine.resizeImage(handle[0], primary.dataType().bitpix(),
                        engineAxes(primary.dimensions())));
            }
            fitsFile.syncCursor();
        }
        catch (FitsException e) {
            fitsFile.closeAfterFailure(e);
            throw e;
        }
        LOG.log(System.Logger.Level.DEBUG, "Created ''{0}''", path);
        return fitsFile;
    }

    public Path path() {
        return path;
    }

    public FileMode mode() {
        return mode;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Get a handle to the HDU at the given 0-based position; 0 is the primary HDU.
     */
    public FitsHdu hdu(int index) throws FitsException {
        return hdu(HduSelector.index(index));
    }

    /**
     * Get a handle to the first HDU whose EXTNAME matches, ignoring case.
     */
    public FitsHdu hdu(String name) throws FitsException {
        return hdu(HduSelector.name(name));
    }

    public FitsHdu hdu(HduSelector selector) throws FitsException {
        checkAccess();
        int status;
        int[] type = new int[1];
        if (selector instanceof HduSelector.ByIndex byIndex) {
            status = engine.moveAbsolute(file, byIndex.index() + 1, type);
        }
        else {
            HduSelector.ByName byName = (HduSelector.ByName) selector;
            status = engine.moveByName(file, HduType.ANY.code(), byName.name(), byName.version());
        }
        if (status != Status.OK) {
            throw new AddressException(selector.toString(), ErrorTranslator.engineError(engine, status));
        }
        syncCursor();
        LOG.log(System.Logger.Level.TRACE, "Moved to HDU {0} of ''{1}''", currentIndex, path);
        return new FitsHdu(this, currentIndex, HduCatalog.fetch(engine, file));
    }

    public FitsHdu primaryHdu() throws FitsException {
        return hdu(0);
    }

    /**
     * Get a handle to the HDU the engine currently points at.
     */
    public FitsHdu currentHdu() throws FitsException {
        checkAccess();
        syncCursor();
        return hdu(currentIndex);
    }

    public int numHdus() throws FitsException {
        checkAccess();
        int[] count = new int[1];
        ErrorTranslator.check(engine, engine.hduCount(file, count));
        return count[0];
    }

    public List<FitsHdu> hdus() throws FitsException {
        int count = numHdus();
        List<FitsHdu> hdus = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            hdus.add(hdu(i));
        }
        return hdus;
    }

    /**
     * The EXTNAME of every HDU in order, with an empty name for HDUs without one.
     */
    public List<String> hduNames() throws FitsException {
        List<String> names = new ArrayList<>();
        for (FitsHdu hdu : hdus()) {
            names.add(hdu.name());
        }
        return names;
    }

    /**
     * Append an image extension.
     *
     * @param extname the EXTNAME of the new HDU
     */
    public FitsHdu createImage(String extname, ImageDescription description) throws FitsException {
        checkAccess();
        requireWritable();
        ErrorTranslator.check(engine, engine.createImage(file, description.dataType().bitpix(),
                engineAxes(description.dimensions())));
        ErrorTranslator.check(engine, engine.writeKey(file, TypeTag.TSTRING.code(), "EXTNAME",
                TextCodec.encode(extname), null));
        syncCursor();
        LOG.log(System.Logger.Level.DEBUG, "Created image ''{0}'' with shape {1} at HDU {2}",
                extname, description.dimensions(), currentIndex);
        return hdu(currentIndex);
    }

    /**
     * Append a binary table extension without rows.
     *
     * @param extname the EXTNAME of the new HDU
     */
    public FitsHdu createTable(String extname, List<ConcreteColumnDescription> columns) throws FitsException {
        checkAccess();
        requireWritable();
        Set<String> names = new HashSet<>();
        String[] ttype = new String[columns.size()];
        String[] tform = new String[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            ConcreteColumnDescription column = columns.get(i);
            if (!names.add(column.name().toUpperCase(Locale.ROOT))) {
                throw new UsageException("Duplicate column name '" + column.name() + "'");
            }
            ttype[i] = column.name();
            tform[i] = column.dataType().toTypeCode();
        }
        ErrorTranslator.check(engine, engine.createTable(file, ttype, tform, extname));
        syncCursor();
        LOG.log(System.Logger.Level.DEBUG, "Created table ''{0}'' with {1} columns at HDU {2}",
                extname, columns.size(), currentIndex);
        return hdu(currentIndex);
    }

    /**
     * Write a short summary of every HDU.
     */
    public void prettyPrint(Appendable out) throws IOException {
        out.append("file: ").append(String.valueOf(path)).append('\n');
        out.append(" idx  type    name\n");
        for (FitsHdu hdu : hdus()) {
            String name = hdu.name();
            HduInfo info = hdu.info();
            out.append(String.format(Locale.ROOT, " %3d  %-6s  %s", hdu.index(),
                    info instanceof HduInfo.ImageInfo ? "IMAGE" : "TABLE", name.isEmpty() ? "-" : name));
            if (info instanceof HduInfo.ImageInfo image) {
                out.append(String.format(Locale.ROOT, "  %s %s%n", image.pixelType(), image.shape()));
            }
            else {
                HduInfo.TableInfo table = (HduInfo.TableInfo) info;
                out.append(String.format(Locale.ROOT, "  %d rows%n", table.rowCount()));
                for (ConcreteColumnDescription column : table.columns()) {
                    out.append(String.format(Locale.ROOT, "          %-16s %s%n",
                            column.name(), column.dataType().toTypeCode()));
                }
            }
        }
    }

    /**
     * Wrap this file for use from multiple threads. The file must then only be
     * accessed through the returned wrapper.
     */
    public ThreadsafeFitsFile threadsafe() throws FitsException {
        checkAccess();
        if (shared) {
            throw new UsageException("File is already wrapped for multi-threaded use");
        }
        shared = true;
        owner = null;
        return new ThreadsafeFitsFile(this);
    }

    /**
     * Close the file, writing pending changes. Closing twice has no effect.
     * Failures reported by the engine are logged.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int status = engine.close(file);
        if (status != Status.OK) {
            LOG.log(System.Logger.Level.WARNING, "Failed to close ''{0}'': {1} {2}", path, status,
                    engine.statusText(status));
        }
        else {
            LOG.log(System.Logger.Level.DEBUG, "Closed ''{0}''", path);
        }
    }

    @Override
    public String toString() {
        return "FitsFile[" + path + ", " + mode + (closed ? ", closed" : "") + "]";
    }

    // package-private API used by handles and the lock wrapper

    EngineTarget target() {
        return new EngineTarget(engine, file);
    }

    FitsEngine engine() {
        return engine;
    }

    EngineFile engineFile() {
        return file;
    }

    void checkAccess() throws UsageException {
        if (closed) {
            throw new UsageException("File '" + path + "' is closed");
        }
        if (threadConfinement && owner != Thread.currentThread()) {
            throw new UsageException(shared
                    ? "File '" + path + "' is shared, access it through ThreadsafeFitsFile"
                    : "File '" + path + "' is confined to thread " + (owner == null ? "-" : owner.getName()));
        }
    }

    void requireWritable() throws UsageException {
        if (mode != FileMode.READWRITE) {
            throw new UsageException("File '" + path + "' is opened read-only");
        }
    }

    /**
     * Move the engine to the given HDU.
     */
    void makeCurrent(int index) throws FitsException {
        checkAccess();
        int[] type = new int[1];
        ErrorTranslator.check(engine, engine.moveAbsolute(file, index + 1, type));
        if (currentIndex != index) {
            LOG.log(System.Logger.Level.TRACE, "Moved from HDU {0} to {1} of ''{2}''", currentIndex, index, path);
        }
        currentIndex = index;
    }

    /**
     * Read back the engine's current HDU after it moved on its own.
     */
    void syncCursor() throws FitsException {
        int[] hduNum = new int[1];
        ErrorTranslator.check(engine, engine.currentHdu(file, hduNum));
        currentIndex = hduNum[0] - 1;
    }

    Thread transferOwnership(Thread newOwner) {
        Thread previous = owner;
        owner = newOwner;
        return previous;
    }

    private void closeAfterFailure(FitsException failure) {
        closed = true;
        int status = engine.close(file);
        if (status != Status.OK) {
            failure.addSuppressed(ErrorTranslator.engineError(engine, status));
        }
    }

    static long[] engineAxes(List<Long> dimensions) {
        long[] naxes = new long[dimensions.size()];
        for (int i = 0; i < naxes.length; i++) {
            naxes[i] = dimensions.get(naxes.length - 1 - i);
        }
        return naxes;
    }
}
