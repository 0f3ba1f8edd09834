/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.reader;

import java.util.concurrent.locks.ReentrantLock;

import dev.fitsio.errors.FitsException;

/**
 * A {@link FitsFile} shared between threads. All access goes through
 * {@link #withLock(FitsFunction)}, which serializes callers in arrival order and
 * lets the calling thread use the file and its handles until the function returns.
 *
 * <pre>{@code
 * ThreadsafeFitsFile shared = FitsFile.open(path).threadsafe();
 * List<Integer> values = shared.withHdu(1, hdu -> hdu.readCol(FitsType.INT32, "bar"));
 * }</pre>
 */
public final class ThreadsafeFitsFile implements AutoCloseable {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final FitsFile file;

    ThreadsafeFitsFile(FitsFile file) {
        this.file = file;
    }

    public <R> R withLock(FitsFunction<FitsFile, R> action) throws FitsException {
        lock.lock();
        try {
            Thread previous = file.transferOwnership(Thread.currentThread());
            try {
                return action.apply(file);
            }
            finally {
                file.transferOwnership(previous);
            }
        }
        finally {
            lock.unlock();
        }
    }

    public <R> R withHdu(HduSelector selector, FitsFunction<FitsHdu, R> action) throws FitsException {
        return withLock(f -> action.apply(f.hdu(selector)));
    }

    public <R> R withHdu(int index, FitsFunction<FitsHdu, R> action) throws FitsException {
        return withHdu(HduSelector.index(index), action);
    }

    @Override
    public void close() {
        lock.lock();
        try {
            file.close();
        }
        finally {
            lock.unlock();
        }
    }
}
