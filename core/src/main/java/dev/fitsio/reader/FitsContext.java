/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.reader;

import dev.fitsio.engine.FitsEngine;
import dev.fitsio.internal.engine.DefaultFitsEngine;

/**
 * Configuration shared by the files opened through it: the engine to use and
 * whether files are confined to the thread that opened them.
 * <p>
 * {@link #create()} reads its defaults from system properties:
 * <ul>
 *   <li>{@code fitsio.engine}: class name of a {@link FitsEngine} with a public
 *   no-arg constructor, {@link DefaultFitsEngine} if unset</li>
 *   <li>{@code fitsio.threadConfinement}: {@code false} disables the owner thread check</li>
 * </ul>
 * </p>
 */
public final class FitsContext {

    static final String ENGINE_PROPERTY = "fitsio.engine";
    static final String THREAD_CONFINEMENT_PROPERTY = "fitsio.threadConfinement";

    private static final System.Logger LOG = System.getLogger(FitsContext.class.getName());

    private final FitsEngine engine;
    private final boolean threadConfinement;

    private FitsContext(FitsEngine engine, boolean threadConfinement) {
        this.engine = engine;
        this.threadConfinement = threadConfinement;
    }

    /**
     * Create a context configured from system properties.
     */
    public static FitsContext create() {
        boolean threadConfinement = !"false".equalsIgnoreCase(System.getProperty(THREAD_CONFINEMENT_PROPERTY));
        return new FitsContext(loadEngine(System.getProperty(ENGINE_PROPERTY)), threadConfinement);
    }

    /**
     * Create a context using the given engine, with thread confinement enabled.
     */
    public static FitsContext create(FitsEngine engine) {
        return new FitsContext(engine, true);
    }

    public FitsContext withThreadConfinement(boolean threadConfinement) {
        return new FitsContext(engine, threadConfinement);
    }

    public FitsEngine engine() {
        return engine;
    }

    public boolean threadConfinement() {
        return threadConfinement;
    }

    private static FitsEngine loadEngine(String className) {
        if (className == null || className.isBlank()) {
            return new DefaultFitsEngine();
        }
        try {
            FitsEngine engine = Class.forName(className)
                    .asSubclass(FitsEngine.class)
                    .getDeclaredConstructor()
                    .newInstance();
            LOG.log(System.Logger.Level.DEBUG, "Using FITS engine ''{0}''", className);
            return engine;
        }
        catch (ReflectiveOperationException | ClassCastException e) {
            throw new IllegalStateException("Cannot instantiate FITS engine '" + className + "' configured via "
                    + ENGINE_PROPERTY, e);
        }
    }
}
