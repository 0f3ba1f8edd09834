/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.reader;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import dev.fitsio.CountingFitsEngine;
import dev.fitsio.internal.engine.DefaultFitsEngine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FitsContextTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(FitsContext.ENGINE_PROPERTY);
        System.clearProperty(FitsContext.THREAD_CONFINEMENT_PROPERTY);
    }

    @Test
    void testDefaults() {
        FitsContext context = FitsContext.create();

        assertThat(context.engine()).isInstanceOf(DefaultFitsEngine.class);
        assertThat(context.threadConfinement()).isTrue();
    }

    @Test
    void testConfiguredFromSystemProperties() {
        System.setProperty(FitsContext.ENGINE_PROPERTY, CountingFitsEngine.class.getName());
        System.setProperty(FitsContext.THREAD_CONFINEMENT_PROPERTY, "false");

        FitsContext context = FitsContext.create();

        assertThat(context.engine()).isInstanceOf(CountingFitsEngine.class);
        assertThat(context.threadConfinement()).isFalse();
        assertThat(context.withThreadConfinement(true).engine()).isSameAs(context.engine());
    }

    @Test
    void testUnknownEngineClass() {
        System.setProperty(FitsContext.ENGINE_PROPERTY, "dev.fitsio.NoSuchEngine");

        assertThatThrownBy(FitsContext::create)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("dev.fitsio.NoSuchEngine")
                .hasCauseInstanceOf(ClassNotFoundException.class);
    }
}
