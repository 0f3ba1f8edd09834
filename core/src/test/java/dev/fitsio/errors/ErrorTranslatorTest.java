/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.errors;

import org.junit.jupiter.api.Test;

import dev.fitsio.engine.FitsEngine;
import dev.fitsio.engine.Status;
import dev.fitsio.internal.engine.DefaultFitsEngine;
import dev.fitsio.range.Range;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ErrorTranslatorTest {

    private final FitsEngine engine = new DefaultFitsEngine();

    @Test
    void testOkStatusPasses() {
        assertThatCode(() -> ErrorTranslator.check(engine, Status.OK)).doesNotThrowAnyException();
        assertThatCode(() -> ErrorTranslator.check(engine, Status.OK, new Range(0, 5))).doesNotThrowAnyException();
    }

    @Test
    void testStatusBecomesEngineException() {
        assertThatThrownBy(() -> ErrorTranslator.check(engine, Status.FILE_NOT_CREATED))
                .isInstanceOfSatisfying(EngineException.class, e -> {
                    assertThat(e.status()).isEqualTo(105);
                    assertThat(e.statusText()).isEqualTo("couldn't create the named file");
                    assertThat(e.kind()).isEqualTo(ErrorKind.ENGINE);
                })
                .hasMessage("FITS engine error 105: couldn't create the named file");
    }

    @Test
    void testBadRowWithRangeBecomesIndexException() {
        Range requested = new Range(0, 20);

        assertThatThrownBy(() -> ErrorTranslator.check(engine, Status.BAD_ROW_NUM, requested))
                .isInstanceOfSatisfying(IndexException.class, e -> {
                    assertThat(e.requestedRange()).isEqualTo(requested);
                    assertThat(e.kind()).isEqualTo(ErrorKind.INDEX);
                })
                .hasMessage("given indices out of range: [0, 20)");
    }

    @Test
    void testBadRowWithoutRangeStaysEngineError() {
        assertThatThrownBy(() -> ErrorTranslator.check(engine, Status.BAD_ROW_NUM, null))
                .isInstanceOfSatisfying(EngineException.class, e -> assertThat(e.status()).isEqualTo(307));
    }

    @Test
    void testTranslateReturnsValue() throws Exception {
        assertThat(ErrorTranslator.translate(engine, Status.OK, "value")).isEqualTo("value");
        assertThatThrownBy(() -> ErrorTranslator.translate(engine, Status.KEY_NO_EXIST, "value"))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("202");
    }
}
