/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.fitsio.range.Range;
import dev.fitsio.reader.FitsFile;
import dev.fitsio.reader.FitsHdu;
import dev.fitsio.schema.ColumnDataType;
import dev.fitsio.schema.ColumnDescription;
import dev.fitsio.schema.ConcreteColumnDescription;
import dev.fitsio.schema.HduInfo;
import dev.fitsio.schema.ImageDescription;
import dev.fitsio.schema.ImageType;
import dev.fitsio.types.FitsType;
import dev.fitsio.types.HeaderValue;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end scenarios writing files to disk and reading them back.
 */
class FitsScenariosTest {

    @TempDir
    Path tempDir;

    @Test
    void writeAndReadBackCompleteFile() throws Exception {
        Path path = tempDir.resolve("example.fits");
        ImageDescription primaryDescription = new ImageDescription(ImageType.DOUBLE, List.of(64L, 128L));

        try (FitsFile file = FitsFile.builder(path).withCustomPrimary(primaryDescription).overwrite().create()) {
            FitsHdu primary = file.primaryHdu();
            primary.writeKey(FitsType.STRING, "PROJECT", "My First Astronomy Project");
            primary.writeKey(FitsType.FLOAT32, "EXPTIME", 15.2f, "Exposure time [s]");
            primary.writeKey(FitsType.INT64, "IMAGE_ID", 20180101010005L);

            List<Double> pixels = new ArrayList<>();
            for (int i = 0; i < 64 * 128; i++) {
                pixels.add(i * 12.5 + 102.5);
            }
            primary.writeImage(FitsType.FLOAT64, pixels);

            file.createImage("IMG", new ImageDescription(ImageType.LONG, List.of(256L, 256L)));

            List<ConcreteColumnDescription> columns = List.of(
                    ColumnDescription.named("OBJ_ID").withType(ColumnDataType.INT).create(),
                    ColumnDescription.named("NAME").withType(ColumnDataType.TEXT).thatRepeats(10).create(),
                    ColumnDescription.named("MAG").withType(ColumnDataType.FLOAT).create());
            FitsHdu table = file.createTable("DATA", columns);

            List<Integer> ids = new ArrayList<>();
            List<String> names = new ArrayList<>();
            List<Float> magnitudes = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                ids.add(i);
                names.add("N" + i);
                magnitudes.add(-0.2f * i);
            }
            table = table.writeCol(FitsType.INT32, "OBJ_ID", ids);
            table = table.writeCol(FitsType.STRING, "NAME", names);
            table.writeCol(FitsType.FLOAT32, "MAG", magnitudes);
        }

        try (FitsFile file = FitsFile.edit(path)) {
            StringBuilder summary = new StringBuilder();
            file.prettyPrint(summary);
            assertThat(summary.toString()).contains("DATA").contains("IMG").contains("10 rows");

            FitsHdu primary = file.primaryHdu();
            assertThat(primary.readKey(FitsType.STRING, "PROJECT")).isEqualTo("My First Astronomy Project");
            HeaderValue<Float> exptime = primary.readKeyWithComment(FitsType.FLOAT32, "EXPTIME");
            assertThat(exptime.value()).isEqualTo(15.2f);
            assertThat(exptime.comment()).contains("Exposure time [s]");
            assertThat(primary.readKey(FitsType.INT64, "IMAGE_ID")).isEqualTo(20180101010005L);

            List<Double> region = primary.readRegion(FitsType.FLOAT64, Range.of(19, 29), Range.of(19, 29));
            assertThat(region).hasSize(100);
            assertThat(region.get(0)).isEqualTo((19 * 128 + 19) * 12.5 + 102.5);

            FitsHdu table = file.hdu("DATA");
            assertThat(table.readColRange(FitsType.FLOAT32, "MAG", Range.of(3, 6)))
                    .containsExactly(-0.2f * 3, -0.2f * 4, -0.2f * 5);
            assertThat(table.readCellValue(FitsType.STRING, "NAME", 4)).isEqualTo("N4");
            assertThat(table.readCellValue(FitsType.INT32, "OBJ_ID", 4)).isEqualTo(4);
        }
    }

    @Test
    void tableColumnSurvivesReopen() throws Exception {
        Path path = tempDir.resolve("table.fits");

        try (FitsFile file = FitsFile.create(path)) {
            FitsHdu table = file.createTable("foo",
                    List.of(ColumnDescription.named("bar").withType(ColumnDataType.INT).create()));
            table.writeCol(FitsType.INT32, "bar", Collections.nCopies(10, 10101));
        }

        try (FitsFile file = FitsFile.open(path)) {
            FitsHdu table = file.hdu("foo");
            assertThat(((HduInfo.TableInfo) table.info()).rowCount()).isEqualTo(10);
            assertThat(table.readCol(FitsType.INT32, "bar")).hasSize(10).containsOnly(10101);
        }
    }

    @Test
    void readSquareRegionOfLargeImage() throws Exception {
        Path path = tempDir.resolve("image.fits");

        try (FitsFile file = FitsFile.create(path)) {
            FitsHdu image = file.createImage("img", new ImageDescription(ImageType.LONG, List.of(100L, 100L)));
            List<Integer> pixels = new ArrayList<>();
            for (int row = 0; row < 100; row++) {
                for (int column = 0; column < 100; column++) {
                    pixels.add(row * 1000 + column);
                }
            }
            image.writeImage(FitsType.INT32, pixels);
        }

        try (FitsFile file = FitsFile.open(path)) {
            List<Integer> region = file.hdu("img").readRegion(FitsType.INT32, Range.of(0, 11), Range.of(0, 11));

            assertThat(region).hasSize(121);
            assertThat(region.get(0)).isEqualTo(0);
            assertThat(region.get(120)).isEqualTo(10 * 1000 + 10);
        }
    }

    @Test
    void textColumnSurvivesReopen() throws Exception {
        Path path = tempDir.resolve("text.fits");
        List<String> values = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            values.add("value" + i);
        }

        try (FitsFile file = FitsFile.create(path)) {
            file.createTable("foo",
                    List.of(ColumnDescription.named("bar").withType(ColumnDataType.TEXT).thatRepeats(7).create()))
                    .writeCol(FitsType.STRING, "bar", values);
        }

        try (FitsFile file = FitsFile.open(path)) {
            assertThat(file.hdu("foo").readCol(FitsType.STRING, "bar")).containsExactlyElementsOf(values);
        }
    }

    @Test
    void repeatedHandlesAgree() throws Exception {
        Path path = tempDir.resolve("handles.fits");

        try (FitsFile file = FitsFile.create(path)) {
            file.primaryHdu().writeKey(FitsType.INT32, "COUNT", 3);
            FitsHdu other = file.createTable("other",
                    List.of(ColumnDescription.named("n").withType(ColumnDataType.INT).create()));
            other.writeKey(FitsType.INT32, "COUNT", 42);
            other.writeCol(FitsType.INT32, "n", List.of(7, 8, 9));
        }

        try (FitsFile file = FitsFile.open(path)) {
            FitsHdu first = file.hdu(0);
            int before = first.readKey(FitsType.INT32, "COUNT");

            FitsHdu other = file.hdu(1);
            assertThat(other.readKey(FitsType.INT32, "COUNT")).isEqualTo(42);
            assertThat(other.readCol(FitsType.INT32, "n")).containsExactly(7, 8, 9);

            FitsHdu second = file.hdu(0);
            assertThat(first.index()).isEqualTo(second.index());
            assertThat(first.info()).isEqualTo(second.info());
            assertThat(first.readKey(FitsType.INT32, "COUNT")).isEqualTo(before).isEqualTo(3);

            other.readCellValue(FitsType.INT32, "n", 2);
            assertThat(second.readKey(FitsType.INT32, "COUNT")).isEqualTo(before);
        }
    }
}
