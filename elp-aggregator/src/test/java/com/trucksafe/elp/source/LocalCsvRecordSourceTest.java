package com.trucksafe.elp.source;

import com.trucksafe.elp.model.InspectionRow;
import com.trucksafe.elp.model.ViolationRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalCsvRecordSourceTest {

    private static final String VIOLATION_HEADER =
            "INSPECTION_ID,PART_NO,PART_NO_SECTION,CHANGE_DATE,OUT_OF_SERVICE_INDICATOR";

    @TempDir
    Path dir;

    private Path write(String name, String... lines) throws Exception {
        Path file = dir.resolve(name);
        Files.write(file, List.of(lines), StandardCharsets.UTF_8);
        return file;
    }

    private LocalCsvRecordSource source(Path violations, Path inspections, int batchSize) {
        return new LocalCsvRecordSource(violations, inspections, batchSize, new SchemaRegistry());
    }

    private static List<ViolationRow> readAll(LocalCsvRecordSource source) {
        List<ViolationRow> rows = new ArrayList<>();
        source.forEachViolationBatch(rows::addAll);
        return rows;
    }

    @Nested
    @DisplayName("Violations")
    class Violations {

        @Test
        @DisplayName("reads every violation row through the detected schema")
        void readsRows() throws Exception {
            Path violations = write("violations.csv",
                    "INSPECTION_ID,PART_NO,PART_NO_SECTION,SECTION_DESC,CHANGE_DATE,OUT_OF_SERVICE_INDICATOR",
                    "1,391,11(B)(2),\"Driver cannot read, speak English\",20250601,Y",
                    "2,392,2A,Speeding,20250602,N");

            List<ViolationRow> rows = readAll(source(violations, dir.resolve("none.csv"), 10));

            assertThat(rows).hasSize(2);
            assertThat(rows.get(0).getInspectionId()).isEqualTo("1");
            assertThat(rows.get(0).getSection()).isEqualTo("11(B)(2)");
            assertThat(rows.get(0).getDescription()).isEqualTo("Driver cannot read, speak English");
            assertThat(rows.get(1).getPartNumber()).isEqualTo("392");
        }

        @Test
        @DisplayName("streams violations in batches of the configured size")
        void batches() throws Exception {
            Path violations = write("violations.csv", VIOLATION_HEADER,
                    "1,391,11B2,20250601,Y", "2,391,11B2,20250601,N", "3,391,11B2,20250601,Y");
            List<Integer> sizes = new ArrayList<>();

            int delivered = source(violations, dir.resolve("none.csv"), 2)
                    .forEachViolationBatch(batch -> sizes.add(batch.size()));

            assertThat(delivered).isEqualTo(3);
            assertThat(sizes).containsExactly(2, 1);
        }

        @Test
        @DisplayName("a line with extra fields is skipped and the rest of the file is read")
        void longLineSkipped() throws Exception {
            Path violations = write("violations.csv", VIOLATION_HEADER,
                    "1,391,11B2,20250601,Y",
                    "2,391,11B2,20250601,Y,EXTRA",
                    "3,391,11B2,20250601,N");

            List<ViolationRow> rows = readAll(source(violations, dir.resolve("none.csv"), 10));

            assertThat(rows).extracting(ViolationRow::getInspectionId).containsExactly("1", "3");
        }

        @Test
        @DisplayName("a truncated line is skipped and the rest of the file is read")
        void shortLineSkipped() throws Exception {
            Path violations = write("violations.csv", VIOLATION_HEADER,
                    "1,391,11B2,20250601,Y",
                    "2,391,11B2",
                    "3,391,11B2,20250601,N");

            List<ViolationRow> rows = readAll(source(violations, dir.resolve("none.csv"), 10));

            assertThat(rows).extracting(ViolationRow::getInspectionId).containsExactly("1", "3");
        }

        @Test
        @DisplayName("a header-only file yields no rows")
        void headerOnly() throws Exception {
            Path violations = write("violations.csv", VIOLATION_HEADER);

            assertThat(readAll(source(violations, dir.resolve("none.csv"), 10))).isEmpty();
        }

        @Test
        @DisplayName("a missing export fails with a hint")
        void missingFile() {
            LocalCsvRecordSource source = source(dir.resolve("absent.csv"), dir.resolve("absent.csv"), 10);

            assertThatThrownBy(() -> readAll(source))
                    .isInstanceOf(UncheckedIOException.class)
                    .cause()
                    .isInstanceOf(NoSuchFileException.class)
                    .hasMessageContaining("export not found");
        }
    }

    @Nested
    @DisplayName("Inspections")
    class Inspections {

        @Test
        @DisplayName("hands inspections over in batches of the configured size")
        void batchesInspections() throws Exception {
            Path inspections = write("inspections.csv",
                    "INSPECTION_ID,REPORT_STATE,INSP_DATE",
                    "1,CA,20250601", "2,TX,20250601", "3,FL,20250601",
                    "4,NY,20250601", "5,AZ,20250601");
            List<Integer> sizes = new ArrayList<>();

            int delivered = source(dir.resolve("none.csv"), inspections, 2)
                    .forEachInspectionBatch(batch -> {
                        sizes.add(batch.size());
                        return true;
                    });

            assertThat(delivered).isEqualTo(5);
            assertThat(sizes).containsExactly(2, 2, 1);
        }

        @Test
        @DisplayName("stops reading when the consumer is satisfied")
        void stopsEarly() throws Exception {
            Path inspections = write("inspections.csv",
                    "INSPECTION_ID,REPORT_STATE",
                    "1,CA", "2,TX", "3,FL", "4,NY", "5,AZ");
            List<String> seen = new ArrayList<>();

            int delivered = source(dir.resolve("none.csv"), inspections, 2)
                    .forEachInspectionBatch(batch -> {
                        batch.stream().map(InspectionRow::getInspectionId).forEach(seen::add);
                        return false;
                    });

            assertThat(delivered).isEqualTo(2);
            assertThat(seen).containsExactly("1", "2");
        }

        @Test
        @DisplayName("short and long lines are skipped without ending the scan")
        void malformedLinesSkipped() throws Exception {
            Path inspections = write("inspections.csv",
                    "INSPECTION_ID,REPORT_STATE,INSP_DATE",
                    "1,CA,20250601",
                    "2,TX",
                    "3,FL,20250601,surplus",
                    "4,NY,20250601");
            List<String> seen = new ArrayList<>();

            int delivered = source(dir.resolve("none.csv"), inspections, 10)
                    .forEachInspectionBatch(batch -> {
                        batch.stream().map(InspectionRow::getInspectionId).forEach(seen::add);
                        return true;
                    });

            assertThat(delivered).isEqualTo(2);
            assertThat(seen).containsExactly("1", "4");
        }
    }

    @Test
    @DisplayName("batch size must be positive")
    void invalidBatchSize() {
        assertThatThrownBy(() -> source(dir, dir, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
