package com.energyweather.recon.quality;

import com.energyweather.recon.model.FlatTable;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QualityReportGeneratorTest {

    private static final Clock NOW = Clock.fixed(Instant.parse("2024-05-10T12:00:00Z"), ZoneOffset.UTC);
    private static final List<String> TEMPS = List.of("temp_min_F", "temp_max_F");

    private final QualityReportGenerator generator = new QualityReportGenerator(NOW);

    @Test
    void report_shouldCountRuleBasedOutliers() {
        FlatTable table = FlatTable.builder(List.of("date", "temp_max_F", "temp_min_F", "energy_demand_MW"))
                .addRow(Arrays.asList(LocalDate.of(2024, 5, 8), 70.0, 40.0, 20000.0))
                .addRow(Arrays.asList(LocalDate.of(2024, 5, 8), 135.0, 45.0, 25000.0))
                .addRow(Arrays.asList(LocalDate.of(2024, 5, 8), 65.0, -60.0, -100.0))
                .build();

        QualityReport report = generator.report(table, TEMPS, "energy_demand_MW", "date");

        assertEquals(1, report.outliers.get("temp_max_F").ruleBased.count);
        assertEquals(1, report.outliers.get("temp_min_F").ruleBased.count);
        assertEquals(1, report.outliers.get("energy_demand_MW").ruleBased.count);
        assertEquals(0, report.outliers.get("temp_max_F").iqr.count);
        assertEquals(List.of("temp_min_F", "temp_max_F", "energy_demand_MW"), List.copyOf(report.outliers.keySet()));
    }

    @Test
    void report_shouldCountIqrOutliersWithLinearQuartiles() {
        FlatTable.Builder builder = FlatTable.builder(List.of("date", "temp_max_F"));
        for (double v : new double[]{10, 11, 12, 13, 14, 100}) {
            builder.addRow(Arrays.asList(LocalDate.of(2024, 5, 9), v));
        }

        QualityReport report = generator.report(builder.build(), List.of("temp_max_F"), "energy_demand_MW", "date");

        OutlierEntry entry = report.outliers.get("temp_max_F");
        assertEquals(0, entry.ruleBased.count);
        assertEquals(1, entry.iqr.count);
        assertEquals(11.25, Percentiles.quantile(new double[]{10, 11, 12, 13, 14, 100}, 0.25), 1e-9);
        assertEquals(13.75, Percentiles.quantile(new double[]{10, 11, 12, 13, 14, 100}, 0.75), 1e-9);
    }

    @Test
    void report_shouldUseSentinelsForMissingOrTextColumns() {
        FlatTable table = FlatTable.builder(List.of("date", "temp_max_F"))
                .addRow(Arrays.asList(LocalDate.of(2024, 5, 9), "hot"))
                .build();

        QualityReport report = generator.report(table, TEMPS, "energy_demand_MW", "date");

        assertEquals("Column not found", report.outliers.get("temp_min_F").ruleBased.value());
        assertEquals("Column not found", report.outliers.get("temp_min_F").iqr.value());
        assertEquals("Column temp_max_F is not numeric", report.outliers.get("temp_max_F").ruleBased.value());
        assertEquals("Column not found", report.outliers.get("energy_demand_MW").ruleBased.value());
        assertTrue(report.outliers.get("energy_demand_MW").iqr.isSentinel());
    }

    @Test
    void report_shouldCountMissingValuesPerColumn() {
        FlatTable table = FlatTable.builder(List.of("date", "temp_max_F", "city"))
                .addRow(Arrays.asList(LocalDate.of(2024, 5, 9), null, "Chicago"))
                .addRow(Arrays.asList(null, Double.NaN, "Chicago"))
                .build();

        QualityReport report = generator.report(table, TEMPS, "energy_demand_MW", "date");

        assertEquals(1, report.missingValues.get("date"));
        assertEquals(2, report.missingValues.get("temp_max_F"));
        assertEquals(0, report.missingValues.get("city"));
        assertEquals(2, report.datasetInfo.rows);
        assertEquals(3, report.datasetInfo.columns);
        assertEquals(List.of("date", "temp_max_F", "city"), report.datasetInfo.columnNames);
        assertEquals(0, report.outliers.get("temp_max_F").ruleBased.count);
    }

    @Test
    void freshness_shouldAcceptDataTwoDaysOld() {
        QualityReport report = generator.report(dated(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 8)),
                TEMPS, "energy_demand_MW", "date", 2);

        assertTrue(report.freshness.fresh);
        assertEquals(2L, report.freshness.daysAgo);
        assertEquals("2024-05-08", report.freshness.latestDate);
        assertEquals(2, report.freshness.thresholdDays);
        assertNull(report.freshness.error);
    }

    @Test
    void freshness_shouldRejectDataThreeDaysOld() {
        QualityReport report = generator.report(dated(LocalDate.of(2024, 5, 7)), TEMPS, "energy_demand_MW", "date", 2);

        assertFalse(report.freshness.fresh);
        assertEquals(3L, report.freshness.daysAgo);
    }

    @Test
    void freshness_shouldParseTextAndDateTimes() {
        FlatTable table = FlatTable.builder(List.of("date"))
                .addRow(Arrays.asList("2024-05-09T18:00:00"))
                .addRow(Arrays.asList("garbage"))
                .build();

        QualityReport report = generator.report(table, TEMPS, "energy_demand_MW", "date", 0);

        assertEquals(0L, report.freshness.daysAgo);
        assertTrue(report.freshness.fresh);
        assertEquals("2024-05-09T18:00:00Z", report.freshness.latestDate);
    }

    @Test
    void freshness_shouldReportErrorWithoutValidDates() {
        FlatTable noDates = FlatTable.builder(List.of("date")).addRow(Arrays.asList((Object) null)).build();
        FlatTable noColumn = FlatTable.builder(List.of("city")).addRow(List.of("Chicago")).build();

        Freshness empty = generator.report(noDates, TEMPS, "energy_demand_MW", "date").freshness;
        Freshness absent = generator.report(noColumn, TEMPS, "energy_demand_MW", "date").freshness;

        assertFalse(empty.fresh);
        assertNotNull(empty.error);
        assertNull(empty.daysAgo);
        assertFalse(absent.fresh);
        assertNotNull(absent.error);
    }

    @Test
    void report_shouldRejectContractViolations() {
        FlatTable table = dated(LocalDate.of(2024, 5, 9));

        InvalidReportInputException nullTable = assertThrows(InvalidReportInputException.class,
                () -> generator.report(null, TEMPS, "energy_demand_MW", "date"));
        assertEquals("invalid-input", nullTable.kind());
        assertThrows(InvalidReportInputException.class,
                () -> generator.report(table, null, "energy_demand_MW", "date"));
        assertThrows(InvalidReportInputException.class,
                () -> generator.report(table, TEMPS, " ", "date"));
        assertThrows(InvalidReportInputException.class,
                () -> generator.report(table, TEMPS, "energy_demand_MW", null));
        assertThrows(InvalidReportInputException.class,
                () -> generator.report(table, TEMPS, "energy_demand_MW", "date", -1));
    }

    @Test
    void report_shouldDefaultThresholdToTwoDays() {
        QualityReport report = generator.report(dated(LocalDate.of(2024, 5, 9)), TEMPS, "energy_demand_MW", "date");

        assertEquals(QualityReportGenerator.DEFAULT_FRESHNESS_DAYS, report.freshness.thresholdDays);
        assertEquals(2, report.freshness.thresholdDays);
    }

    private static FlatTable dated(LocalDate... dates) {
        FlatTable.Builder builder = FlatTable.builder(List.of("date"));
        for (LocalDate d : dates) {
            builder.addRow(Arrays.asList((Object) d));
        }
        return builder.build();
    }
}
