package com.energyweather.recon.quality;

import com.energyweather.recon.model.FlatTable;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QualityReportWriterTest {

    private final QualityReportGenerator generator =
            new QualityReportGenerator(Clock.fixed(Instant.parse("2024-05-03T06:00:00Z"), ZoneOffset.UTC));
    private final QualityReportWriter writer = new QualityReportWriter();

    @Test
    void toJson_shouldExposeTopLevelSections() {
        FlatTable weather = FlatTable.builder(List.of("city", "date", "temp_max_F", "temp_min_F"))
                .addRow(Arrays.asList("New York", LocalDate.of(2024, 5, 1), 70.0, 50.0))
                .addRow(Arrays.asList("New York", LocalDate.of(2024, 5, 2), 135.0, null))
                .build();

        JSONObject json = writer.toJson(generator.report(weather, List.of("temp_min_F", "temp_max_F"), "energy_demand_MW", "date"));

        assertEquals(4, json.length());
        JSONObject info = json.getJSONObject("dataset_info");
        assertEquals(2, info.getInt("rows"));
        assertEquals(4, info.getInt("columns"));
        assertEquals("temp_max_F", info.getJSONArray("column_names").getString(2));
        assertEquals(1, json.getJSONObject("missing_values").getInt("temp_min_F"));

        JSONObject outliers = json.getJSONObject("outliers");
        assertEquals(1, outliers.getJSONObject("temp_max_F").getInt("rule_based"));
        assertEquals(0, outliers.getJSONObject("temp_max_F").getInt("iqr"));
        assertEquals("Column not found", outliers.getJSONObject("energy_demand_MW").getString("rule_based"));
        assertEquals("Column not found", outliers.getJSONObject("energy_demand_MW").getString("iqr"));

        JSONObject freshness = json.getJSONObject("freshness");
        assertTrue(freshness.getBoolean("is_fresh"));
        assertEquals("2024-05-02", freshness.getString("latest_date"));
        assertEquals(1, freshness.getInt("days_ago"));
        assertEquals(2, freshness.getInt("threshold_days"));
    }

    @Test
    void toJson_shouldOmitAgeWhenFreshnessUnavailable() {
        FlatTable noDates = FlatTable.builder(List.of("city")).addRow(List.of("Chicago")).build();

        JSONObject freshness = writer.toJson(generator.report(noDates, List.of(), "energy_demand_MW", "date"))
                .getJSONObject("freshness");

        assertFalse(freshness.getBoolean("is_fresh"));
        assertTrue(freshness.has("error"));
        assertFalse(freshness.has("days_ago"));
        assertFalse(freshness.has("latest_date"));
    }

    @Test
    void write_shouldCreateIndentedJsonFile(@TempDir Path dir) throws Exception {
        FlatTable table = FlatTable.builder(List.of("date", "energy_demand_MW"))
                .addRow(Arrays.asList(LocalDate.of(2024, 5, 3), -5.0))
                .build();
        Path target = dir.resolve("reports/quality_report_energy_2024_05_03.json");

        writer.write(generator.report(table, List.of(), "energy_demand_MW", "date"), target);

        String text = Files.readString(target, StandardCharsets.UTF_8);
        assertTrue(text.contains("\n  \"outliers\""));
        JSONObject json = new JSONObject(text);
        assertEquals(1, json.getJSONObject("outliers").getJSONObject("energy_demand_MW").getInt("rule_based"));
        assertEquals(0, json.getJSONObject("freshness").getInt("days_ago"));
    }
}
