package com.energyweather.recon.ingest;

import com.energyweather.recon.model.Kind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class SchemaMappingTest {

    private final SchemaMapping energy = SchemaMapping.forKind(Kind.ENERGY);
    private final SchemaMapping weather = SchemaMapping.forKind(Kind.WEATHER);

    @Test
    void energy_shouldHealLegacyNamesAndDropDescription() {
        Map<String, String> mapping = energy.mapColumns(List.of("period", "value", "responndent-name", "timezone-description"));

        assertEquals(List.of("period", "value", "responndent-name"), new ArrayList<>(mapping.keySet()));
        assertEquals("energy_demand_MW", mapping.get("value"));
        assertEquals("respondent_name", mapping.get("responndent-name"));
        assertEquals("period", mapping.get("period"));
        assertFalse(mapping.containsKey("timezone-description"));
    }

    @Test
    void energy_shouldKeepCanonicalDemandWhenPresent() {
        Map<String, String> mapping = energy.mapColumns(List.of("energy_demand_MW", "value"));

        assertEquals("energy_demand_MW", mapping.get("energy_demand_MW"));
        assertEquals("value", mapping.get("value"));
    }

    @Test
    void energy_shouldPickFirstAliasInPriorityOrder() {
        Map<String, String> mapping = energy.mapColumns(List.of("Value", "load", "demand"));

        assertEquals("energy_demand_MW", mapping.get("demand"));
        assertEquals("load", mapping.get("load"));
        assertEquals("Value", mapping.get("Value"));
    }

    @Test
    void weather_shouldMapNoaaCodes() {
        Map<String, String> mapping = weather.mapColumns(List.of("TMAX", "TMIN", "PRCP", "station"));

        assertEquals("temp_max_F", mapping.get("TMAX"));
        assertEquals("temp_min_F", mapping.get("TMIN"));
        assertEquals("precipitation", mapping.get("PRCP"));
        assertEquals("station", mapping.get("station"));
    }

    @Test
    void weather_shouldNotOverwriteExistingCanonicalColumn() {
        Map<String, String> mapping = weather.mapColumns(List.of("tempp_max_F", "temp_max_F"));

        assertEquals("tempp_max_F", mapping.get("tempp_max_F"));
        assertEquals("temp_max_F", mapping.get("temp_max_F"));
    }

    @Test
    void apply_shouldRenameCells() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("TMAX", "70");
        row.put("TMIN", null);
        Map<String, Object> out = weather.apply(row, weather.mapColumns(row.keySet()));

        assertEquals("70", out.get("temp_max_F"));
        assertEquals(List.of("temp_max_F", "temp_min_F"), new ArrayList<>(out.keySet()));
    }
}
