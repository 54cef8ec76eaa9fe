package com.energyweather.recon.store;

import com.energyweather.recon.model.FlatTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class FlatTableCsvTest {

    @TempDir
    Path dir;

    @Test
    void write_shouldProduceStableTextAndLeaveNoTempFiles() throws Exception {
        FlatTable table = FlatTable.builder(List.of("city", "date", "energy_demand_MW", "note"))
                .addRow(Arrays.asList("New York", LocalDate.of(2024, 5, 1), 20000.0, "a,b"))
                .addRow(Arrays.asList("New York", LocalDate.of(2024, 5, 2), null, null))
                .build();
        Path target = dir.resolve("nested/energy_master.csv");

        FlatTableCsv.write(table, target);

        assertEquals("city,date,energy_demand_MW,note\n"
                        + "New York,2024-05-01,20000,\"a,b\"\n"
                        + "New York,2024-05-02,,\n",
                Files.readString(target, StandardCharsets.UTF_8));
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertEquals(List.of("energy_master.csv"),
                    files.map(p -> p.getFileName().toString()).collect(Collectors.toList()));
        }
    }

    @Test
    void read_shouldInferColumnTypes() throws Exception {
        Path file = dir.resolve("merged.csv");
        Files.writeString(file, "date,city,temp_avg,weather_available,timezone,empty\n"
                + "2024-05-01,New York,60,true,America/New_York,\n"
                + "2024-05-02,New York,,false,America/New_York,\n", StandardCharsets.UTF_8);

        FlatTable table = FlatTableCsv.read(file);

        assertEquals(2, table.rowCount());
        assertEquals(LocalDate.of(2024, 5, 1), table.cell(0, "date"));
        assertEquals(60.0, table.cell(0, "temp_avg"));
        assertNull(table.cell(1, "temp_avg"));
        assertEquals(Boolean.TRUE, table.cell(0, "weather_available"));
        assertEquals(Boolean.FALSE, table.cell(1, "weather_available"));
        assertEquals("America/New_York", table.cell(0, "timezone"));
        assertNull(table.cell(0, "empty"));
    }

    @Test
    void readText_shouldKeepCellsVerbatim() throws Exception {
        Path file = dir.resolve("raw.csv");
        Files.writeString(file, "city,date,code\nChicago,2024-05-01,01\n", StandardCharsets.UTF_8);

        FlatTable table = FlatTableCsv.readText(file);

        assertEquals("01", table.cell(0, "code"));
        assertEquals("2024-05-01", table.cell(0, "date"));
    }

    @Test
    void writeThenRead_shouldPreserveValues() throws Exception {
        FlatTable table = FlatTable.builder(List.of("date", "lat", "weather_available"))
                .addRow(Arrays.asList(LocalDate.of(2024, 5, 1), 40.7128, true))
                .build();
        Path file = dir.resolve("roundtrip.csv");

        FlatTableCsv.write(table, file);
        FlatTable read = FlatTableCsv.read(file);

        assertEquals(table.row(0), read.row(0));
    }
}
