package com.energyweather.recon.ingest;

import com.energyweather.recon.city.CityNormalizer;
import com.energyweather.recon.model.FileRejection;
import com.energyweather.recon.model.Kind;
import com.energyweather.recon.model.ParseResult;
import com.energyweather.recon.model.RawRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordParserTest {

    private final RecordParser parser = new RecordParser(new CityNormalizer());

    @Test
    void parseCsv_shouldNormalizeCityAndDemand() {
        String csv = "date,value,respondent-name\n"
                + "2024-05-01,20000,NYIS\n"
                + "2024-05-02,,NYIS\n"
                + "2024-05-03,abc,NYIS\n"
                + "not-a-date,1,NYIS\n";

        ParseResult result = parser.parse("energy_new york _2024-05-01_2024-05-03.csv", csv);

        assertTrue(result.success);
        assertEquals(Kind.ENERGY, result.kind);
        assertEquals("New York", result.city);
        assertEquals(2, result.records.size());
        assertEquals(2, result.droppedRows);

        RawRecord first = result.records.get(0);
        assertEquals("New York", first.city);
        assertEquals(LocalDate.of(2024, 5, 1), first.date);
        assertEquals(20000.0, first.value("energy_demand_MW"));
        assertEquals("NYIS", first.value("respondent_name"));
        assertNull(result.records.get(1).value("energy_demand_MW"));
    }

    @Test
    void parseJson_shouldIngestNothingFromEnvelopeWithoutDate() {
        String json = "{\"response\":{\"data\":["
                + "{\"period\":\"2024-05-01\",\"value\":20000,\"respondent\":\"NYIS\"},"
                + "{\"period\":\"2024-05-02\",\"value\":21000,\"respondent\":\"NYIS\"}"
                + "]}}";

        ParseResult result = parser.parse("energy_NYIS_2024-05-01_2024-05-02.json", json);

        assertTrue(result.success);
        assertTrue(result.records.isEmpty());
        assertEquals(2, result.droppedRows);
    }

    @Test
    void parseJson_shouldReadEnvelopeRowsByDateOnly() {
        String json = "{\"response\":{\"data\":["
                + "{\"date\":\"2024-05-01\",\"value\":\"21000\"},"
                + "{\"date\":\"n/a\",\"period\":\"2024-05-02\",\"value\":22000}"
                + "]}}";

        ParseResult result = parser.parse("energy_New York_2024-05-01_2024-05-02.json", json);

        assertTrue(result.success);
        assertEquals(1, result.records.size());
        assertEquals(1, result.droppedRows);
        assertEquals(LocalDate.of(2024, 5, 1), result.records.get(0).date);
        assertEquals(21000.0, result.records.get(0).value("energy_demand_MW"));
    }

    @Test
    void parseCsv_shouldFallBackToPeriodWhenDateUnusable() {
        String csv = "date,period,value\n"
                + "n/a,2024-05-01T05,21000\n"
                + ",2024-05-02T05,22000\n";

        ParseResult result = parser.parse("energy_chicago_2024-05-01_2024-05-02.csv", csv);

        assertTrue(result.success);
        assertEquals(2, result.records.size());
        assertEquals(LocalDate.of(2024, 5, 1), result.records.get(0).date);
        assertEquals(22000.0, result.records.get(1).value("energy_demand_MW"));
    }

    @Test
    void parseWeather_shouldMapColumnsAndAttachTimezone() {
        String json = "[{\"date\":\"2024-05-01\",\"TMAX\":70,\"TMIN\":50,\"PRCP\":0.1}]";

        ParseResult result = parser.parse("weather_new york_2024-05-01_2024-05-02.json", json);

        assertTrue(result.success);
        RawRecord record = result.records.get(0);
        assertEquals(70.0, record.value("temp_max_F"));
        assertEquals(50.0, record.value("temp_min_F"));
        assertEquals(0.1, (Double) record.value("precipitation"), 1e-9);
        assertEquals("America/New_York", record.value("timezone"));
    }

    @Test
    void parse_shouldRejectRawApiResults() {
        ParseResult result = parser.parse("weather_Seattle_2024-05-01.json", "{\"results\":[{\"date\":\"2024-05-01\"}]}");

        assertFalse(result.success);
        assertEquals(FileRejection.Reason.UNRECOGNIZED_STRUCTURE, result.rejection.reason);
    }

    @Test
    void parse_shouldRejectMalformedJson() {
        ParseResult result = parser.parse("weather_Seattle_2024-05-01.json", "{not json");

        assertFalse(result.success);
        assertEquals(FileRejection.Reason.UNRECOGNIZED_STRUCTURE, result.rejection.reason);
    }

    @Test
    void parse_shouldRejectFilesWithoutUsableDate() {
        ParseResult result = parser.parse("energy_Chicago_2024-05-01.csv", "foo,value\n1,2\n");

        assertFalse(result.success);
        assertEquals(FileRejection.Reason.NO_USABLE_DATE, result.rejection.reason);
    }

    @Test
    void parse_shouldRejectBadNamesAndTypes() {
        assertEquals(FileRejection.Reason.UNPARSEABLE_FILENAME,
                parser.parse("readme.csv", "date\n2024-05-01\n").rejection.reason);
        assertEquals(FileRejection.Reason.UNSUPPORTED_TYPE,
                parser.parse("energy_Chicago_2024-05-01.txt", "date\n2024-05-01\n").rejection.reason);
    }

    @Test
    void parsePath_shouldStripBomAndReadFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("energy_houston_2024-05-01_2024-05-01.csv");
        Files.writeString(file, "\uFEFFdate,demand\n2024-05-01,\"1,500\"\n", StandardCharsets.UTF_8);

        ParseResult result = parser.parse(file);

        assertTrue(result.success);
        assertEquals("Houston", result.city);
        assertEquals(1500.0, result.records.get(0).value("energy_demand_MW"));
    }

    @Test
    void parsePath_shouldReportUnreadableFile(@TempDir Path dir) {
        ParseResult result = parser.parse(dir.resolve("energy_houston_2024-05-01.csv"));

        assertFalse(result.success);
        assertEquals(FileRejection.Reason.UNREADABLE_FILE, result.rejection.reason);
    }
}
