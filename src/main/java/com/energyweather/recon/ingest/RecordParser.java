package com.energyweather.recon.ingest;

import com.energyweather.recon.city.CityNormalizer;
import com.energyweather.recon.model.FileNameMatch;
import com.energyweather.recon.model.FileRejection;
import com.energyweather.recon.model.Kind;
import com.energyweather.recon.model.ParseResult;
import com.energyweather.recon.model.RawRecord;
import com.energyweather.utils.Cells;
import com.energyweather.utils.DateParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模块说明：RecordParser（class）。
 * 主要职责：把一个原始文件（CSV 或 JSON）解析为带 kind、城市与日历日期的规范化记录。
 * 使用建议：文件级失败返回 rejected 结果而不是抛异常，调用方继续处理其余文件。
 */
public final class RecordParser {
    private static final Logger LOG = LogManager.getLogger(RecordParser.class);

    static final String DATE_COLUMN = "date";
    static final String PERIOD_COLUMN = "period";
    static final String CITY_COLUMN = "city";
    static final String TIMEZONE_COLUMN = "timezone";

    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .setTrim(true)
            .build();

    private final FileNameParser fileNameParser;
    private final CityNormalizer cityNormalizer;

    public RecordParser(CityNormalizer cityNormalizer) {
        this(new FileNameParser(), cityNormalizer);
    }

    public RecordParser(FileNameParser fileNameParser, CityNormalizer cityNormalizer) {
        this.fileNameParser = fileNameParser;
        this.cityNormalizer = cityNormalizer;
    }

    public ParseResult parse(Path file) {
        String fileName = file.getFileName() == null ? file.toString() : file.getFileName().toString();
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Skipping {}: cannot read file ({})", fileName, e.getMessage());
            return ParseResult.rejected(fileName, FileRejection.Reason.UNREADABLE_FILE, e.getMessage());
        }
        return parse(fileName, content);
    }

    public ParseResult parse(String fileName, String content) {
        FileNameMatch match = fileNameParser.parse(fileName);
        if (!match.matched) {
            LOG.warn("Skipping {}: unable to extract kind/city/date from file name", fileName);
            return ParseResult.rejected(fileName, FileRejection.Reason.UNPARSEABLE_FILENAME, match.reason);
        }

        String ext = FileNameParser.extension(fileName);
        String body = stripBom(content == null ? "" : content);
        List<Map<String, Object>> rawRows;
        List<String> header;
        if ("json".equals(ext)) {
            rawRows = readJsonRows(body);
            if (rawRows == null) {
                LOG.warn("Skipping {}: unrecognized JSON structure", fileName);
                return ParseResult.rejected(fileName, FileRejection.Reason.UNRECOGNIZED_STRUCTURE,
                        "expected a list of objects or response.data");
            }
            header = collectHeader(rawRows);
        } else if ("csv".equals(ext)) {
            try {
                header = new ArrayList<>();
                rawRows = readCsvRows(body, header);
            } catch (IOException | RuntimeException e) {
                LOG.warn("Skipping {}: malformed CSV ({})", fileName, e.getMessage());
                return ParseResult.rejected(fileName, FileRejection.Reason.UNRECOGNIZED_STRUCTURE, e.getMessage());
            }
        } else {
            LOG.warn("Skipping unsupported file type: {}", fileName);
            return ParseResult.rejected(fileName, FileRejection.Reason.UNSUPPORTED_TYPE, ext);
        }

        Kind kind = match.kind;
        String city = CityNormalizer.normalize(match.cityToken);
        String dateSource;
        if ("json".equals(ext)) {
            // JSON rows carry their own date; rows without one are dropped below.
            dateSource = DATE_COLUMN;
            if (!header.contains(DATE_COLUMN)) {
                LOG.info("{}: no 'date' field in JSON rows, nothing to ingest", fileName);
            }
        } else {
            dateSource = chooseDateColumn(header, rawRows);
            if (dateSource == null) {
                LOG.warn("Skipping {}: missing usable 'date' and 'period'", fileName);
                return ParseResult.rejected(fileName, FileRejection.Reason.NO_USABLE_DATE, "columns=" + header);
            }
            if (PERIOD_COLUMN.equals(dateSource)) {
                LOG.info("Using 'period' as fallback for 'date' in {}", fileName);
            }
        }

        SchemaMapping mapping = SchemaMapping.forKind(kind);
        List<String> valueColumns = new ArrayList<>();
        for (String column : header) {
            if (DATE_COLUMN.equals(column) || CITY_COLUMN.equals(column) || dateSource.equals(column)) {
                continue;
            }
            valueColumns.add(column);
        }
        Map<String, String> columnMapping = mapping.mapColumns(valueColumns);
        if (kind == Kind.ENERGY && !columnMapping.containsValue("energy_demand_MW")) {
            LOG.warn("No demand column found in {}. Available columns: {}", fileName, header);
        }

        String timezone = cityNormalizer.resolve(city).timezone();
        List<RawRecord> records = new ArrayList<>(rawRows.size());
        int dropped = 0;
        for (Map<String, Object> raw : rawRows) {
            LocalDate date = DateParsing.parseDate(raw.get(dateSource));
            if (date == null) {
                dropped++;
                continue;
            }
            Map<String, Object> values = normalizeValues(kind, mapping.apply(raw, columnMapping));
            if (values == null) {
                dropped++;
                continue;
            }
            if (kind == Kind.WEATHER) {
                values.put(TIMEZONE_COLUMN, timezone);
            }
            records.add(new RawRecord(kind, city, date, values));
        }

        if (dropped > 0) {
            LOG.info("{}: dropped {} row(s) with unparseable date or non-numeric values", fileName, dropped);
        }
        LOG.info("Parsed {} kind={} city={} rows={}", fileName, kind.prefix(), city, records.size());
        return ParseResult.parsed(fileName, kind, city, records, dropped);
    }

    /**
     * Canonical numeric columns become {@link Double} (null when empty); everything else is text.
     * Returns null when a canonical numeric cell holds non-numeric text.
     */
    private Map<String, Object> normalizeValues(Kind kind, Map<String, Object> mapped) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : mapped.entrySet()) {
            String column = entry.getKey();
            Object raw = entry.getValue();
            if (kind.numericColumns().contains(column)) {
                try {
                    out.put(column, Cells.parseNumber(raw));
                } catch (NumberFormatException e) {
                    return null;
                }
            } else {
                out.put(column, raw == null ? null : String.valueOf(raw));
            }
        }
        return out;
    }

    private String chooseDateColumn(List<String> header, List<Map<String, Object>> rows) {
        if (header.contains(DATE_COLUMN) && anyParseable(rows, DATE_COLUMN)) {
            return DATE_COLUMN;
        }
        if (header.contains(PERIOD_COLUMN) && anyParseable(rows, PERIOD_COLUMN)) {
            return PERIOD_COLUMN;
        }
        return null;
    }

    private boolean anyParseable(List<Map<String, Object>> rows, String column) {
        for (Map<String, Object> row : rows) {
            if (DateParsing.parseDate(row.get(column)) != null) {
                return true;
            }
        }
        return false;
    }

    private List<Map<String, Object>> readJsonRows(String body) {
        Object root;
        try {
            root = new JSONTokener(body).nextValue();
        } catch (JSONException e) {
            return null;
        }
        JSONArray array = null;
        if (root instanceof JSONArray list) {
            array = list;
        } else if (root instanceof JSONObject obj) {
            JSONObject response = obj.optJSONObject("response");
            if (response != null) {
                array = response.optJSONArray("data");
            }
        }
        if (array == null) {
            return null;
        }
        List<Map<String, Object>> rows = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item == null) {
                return null;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (String key : item.keySet()) {
                Object value = item.opt(key);
                row.put(key, JSONObject.NULL.equals(value) ? null : value);
            }
            rows.add(row);
        }
        return rows;
    }

    private List<Map<String, Object>> readCsvRows(String body, List<String> headerOut) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (CSVParser parser = CSV_FORMAT.parse(new StringReader(body))) {
            for (String name : parser.getHeaderNames()) {
                if (name != null && !name.trim().isEmpty() && !headerOut.contains(name.trim())) {
                    headerOut.add(name.trim());
                }
            }
            for (CSVRecord record : parser) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (String name : headerOut) {
                    String value = record.isSet(name) ? record.get(name) : null;
                    row.put(name, value == null || value.isEmpty() ? null : value);
                }
                rows.add(row);
            }
        }
        return rows;
    }

    private List<String> collectHeader(List<Map<String, Object>> rows) {
        Set<String> header = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            header.addAll(row.keySet());
        }
        return new ArrayList<>(header);
    }

    private static String stripBom(String content) {
        return !content.isEmpty() && content.charAt(0) == '\uFEFF' ? content.substring(1) : content;
    }
}
