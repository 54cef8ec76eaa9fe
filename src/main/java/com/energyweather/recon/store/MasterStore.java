package com.energyweather.recon.store;

import com.energyweather.recon.city.CityNormalizer;
import com.energyweather.recon.ingest.SchemaMapping;
import com.energyweather.recon.model.FlatTable;
import com.energyweather.recon.model.Kind;
import com.energyweather.recon.model.MasterRow;
import com.energyweather.recon.model.MergeResult;
import com.energyweather.recon.model.RawRecord;
import com.energyweather.utils.Cells;
import com.energyweather.utils.DateParsing;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模块说明：MasterStore（class）。
 * 主要职责：持有某一 kind 的全部主数据行，每个 (city, date) 至多一行；合并新批次时后写入者整行覆盖先写入者。
 * 使用建议：每次运行 load 一次、merge 一次、snapshot 一次；快照按 (city, date) 排序并以原子替换方式落盘。
 */
public final class MasterStore {
    private static final Logger LOG = LogManager.getLogger(MasterStore.class);

    static final String CITY_COLUMN = "city";
    static final String DATE_COLUMN = "date";

    private static final Comparator<MasterRow> SNAPSHOT_ORDER =
            Comparator.comparing((MasterRow r) -> r.city).thenComparing(r -> r.date);

    private final Kind kind;
    private final Path snapshotPath;
    private final Map<MasterRow.Key, MasterRow> rows = new HashMap<>();
    private final Set<String> extraColumns = new LinkedHashSet<>();

    private MasterStore(Kind kind, Path snapshotPath) {
        this.kind = kind;
        this.snapshotPath = snapshotPath;
    }

    public static MasterStore empty(Kind kind, Path snapshotPath) {
        return new MasterStore(kind, snapshotPath);
    }

    public static MasterStore load(Kind kind, Path snapshotPath) throws IOException {
        return load(kind, snapshotPath, new CityNormalizer());
    }

    /**
     * Loads the snapshot at {@code snapshotPath}. A missing file gives an empty store. Legacy column
     * names are healed with the kind's {@link SchemaMapping}; rows without a usable date are skipped.
     */
    public static MasterStore load(Kind kind, Path snapshotPath, CityNormalizer cityNormalizer) throws IOException {
        MasterStore store = new MasterStore(kind, snapshotPath);
        if (snapshotPath == null || !Files.exists(snapshotPath)) {
            LOG.info("No {} master snapshot at {}, starting empty", kind.prefix(), snapshotPath);
            return store;
        }

        FlatTable table = FlatTableCsv.readText(snapshotPath);
        List<String> valueColumns = new ArrayList<>();
        for (String column : table.columns()) {
            if (!CITY_COLUMN.equals(column) && !DATE_COLUMN.equals(column)) {
                valueColumns.add(column);
            }
        }
        SchemaMapping mapping = SchemaMapping.forKind(kind);
        Map<String, String> columnMapping = mapping.mapColumns(valueColumns);
        for (Map.Entry<String, String> entry : columnMapping.entrySet()) {
            if (!entry.getKey().equals(entry.getValue())) {
                LOG.info("Healing legacy column {} -> {} in {}", entry.getKey(), entry.getValue(), snapshotPath);
            }
        }

        int skipped = 0;
        for (int r = 0; r < table.rowCount(); r++) {
            Map<String, Object> cells = table.rowAsMap(r);
            LocalDate date = DateParsing.parseDate(cells.get(DATE_COLUMN));
            if (date == null) {
                skipped++;
                continue;
            }
            String city = CityNormalizer.normalize((String) cells.get(CITY_COLUMN));
            Map<String, Object> values = store.coerce(mapping.apply(cells, columnMapping));
            if (kind == Kind.WEATHER && values.get("timezone") == null) {
                values.put("timezone", cityNormalizer.resolve(city).timezone());
            }
            store.put(new MasterRow(city, date, values));
        }
        if (skipped > 0) {
            LOG.warn("Skipped {} {} master row(s) without a valid date in {}", skipped, kind.prefix(), snapshotPath);
        }
        LOG.info("Loaded {} master: rows={} from {}", kind.prefix(), store.size(), snapshotPath);
        return store;
    }

    /**
     * Merges a batch in list order. A record whose key already exists replaces the stored row as a
     * whole; records without a date are dropped.
     */
    public MergeResult merge(List<RawRecord> batch) {
        int incoming = batch == null ? 0 : batch.size();
        int dropped = 0;
        int inserted = 0;
        int replaced = 0;
        if (batch != null) {
            for (RawRecord record : batch) {
                if (record.kind != kind) {
                    throw new IllegalArgumentException("cannot merge " + record.kind + " record into " + kind + " master");
                }
                if (record.date == null) {
                    dropped++;
                    continue;
                }
                if (put(MasterRow.from(record))) {
                    replaced++;
                } else {
                    inserted++;
                }
            }
        }
        MergeResult result = new MergeResult(incoming, dropped, inserted, replaced, rows.size());
        LOG.info("Merged {} batch: incoming={} inserted={} replaced={} dropped={} total={}",
                kind.prefix(), incoming, inserted, replaced, dropped, rows.size());
        return result;
    }

    public void snapshot() throws IOException {
        snapshotTo(snapshotPath);
    }

    public void snapshotTo(Path target) throws IOException {
        if (target == null) {
            throw new IllegalStateException(kind.prefix() + " master has no snapshot path");
        }
        FlatTableCsv.write(toTable(), target);
        LOG.info("Wrote {} master snapshot rows={} -> {}", kind.prefix(), rows.size(), target);
    }

    /** Rows sorted by {@code (city, date)}. */
    public List<MasterRow> rows() {
        List<MasterRow> out = new ArrayList<>(rows.values());
        out.sort(SNAPSHOT_ORDER);
        return out;
    }

    public List<String> columns() {
        List<String> columns = new ArrayList<>();
        columns.add(CITY_COLUMN);
        columns.add(DATE_COLUMN);
        columns.addAll(kind.canonicalColumns());
        columns.addAll(extraColumns);
        return columns;
    }

    public FlatTable toTable() {
        List<String> columns = columns();
        FlatTable.Builder builder = FlatTable.builder(columns);
        for (MasterRow row : rows()) {
            Map<String, Object> cells = new LinkedHashMap<>(row.values);
            cells.put(CITY_COLUMN, row.city);
            cells.put(DATE_COLUMN, row.date);
            builder.addRow(cells);
        }
        return builder.build();
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** Returns true when an existing row was replaced. */
    private boolean put(MasterRow row) {
        for (String column : row.values.keySet()) {
            if (!CITY_COLUMN.equals(column) && !DATE_COLUMN.equals(column)
                    && !kind.canonicalColumns().contains(column)) {
                extraColumns.add(column);
            }
        }
        return rows.put(row.key(), row) != null;
    }

    private Map<String, Object> coerce(Map<String, Object> mapped) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : mapped.entrySet()) {
            String column = entry.getKey();
            Object raw = entry.getValue();
            if (kind.numericColumns().contains(column)) {
                try {
                    out.put(column, Cells.parseNumber(raw));
                } catch (NumberFormatException e) {
                    LOG.warn("Non-numeric {} value '{}' in {} master, stored as empty", column, raw, kind.prefix());
                    out.put(column, null);
                }
            } else {
                out.put(column, raw);
            }
        }
        return out;
    }
}
