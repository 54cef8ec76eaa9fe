package com.energyweather.recon.quality;

import com.energyweather.recon.model.FlatTable;
import com.energyweather.utils.Cells;
import com.energyweather.utils.DateParsing;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模块说明：QualityReportGenerator（class）。
 * 主要职责：对一个 FlatTable 统计缺失值、规则阈值与 IQR 异常值、以及最新日期的新鲜度。
 * 使用建议：时钟通过构造函数注入，测试中使用固定时钟；入参违反约定时直接抛出 InvalidReportInputException。
 */
public final class QualityReportGenerator {
    private static final Logger LOG = LogManager.getLogger(QualityReportGenerator.class);

    public static final int DEFAULT_FRESHNESS_DAYS = 2;
    static final double TEMPERATURE_MAX_F = 130.0;
    static final double TEMPERATURE_MIN_F = -50.0;
    static final double DEMAND_MIN = 0.0;
    static final double IQR_FACTOR = 1.5;

    private static final long SECONDS_PER_DAY = 86_400L;

    private final Clock clock;

    public QualityReportGenerator() {
        this(Clock.systemUTC());
    }

    public QualityReportGenerator(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public QualityReport report(FlatTable table, List<String> temperatureColumns, String demandColumn, String dateColumn) {
        return report(table, temperatureColumns, demandColumn, dateColumn, DEFAULT_FRESHNESS_DAYS);
    }

    public QualityReport report(
            FlatTable table,
            List<String> temperatureColumns,
            String demandColumn,
            String dateColumn,
            int freshnessThresholdDays
    ) {
        if (table == null) {
            throw new InvalidReportInputException("table must not be null");
        }
        if (temperatureColumns == null) {
            throw new InvalidReportInputException("temperatureColumns must not be null");
        }
        if (demandColumn == null || demandColumn.trim().isEmpty()) {
            throw new InvalidReportInputException("demandColumn must not be blank");
        }
        if (dateColumn == null || dateColumn.trim().isEmpty()) {
            throw new InvalidReportInputException("dateColumn must not be blank");
        }
        if (freshnessThresholdDays < 0) {
            throw new InvalidReportInputException("freshnessThresholdDays must be >= 0, got " + freshnessThresholdDays);
        }

        DatasetInfo info = new DatasetInfo(table.rowCount(), table.columnCount(), table.columns());
        Map<String, Integer> missing = missingValues(table);

        Map<String, OutlierEntry> outliers = new LinkedHashMap<>();
        Set<String> temperatures = new LinkedHashSet<>();
        for (String column : temperatureColumns) {
            if (column != null && !column.trim().isEmpty()) {
                temperatures.add(column);
            }
        }
        for (String column : temperatures) {
            outliers.put(column, outliersFor(table, column, true));
        }
        outliers.put(demandColumn, outliersFor(table, demandColumn, false));

        Freshness freshness = freshness(table, dateColumn, freshnessThresholdDays);
        LOG.info("Quality report rows={} columns={} fresh={}", info.rows, info.columns, freshness.fresh);
        return new QualityReport(info, missing, outliers, freshness);
    }

    private Map<String, Integer> missingValues(FlatTable table) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (String column : table.columns()) {
            int count = 0;
            for (Object cell : table.column(column)) {
                if (Cells.isMissing(cell)) {
                    count++;
                }
            }
            out.put(column, count);
        }
        return out;
    }

    private OutlierEntry outliersFor(FlatTable table, String column, boolean temperature) {
        if (!table.hasColumn(column)) {
            return OutlierEntry.sentinel("Column not found");
        }
        List<Double> values = numericValues(table.column(column));
        if (values == null) {
            return OutlierEntry.sentinel("Column " + column + " is not numeric");
        }

        int ruleCount = 0;
        for (double v : values) {
            boolean outlier = temperature
                    ? v > TEMPERATURE_MAX_F || v < TEMPERATURE_MIN_F
                    : v < DEMAND_MIN;
            if (outlier) {
                ruleCount++;
            }
        }

        int iqrCount = 0;
        if (!values.isEmpty()) {
            double[] sorted = Percentiles.sorted(values);
            double q1 = Percentiles.quantile(sorted, 0.25);
            double q3 = Percentiles.quantile(sorted, 0.75);
            double iqr = q3 - q1;
            double lower = q1 - IQR_FACTOR * iqr;
            double upper = q3 + IQR_FACTOR * iqr;
            for (double v : sorted) {
                if (v < lower || v > upper) {
                    iqrCount++;
                }
            }
        }
        return new OutlierEntry(OutlierCount.of(ruleCount), OutlierCount.of(iqrCount));
    }

    /** Non-missing values of a column, or null if any of them is not a number. */
    private static List<Double> numericValues(List<Object> cells) {
        List<Double> out = new ArrayList<>(cells.size());
        for (Object cell : cells) {
            if (Cells.isMissing(cell)) {
                continue;
            }
            if (!(cell instanceof Number n)) {
                return null;
            }
            out.add(n.doubleValue());
        }
        return out;
    }

    private Freshness freshness(FlatTable table, String dateColumn, int thresholdDays) {
        if (!table.hasColumn(dateColumn)) {
            return Freshness.unavailable("Column " + dateColumn + " not found", thresholdDays);
        }
        Instant latest = null;
        for (Object cell : table.column(dateColumn)) {
            Instant instant = DateParsing.parseInstant(cell);
            if (instant != null && (latest == null || instant.isAfter(latest))) {
                latest = instant;
            }
        }
        if (latest == null) {
            return Freshness.unavailable("No valid dates in column " + dateColumn, thresholdDays);
        }
        Instant now = clock.instant();
        long daysAgo = Math.floorDiv(Duration.between(latest, now).getSeconds(), SECONDS_PER_DAY);
        return new Freshness(render(latest), daysAgo, daysAgo <= thresholdDays, thresholdDays, null);
    }

    private static String render(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        if (utc.toLocalTime().equals(LocalTime.MIDNIGHT)) {
            return utc.toLocalDate().toString();
        }
        return instant.toString();
    }
}
