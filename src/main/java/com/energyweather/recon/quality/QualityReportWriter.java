package com.energyweather.recon.quality;

import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Serializes a {@link QualityReport} to JSON with top-level keys
 * {@code dataset_info}, {@code missing_values}, {@code outliers} and {@code freshness}.
 */
public final class QualityReportWriter {
    private static final int INDENT = 2;

    public JSONObject toJson(QualityReport report) {
        JSONObject root = new JSONObject();

        JSONObject info = new JSONObject();
        info.put("rows", report.datasetInfo.rows);
        info.put("columns", report.datasetInfo.columns);
        info.put("column_names", new JSONArray(report.datasetInfo.columnNames));
        root.put("dataset_info", info);

        JSONObject missing = new JSONObject();
        for (Map.Entry<String, Integer> entry : report.missingValues.entrySet()) {
            missing.put(entry.getKey(), entry.getValue().intValue());
        }
        root.put("missing_values", missing);

        JSONObject outliers = new JSONObject();
        for (Map.Entry<String, OutlierEntry> entry : report.outliers.entrySet()) {
            JSONObject o = new JSONObject();
            o.put("rule_based", entry.getValue().ruleBased.value());
            o.put("iqr", entry.getValue().iqr.value());
            outliers.put(entry.getKey(), o);
        }
        root.put("outliers", outliers);

        Freshness f = report.freshness;
        JSONObject freshness = new JSONObject();
        freshness.put("is_fresh", f.fresh);
        if (f.hasError()) {
            freshness.put("error", f.error);
        } else {
            freshness.put("latest_date", f.latestDate);
            freshness.put("days_ago", f.daysAgo.longValue());
            freshness.put("threshold_days", f.thresholdDays);
        }
        root.put("freshness", freshness);
        return root;
    }

    public String toJsonString(QualityReport report) {
        return toJson(report).toString(INDENT);
    }

    public void write(QualityReport report, Path target) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Files.writeString(target, toJsonString(report) + "\n", StandardCharsets.UTF_8);
    }
}
