package com.energyweather.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Step timings and file/row counters of one pipeline run, rendered as a plain-text summary.
 */
public final class RunTelemetry {
    public static final String STEP_SCAN = "SCAN";
    public static final String STEP_PARSE = "PARSE";
    public static final String STEP_MERGE_ENERGY = "MERGE_ENERGY";
    public static final String STEP_MERGE_WEATHER = "MERGE_WEATHER";
    public static final String STEP_JOIN = "JOIN";
    public static final String STEP_QUALITY = "QUALITY";

    private final String runId;
    private final String trigger;
    private final Clock clock;
    private final Instant startedAt;
    private Instant finishedAt;
    private String status = "RUNNING";

    private int filesScanned;
    private int filesParsed;
    private int filesRejected;
    private int rowsDropped;
    private long errorsTotal;

    private final Map<String, Step> steps = new LinkedHashMap<>();
    private final Map<String, Long> openSince = new HashMap<>();

    public RunTelemetry(String runId, String trigger, Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.runId = orDefault(runId, "run");
        this.trigger = orDefault(trigger, "manual");
        this.startedAt = this.clock.instant();
    }

    public synchronized void startStep(String name) {
        String key = stepKey(name);
        steps.computeIfAbsent(key, Step::new);
        openSince.put(key, System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, null);
    }

    /** Closes the step opened by {@link #startStep}; counts accumulate when a step runs more than once. */
    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount, String note) {
        String key = stepKey(name);
        Long since = openSince.remove(key);
        long elapsedMs = since == null ? 0L : (System.nanoTime() - since) / 1_000_000L;
        steps.computeIfAbsent(key, Step::new).add(elapsedMs, itemsIn, itemsOut, errorCount, note);
        errorsTotal += Math.max(0L, errorCount);
    }

    public synchronized void recordFiles(int scanned, int parsed, int rejected) {
        filesScanned = Math.max(0, scanned);
        filesParsed = Math.max(0, parsed);
        filesRejected = Math.max(0, rejected);
    }

    public synchronized void addRowsDropped(int count) {
        rowsDropped += Math.max(0, count);
    }

    public synchronized void finish(String finalStatus) {
        if (finishedAt == null) {
            finishedAt = clock.instant();
        }
        status = orDefault(finalStatus, "COMPLETED");
    }

    public synchronized long totalElapsedMs() {
        return Math.max(0L, Duration.between(startedAt, endInstant()).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>(steps.size());
        steps.values().forEach(step -> out.add(step.toRecord()));
        return out;
    }

    public synchronized String getSummary() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("run_id", runId);
        fields.put("trigger", trigger);
        fields.put("status", status);
        fields.put("started_at", DateTimeFormatter.ISO_INSTANT.format(startedAt));
        fields.put("finished_at", DateTimeFormatter.ISO_INSTANT.format(endInstant()));
        fields.put("total_elapsed_ms", totalElapsedMs());
        fields.put("files_scanned", filesScanned);
        fields.put("files_parsed", filesParsed);
        fields.put("files_rejected", filesRejected);
        fields.put("rows_dropped", rowsDropped);
        fields.put("errors_total", errorsTotal);

        StringBuilder sb = new StringBuilder();
        fields.forEach((key, value) -> sb.append(key).append('=').append(value).append('\n'));
        sb.append("steps:");
        for (Step step : steps.values()) {
            sb.append('\n').append("  ").append(step.describe());
        }
        return sb.toString();
    }

    private Instant endInstant() {
        return finishedAt == null ? clock.instant() : finishedAt;
    }

    private static String stepKey(String name) {
        String trimmed = name == null ? "" : name.trim();
        return trimmed.isEmpty() ? "UNKNOWN_STEP" : trimmed.toUpperCase(Locale.ROOT);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static final class Step {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private final List<String> notes = new ArrayList<>();

        private Step(String name) {
            this.name = name;
        }

        private void add(long elapsed, long in, long out, long errors, String note) {
            elapsedMs += Math.max(0L, elapsed);
            itemsIn += Math.max(0L, in);
            itemsOut += Math.max(0L, out);
            errorCount += Math.max(0L, errors);
            if (note != null && !note.isBlank()) {
                notes.add(note.trim());
            }
        }

        private String note() {
            return String.join("; ", notes);
        }

        private String describe() {
            String line = String.format(Locale.ROOT, "%s elapsed_ms=%d in=%d out=%d err=%d",
                    name, elapsedMs, itemsIn, itemsOut, errorCount);
            return notes.isEmpty() ? line : line + " note=" + note();
        }

        private StepRecord toRecord() {
            return new StepRecord(name, elapsedMs, itemsIn, itemsOut, errorCount, note());
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String note
    ) {
    }
}
