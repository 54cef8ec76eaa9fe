package com.energyweather.recon.runner;

import com.energyweather.core.RunTelemetry;
import com.energyweather.recon.city.CityNormalizer;
import com.energyweather.recon.config.Config;
import com.energyweather.recon.ingest.IngestOrder;
import com.energyweather.recon.ingest.RawFileScanner;
import com.energyweather.recon.ingest.RecordParser;
import com.energyweather.recon.join.JoinEngine;
import com.energyweather.recon.join.JoinMode;
import com.energyweather.recon.model.FileRejection;
import com.energyweather.recon.model.FlatTable;
import com.energyweather.recon.model.JoinedRow;
import com.energyweather.recon.model.Kind;
import com.energyweather.recon.model.MergeResult;
import com.energyweather.recon.model.ParseResult;
import com.energyweather.recon.model.PipelineRunOutcome;
import com.energyweather.recon.model.RawRecord;
import com.energyweather.recon.model.RunStatus;
import com.energyweather.recon.quality.InvalidReportInputException;
import com.energyweather.recon.quality.QualityReport;
import com.energyweather.recon.quality.QualityReportGenerator;
import com.energyweather.recon.quality.QualityReportWriter;
import com.energyweather.recon.store.FlatTableCsv;
import com.energyweather.recon.store.MasterStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：PipelineRunner（class）。
 * 主要职责：串联一次完整批处理：扫描原始文件、解析、按 kind 合并主表并落盘快照、能源与天气连接、生成质量报告。
 * 使用建议：单文件或单行错误只记录并计数，不中断运行；只有快照与输出写入失败、或配置非法时抛出 PipelineException。
 */
public final class PipelineRunner {
    private static final Logger LOG = LogManager.getLogger(PipelineRunner.class);

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy_MM_dd");
    private static final DateTimeFormatter RUN_ID = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Config config;
    private final Clock clock;
    private final CityNormalizer cityNormalizer;
    private final RecordParser recordParser;
    private final JoinEngine joinEngine;
    private final QualityReportGenerator qualityReportGenerator;
    private final QualityReportWriter qualityReportWriter;
    private RunTelemetry lastTelemetry;

    public PipelineRunner(Config config) {
        this(config, Clock.systemUTC(), new CityNormalizer());
    }

    public PipelineRunner(Config config, Clock clock, CityNormalizer cityNormalizer) {
        this.config = config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.cityNormalizer = cityNormalizer == null ? new CityNormalizer() : cityNormalizer;
        this.recordParser = new RecordParser(this.cityNormalizer);
        this.joinEngine = new JoinEngine(this.cityNormalizer);
        this.qualityReportGenerator = new QualityReportGenerator(this.clock);
        this.qualityReportWriter = new QualityReportWriter();
    }

    public RunTelemetry lastTelemetry() {
        return lastTelemetry;
    }

    public PipelineRunOutcome run() throws PipelineException {
        IngestOrder order;
        JoinMode joinMode;
        ZoneId reportZone;
        try {
            order = IngestOrder.parse(config.getString("ingest.order"));
            joinMode = JoinMode.parse(config.getString("join.mode"));
            reportZone = ZoneId.of(config.getString("report.date_zone", "UTC"));
        } catch (RuntimeException e) {
            throw new PipelineException("invalid configuration: " + e.getMessage(), e);
        }

        Path rawDir = config.getPath("paths.raw_dir");
        Path processedDir = config.getPath("paths.processed_dir");
        Path reportDir = config.getPath("paths.report_dir");
        String stamp = STAMP.format(LocalDate.now(clock.withZone(reportZone)));

        RunTelemetry telemetry = new RunTelemetry(
                RUN_ID.format(clock.instant().atZone(reportZone)), "manual", clock);
        this.lastTelemetry = telemetry;
        LOG.info("Pipeline start raw_dir={} processed_dir={} report_dir={} order={} join={}",
                rawDir, processedDir, reportDir, order, joinMode);

        try {
            PipelineRunOutcome outcome = execute(telemetry, order, joinMode, rawDir, processedDir, reportDir, stamp);
            telemetry.finish(outcome.status.name());
            return outcome;
        } catch (PipelineException e) {
            telemetry.finish("FAILED");
            throw e;
        } finally {
            LOG.info("Run summary\n{}", telemetry.getSummary());
        }
    }

    private PipelineRunOutcome execute(
            RunTelemetry telemetry,
            IngestOrder order,
            JoinMode joinMode,
            Path rawDir,
            Path processedDir,
            Path reportDir,
            String stamp
    ) throws PipelineException {
        telemetry.startStep(RunTelemetry.STEP_SCAN);
        List<Path> files;
        try {
            files = new RawFileScanner(order, config.getList("ingest.extensions")).scan(rawDir);
        } catch (IOException | UncheckedIOException e) {
            telemetry.endStep(RunTelemetry.STEP_SCAN, 0, 0, 1, e.getMessage());
            throw new PipelineException("failed to scan " + rawDir, e);
        }
        telemetry.endStep(RunTelemetry.STEP_SCAN, files.size(), files.size(), 0);

        telemetry.startStep(RunTelemetry.STEP_PARSE);
        Map<Kind, List<RawRecord>> batches = new EnumMap<>(Kind.class);
        for (Kind kind : Kind.values()) {
            batches.put(kind, new ArrayList<>());
        }
        List<FileRejection> rejections = new ArrayList<>();
        int parsed = 0;
        int rowsDropped = 0;
        for (Path file : files) {
            ParseResult result = recordParser.parse(file);
            if (!result.success) {
                rejections.add(result.rejection);
                continue;
            }
            parsed++;
            rowsDropped += result.droppedRows;
            batches.get(result.kind).addAll(result.records);
        }
        telemetry.recordFiles(files.size(), parsed, rejections.size());
        telemetry.addRowsDropped(rowsDropped);
        telemetry.endStep(RunTelemetry.STEP_PARSE, files.size(), parsed, rejections.size(),
                "rows_dropped=" + rowsDropped);

        if (parsed == 0) {
            LOG.info("No parseable raw files under {} (scanned={} rejected={}), nothing to do",
                    rawDir, files.size(), rejections.size());
            return PipelineRunOutcome.nothingToDo(files.size(), rejections);
        }

        telemetry.startStep(RunTelemetry.STEP_MERGE_ENERGY);
        MergedKind energyResult = mergeKind(Kind.ENERGY, batches.get(Kind.ENERGY), processedDir, stamp);
        MasterStore energy = energyResult.store();
        MergeResult energyMerge = energyResult.merge();
        telemetry.endStep(RunTelemetry.STEP_MERGE_ENERGY, energyMerge.incoming(), energy.size(), 0);

        telemetry.startStep(RunTelemetry.STEP_MERGE_WEATHER);
        MergedKind weatherResult = mergeKind(Kind.WEATHER, batches.get(Kind.WEATHER), processedDir, stamp);
        MasterStore weather = weatherResult.store();
        MergeResult weatherMerge = weatherResult.merge();
        telemetry.endStep(RunTelemetry.STEP_MERGE_WEATHER, weatherMerge.incoming(), weather.size(), 0);

        telemetry.startStep(RunTelemetry.STEP_JOIN);
        Path mergedPath = null;
        int mergedRows = 0;
        boolean joinable = joinMode == JoinMode.LEFT_ON_ENERGY
                ? !energy.isEmpty()
                : !energy.isEmpty() && !weather.isEmpty();
        if (joinable) {
            List<JoinedRow> joined = joinEngine.join(energy.rows(), weather.rows(), joinMode);
            mergedRows = joined.size();
            mergedPath = processedDir.resolve("processed_merged_data_" + stamp + ".csv");
            writeTable(JoinEngine.toTable(joined), mergedPath);
            LOG.info("Merged data saved to {} rows={}", mergedPath, mergedRows);
        } else {
            LOG.info("Skipping merge, mode={} energy rows={} weather rows={}", joinMode, energy.size(), weather.size());
        }
        telemetry.endStep(RunTelemetry.STEP_JOIN, energy.size() + weather.size(), mergedRows, 0,
                "mode=" + joinMode);

        telemetry.startStep(RunTelemetry.STEP_QUALITY);
        Map<Kind, Path> reportPaths = new EnumMap<>(Kind.class);
        writeReport(Kind.WEATHER, weather, reportDir, stamp, reportPaths);
        writeReport(Kind.ENERGY, energy, reportDir, stamp, reportPaths);
        telemetry.endStep(RunTelemetry.STEP_QUALITY, 2, reportPaths.size(), 0);

        return new PipelineRunOutcome(
                RunStatus.COMPLETED,
                files.size(),
                parsed,
                rejections,
                rowsDropped,
                energyMerge,
                weatherMerge,
                energy.size(),
                weather.size(),
                mergedRows,
                mergedPath,
                reportPaths
        );
    }

    private MergedKind mergeKind(Kind kind, List<RawRecord> batch, Path processedDir, String stamp)
            throws PipelineException {
        Path masterPath = processedDir.resolve(kind.prefix() + "_master.csv");
        MasterStore store;
        try {
            store = MasterStore.load(kind, masterPath, cityNormalizer);
        } catch (IOException | UncheckedIOException e) {
            throw new PipelineException("failed to read " + kind.prefix() + " master " + masterPath, e);
        }
        MergeResult merge = store.merge(batch);
        if (batch.isEmpty()) {
            LOG.info("No valid {} data files found", kind.prefix());
        }

        Path backup = processedDir.resolve("backup_" + kind.prefix() + ".csv");
        try {
            if (!batch.isEmpty()) {
                store.snapshot();
                if (config.getBoolean("processed.write_dated_copy", true)) {
                    Path dated = processedDir.resolve("processed_" + kind.prefix() + "_data_" + stamp + ".csv");
                    store.snapshotTo(dated);
                }
            }
            if (!store.isEmpty() && config.getBoolean("processed.write_backup", true)) {
                store.snapshotTo(backup);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new PipelineException("failed to write " + kind.prefix() + " snapshot under " + processedDir, e);
        }
        return new MergedKind(store, merge);
    }

    private void writeReport(Kind kind, MasterStore store, Path reportDir, String stamp, Map<Kind, Path> out)
            throws PipelineException {
        if (store.isEmpty()) {
            LOG.info("No {} data to check quality", kind.prefix());
            return;
        }
        FlatTable table = store.toTable();
        List<String> temperatureColumns = new ArrayList<>(config.getList("quality.temperature_columns"));
        int threshold;
        if (kind == Kind.ENERGY) {
            temperatureColumns.removeIf(column -> !table.hasColumn(column));
            threshold = config.getInt("quality.freshness.energy_days",
                    config.getInt("quality.freshness.default_days", QualityReportGenerator.DEFAULT_FRESHNESS_DAYS));
        } else {
            threshold = config.getInt("quality.freshness.weather_days",
                    config.getInt("quality.freshness.default_days", QualityReportGenerator.DEFAULT_FRESHNESS_DAYS));
        }

        QualityReport report;
        try {
            report = qualityReportGenerator.report(
                    table,
                    temperatureColumns,
                    config.getString("quality.demand_column", "energy_demand_MW"),
                    config.getString("quality.date_column", "date"),
                    threshold
            );
        } catch (InvalidReportInputException e) {
            throw new PipelineException(kind.prefix() + " quality report rejected its input: " + e.getMessage(), e);
        }

        Path target = reportDir.resolve("quality_report_" + kind.prefix() + "_" + stamp + ".json");
        try {
            qualityReportWriter.write(report, target);
        } catch (IOException e) {
            throw new PipelineException("failed to write quality report " + target, e);
        }
        out.put(kind, target);
        LOG.info("{} quality report saved to {}", kind.prefix(), target);
    }

    private void writeTable(FlatTable table, Path target) throws PipelineException {
        try {
            FlatTableCsv.write(table, target);
        } catch (IOException | UncheckedIOException e) {
            throw new PipelineException("failed to write " + target, e);
        }
    }

    private record MergedKind(MasterStore store, MergeResult merge) {
    }
}
