package com.energyweather.recon.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public final class PipelineRunOutcome {
    public final RunStatus status;
    public final int filesScanned;
    public final int filesParsed;
    public final List<FileRejection> rejections;
    public final int rowsDropped;
    public final MergeResult energyMerge;
    public final MergeResult weatherMerge;
    public final int energyRows;
    public final int weatherRows;
    public final int mergedRows;
    public final Path mergedPath;
    public final Map<Kind, Path> reportPaths;

    public PipelineRunOutcome(
            RunStatus status,
            int filesScanned,
            int filesParsed,
            List<FileRejection> rejections,
            int rowsDropped,
            MergeResult energyMerge,
            MergeResult weatherMerge,
            int energyRows,
            int weatherRows,
            int mergedRows,
            Path mergedPath,
            Map<Kind, Path> reportPaths
    ) {
        this.status = status;
        this.filesScanned = filesScanned;
        this.filesParsed = filesParsed;
        this.rejections = rejections == null ? List.of() : List.copyOf(rejections);
        this.rowsDropped = rowsDropped;
        this.energyMerge = energyMerge;
        this.weatherMerge = weatherMerge;
        this.energyRows = energyRows;
        this.weatherRows = weatherRows;
        this.mergedRows = mergedRows;
        this.mergedPath = mergedPath;
        this.reportPaths = reportPaths == null ? Map.of() : Map.copyOf(reportPaths);
    }

    public static PipelineRunOutcome nothingToDo(int filesScanned, List<FileRejection> rejections) {
        return new PipelineRunOutcome(
                RunStatus.NOTHING_TO_DO,
                filesScanned,
                0,
                rejections,
                0,
                null,
                null,
                0,
                0,
                0,
                null,
                Map.of()
        );
    }
}
