package com.energyweather.recon.model;

import java.util.List;

/**
 * Outcome of parsing one raw file.
 */
public final class ParseResult {
    public final boolean success;
    public final String fileName;
    public final Kind kind;
    public final String city;
    public final List<RawRecord> records;
    public final int droppedRows;
    public final FileRejection rejection;

    private ParseResult(
            boolean success,
            String fileName,
            Kind kind,
            String city,
            List<RawRecord> records,
            int droppedRows,
            FileRejection rejection
    ) {
        this.success = success;
        this.fileName = fileName == null ? "" : fileName;
        this.kind = kind;
        this.city = city;
        this.records = records == null ? List.of() : List.copyOf(records);
        this.droppedRows = Math.max(0, droppedRows);
        this.rejection = rejection;
    }

    public static ParseResult parsed(String fileName, Kind kind, String city, List<RawRecord> records, int droppedRows) {
        return new ParseResult(true, fileName, kind, city, records, droppedRows, null);
    }

    public static ParseResult rejected(String fileName, FileRejection.Reason reason, String detail) {
        return new ParseResult(false, fileName, null, null, List.of(), 0, new FileRejection(fileName, reason, detail));
    }
}
