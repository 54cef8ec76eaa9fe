package com.energyweather.recon.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.Locale;

/**
 * Order in which raw files feed {@code MasterStore.merge}. Last-write-wins resolves overlapping keys in
 * favour of the file processed last, so this order is part of the pipeline contract.
 */
public enum IngestOrder {
    /** Ascending path relative to the raw directory, '/' separated, case-sensitive. */
    LEXICAL,
    /** Ascending last-modified time; ties fall back to {@link #LEXICAL}. */
    MODIFIED_TIME;

    public Comparator<Path> comparator(Path root) {
        Comparator<Path> lexical = Comparator.comparing(p -> relativeKey(root, p));
        if (this == LEXICAL) {
            return lexical;
        }
        Comparator<Path> byTime = Comparator.comparing(IngestOrder::modifiedTime);
        return byTime.thenComparing(lexical);
    }

    public static IngestOrder parse(String raw) {
        String token = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (token) {
            case "":
            case "lexical":
            case "name":
                return LEXICAL;
            case "modified_time":
            case "mtime":
                return MODIFIED_TIME;
            default:
                throw new IllegalArgumentException("unknown ingest order: " + raw + " (use lexical or modified_time)");
        }
    }

    static String relativeKey(Path root, Path file) {
        Path rel = root == null ? file : root.relativize(file);
        return rel.toString().replace('\\', '/');
    }

    private static FileTime modifiedTime(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read mtime of " + file, e);
        }
    }
}
