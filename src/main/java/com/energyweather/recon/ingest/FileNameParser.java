package com.energyweather.recon.ingest;

import com.energyweather.recon.model.FileNameMatch;
import com.energyweather.recon.model.Kind;
import com.energyweather.utils.DateParsing;

import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies raw file names of the form {@code {kind}_{cityToken}_{YYYY-MM-DD}[...].{ext}}.
 * The city token is matched lazily, so it ends before the first embedded date.
 */
public final class FileNameParser {
    public static final String REASON_UNPARSEABLE = "unparseable-filename";

    private static final Pattern NAME_PATTERN = Pattern.compile(
            "^(energy|weather)_(.+?)_(\\d{4}-\\d{2}-\\d{2}).*$"
    );

    public FileNameMatch parse(String fileName) {
        if (fileName == null || fileName.trim().isEmpty()) {
            return FileNameMatch.rejected(REASON_UNPARSEABLE);
        }
        String stem = stem(fileName.trim());
        Matcher m = NAME_PATTERN.matcher(stem);
        if (!m.matches()) {
            return FileNameMatch.rejected(REASON_UNPARSEABLE);
        }
        Kind kind = Kind.fromPrefix(m.group(1)).orElse(null);
        LocalDate start = DateParsing.parseDate(m.group(3));
        if (kind == null || start == null) {
            return FileNameMatch.rejected(REASON_UNPARSEABLE);
        }
        return FileNameMatch.parsed(kind, m.group(2), start);
    }

    static String stem(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String name = slash >= 0 ? fileName.substring(slash + 1) : fileName;
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static String extension(String fileName) {
        String name = fileName == null ? "" : fileName.trim();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
