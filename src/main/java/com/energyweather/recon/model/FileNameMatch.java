package com.energyweather.recon.model;

import java.time.LocalDate;

/**
 * Result of classifying a raw file name: either the kind, city token and start date it encodes, or the
 * reason it was rejected.
 */
public final class FileNameMatch {
    public final boolean matched;
    public final Kind kind;
    public final String cityToken;
    public final LocalDate startDate;
    public final String reason;

    private FileNameMatch(boolean matched, Kind kind, String cityToken, LocalDate startDate, String reason) {
        this.matched = matched;
        this.kind = kind;
        this.cityToken = cityToken;
        this.startDate = startDate;
        this.reason = reason == null ? "" : reason;
    }

    public static FileNameMatch parsed(Kind kind, String cityToken, LocalDate startDate) {
        return new FileNameMatch(true, kind, cityToken, startDate, "");
    }

    public static FileNameMatch rejected(String reason) {
        return new FileNameMatch(false, null, null, null, reason);
    }

    @Override
    public String toString() {
        return matched
                ? "Parsed{" + kind.prefix() + ", " + cityToken + ", " + startDate + "}"
                : "Rejected{" + reason + "}";
    }
}
