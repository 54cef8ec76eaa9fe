package com.energyweather.recon.quality;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Age of the newest record. When {@code error} is set only {@code fresh=false} is meaningful.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class Freshness {
    public final String latestDate;
    public final Long daysAgo;
    public final boolean fresh;
    public final int thresholdDays;
    public final String error;

    public static Freshness unavailable(String error, int thresholdDays) {
        return new Freshness(null, null, false, thresholdDays, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
