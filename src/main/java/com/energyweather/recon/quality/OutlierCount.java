package com.energyweather.recon.quality;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either a count of outlying cells or a sentinel message explaining why no count exists.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class OutlierCount {
    public final Integer count;
    public final String sentinel;

    public static OutlierCount of(int count) {
        return new OutlierCount(count, null);
    }

    public static OutlierCount sentinel(String message) {
        return new OutlierCount(null, message);
    }

    public boolean isSentinel() {
        return count == null;
    }

    /** Integer count, or the sentinel text. */
    public Object value() {
        return count == null ? sentinel : count;
    }
}
