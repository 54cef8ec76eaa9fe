package com.energyweather.recon.quality;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class OutlierEntry {
    public final OutlierCount ruleBased;
    public final OutlierCount iqr;

    public static OutlierEntry sentinel(String message) {
        OutlierCount s = OutlierCount.sentinel(message);
        return new OutlierEntry(s, s);
    }
}
