package com.energyweather.recon.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One normalized row parsed from a raw file. Values hold canonical numeric columns as {@link Double}
 * (null when the cell was empty) and pass-through columns as text.
 */
public final class RawRecord {
    public final Kind kind;
    public final String city;
    public final LocalDate date;
    public final Map<String, Object> values;

    public RawRecord(Kind kind, String city, LocalDate date, Map<String, Object> values) {
        this.kind = kind;
        this.city = city;
        this.date = date;
        this.values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object value(String column) {
        return values.get(column);
    }

    @Override
    public String toString() {
        return kind.prefix() + "[" + city + " " + date + "] " + values;
    }
}
