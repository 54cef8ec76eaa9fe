package com.energyweather.recon.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The stored unit of a master table: the latest known values for one {@code (city, date)} key.
 */
public final class MasterRow {
    public final String city;
    public final LocalDate date;
    public final Map<String, Object> values;

    public MasterRow(String city, LocalDate date, Map<String, Object> values) {
        this.city = city;
        this.date = date;
        this.values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static MasterRow from(RawRecord record) {
        return new MasterRow(record.city, record.date, record.values);
    }

    public Key key() {
        return new Key(city, date);
    }

    public Object value(String column) {
        return values.get(column);
    }

    public Double number(String column) {
        Object raw = values.get(column);
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        return null;
    }

    public String text(String column) {
        Object raw = values.get(column);
        return raw == null ? null : String.valueOf(raw);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MasterRow other)) {
            return false;
        }
        return Objects.equals(city, other.city)
                && Objects.equals(date, other.date)
                && Objects.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(city, date, values);
    }

    @Override
    public String toString() {
        return "MasterRow[" + city + " " + date + "] " + values;
    }

    public record Key(String city, LocalDate date) {
    }
}
