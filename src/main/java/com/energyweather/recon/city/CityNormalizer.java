package com.energyweather.recon.city;

import com.energyweather.recon.model.CityMetadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical city names and their static metadata. Pure and I/O free.
 */
public final class CityNormalizer {
    public static final String UNKNOWN_CITY = "Unknown";

    private static final Map<String, CityMetadata> DEFAULT_TABLE = buildDefaultTable();

    private final Map<String, CityMetadata> table;

    public CityNormalizer() {
        this(DEFAULT_TABLE);
    }

    public CityNormalizer(Map<String, CityMetadata> table) {
        Map<String, CityMetadata> copy = new LinkedHashMap<>();
        if (table != null) {
            for (Map.Entry<String, CityMetadata> entry : table.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    copy.put(normalize(entry.getKey()), entry.getValue());
                }
            }
        }
        this.table = Collections.unmodifiableMap(copy);
    }

    /**
     * Trims, collapses inner whitespace and title-cases every word ({@code " new york "} becomes
     * {@code "New York"}). Null or blank input maps to {@code "Unknown"}.
     */
    public static String normalize(String cityToken) {
        if (cityToken == null) {
            return UNKNOWN_CITY;
        }
        String trimmed = cityToken.trim().replaceAll("\\s+", " ");
        if (trimmed.isEmpty()) {
            return UNKNOWN_CITY;
        }
        StringBuilder sb = new StringBuilder(trimmed.length());
        boolean previousLetter = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                sb.append(c);
                previousLetter = false;
            }
        }
        return sb.toString();
    }

    /** Metadata for a city name; unknown cities never fail, they resolve to {@link CityMetadata#unknown()}. */
    public CityMetadata resolve(String city) {
        if (city == null) {
            return CityMetadata.unknown();
        }
        CityMetadata found = table.get(normalize(city));
        return found == null ? CityMetadata.unknown() : found;
    }

    public Map<String, CityMetadata> table() {
        return table;
    }

    private static Map<String, CityMetadata> buildDefaultTable() {
        Map<String, CityMetadata> t = new LinkedHashMap<>();
        t.put("New York", new CityMetadata("America/New_York", 40.7128, -74.0060));
        t.put("Chicago", new CityMetadata("America/Chicago", 41.8781, -87.6298));
        t.put("Houston", new CityMetadata("America/Chicago", 29.7604, -95.3698));
        t.put("Phoenix", new CityMetadata("America/Phoenix", 33.4484, -112.0740));
        t.put("Seattle", new CityMetadata("America/Los_Angeles", 47.6062, -122.3321));
        return Collections.unmodifiableMap(t);
    }
}
