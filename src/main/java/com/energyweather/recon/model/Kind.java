package com.energyweather.recon.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The two raw data domains the pipeline reconciles.
 */
public enum Kind {
    ENERGY("energy", List.of("energy_demand_MW"), List.of()),
    WEATHER("weather", List.of("temp_max_F", "temp_min_F", "precipitation"), List.of("timezone"));

    private final String prefix;
    private final List<String> numericColumns;
    private final List<String> textColumns;

    Kind(String prefix, List<String> numericColumns, List<String> textColumns) {
        this.prefix = prefix;
        this.numericColumns = numericColumns;
        this.textColumns = textColumns;
    }

    /** Lower-case token used in file names and artifact names. */
    public String prefix() {
        return prefix;
    }

    public List<String> numericColumns() {
        return numericColumns;
    }

    public List<String> textColumns() {
        return textColumns;
    }

    /** Canonical value columns in snapshot order, excluding the {@code city}/{@code date} key. */
    public List<String> canonicalColumns() {
        List<String> out = new ArrayList<>(numericColumns.size() + textColumns.size());
        out.addAll(numericColumns);
        out.addAll(textColumns);
        return List.copyOf(out);
    }

    public static Optional<Kind> fromPrefix(String raw) {
        String token = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (Kind kind : values()) {
            if (kind.prefix.equals(token)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
