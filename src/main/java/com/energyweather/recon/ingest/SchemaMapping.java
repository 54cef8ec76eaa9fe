package com.energyweather.recon.ingest;

import com.energyweather.recon.model.Kind;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declarative column healing per kind: known typos, legacy aliases and dropped columns.
 * Consulted once per file (or snapshot) header, never per row.
 */
public final class SchemaMapping {
    private static final SchemaMapping ENERGY = new SchemaMapping(
            Map.of(
                    "responndent-name", "respondent_name",
                    "respondent-name", "respondent_name"
            ),
            Map.of(
                    "energy_demand_MW", List.of(
                            "demand", "Demand", "DEMAND",
                            "demand_mw", "demand_MW", "Demand_MW",
                            "load", "Load", "LOAD",
                            "consumption", "Consumption", "CONSUMPTION",
                            "value", "Value", "VALUE"
                    )
            ),
            Set.of("timezone-description")
    );

    private static final SchemaMapping WEATHER = new SchemaMapping(
            Map.of(
                    "tempp_max_F", "temp_max_F",
                    "TMAX", "temp_max_F",
                    "TMIN", "temp_min_F",
                    "PRCP", "precipitation"
            ),
            Map.of(),
            Set.of()
    );

    private final Map<String, String> renames;
    private final Map<String, List<String>> aliases;
    private final Set<String> dropped;

    SchemaMapping(Map<String, String> renames, Map<String, List<String>> aliases, Set<String> dropped) {
        this.renames = renames;
        this.aliases = aliases;
        this.dropped = dropped;
    }

    public static SchemaMapping forKind(Kind kind) {
        return kind == Kind.ENERGY ? ENERGY : WEATHER;
    }

    /**
     * Maps every source column to its canonical name. Dropped columns are absent from the result.
     * A rename or alias never overwrites a column that already carries the target name; the first
     * alias present (in priority order) wins.
     */
    public Map<String, String> mapColumns(Collection<String> sourceColumns) {
        Set<String> present = new LinkedHashSet<>(sourceColumns);
        Set<String> claimed = new LinkedHashSet<>();
        Map<String, String> out = new LinkedHashMap<>();

        for (Map.Entry<String, List<String>> alias : aliases.entrySet()) {
            String target = alias.getKey();
            if (present.contains(target)) {
                continue;
            }
            for (String candidate : alias.getValue()) {
                if (present.contains(candidate)) {
                    out.put(candidate, target);
                    claimed.add(target);
                    break;
                }
            }
        }

        for (String column : present) {
            if (out.containsKey(column)) {
                continue;
            }
            if (dropped.contains(column)) {
                continue;
            }
            String target = renames.get(column);
            if (target != null && !present.contains(target) && claimed.add(target)) {
                out.put(column, target);
            } else {
                out.put(column, column);
            }
        }

        Map<String, String> ordered = new LinkedHashMap<>();
        for (String column : present) {
            if (out.containsKey(column)) {
                ordered.put(column, out.get(column));
            }
        }
        return Collections.unmodifiableMap(ordered);
    }

    /** Applies {@link #mapColumns} to one row of cells keyed by source column. */
    public Map<String, Object> apply(Map<String, ?> row, Map<String, String> columnMapping) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : columnMapping.entrySet()) {
            if (row.containsKey(entry.getKey())) {
                out.put(entry.getValue(), row.get(entry.getKey()));
            }
        }
        return out;
    }
}
