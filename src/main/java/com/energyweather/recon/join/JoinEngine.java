package com.energyweather.recon.join;

import com.energyweather.recon.city.CityNormalizer;
import com.energyweather.recon.model.CityMetadata;
import com.energyweather.recon.model.FlatTable;
import com.energyweather.recon.model.JoinedRow;
import com.energyweather.recon.model.MasterRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Joins the energy and weather masters on {@code (date, city)} and derives the per-row weather fields.
 * Output follows the order of the energy rows.
 */
public final class JoinEngine {
    private static final Logger LOG = LogManager.getLogger(JoinEngine.class);

    static final String DEMAND = "energy_demand_MW";
    static final String TEMP_MAX = "temp_max_F";
    static final String TEMP_MIN = "temp_min_F";
    static final String PRECIPITATION = "precipitation";
    static final String TIMEZONE = "timezone";

    private final CityNormalizer cityNormalizer;

    public JoinEngine(CityNormalizer cityNormalizer) {
        this.cityNormalizer = cityNormalizer == null ? new CityNormalizer() : cityNormalizer;
    }

    public List<JoinedRow> join(List<MasterRow> energyRows, List<MasterRow> weatherRows, JoinMode mode) {
        JoinMode effective = mode == null ? JoinMode.INNER : mode;
        Map<MasterRow.Key, MasterRow> weatherByKey = new HashMap<>();
        if (weatherRows != null) {
            for (MasterRow row : weatherRows) {
                weatherByKey.put(row.key(), row);
            }
        }

        List<JoinedRow> out = new ArrayList<>();
        int unmatched = 0;
        if (energyRows != null) {
            for (MasterRow energy : energyRows) {
                MasterRow weather = weatherByKey.get(energy.key());
                if (weather == null) {
                    unmatched++;
                    if (effective == JoinMode.INNER) {
                        continue;
                    }
                }
                out.add(toJoined(energy, weather));
            }
        }
        LOG.info("Joined energy={} weather={} mode={} rows={} unmatched_energy={}",
                energyRows == null ? 0 : energyRows.size(),
                weatherByKey.size(),
                effective.name().toLowerCase(Locale.ROOT),
                out.size(),
                unmatched);
        return out;
    }

    /** Renders joined rows with the fixed merged-output column order. */
    public static FlatTable toTable(List<JoinedRow> rows) {
        FlatTable.Builder builder = FlatTable.builder(JoinedRow.COLUMNS);
        if (rows != null) {
            for (JoinedRow row : rows) {
                builder.addRow(row.cells());
            }
        }
        return builder.build();
    }

    private JoinedRow toJoined(MasterRow energy, MasterRow weather) {
        CityMetadata meta = cityNormalizer.resolve(energy.city);
        Double tempMax = weather == null ? null : weather.number(TEMP_MAX);
        Double tempMin = weather == null ? null : weather.number(TEMP_MIN);
        Double tempAvg = tempMax == null || tempMin == null ? null : (tempMax + tempMin) / 2.0;
        String timezone = weather == null ? null : weather.text(TIMEZONE);
        if (timezone == null || timezone.trim().isEmpty()) {
            timezone = meta.timezone();
        }
        return JoinedRow.builder()
                .date(energy.date)
                .city(energy.city)
                .energyDemandMw(energy.number(DEMAND))
                .tempMaxF(tempMax)
                .tempMinF(tempMin)
                .precipitation(weather == null ? null : weather.number(PRECIPITATION))
                .tempAvg(tempAvg)
                .weatherAvailable(tempAvg != null)
                .lat(meta.lat())
                .lon(meta.lon())
                .timezone(timezone)
                .build();
    }
}
