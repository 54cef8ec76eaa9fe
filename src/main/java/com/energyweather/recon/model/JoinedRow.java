package com.energyweather.recon.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * 模块说明：JoinedRow（class）。
 * 主要职责：一条 (city, date) 的能源与天气合并结果，天气字段在 left 模式下可能为空。
 * 使用建议：由 JoinEngine 每次运行重新生成，创建后不可修改。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder
public final class JoinedRow {
    public static final List<String> COLUMNS = List.of(
            "date",
            "city",
            "energy_demand_MW",
            "temp_max_F",
            "temp_min_F",
            "precipitation",
            "temp_avg",
            "weather_available",
            "lat",
            "lon",
            "timezone"
    );

    public final LocalDate date;
    public final String city;
    public final Double energyDemandMw;
    public final Double tempMaxF;
    public final Double tempMinF;
    public final Double precipitation;
    public final Double tempAvg;
    public final boolean weatherAvailable;
    public final Double lat;
    public final Double lon;
    public final String timezone;

    /** Cells in {@link #COLUMNS} order. */
    public List<Object> cells() {
        return Arrays.asList(
                date,
                city,
                energyDemandMw,
                tempMaxF,
                tempMinF,
                precipitation,
                tempAvg,
                weatherAvailable,
                lat,
                lon,
                timezone
        );
    }
}
