package com.energyweather.recon.quality;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class DatasetInfo {
    public final int rows;
    public final int columns;
    public final List<String> columnNames;
}
