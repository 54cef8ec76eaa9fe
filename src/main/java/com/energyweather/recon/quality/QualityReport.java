package com.energyweather.recon.quality;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Map;

/**
 * 模块说明：QualityReport（class）。
 * 主要职责：单个数据表的质量结论，包含表结构、缺失值计数、规则与 IQR 两种异常值计数，以及数据新鲜度。
 * 使用建议：由 QualityReportGenerator 生成，交给 QualityReportWriter 序列化为 JSON。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class QualityReport {
    public final DatasetInfo datasetInfo;
    public final Map<String, Integer> missingValues;
    public final Map<String, OutlierEntry> outliers;
    public final Freshness freshness;
}
