package com.energyweather.recon.model;

/**
 * Static metadata for a canonical city. Unknown cities carry timezone {@code "Unknown"} and null coordinates.
 */
public record CityMetadata(String timezone, Double lat, Double lon) {
    public static final String UNKNOWN_TIMEZONE = "Unknown";

    public static CityMetadata unknown() {
        return new CityMetadata(UNKNOWN_TIMEZONE, null, null);
    }

    public boolean known() {
        return !UNKNOWN_TIMEZONE.equals(timezone);
    }
}
