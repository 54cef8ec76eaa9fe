package com.energyweather.recon.quality;

/**
 * Raised when a quality report is requested with arguments that break the caller contract.
 */
public class InvalidReportInputException extends IllegalArgumentException {
    public static final String KIND = "invalid-input";

    public InvalidReportInputException(String message) {
        super(message);
    }

    public String kind() {
        return KIND;
    }
}
