package com.energyweather.recon.model;

public enum RunStatus {
    COMPLETED,
    NOTHING_TO_DO
}
