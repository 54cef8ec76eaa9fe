package com.energyweather.recon.join;

import java.util.Locale;

public enum JoinMode {
    /** Only keys present in both masters. */
    INNER,
    /** Every energy row; weather fields are null where no weather row matches. */
    LEFT_ON_ENERGY;

    public static JoinMode parse(String raw) {
        String token = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (token) {
            case "":
            case "inner":
                return INNER;
            case "left":
            case "left_on_energy":
                return LEFT_ON_ENERGY;
            default:
                throw new IllegalArgumentException("unknown join mode: " + raw + " (use inner or left_on_energy)");
        }
    }
}
