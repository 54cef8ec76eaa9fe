package com.energyweather.recon.quality;

import java.util.Arrays;
import java.util.List;

final class Percentiles {

    private Percentiles() {
    }

    static double[] sorted(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        Arrays.sort(out);
        return out;
    }

    /**
     * Quantile of an ascending array with linear interpolation between closest ranks,
     * position {@code q * (n - 1)}.
     */
    static double quantile(double[] ascending, double q) {
        if (ascending.length == 0) {
            return Double.NaN;
        }
        if (ascending.length == 1) {
            return ascending[0];
        }
        double pos = q * (ascending.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        double frac = pos - lo;
        return ascending[lo] + (ascending[hi] - ascending[lo]) * frac;
    }
}
