package com.astrazeneca.symetrics.constraints;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;

/**
 * Zero mean, unit variance scaling. Parameters are fitted on the whole sample with the population standard
 * deviation (divided by n). NaN values are skipped by the fit and stay NaN after the transform. A sample without
 * variance is only centered.
 */
public class StandardScaler {
    private static final double ZERO_SCALE = 10 * Math.ulp(1.0);

    private final double mean;
    private final double scale;

    StandardScaler(double mean, double scale) {
        this.mean = mean;
        this.scale = scale;
    }

    /**
     * @param values sample to fit on
     * @return scaler with the mean and standard deviation of the sample
     */
    public static StandardScaler fit(double[] values) {
        double[] finite = Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
        if (finite.length == 0) {
            return new StandardScaler(Double.NaN, 1.0);
        }
        double mean = new Mean().evaluate(finite);
        double std = new StandardDeviation(false).evaluate(finite);
        return new StandardScaler(mean, std < ZERO_SCALE ? 1.0 : std);
    }

    public double transform(double value) {
        return (value - mean) / scale;
    }

    public double[] transform(double[] values) {
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = transform(values[i]);
        }
        return scaled;
    }

    public double getMean() {
        return mean;
    }

    public double getScale() {
        return scale;
    }
}
