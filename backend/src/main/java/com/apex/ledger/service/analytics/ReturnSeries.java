package com.apex.ledger.service.analytics;

import com.apex.ledger.exception.RiskComputationException;
import com.apex.ledger.exception.RiskComputationException.Reason;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.List;

/**
 * Descriptive statistics over daily simple returns. Standard deviations and
 * covariances are sample (n - 1) estimates; percentiles interpolate linearly
 * between order statistics.
 */
final class ReturnSeries {

    // Below this a standard deviation is treated as zero
    static final double EPSILON = 1e-12;

    private ReturnSeries() {
    }

    static double[] toArray(List<Double> returns, String label) {
        if (returns == null) {
            throw new RiskComputationException(Reason.INVALID_INPUT, label + " series is required");
        }
        double[] values = new double[returns.size()];
        for (int i = 0; i < values.length; i++) {
            Double value = returns.get(i);
            if (value == null || !Double.isFinite(value)) {
                throw new RiskComputationException(Reason.INVALID_INPUT,
                        label + " series has a missing or non-finite value at index " + i);
            }
            values[i] = value;
        }
        return values;
    }

    static double mean(double[] values) {
        return StatUtils.mean(values);
    }

    static double sampleStd(double[] values) {
        if (values.length < 2) {
            return Double.NaN;
        }
        return Math.sqrt(StatUtils.variance(values));
    }

    static boolean isZero(double std) {
        return Double.isNaN(std) || std < EPSILON;
    }

    static double sampleCovariance(double[] left, double[] right) {
        return new Covariance().covariance(left, right, true);
    }

    /**
     * @param percent in (0, 100]
     */
    static double percentile(double[] values, double percent) {
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, percent);
    }

    /**
     * Mean of the observations at or below {@code threshold}.
     */
    static double tailMean(double[] values, double threshold) {
        double sum = 0.0;
        int count = 0;
        for (double value : values) {
            if (value <= threshold) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? threshold : sum / count;
    }

    /**
     * Largest peak-to-trough fall of the compounded wealth curve, as a positive
     * fraction. The running peak starts at the first compounded value.
     */
    static double maxDrawdown(double[] values) {
        double wealth = 1.0;
        double peak = Double.NaN;
        double maxDrawdown = 0.0;
        for (double value : values) {
            wealth *= 1.0 + value;
            if (Double.isNaN(peak) || wealth > peak) {
                peak = wealth;
            }
            if (peak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - wealth) / peak);
            }
        }
        return maxDrawdown;
    }

    static double growthFactor(double[] values) {
        double wealth = 1.0;
        for (double value : values) {
            wealth *= 1.0 + value;
        }
        return wealth;
    }

    static double[] rollingSum(double[] values, int window) {
        if (window <= 1) {
            return values.clone();
        }
        double[] sums = new double[Math.max(values.length - window + 1, 0)];
        for (int i = 0; i < sums.length; i++) {
            double sum = 0.0;
            for (int j = i; j < i + window; j++) {
                sum += values[j];
            }
            sums[i] = sum;
        }
        return sums;
    }

    static double[] scaled(double[] values, double factor) {
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] * factor;
        }
        return scaled;
    }
}
