package com.scoutengine.core.model;

import java.util.Objects;

/**
 * Statistical reference a current value is compared against.
 *
 * <p>
 * A {@code Baseline} only exists when enough samples were available; an
 * undefined baseline is represented by an empty {@code Optional} at the call
 * site, never by a zero or NaN mean.
 * </p>
 *
 * @since 1.0.0
 */
public final class Baseline {

    private final WindowKind windowKind;
    private final double mean;
    private final double stddev;
    private final int sampleCount;

    private Baseline(WindowKind windowKind, double mean, double stddev, int sampleCount) {
        this.windowKind = Objects.requireNonNull(windowKind, "windowKind must not be null");
        this.mean = mean;
        this.stddev = stddev;
        this.sampleCount = sampleCount;
    }

    /**
     * Compute mean and population standard deviation over {@code samples}.
     *
     * @param windowKind window the samples were drawn from
     * @param samples    sample values; must not be empty
     * @return a new baseline
     * @throws IllegalArgumentException if {@code samples} is empty
     */
    public static Baseline of(WindowKind windowKind, double[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (samples.length == 0) {
            throw new IllegalArgumentException("Baseline requires at least one sample");
        }
        double sum = 0;
        for (double v : samples) {
            sum += v;
        }
        double mean = sum / samples.length;
        double sumSquaredDiff = 0;
        for (double v : samples) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return new Baseline(windowKind, mean, Math.sqrt(sumSquaredDiff / samples.length), samples.length);
    }

    public WindowKind getWindowKind() {
        return windowKind;
    }

    public double getMean() {
        return mean;
    }

    public double getStddev() {
        return stddev;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Baseline that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(stddev, that.stddev) == 0
                && sampleCount == that.sampleCount
                && windowKind == that.windowKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(windowKind, mean, stddev, sampleCount);
    }

    @Override
    public String toString() {
        return "Baseline{" +
                "windowKind=" + windowKind +
                ", mean=" + mean +
                ", stddev=" + stddev +
                ", sampleCount=" + sampleCount +
                '}';
    }
}
