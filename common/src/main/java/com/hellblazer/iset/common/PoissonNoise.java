/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.iset.common;

import java.util.Objects;
import java.util.Random;

/**
 * Poisson photon-count generator.
 * <p>
 * Means below the Gaussian threshold are sampled exactly by Knuth's multiplication method. At or above the threshold
 * a rounded normal approximation N(λ, λ), clipped at zero, is used for speed.
 * <p>
 * The exact {@link #pmf(int, double)} and {@link #cdf(int, double)} are provided for validating samples.
 *
 * @author hal.hildebrand
 */
public final class PoissonNoise {

    /** Means at or above this value use the normal approximation by default */
    public static final double DEFAULT_GAUSSIAN_THRESHOLD = 15.0;

    private final Random random;
    private final double gaussianThreshold;

    /**
     * @param random source of uniform and normal deviates
     */
    public PoissonNoise(Random random) {
        this(random, DEFAULT_GAUSSIAN_THRESHOLD);
    }

    /**
     * @param random            source of uniform and normal deviates
     * @param gaussianThreshold mean at which the normal approximation takes over
     */
    public PoissonNoise(Random random, double gaussianThreshold) {
        this.random = Objects.requireNonNull(random, "random");
        if (!(gaussianThreshold > 0)) {
            throw new IllegalArgumentException("Gaussian threshold must be positive: " + gaussianThreshold);
        }
        this.gaussianThreshold = gaussianThreshold;
    }

    /**
     * Probability mass of a Poisson distribution.
     *
     * @param k      count
     * @param lambda mean
     * @return P(X = k)
     */
    public static double pmf(int k, double lambda) {
        if (k < 0) {
            return 0.0;
        }
        if (lambda == 0.0) {
            return k == 0 ? 1.0 : 0.0;
        }
        return Math.exp(k * Math.log(lambda) - lambda - logFactorial(k));
    }

    /**
     * Cumulative distribution of a Poisson distribution.
     *
     * @param k      count
     * @param lambda mean
     * @return P(X &lt;= k)
     */
    public static double cdf(int k, double lambda) {
        var sum = 0.0;
        for (int i = 0; i <= k; i++) {
            sum += pmf(i, lambda);
        }
        return Math.min(1.0, sum);
    }

    private static double logFactorial(int k) {
        var sum = 0.0;
        for (int i = 2; i <= k; i++) {
            sum += Math.log(i);
        }
        return sum;
    }

    /**
     * @return mean at which the normal approximation takes over
     */
    public double getGaussianThreshold() {
        return gaussianThreshold;
    }

    /**
     * Draw one sample.
     *
     * @param lambda mean, non-negative
     * @return Poisson distributed count
     */
    public long sample(double lambda) {
        if (lambda < 0 || Double.isNaN(lambda)) {
            throw new IllegalArgumentException("Poisson mean must be non-negative: " + lambda);
        }
        if (lambda == 0.0) {
            return 0;
        }
        if (lambda >= gaussianThreshold) {
            var value = Math.round(lambda + Math.sqrt(lambda) * random.nextGaussian());
            return Math.max(0, value);
        }
        var limit = Math.exp(-lambda);
        long k = 0;
        var p = random.nextDouble();
        while (p > limit) {
            k++;
            p *= random.nextDouble();
        }
        return k;
    }

    /**
     * Draw independent samples with a common mean.
     *
     * @param lambda mean
     * @param count  number of samples
     * @return samples
     */
    public double[] samples(double lambda, int count) {
        var out = new double[count];
        for (int i = 0; i < count; i++) {
            out[i] = sample(lambda);
        }
        return out;
    }

    /**
     * Draw one sample per element, each element being the mean of its own distribution.
     *
     * @param means per-element means
     * @return samples, same length as means
     */
    public double[] apply(double[] means) {
        var out = new double[means.length];
        for (int i = 0; i < means.length; i++) {
            out[i] = sample(means[i]);
        }
        return out;
    }
}
