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

package com.hellblazer.iset.oi;

import com.hellblazer.iset.common.PoissonNoise;
import com.hellblazer.iset.spectral.SamplePrecision;

import java.util.Objects;

/**
 * Immutable defaults governing optical image behaviour when data or companion objects are missing, plus the photon
 * noise and precision policies.
 *
 * @author hal.hildebrand
 */
public final class OpticalImageConfiguration {

    private static final OpticalImageConfiguration DEFAULT = builder().build();

    private final int             defaultRows;
    private final int             defaultCols;
    private final double          defaultFov;
    private final double          defaultSceneDistance;
    private final double          noiseIntegrationTime;
    private final double          gaussianThreshold;
    private final SamplePrecision precision;
    private final boolean         enforceNonNegative;

    private OpticalImageConfiguration(Builder builder) {
        this.defaultRows = builder.defaultRows;
        this.defaultCols = builder.defaultCols;
        this.defaultFov = builder.defaultFov;
        this.defaultSceneDistance = builder.defaultSceneDistance;
        this.noiseIntegrationTime = builder.noiseIntegrationTime;
        this.gaussianThreshold = builder.gaussianThreshold;
        this.precision = builder.precision;
        this.enforceNonNegative = builder.enforceNonNegative;
    }

    public static OpticalImageConfiguration getDefault() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Row count assumed when there is neither photon data nor a companion scene
     */
    public int getDefaultRows() {
        return defaultRows;
    }

    /**
     * Column count assumed when there is neither photon data nor a companion scene
     */
    public int getDefaultCols() {
        return defaultCols;
    }

    /**
     * Horizontal field of view in degrees assumed when none has been set and no companion scene is given
     */
    public double getDefaultFov() {
        return defaultFov;
    }

    /**
     * Object distance in meters assumed when none has been set and no companion scene is given
     */
    public double getDefaultSceneDistance() {
        return defaultSceneDistance;
    }

    /**
     * Integration time in seconds used to turn photon rates into counts for the noise getters
     */
    public double getNoiseIntegrationTime() {
        return noiseIntegrationTime;
    }

    public double getGaussianThreshold() {
        return gaussianThreshold;
    }

    public SamplePrecision getPrecision() {
        return precision;
    }

    public boolean isEnforceNonNegative() {
        return enforceNonNegative;
    }

    public Builder toBuilder() {
        return new Builder().withDefaultSize(defaultRows, defaultCols)
                            .withDefaultFov(defaultFov)
                            .withDefaultSceneDistance(defaultSceneDistance)
                            .withNoiseIntegrationTime(noiseIntegrationTime)
                            .withGaussianThreshold(gaussianThreshold)
                            .withPrecision(precision)
                            .withEnforceNonNegative(enforceNonNegative);
    }

    @Override
    public String toString() {
        return String.format(
        "OpticalImageConfiguration[defaultSize=%dx%d, defaultFov=%.2f, defaultSceneDistance=%.3g, noiseIntegrationTime=%.3f, gaussianThreshold=%.1f, precision=%s, enforceNonNegative=%s]",
        defaultRows, defaultCols, defaultFov, defaultSceneDistance, noiseIntegrationTime, gaussianThreshold, precision,
        enforceNonNegative);
    }

    public static class Builder {
        private int             defaultRows          = 128;
        private int             defaultCols          = 128;
        private double          defaultFov           = 10.0;
        private double          defaultSceneDistance = 1e10;
        private double          noiseIntegrationTime = 0.050;
        private double          gaussianThreshold    = PoissonNoise.DEFAULT_GAUSSIAN_THRESHOLD;
        private SamplePrecision precision            = SamplePrecision.SINGLE;
        private boolean         enforceNonNegative   = true;

        private Builder() {
        }

        public Builder withDefaultSize(int rows, int cols) {
            if (rows <= 0 || cols <= 0) {
                throw new IllegalArgumentException("Default size must be positive: " + rows + " x " + cols);
            }
            this.defaultRows = rows;
            this.defaultCols = cols;
            return this;
        }

        public Builder withDefaultFov(double degrees) {
            if (!(degrees > 0 && degrees < 180)) {
                throw new IllegalArgumentException("Field of view must be in (0, 180) degrees: " + degrees);
            }
            this.defaultFov = degrees;
            return this;
        }

        public Builder withDefaultSceneDistance(double meters) {
            if (!(meters > 0)) {
                throw new IllegalArgumentException("Scene distance must be positive: " + meters);
            }
            this.defaultSceneDistance = meters;
            return this;
        }

        public Builder withNoiseIntegrationTime(double seconds) {
            if (!(seconds > 0)) {
                throw new IllegalArgumentException("Integration time must be positive: " + seconds);
            }
            this.noiseIntegrationTime = seconds;
            return this;
        }

        public Builder withGaussianThreshold(double lambda) {
            if (!(lambda > 0)) {
                throw new IllegalArgumentException("Gaussian threshold must be positive: " + lambda);
            }
            this.gaussianThreshold = lambda;
            return this;
        }

        public Builder withPrecision(SamplePrecision precision) {
            this.precision = Objects.requireNonNull(precision, "precision");
            return this;
        }

        public Builder withEnforceNonNegative(boolean enforce) {
            this.enforceNonNegative = enforce;
            return this;
        }

        public OpticalImageConfiguration build() {
            return new OpticalImageConfiguration(this);
        }
    }
}
