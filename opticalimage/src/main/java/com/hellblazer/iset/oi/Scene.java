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

import com.hellblazer.iset.spectral.SpectralSampleSet;

/**
 * The scene an optical image was computed from, passed explicitly wherever geometry falls back to scene values.
 *
 * @param rows     scene rows
 * @param cols     scene columns
 * @param fov      horizontal field of view, degrees
 * @param distance object distance, meters
 * @param wave     scene wavelength samples, may be null
 * @author hal.hildebrand
 */
public record Scene(int rows, int cols, double fov, double distance, SpectralSampleSet wave) {

    public Scene {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Scene size must be positive: " + rows + " x " + cols);
        }
        if (!(fov > 0 && fov < 180)) {
            throw new IllegalArgumentException("Scene field of view must be in (0, 180) degrees: " + fov);
        }
        if (!(distance > 0)) {
            throw new IllegalArgumentException("Scene distance must be positive: " + distance);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int               rows     = 128;
        private int               cols     = 128;
        private double            fov      = 10.0;
        private double            distance = 1.2;
        private SpectralSampleSet wave;

        private Builder() {
        }

        public Builder withSize(int rows, int cols) {
            this.rows = rows;
            this.cols = cols;
            return this;
        }

        public Builder withFov(double degrees) {
            this.fov = degrees;
            return this;
        }

        public Builder withDistance(double meters) {
            this.distance = meters;
            return this;
        }

        public Builder withWave(SpectralSampleSet wave) {
            this.wave = wave;
            return this;
        }

        public Scene build() {
            return new Scene(rows, cols, fov, distance, wave);
        }
    }
}
