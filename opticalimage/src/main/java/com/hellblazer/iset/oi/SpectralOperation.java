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

/**
 * Element-wise operations applying a per-wavelength spectrum to every pixel of an optical image.
 *
 * @author hal.hildebrand
 */
public enum SpectralOperation {
    MULTIPLY {
        @Override
        public double apply(double value, double spectrum) {
            return value * spectrum;
        }
    },
    DIVIDE {
        @Override
        public double apply(double value, double spectrum) {
            return value / spectrum;
        }
    },
    ADD {
        @Override
        public double apply(double value, double spectrum) {
            return value + spectrum;
        }
    },
    SUBTRACT {
        @Override
        public double apply(double value, double spectrum) {
            return Math.max(0.0, value - spectrum);
        }
    };

    public abstract double apply(double value, double spectrum);
}
