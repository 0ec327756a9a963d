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

package com.hellblazer.iset.spectral;

import com.hellblazer.iset.common.IsetException;

/**
 * Floating point precision of stored photon data. Values written at single precision are rounded to the nearest
 * float; reads always return doubles.
 *
 * @author hal.hildebrand
 */
public enum SamplePrecision {
    SINGLE(32),
    DOUBLE(64);

    private final int bitDepth;

    SamplePrecision(int bitDepth) {
        this.bitDepth = bitDepth;
    }

    /**
     * Resolve the legacy bit depth field.
     *
     * @param bitDepth 32 or 64
     * @return the precision
     * @throws IsetException.UnsupportedPrecisionException for any other value
     */
    public static SamplePrecision fromBitDepth(int bitDepth) {
        return switch (bitDepth) {
            case 32 -> SINGLE;
            case 64 -> DOUBLE;
            default -> throw new IsetException.UnsupportedPrecisionException(bitDepth);
        };
    }

    public int bitDepth() {
        return bitDepth;
    }

    /**
     * Round a value to this precision.
     *
     * @param value value
     * @return value as stored
     */
    public double store(double value) {
        return this == SINGLE ? (double) (float) value : value;
    }

    /**
     * Round every element of a cube to this precision, in place.
     *
     * @param cube cube to round
     * @return the same cube
     */
    public SpectralCube storeInPlace(SpectralCube cube) {
        if (this == DOUBLE) {
            return cube;
        }
        for (int w = 0; w < cube.waves(); w++) {
            for (int r = 0; r < cube.rows(); r++) {
                for (int c = 0; c < cube.cols(); c++) {
                    cube.set(r, c, w, store(cube.get(r, c, w)));
                }
            }
        }
        return cube;
    }
}
