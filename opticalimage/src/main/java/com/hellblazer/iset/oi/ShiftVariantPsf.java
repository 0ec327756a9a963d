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

import java.util.Objects;

/**
 * Precomputed shift-variant point spread functions from ray trace optics, sampled over image height, field angle and
 * wavelength.
 *
 * @param psf          kernels indexed [height][angle][wavelength][row][col]
 * @param sampleAngles field angles, degrees
 * @param imageHeights image heights, meters
 * @param opticsName   name of the optics the kernels were derived from
 * @param wavelength   wavelengths of the kernels, nm
 * @author hal.hildebrand
 */
public record ShiftVariantPsf(double[][][][][] psf, double[] sampleAngles, double[] imageHeights, String opticsName,
                              double[] wavelength) {

    public ShiftVariantPsf {
        Objects.requireNonNull(psf, "psf");
        Objects.requireNonNull(sampleAngles, "sampleAngles");
        Objects.requireNonNull(imageHeights, "imageHeights");
        Objects.requireNonNull(wavelength, "wavelength");
    }

    public double[][] kernel(int height, int angle, int wave) {
        return psf[height][angle][wave];
    }

    /**
     * @return rows and cols of each kernel
     */
    public int[] kernelSize() {
        var first = psf[0][0][0];
        return new int[] { first.length, first.length == 0 ? 0 : first[0].length };
    }

    public double angleStep() {
        if (sampleAngles.length < 2) {
            throw new IllegalStateException("Angle step needs at least two sample angles");
        }
        return sampleAngles[1] - sampleAngles[0];
    }
}
