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

import com.hellblazer.iset.spectral.SpectralCube;
import com.hellblazer.iset.spectral.SpectralSampleSet;

/**
 * Optical images with simple photon data for tests.
 *
 * @author hal.hildebrand
 */
public final class TestImages {

    public static final SpectralSampleSet WAVE = SpectralSampleSet.range(400, 700, 10);

    private TestImages() {
    }

    public static OpticalImage uniform(int rows, int cols, double photons) {
        return uniform(rows, cols, photons, 10.0);
    }

    public static OpticalImage uniform(int rows, int cols, double photons, double fov) {
        var oi = new OpticalImage(WAVE);
        oi.setFov(fov);
        oi.data().setPhotons(SpectralCube.uniform(rows, cols, WAVE.count(), photons));
        return oi;
    }

    /**
     * Photons rising linearly with wavelength, scaled by (1 + row + col)
     */
    public static OpticalImage ramp(int rows, int cols) {
        var oi = new OpticalImage(WAVE);
        oi.setFov(5.0);
        var cube = new SpectralCube(rows, cols, WAVE.count());
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                for (int w = 0; w < WAVE.count(); w++) {
                    cube.set(r, c, w, 1e14 * (1 + r + c) * (1 + w));
                }
            }
        }
        oi.data().setPhotons(cube);
        return oi;
    }
}
