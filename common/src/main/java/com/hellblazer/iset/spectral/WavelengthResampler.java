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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Linear interpolation along the wavelength axis.
 * <p>
 * Query points outside the source range evaluate to zero. Callers that must not extrapolate check
 * {@link SpectralSampleSet#encloses(SpectralSampleSet)} first.
 *
 * @author hal.hildebrand
 */
public final class WavelengthResampler {
    private static final Logger log = LoggerFactory.getLogger(WavelengthResampler.class);

    private WavelengthResampler() {
    }

    /**
     * Resample a cube from one wavelength axis to another, pixel by pixel.
     *
     * @param oldWave axis of the source cube
     * @param newWave target axis
     * @param cube    source cube, waves() == oldWave.count()
     * @return cube with newWave.count() planes
     */
    public static SpectralCube interpolate(SpectralSampleSet oldWave, SpectralSampleSet newWave, SpectralCube cube) {
        if (cube.waves() != oldWave.count()) {
            throw new IllegalArgumentException(
            "Cube has " + cube.waves() + " planes but axis has " + oldWave.count() + " samples");
        }
        log.debug("Resampling {} from {} to {}", cube, oldWave, newWave);
        var x = oldWave.wavelengths();
        var xq = newWave.wavelengths();
        var pixels = cube.toPixels();
        var resampled = new double[pixels.length][];
        for (int p = 0; p < pixels.length; p++) {
            resampled[p] = interpolate(x, pixels[p], xq);
        }
        return SpectralCube.fromPixels(cube.rows(), cube.cols(), resampled);
    }

    /**
     * One-dimensional linear interpolation with zero outside [x[0], x[n-1]].
     *
     * @param x  increasing sample positions
     * @param y  values at x
     * @param xq query positions
     * @return interpolated values at xq
     */
    public static double[] interpolate(double[] x, double[] y, double[] xq) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y lengths differ: " + x.length + " vs " + y.length);
        }
        var out = new double[xq.length];
        var n = x.length;
        int j = 0;
        for (int i = 0; i < xq.length; i++) {
            var q = xq[i];
            if (q < x[0] || q > x[n - 1] || Double.isNaN(q)) {
                out[i] = 0.0;
                continue;
            }
            if (n == 1) {
                out[i] = y[0];
                continue;
            }
            // xq is usually increasing; restart the scan only when it is not
            if (j > 0 && q < x[j]) {
                j = 0;
            }
            while (j < n - 2 && q > x[j + 1]) {
                j++;
            }
            var t = (q - x[j]) / (x[j + 1] - x[j]);
            out[i] = y[j] + t * (y[j + 1] - y[j]);
        }
        return out;
    }

    /**
     * Resample a spectrum defined on one axis onto another.
     *
     * @param from     axis of the spectrum
     * @param spectrum values on from
     * @param to       target axis
     * @return values on to
     */
    public static double[] interpolate(SpectralSampleSet from, double[] spectrum, SpectralSampleSet to) {
        return interpolate(from.wavelengths(), spectrum, to.wavelengths());
    }
}
