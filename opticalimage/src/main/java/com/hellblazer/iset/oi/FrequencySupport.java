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

import java.util.Arrays;

/**
 * Spatial frequencies represented by the image samples.
 *
 * @param fx column frequencies
 * @param fy row frequencies
 * @author hal.hildebrand
 */
public record FrequencySupport(double[] fx, double[] fy) {

    /**
     * Frequencies -1 to 1 for a sequence of n samples, with zero at index ceil((n + 1) / 2) - 1.
     */
    public static double[] unitFrequencyList(int n) {
        var mid = (int) Math.ceil((n + 1) / 2.0);
        var out = new double[n];
        var max = 0.0;
        for (int i = 0; i < n; i++) {
            out[i] = (i + 1) - mid;
            max = Math.max(max, Math.abs(out[i]));
        }
        if (max > 0) {
            for (int i = 0; i < n; i++) {
                out[i] /= max;
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FrequencySupport other && Arrays.equals(fx, other.fx) && Arrays.equals(fy, other.fy);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(fx) + Arrays.hashCode(fy);
    }

    @Override
    public String toString() {
        return "FrequencySupport[fx=" + Arrays.toString(fx) + ", fy=" + Arrays.toString(fy) + "]";
    }
}
