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
 * Zero-centred sample positions of an optical image.
 *
 * @param x column positions, left to right
 * @param y row positions, top to bottom
 * @author hal.hildebrand
 */
public record SpatialSupport(double[] x, double[] y) {

    /**
     * Evenly spaced centres of n samples of the given spacing, symmetric about zero.
     */
    public static double[] centred(int n, double spacing) {
        var out = new double[n];
        var start = -n * spacing / 2 + spacing / 2;
        for (int i = 0; i < n; i++) {
            out[i] = start + i * spacing;
        }
        return out;
    }

    /**
     * @return the distance of pixel (row, col) from the image centre
     */
    public double eccentricity(int row, int col) {
        return Math.hypot(x[col], y[row]);
    }

    /**
     * @param decimals number of decimals to round to
     * @return true if both supports have the same sample positions after rounding
     */
    public boolean matches(SpatialSupport other, int decimals) {
        return matches(x, other.x, decimals) && matches(y, other.y, decimals);
    }

    private static boolean matches(double[] a, double[] b, int decimals) {
        if (a.length != b.length) {
            return false;
        }
        var scale = Math.pow(10, decimals);
        for (int i = 0; i < a.length; i++) {
            if (Math.round(a[i] * scale) != Math.round(b[i] * scale)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SpatialSupport other && Arrays.equals(x, other.x) && Arrays.equals(y, other.y);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(x) + Arrays.hashCode(y);
    }

    @Override
    public String toString() {
        return "SpatialSupport[x=" + Arrays.toString(x) + ", y=" + Arrays.toString(y) + "]";
    }
}
