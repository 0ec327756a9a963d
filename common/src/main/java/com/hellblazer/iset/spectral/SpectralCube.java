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

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

/**
 * A (row, col, wavelength) floating point array.
 * <p>
 * Storage is planar: each wavelength plane is a contiguous row-major block of {@code rows * cols} values. Indices
 * are 0-based.
 * <p>
 * Instances are mutable through {@link #set(int, int, int, double)} and {@link #setPlane(int, double[][])}; owners
 * hand out {@link #copy()}s.
 *
 * @author hal.hildebrand
 */
public final class SpectralCube {

    private final int      rows;
    private final int      cols;
    private final int      waves;
    private final double[] data;

    /**
     * Zero-filled cube.
     *
     * @param rows  row count
     * @param cols  column count
     * @param waves wavelength count
     */
    public SpectralCube(int rows, int cols, int waves) {
        this(rows, cols, waves, new double[checkedSize(rows, cols, waves)]);
    }

    private SpectralCube(int rows, int cols, int waves, double[] data) {
        this.rows = rows;
        this.cols = cols;
        this.waves = waves;
        this.data = data;
    }

    private static int checkedSize(int rows, int cols, int waves) {
        if (rows <= 0 || cols <= 0 || waves <= 0) {
            throw new IllegalArgumentException(
            String.format("Cube dimensions must be positive: %d x %d x %d", rows, cols, waves));
        }
        return Math.multiplyExact(Math.multiplyExact(rows, cols), waves);
    }

    /**
     * Cube with every element equal to a value.
     *
     * @param rows  row count
     * @param cols  column count
     * @param waves wavelength count
     * @param value fill value
     * @return the cube
     */
    public static SpectralCube uniform(int rows, int cols, int waves, double value) {
        var cube = new SpectralCube(rows, cols, waves);
        Arrays.fill(cube.data, value);
        return cube;
    }

    /**
     * Cube whose every pixel carries the same spectrum.
     *
     * @param rows     row count
     * @param cols     column count
     * @param spectrum per-wavelength values
     * @return the cube
     */
    public static SpectralCube ofSpectrum(int rows, int cols, double... spectrum) {
        var cube = new SpectralCube(rows, cols, spectrum.length);
        var plane = rows * cols;
        for (int w = 0; w < spectrum.length; w++) {
            Arrays.fill(cube.data, w * plane, (w + 1) * plane, spectrum[w]);
        }
        return cube;
    }

    /**
     * Copy a nested double array indexed [row][col][wave].
     *
     * @param values source values
     * @return the cube
     */
    public static SpectralCube of(double[][][] values) {
        var rows = values.length;
        var cols = rows == 0 ? 0 : values[0].length;
        var waves = cols == 0 ? 0 : values[0][0].length;
        var cube = new SpectralCube(rows, cols, waves);
        for (int r = 0; r < rows; r++) {
            if (values[r].length != cols) {
                throw new IllegalArgumentException("Ragged row " + r);
            }
            for (int c = 0; c < cols; c++) {
                if (values[r][c].length != waves) {
                    throw new IllegalArgumentException("Ragged spectrum at " + r + "," + c);
                }
                for (int w = 0; w < waves; w++) {
                    cube.set(r, c, w, values[r][c][w]);
                }
            }
        }
        return cube;
    }

    /**
     * Copy a nested single precision array indexed [row][col][wave].
     *
     * @param values source values
     * @return the cube
     */
    public static SpectralCube of(float[][][] values) {
        var rows = values.length;
        var cols = rows == 0 ? 0 : values[0].length;
        var waves = cols == 0 ? 0 : values[0][0].length;
        var cube = new SpectralCube(rows, cols, waves);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (values[r][c].length != waves) {
                    throw new IllegalArgumentException("Ragged spectrum at " + r + "," + c);
                }
                for (int w = 0; w < waves; w++) {
                    cube.set(r, c, w, values[r][c][w]);
                }
            }
        }
        return cube;
    }

    /**
     * Cube from a pixel-major matrix, one row per pixel in row-major order and one column per wavelength.
     *
     * @param rows  row count
     * @param cols  column count
     * @param pixel [pixel][wave] values
     * @return the cube
     */
    public static SpectralCube fromPixels(int rows, int cols, double[][] pixel) {
        if (pixel.length != rows * cols) {
            throw new IllegalArgumentException("Expected " + rows * cols + " pixels, got " + pixel.length);
        }
        var waves = pixel[0].length;
        var cube = new SpectralCube(rows, cols, waves);
        var plane = rows * cols;
        for (int p = 0; p < plane; p++) {
            for (int w = 0; w < waves; w++) {
                cube.data[w * plane + p] = pixel[p][w];
            }
        }
        return cube;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int waves() {
        return waves;
    }

    /**
     * @return total element count
     */
    public int size() {
        return data.length;
    }

    private int index(int row, int col, int wave) {
        return (wave * rows + row) * cols + col;
    }

    public double get(int row, int col, int wave) {
        return data[index(row, col, wave)];
    }

    public void set(int row, int col, int wave, double value) {
        data[index(row, col, wave)] = value;
    }

    /**
     * Spectrum at one pixel.
     *
     * @param row row index
     * @param col column index
     * @return per-wavelength values
     */
    public double[] spectrum(int row, int col) {
        var out = new double[waves];
        for (int w = 0; w < waves; w++) {
            out[w] = get(row, col, w);
        }
        return out;
    }

    /**
     * Copy of one wavelength plane.
     *
     * @param wave plane index
     * @return [row][col] values
     */
    public double[][] plane(int wave) {
        var out = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(data, index(r, 0, wave), out[r], 0, cols);
        }
        return out;
    }

    /**
     * Overwrite one wavelength plane.
     *
     * @param wave   plane index
     * @param values [row][col] values
     */
    public void setPlane(int wave, double[][] values) {
        if (values.length != rows) {
            throw new IllegalArgumentException("Plane has " + values.length + " rows, expected " + rows);
        }
        for (int r = 0; r < rows; r++) {
            if (values[r].length != cols) {
                throw new IllegalArgumentException("Plane row " + r + " has " + values[r].length + " cols");
            }
            System.arraycopy(values[r], 0, data, index(r, 0, wave), cols);
        }
    }

    /**
     * Sub-cube holding the given wavelength planes, in the order given.
     *
     * @param indices plane indices
     * @return new cube
     */
    public SpectralCube planes(int... indices) {
        var out = new SpectralCube(rows, cols, indices.length);
        var plane = rows * cols;
        for (int i = 0; i < indices.length; i++) {
            System.arraycopy(data, indices[i] * plane, out.data, i * plane, plane);
        }
        return out;
    }

    /**
     * Pixel-major matrix: one row per pixel in row-major order, one column per wavelength.
     *
     * @return [pixel][wave] values
     */
    public double[][] toPixels() {
        var plane = rows * cols;
        var out = new double[plane][waves];
        for (int p = 0; p < plane; p++) {
            for (int w = 0; w < waves; w++) {
                out[p][w] = data[w * plane + p];
            }
        }
        return out;
    }

    /**
     * @return nested copy indexed [row][col][wave]
     */
    public double[][][] toArray() {
        var out = new double[rows][cols][waves];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                for (int w = 0; w < waves; w++) {
                    out[r][c][w] = get(r, c, w);
                }
            }
        }
        return out;
    }

    /**
     * @return deep copy
     */
    public SpectralCube copy() {
        return new SpectralCube(rows, cols, waves, data.clone());
    }

    /**
     * Element-wise transform into a new cube.
     *
     * @param op transform
     * @return new cube
     */
    public SpectralCube map(DoubleUnaryOperator op) {
        var out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = op.applyAsDouble(data[i]);
        }
        return new SpectralCube(rows, cols, waves, out);
    }

    /**
     * Combine with a cube of the same shape element by element, into a new cube.
     *
     * @param other    second operand
     * @param combiner receives the row-major pixel index and the two values
     * @return new cube
     */
    public SpectralCube combine(SpectralCube other, ElementCombiner combiner) {
        if (!sameShape(other)) {
            throw new IllegalArgumentException("Shape mismatch: " + this + " vs " + other);
        }
        var plane = rows * cols;
        var out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = combiner.combine(i % plane, data[i], other.data[i]);
        }
        return new SpectralCube(rows, cols, waves, out);
    }

    /**
     * Element combination for {@link #combine(SpectralCube, ElementCombiner)}.
     */
    @FunctionalInterface
    public interface ElementCombiner {
        double combine(int pixel, double a, double b);
    }

    /**
     * Multiply every element in place.
     *
     * @param factor multiplier
     */
    public void scaleInPlace(double factor) {
        for (int i = 0; i < data.length; i++) {
            data[i] *= factor;
        }
    }

    /**
     * Multiply each wavelength plane by its own factor, into a new cube.
     *
     * @param factors one factor per wavelength
     * @return new cube
     */
    public SpectralCube scalePlanes(double[] factors) {
        if (factors.length != waves) {
            throw new IllegalArgumentException("Expected " + waves + " factors, got " + factors.length);
        }
        var out = copy();
        var plane = rows * cols;
        for (int w = 0; w < waves; w++) {
            for (int p = 0; p < plane; p++) {
                out.data[w * plane + p] *= factors[w];
            }
        }
        return out;
    }

    /**
     * Weighted sum over wavelength at each pixel.
     *
     * @param weights one weight per wavelength
     * @return [row][col] sums
     */
    public double[][] weightedSum(double[] weights) {
        if (weights.length != waves) {
            throw new IllegalArgumentException("Expected " + waves + " weights, got " + weights.length);
        }
        var out = new double[rows][cols];
        for (int w = 0; w < waves; w++) {
            var weight = weights[w];
            if (weight == 0.0) {
                continue;
            }
            for (int r = 0; r < rows; r++) {
                var base = index(r, 0, w);
                for (int c = 0; c < cols; c++) {
                    out[r][c] += weight * data[base + c];
                }
            }
        }
        return out;
    }

    public double min() {
        var min = Double.POSITIVE_INFINITY;
        for (var v : data) {
            min = Math.min(min, v);
        }
        return min;
    }

    public double max() {
        var max = Double.NEGATIVE_INFINITY;
        for (var v : data) {
            max = Math.max(max, v);
        }
        return max;
    }

    /**
     * @return mean over all elements
     */
    public double mean() {
        var sum = 0.0;
        for (var v : data) {
            sum += v;
        }
        return sum / data.length;
    }

    /**
     * @param other candidate
     * @return true if rows, cols and waves match
     */
    public boolean sameShape(SpectralCube other) {
        return rows == other.rows && cols == other.cols && waves == other.waves;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SpectralCube other && sameShape(other) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * rows + cols) + waves) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return String.format("SpectralCube[%d x %d x %d]", rows, cols, waves);
    }
}
