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

/**
 * Immutable wavelength axis, in nanometers.
 * <p>
 * Samples are strictly increasing; spacing may be uniform or not. The bin width is the difference of the first two
 * samples, or 1 for a single sample.
 * <p>
 * Replacing the axis of an entity means installing a new instance. {@link #withWavelengths(double...)} returns
 * {@code this} when the new samples equal the current ones, which lets owners detect the no-op case by identity.
 *
 * @author hal.hildebrand
 */
public final class SpectralSampleSet {

    private final double[] wave;

    private SpectralSampleSet(double[] wave) {
        this.wave = wave;
    }

    /**
     * Create an axis from explicit samples.
     *
     * @param wavelengths samples in nm, strictly increasing
     * @return the axis
     * @throws IllegalArgumentException if empty, not finite, not positive or not strictly increasing
     */
    public static SpectralSampleSet of(double... wavelengths) {
        if (wavelengths == null || wavelengths.length == 0) {
            throw new IllegalArgumentException("Wavelength samples required");
        }
        var copy = wavelengths.clone();
        for (int i = 0; i < copy.length; i++) {
            if (!Double.isFinite(copy[i]) || copy[i] <= 0) {
                throw new IllegalArgumentException("Wavelength must be positive and finite: " + copy[i]);
            }
            if (i > 0 && copy[i] <= copy[i - 1]) {
                throw new IllegalArgumentException(
                "Wavelengths must be strictly increasing: " + copy[i - 1] + " then " + copy[i]);
            }
        }
        return new SpectralSampleSet(copy);
    }

    /**
     * Uniformly spaced axis from start to end inclusive.
     *
     * @param start first sample, nm
     * @param end   last sample, nm
     * @param step  spacing, nm
     * @return the axis
     */
    public static SpectralSampleSet range(double start, double end, double step) {
        if (!(step > 0)) {
            throw new IllegalArgumentException("Step must be positive: " + step);
        }
        if (end < start) {
            throw new IllegalArgumentException("End " + end + " precedes start " + start);
        }
        var count = (int) Math.floor((end - start) / step + 1e-9) + 1;
        var samples = new double[count];
        for (int i = 0; i < count; i++) {
            samples[i] = start + i * step;
        }
        return of(samples);
    }

    /**
     * @return copy of the samples, nm
     */
    public double[] wavelengths() {
        return wave.clone();
    }

    /**
     * @param index sample index
     * @return wavelength at index, nm
     */
    public double get(int index) {
        return wave[index];
    }

    /**
     * @return number of samples
     */
    public int count() {
        return wave.length;
    }

    /**
     * @return spacing of the first two samples, or 1 for a single sample
     */
    public double binWidth() {
        return wave.length > 1 ? wave[1] - wave[0] : 1.0;
    }

    /**
     * @return first sample, nm
     */
    public double first() {
        return wave[0];
    }

    /**
     * @return last sample, nm
     */
    public double last() {
        return wave[wave.length - 1];
    }

    /**
     * Index of the sample nearest to a wavelength. Ties resolve to the lower index.
     *
     * @param wavelength query, nm
     * @return nearest index
     */
    public int nearestIndex(double wavelength) {
        var pos = Arrays.binarySearch(wave, wavelength);
        if (pos >= 0) {
            return pos;
        }
        var insertion = -pos - 1;
        if (insertion == 0) {
            return 0;
        }
        if (insertion == wave.length) {
            return wave.length - 1;
        }
        var below = wavelength - wave[insertion - 1];
        var above = wave[insertion] - wavelength;
        return above < below ? insertion : insertion - 1;
    }

    /**
     * Nearest indices for a list of wavelengths, in the order given.
     *
     * @param wavelengths queries, nm
     * @return nearest indices
     */
    public int[] nearestIndices(double... wavelengths) {
        var out = new int[wavelengths.length];
        for (int i = 0; i < wavelengths.length; i++) {
            out[i] = nearestIndex(wavelengths[i]);
        }
        return out;
    }

    /**
     * Whether another axis lies within this axis' range, endpoints included.
     *
     * @param other candidate axis
     * @return true if no extrapolation is needed to resample onto other
     */
    public boolean encloses(SpectralSampleSet other) {
        return wave[0] <= other.first() && other.last() <= last();
    }

    /**
     * Whether these samples equal the given ones.
     *
     * @param wavelengths candidate samples
     * @return true if identical
     */
    public boolean sameAs(double... wavelengths) {
        return Arrays.equals(wave, wavelengths);
    }

    /**
     * Replace the samples. Returns this instance when they are unchanged.
     *
     * @param wavelengths new samples
     * @return this, or a new axis
     */
    public SpectralSampleSet withWavelengths(double... wavelengths) {
        if (sameAs(wavelengths)) {
            return this;
        }
        return of(wavelengths);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SpectralSampleSet other && Arrays.equals(wave, other.wave);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(wave);
    }

    @Override
    public String toString() {
        if (wave.length == 1) {
            return "SpectralSampleSet[" + wave[0] + " nm]";
        }
        return String.format("SpectralSampleSet[%s..%s nm, n=%d]", wave[0], last(), wave.length);
    }
}
