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

import com.hellblazer.iset.common.IsetException;
import com.hellblazer.iset.common.MemoizedValue;
import com.hellblazer.iset.common.PoissonNoise;
import com.hellblazer.iset.spectral.Photometry;
import com.hellblazer.iset.spectral.Quanta;
import com.hellblazer.iset.spectral.SamplePrecision;
import com.hellblazer.iset.spectral.SpectralCube;
import com.hellblazer.iset.spectral.SpectralSampleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The photon cube of an optical image, indexed (row, col, wavelength), with its derived illuminance. Every photon
 * write invalidates the illuminance map and its mean; both are recomputed on the next read. A single lock guards the
 * write / recompute pair.
 *
 * @author hal.hildebrand
 */
public final class RadiometricArray {
    private static final Logger log = LoggerFactory.getLogger(RadiometricArray.class);

    private final Lock                      lock = new ReentrantLock();
    private final OpticalImageConfiguration configuration;
    private final MemoizedValue<double[][]> illuminance;
    private final MemoizedValue<Double>     meanIlluminance;
    private       SpectralSampleSet         wave;
    private       SpectralCube              photons;
    private       SamplePrecision           precision;

    public RadiometricArray(SpectralSampleSet wave, OpticalImageConfiguration configuration) {
        this.wave = Objects.requireNonNull(wave, "wave");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.precision = configuration.getPrecision();
        this.illuminance = new MemoizedValue<>(this::computeIlluminance);
        this.meanIlluminance = new MemoizedValue<>(this::computeMeanIlluminance);
    }

    /**
     * Convert a caller supplied photon representation to a cube.
     *
     * @param value a {@link SpectralCube}, double[][][] or float[][][]; a single double[][] or float[][] plane is
     *              accepted as a one wavelength cube
     * @throws IsetException.PhotonTypeException for any other representation, integer arrays included
     */
    public static SpectralCube toCube(Object value) {
        if (value instanceof SpectralCube cube) {
            return cube.copy();
        }
        if (value instanceof double[][][] d) {
            return SpectralCube.of(d);
        }
        if (value instanceof float[][][] f) {
            return SpectralCube.of(f);
        }
        if (value instanceof double[][] plane) {
            var cube = new SpectralCube(plane.length, plane.length == 0 ? 0 : plane[0].length, 1);
            cube.setPlane(0, plane);
            return cube;
        }
        if (value instanceof float[][] plane) {
            var values = new double[plane.length][][];
            for (int r = 0; r < plane.length; r++) {
                values[r] = new double[plane[r].length][1];
                for (int c = 0; c < plane[r].length; c++) {
                    values[r][c][0] = plane[r][c];
                }
            }
            return SpectralCube.of(values);
        }
        throw new IsetException.PhotonTypeException(value == null ? null : value.getClass());
    }

    public SpectralSampleSet wave() {
        return wave;
    }

    /**
     * Rebind the wavelength axis together with the photons sampled on it.
     *
     * @param wave    new axis
     * @param photons photons on the new axis, or null to clear
     */
    void rebind(SpectralSampleSet wave, SpectralCube photons) {
        lock.lock();
        try {
            this.wave = Objects.requireNonNull(wave, "wave");
            if (photons == null) {
                this.photons = null;
            } else {
                store(photons);
            }
            invalidate();
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPhotons() {
        lock.lock();
        try {
            return photons != null;
        } finally {
            lock.unlock();
        }
    }

    public int rows() {
        lock.lock();
        try {
            return photons == null ? 0 : photons.rows();
        } finally {
            lock.unlock();
        }
    }

    public int cols() {
        lock.lock();
        try {
            return photons == null ? 0 : photons.cols();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return a copy of the full photon cube, or null when there is no data
     */
    public SpectralCube photons() {
        lock.lock();
        try {
            return photons == null ? null : photons.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Photon planes at the samples nearest the requested wavelengths. No interpolation is performed.
     *
     * @param wavelengths nm
     * @return the sub-cube, or null when there is no data
     */
    public SpectralCube photons(double... wavelengths) {
        if (wavelengths == null || wavelengths.length == 0) {
            return photons();
        }
        lock.lock();
        try {
            return photons == null ? null : photons.planes(wave.nearestIndices(wavelengths));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the whole photon cube.
     */
    public void setPhotons(SpectralCube cube) {
        Objects.requireNonNull(cube, "photons");
        if (cube.waves() != wave.count()) {
            throw new IllegalArgumentException(
            "Photon cube has " + cube.waves() + " planes for " + wave.count() + " wavelengths");
        }
        validate(cube);
        lock.lock();
        try {
            store(cube.copy());
            invalidate();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write the planes nearest the given wavelengths, leaving the others untouched.
     *
     * @param planes      one plane per wavelength, matching the existing rows and cols
     * @param wavelengths nm
     */
    public void setPhotons(SpectralCube planes, double... wavelengths) {
        if (wavelengths == null || wavelengths.length == 0) {
            setPhotons(planes);
            return;
        }
        Objects.requireNonNull(planes, "photons");
        if (planes.waves() != wavelengths.length) {
            throw new IllegalArgumentException(
            "Expected " + wavelengths.length + " planes, got " + planes.waves());
        }
        validate(planes);
        lock.lock();
        try {
            if (photons == null) {
                if (wave.count() != wavelengths.length) {
                    throw new IllegalStateException("No photon data to write wavelength planes into");
                }
                store(planes.copy());
            } else {
                if (planes.rows() != photons.rows() || planes.cols() != photons.cols()) {
                    throw new IllegalArgumentException(
                    "Plane size " + planes.rows() + " x " + planes.cols() + " does not match " + photons);
                }
                var indices = wave.nearestIndices(wavelengths);
                for (int i = 0; i < indices.length; i++) {
                    photons.setPlane(indices[i], planes.plane(i));
                }
                precision.storeInPlace(photons);
            }
            invalidate();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            photons = null;
            invalidate();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return a copy of the illuminance map, lux, or null when there is no data
     */
    public double[][] illuminance() {
        lock.lock();
        try {
            return photons == null ? null : copyOf(illuminance.get());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store an illuminance map directly. It stands until the next photon write.
     */
    public void setIlluminance(double[][] lux) {
        Objects.requireNonNull(lux, "illuminance");
        if (lux.length == 0 || lux[0].length == 0) {
            throw new IllegalArgumentException("Illuminance map is empty");
        }
        lock.lock();
        try {
            if (photons != null && (lux.length != photons.rows() || lux[0].length != photons.cols())) {
                throw new IllegalArgumentException("Illuminance map does not match " + photons);
            }
            illuminance.set(copyOf(lux));
            meanIlluminance.invalidate();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return mean illuminance, lux, or NaN when there is no data
     */
    public double meanIlluminance() {
        lock.lock();
        try {
            return photons == null ? Double.NaN : meanIlluminance.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rescale every photon uniformly so the mean illuminance becomes the target.
     *
     * @param lux target mean illuminance
     */
    public void setMeanIlluminance(double lux) {
        if (lux < 0 || Double.isNaN(lux)) {
            throw new IllegalArgumentException("Mean illuminance must be non-negative: " + lux);
        }
        lock.lock();
        try {
            if (photons == null) {
                throw new IllegalStateException("No photon data to scale");
            }
            var current = meanIlluminance.get();
            if (current == lux) {
                return;
            }
            if (!(current > 0)) {
                log.warn("Cannot scale photons to {} lux, current mean illuminance is {}", lux, current);
                return;
            }
            photons.scaleInPlace(lux / current);
            precision.storeInPlace(photons);
            invalidate();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the photon cube converted to energy, watts/sr/nm/m^2, or null when there is no data
     */
    public SpectralCube energy(double... wavelengths) {
        lock.lock();
        try {
            if (photons == null) {
                return null;
            }
            if (wavelengths == null || wavelengths.length == 0) {
                return Quanta.toEnergy(wave, photons);
            }
            var indices = wave.nearestIndices(wavelengths);
            var perPhoton = Quanta.energyPerPhoton(wave);
            var factors = new double[indices.length];
            for (int i = 0; i < indices.length; i++) {
                factors[i] = perPhoton[indices[i]];
            }
            return photons.planes(indices).scalePlanes(factors);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return CIE XYZ per pixel, [row][col][3], or null when there is no data
     */
    public double[][][] xyz() {
        lock.lock();
        try {
            return photons == null ? null : Photometry.getDefault().xyz(wave, Quanta.toEnergy(wave, photons));
        } finally {
            lock.unlock();
        }
    }

    public double dataMax() {
        lock.lock();
        try {
            return photons == null ? Double.NaN : photons.max();
        } finally {
            lock.unlock();
        }
    }

    public double dataMin() {
        lock.lock();
        try {
            return photons == null ? Double.NaN : photons.min();
        } finally {
            lock.unlock();
        }
    }

    public SamplePrecision precision() {
        return precision;
    }

    /**
     * Change the stored precision. Existing data is rounded when narrowing.
     */
    public void setPrecision(SamplePrecision precision) {
        lock.lock();
        try {
            this.precision = Objects.requireNonNull(precision, "precision");
            if (photons != null) {
                precision.storeInPlace(photons);
                invalidate();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Photon spectra at the listed pixels, one row per location.
     *
     * @throws IsetException.InvalidRegionException if the list is empty or a location lies outside the image
     */
    public double[][] roiPhotons(List<PixelLocation> locations) {
        lock.lock();
        try {
            checkRegion(locations);
            var out = new double[locations.size()][];
            for (int i = 0; i < out.length; i++) {
                var p = locations.get(i);
                out[i] = photons.spectrum(p.row(), p.col());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public double[] roiMeanPhotons(List<PixelLocation> locations) {
        return columnMean(roiPhotons(locations));
    }

    public double[][] roiEnergy(List<PixelLocation> locations) {
        var spectra = roiPhotons(locations);
        var out = new double[spectra.length][];
        for (int i = 0; i < spectra.length; i++) {
            out[i] = Quanta.toEnergy(wave, spectra[i]);
        }
        return out;
    }

    public double[] roiMeanEnergy(List<PixelLocation> locations) {
        return columnMean(roiEnergy(locations));
    }

    /**
     * Photon counts with Poisson noise. The photon rate is converted to a count over the given collecting area and
     * the configured integration time; each element is then an independent Poisson draw with that mean.
     *
     * @param random          source of randomness
     * @param collectingArea  square meters per sample
     * @return noisy counts, or null when there is no data
     */
    public SpectralCube photonNoise(Random random, double collectingArea) {
        var noise = new PoissonNoise(random, configuration.getGaussianThreshold());
        var scale = collectingArea * configuration.getNoiseIntegrationTime();
        lock.lock();
        try {
            if (photons == null) {
                return null;
            }
            return photons.map(v -> noise.sample(v * scale));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Noisy photon counts converted to energy.
     */
    public SpectralCube energyNoise(Random random, double collectingArea) {
        var counts = photonNoise(random, collectingArea);
        return counts == null ? null : Quanta.toEnergy(wave, counts);
    }

    /**
     * @return number of times the illuminance map has been computed from photons
     */
    long illuminanceComputations() {
        return illuminance.computations();
    }

    RadiometricArray copy(OpticalImageConfiguration configuration) {
        lock.lock();
        try {
            var copy = new RadiometricArray(wave, configuration);
            copy.precision = precision;
            copy.photons = photons == null ? null : photons.copy();
            illuminance.peek().ifPresent(map -> copy.illuminance.set(copyOf(map)));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    private void checkRegion(List<PixelLocation> locations) {
        if (locations == null || locations.isEmpty()) {
            throw new IsetException.InvalidRegionException("Region of interest is empty");
        }
        if (photons == null) {
            throw new IsetException.InvalidRegionException("No photon data for region of interest");
        }
        for (var p : locations) {
            if (!p.within(photons.rows(), photons.cols())) {
                throw new IsetException.InvalidRegionException(
                "Location " + p + " outside " + photons.rows() + " x " + photons.cols());
            }
        }
    }

    private void validate(SpectralCube cube) {
        if (!configuration.isEnforceNonNegative()) {
            return;
        }
        var min = cube.min();
        if (min < 0 || Double.isNaN(min) || Double.isNaN(cube.max())) {
            throw new IsetException.InvalidPhotonValueException(
            "Photon values must be non-negative and defined, minimum is " + min);
        }
    }

    private void store(SpectralCube cube) {
        photons = precision.storeInPlace(cube);
    }

    private void invalidate() {
        illuminance.invalidate();
        meanIlluminance.invalidate();
    }

    private double[][] computeIlluminance() {
        log.debug("Computing illuminance of {}", photons);
        return Photometry.getDefault().illuminance(wave, Quanta.toEnergy(wave, photons));
    }

    private double computeMeanIlluminance() {
        var map = illuminance.get();
        var sum = 0.0;
        var n = 0;
        for (var row : map) {
            for (var v : row) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    private static double[] columnMean(double[][] rows) {
        var out = new double[rows[0].length];
        for (var row : rows) {
            for (int j = 0; j < out.length; j++) {
                out[j] += row[j];
            }
        }
        for (int j = 0; j < out.length; j++) {
            out[j] /= rows.length;
        }
        return out;
    }

    private static double[][] copyOf(double[][] map) {
        var out = new double[map.length][];
        for (int i = 0; i < map.length; i++) {
            out[i] = map[i].clone();
        }
        return out;
    }
}
