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

import com.hellblazer.iset.common.ParameterAccessor;
import com.hellblazer.iset.oi.access.OpticalImageAccessor;
import com.hellblazer.iset.oi.optics.Optics;
import com.hellblazer.iset.spectral.Quanta;
import com.hellblazer.iset.spectral.SpectralCube;
import com.hellblazer.iset.spectral.SpectralSampleSet;
import com.hellblazer.iset.spectral.WavelengthResampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The spatial-spectral irradiance at the sensor plane. Owns its photon data, wavelength axis and optics. Field of view
 * and object distance are the stored geometric primitives; width, height and everything derived from them are
 * computed on demand by {@link #geometry()}.
 *
 * @author hal.hildebrand
 */
public final class OpticalImage implements ParameterAccessor {
    public static final  String            TYPE         = "opticalimage";
    public static final  SpectralSampleSet DEFAULT_WAVE = SpectralSampleSet.range(400, 700, 10);
    private static final Logger            log          = LoggerFactory.getLogger(OpticalImage.class);

    private final OpticalImageConfiguration configuration;
    private final RadiometricArray          data;
    private final Diffuser                  diffuser;
    private       String                    name        = "oi";
    private       String                    filename;
    private       boolean                   consistency;
    private       Optics                    optics;
    private       double                    distance    = Double.NaN;
    private       double                    fov         = Double.NaN;
    private       ShiftVariantPsf           psf;
    private       double[][]                depthMap;

    public OpticalImage() {
        this(DEFAULT_WAVE);
    }

    public OpticalImage(SpectralSampleSet wave) {
        this(wave, OpticalImageConfiguration.getDefault(), new Optics());
    }

    public OpticalImage(SpectralSampleSet wave, OpticalImageConfiguration configuration, Optics optics) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.data = new RadiometricArray(wave, configuration);
        this.optics = Objects.requireNonNull(optics, "optics");
        this.diffuser = new Diffuser();
        optics.getLens().setWave(wave);
    }

    private OpticalImage(OpticalImage source) {
        this.configuration = source.configuration;
        this.data = source.data.copy(source.configuration);
        this.diffuser = source.diffuser.copy();
        this.name = source.name;
        this.filename = source.filename;
        this.consistency = source.consistency;
        this.optics = source.optics.copy();
        this.distance = source.distance;
        this.fov = source.fov;
        this.psf = source.psf;
        this.depthMap = source.depthMap == null ? null : copyOf(source.depthMap);
    }

    public OpticalImageConfiguration getConfiguration() {
        return configuration;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getType() {
        return TYPE;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public boolean isConsistent() {
        return consistency;
    }

    public void setConsistency(boolean consistency) {
        this.consistency = consistency;
    }

    public RadiometricArray data() {
        return data;
    }

    public SpectralSampleSet getWave() {
        return data.wave();
    }

    /**
     * Replace the wavelength axis. Photons are interpolated when the new samples lie within the old range and the
     * mean illuminance is then restored; otherwise the photons are replaced by zeros since spectra are never
     * extrapolated. Equal samples are a no-op.
     */
    public void setWave(SpectralSampleSet wave) {
        Objects.requireNonNull(wave, "wave");
        var oldWave = data.wave();
        if (oldWave.equals(wave)) {
            return;
        }
        optics.getLens().setWave(wave);
        if (!data.hasPhotons()) {
            data.rebind(wave, null);
            return;
        }
        if (oldWave.encloses(wave)) {
            var meanIlluminance = data.meanIlluminance();
            data.rebind(wave, WavelengthResampler.interpolate(oldWave, wave, data.photons()));
            restore(meanIlluminance);
        } else {
            log.warn("Wavelengths {} extend beyond {}, photons of {} replaced by zeros", wave, oldWave, name);
            data.rebind(wave, new SpectralCube(data.rows(), data.cols(), wave.count()));
        }
    }

    /**
     * Resample the photons to an arbitrary set of wavelengths, zero outside the current range, and restore the mean
     * illuminance.
     */
    public void interpolateWave(SpectralSampleSet wave) {
        Objects.requireNonNull(wave, "wave");
        var oldWave = data.wave();
        optics.getLens().setWave(wave);
        if (!data.hasPhotons()) {
            data.rebind(wave, null);
            return;
        }
        var meanIlluminance = data.meanIlluminance();
        data.rebind(wave, WavelengthResampler.interpolate(oldWave, wave, data.photons()));
        restore(meanIlluminance);
    }

    /**
     * Apply a spectrum to every pixel in energy units and store the result back as photons.
     *
     * @param spectrum  one value per wavelength sample
     * @param operation how the spectrum combines with the pixel energy
     */
    public void applySpectrum(double[] spectrum, SpectralOperation operation) {
        Objects.requireNonNull(operation, "operation");
        var wave = data.wave();
        if (spectrum.length != wave.count()) {
            throw new IllegalArgumentException(
            "Spectrum has " + spectrum.length + " values for " + wave.count() + " wavelengths");
        }
        var energy = data.energy();
        if (energy == null) {
            throw new IllegalStateException("No photon data in " + name);
        }
        var scaled = new SpectralCube(energy.rows(), energy.cols(), energy.waves());
        for (int w = 0; w < energy.waves(); w++) {
            for (int r = 0; r < energy.rows(); r++) {
                for (int c = 0; c < energy.cols(); c++) {
                    scaled.set(r, c, w, operation.apply(energy.get(r, c, w), spectrum[w]));
                }
            }
        }
        data.setPhotons(Quanta.toQuanta(wave, scaled));
    }

    public Optics getOptics() {
        return optics;
    }

    public void setOptics(Optics optics) {
        this.optics = Objects.requireNonNull(optics, "optics");
        optics.getLens().setWave(data.wave());
    }

    /**
     * @return the stored object distance, meters, NaN if never set
     */
    public double getDistance() {
        return distance;
    }

    /**
     * @param meters distance of the object the optics is focused on
     */
    public void setDistance(double meters) {
        if (!(meters > 0)) {
            throw new IllegalArgumentException("Distance must be positive: " + meters);
        }
        this.distance = meters;
    }

    /**
     * @return the stored horizontal field of view, degrees, NaN if never set
     */
    public double getFov() {
        return fov;
    }

    public void setFov(double degrees) {
        if (!(degrees > 0 && degrees < 180)) {
            throw new IllegalArgumentException("Field of view must be in (0, 180) degrees: " + degrees);
        }
        this.fov = degrees;
    }

    public Diffuser getDiffuser() {
        return diffuser;
    }

    public ShiftVariantPsf getShiftVariantPsf() {
        return psf;
    }

    public void setShiftVariantPsf(ShiftVariantPsf psf) {
        this.psf = psf;
    }

    /**
     * @return a copy of the depth map, meters, or null if none is set
     */
    public double[][] getDepthMap() {
        return depthMap == null ? null : copyOf(depthMap);
    }

    /**
     * @param meters depth per pixel, copied; null removes the depth map
     */
    public void setDepthMap(double[][] meters) {
        if (meters == null) {
            this.depthMap = null;
            return;
        }
        if (meters.length == 0 || meters[0].length == 0) {
            throw new IllegalArgumentException("Depth map is empty");
        }
        if (data.hasPhotons() && (meters.length != data.rows() || meters[0].length != data.cols())) {
            throw new IllegalArgumentException(
            "Depth map " + meters.length + " x " + meters[0].length + " does not match " + data.rows() + " x "
            + data.cols());
        }
        this.depthMap = copyOf(meters);
    }

    /**
     * @return true where the depth map holds a computed (non-zero) depth, null without a depth map
     */
    public boolean[][] logicalDepthMap() {
        if (depthMap == null) {
            return null;
        }
        var out = new boolean[depthMap.length][];
        for (int r = 0; r < depthMap.length; r++) {
            out[r] = new boolean[depthMap[r].length];
            for (int c = 0; c < depthMap[r].length; c++) {
                out[r][c] = depthMap[r][c] != 0;
            }
        }
        return out;
    }

    public OpticalImageGeometry geometry() {
        return new OpticalImageGeometry(this, null);
    }

    /**
     * @param companion scene supplying size, field of view and distance where this image has none
     */
    public OpticalImageGeometry geometry(Scene companion) {
        return new OpticalImageGeometry(this, companion);
    }

    public OpticalImageAccessor accessor(Scene companion) {
        return new OpticalImageAccessor(this, companion);
    }

    @Override
    public Object get(String parameter, Object... args) {
        return accessor(null).get(parameter, args);
    }

    @Override
    public void set(String parameter, Object value, Object... args) {
        accessor(null).set(parameter, value, args);
    }

    public OpticalImage copy() {
        return new OpticalImage(this);
    }

    @Override
    public String toString() {
        return String.format("OpticalImage[%s, %d x %d, %s]", name, data.rows(), data.cols(), data.wave());
    }

    private void restore(double meanIlluminance) {
        if (meanIlluminance > 0) {
            data.setMeanIlluminance(meanIlluminance);
        }
    }

    private static double[][] copyOf(double[][] map) {
        var out = new double[map.length][];
        for (int i = 0; i < map.length; i++) {
            out[i] = map[i].clone();
        }
        return out;
    }
}
