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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * CIE 1931 2° color matching functions and the photometric integrals built on them.
 * <p>
 * The tabulated ȳ is the photopic luminosity function V(λ). Tables are loaded from the JSON resource
 * {@value #CMF_RESOURCE} and linearly resampled onto the caller's wavelength axis, evaluating to zero outside the
 * tabulated range.
 *
 * @author hal.hildebrand
 */
public final class Photometry {
    private static final Logger log = LoggerFactory.getLogger(Photometry.class);

    /** Maximum luminous efficacy, lm/W */
    public static final double LUMINOUS_EFFICACY = 683.0;

    static final String CMF_RESOURCE = "/photometry/cie1931-2deg.json";

    private final SpectralSampleSet tableWave;
    private final double[]          xbar;
    private final double[]          ybar;
    private final double[]          zbar;

    private Photometry(SpectralSampleSet tableWave, double[] xbar, double[] ybar, double[] zbar) {
        this.tableWave = tableWave;
        this.xbar = xbar;
        this.ybar = ybar;
        this.zbar = zbar;
    }

    /**
     * The CIE 1931 tables bundled with this library.
     *
     * @return shared instance
     */
    public static Photometry getDefault() {
        return Holder.INSTANCE;
    }

    /**
     * Load tables from a classpath resource with {@code wave}, {@code xbar}, {@code ybar} and {@code zbar} arrays.
     *
     * @param resource classpath resource name
     * @return the tables
     */
    public static Photometry load(String resource) {
        try (var in = Photometry.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing photometry resource: " + resource);
            }
            var root = new ObjectMapper().readTree(in);
            var wave = SpectralSampleSet.of(doubles(root, "wave"));
            var photometry = new Photometry(wave, doubles(root, "xbar"), doubles(root, "ybar"), doubles(root, "zbar"));
            log.debug("Loaded color matching functions {} from {}", wave, resource);
            return photometry;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + resource, e);
        }
    }

    private static double[] doubles(JsonNode root, String field) {
        var node = root.get(field);
        if (node == null || !node.isArray()) {
            throw new IllegalStateException("Photometry table lacks array field: " + field);
        }
        var out = new double[node.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = node.get(i).asDouble();
        }
        return out;
    }

    /**
     * @return wavelength axis of the tabulated functions
     */
    public SpectralSampleSet tableWave() {
        return tableWave;
    }

    /**
     * Photopic luminosity V(λ) on the given axis.
     *
     * @param wave target axis
     * @return V(λ) per sample
     */
    public double[] luminosity(SpectralSampleSet wave) {
        return WavelengthResampler.interpolate(tableWave, ybar, wave);
    }

    /**
     * x̄, ȳ, z̄ on the given axis.
     *
     * @param wave target axis
     * @return [3][wave.count()] color matching functions
     */
    public double[][] colorMatching(SpectralSampleSet wave) {
        return new double[][] { WavelengthResampler.interpolate(tableWave, xbar, wave),
                                WavelengthResampler.interpolate(tableWave, ybar, wave),
                                WavelengthResampler.interpolate(tableWave, zbar, wave) };
    }

    /**
     * Illuminance (lux) of an irradiance energy cube: 683 · Δλ · Σ E(λ) V(λ).
     *
     * @param wave   axis of the cube
     * @param energy irradiance in W/m²/nm
     * @return [row][col] lux
     */
    public double[][] illuminance(SpectralSampleSet wave, SpectralCube energy) {
        var weights = luminosity(wave);
        var scale = LUMINOUS_EFFICACY * wave.binWidth();
        for (int i = 0; i < weights.length; i++) {
            weights[i] *= scale;
        }
        return energy.weightedSum(weights);
    }

    /**
     * CIE XYZ tristimulus values of an energy cube.
     *
     * @param wave   axis of the cube
     * @param energy energy cube
     * @return [row][col][3] XYZ
     */
    public double[][][] xyz(SpectralSampleSet wave, SpectralCube energy) {
        var cmf = colorMatching(wave);
        var scale = LUMINOUS_EFFICACY * wave.binWidth();
        var out = new double[energy.rows()][energy.cols()][3];
        for (int channel = 0; channel < 3; channel++) {
            var weights = cmf[channel];
            for (int i = 0; i < weights.length; i++) {
                weights[i] *= scale;
            }
            var sums = energy.weightedSum(weights);
            for (int r = 0; r < energy.rows(); r++) {
                for (int c = 0; c < energy.cols(); c++) {
                    out[r][c][channel] = sums[r][c];
                }
            }
        }
        return out;
    }

    private static final class Holder {
        private static final Photometry INSTANCE = load(CMF_RESOURCE);
    }
}
