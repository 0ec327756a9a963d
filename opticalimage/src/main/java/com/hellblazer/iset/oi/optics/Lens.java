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

package com.hellblazer.iset.oi.optics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.iset.common.IsetException;
import com.hellblazer.iset.common.ParameterAccessor;
import com.hellblazer.iset.common.ParameterNames;
import com.hellblazer.iset.spectral.SpectralSampleSet;
import com.hellblazer.iset.spectral.WavelengthResampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Crystalline lens pigment. The unit density absorbance table is permanent; only the working wavelength grid and the
 * density scale change. Transmittance at the working grid is 10^(-density * absorbance).
 *
 * @author hal.hildebrand
 */
public final class Lens implements ParameterAccessor {
    private static final Logger log = LoggerFactory.getLogger(Lens.class);

    static final String ABSORBANCE_RESOURCE = "/lens/lens-density.json";

    private final SpectralSampleSet tableWave;
    private final double[]          unitDensity;
    private       String            name;
    private       SpectralSampleSet wave;
    private       double            density = 1.0;

    private Lens(String name, SpectralSampleSet tableWave, double[] unitDensity) {
        this.name = name;
        this.tableWave = tableWave;
        this.unitDensity = unitDensity;
        this.wave = tableWave;
    }

    /**
     * @return a lens with the standard human pigment table, working at the table's own wavelengths
     */
    public static Lens defaultLens() {
        return load(ABSORBANCE_RESOURCE);
    }

    public static Lens load(String resource) {
        try (var in = Lens.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing lens resource: " + resource);
            }
            var root = new ObjectMapper().readTree(in);
            var wave = SpectralSampleSet.of(doubles(root, "wave"));
            var density = doubles(root, "unitDensity");
            if (density.length != wave.count()) {
                throw new IllegalStateException(
                "Lens table has " + density.length + " densities for " + wave.count() + " wavelengths");
            }
            var name = root.hasNonNull("name") ? root.get("name").asText() : "lens";
            log.debug("Loaded lens {} over {} from {}", name, wave, resource);
            return new Lens(name, wave, density);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + resource, e);
        }
    }

    private static double[] doubles(JsonNode root, String field) {
        var node = root.get(field);
        if (node == null || !node.isArray()) {
            throw new IllegalStateException("Lens table lacks array field: " + field);
        }
        var out = new double[node.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = node.get(i).asDouble();
        }
        return out;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public SpectralSampleSet getWave() {
        return wave;
    }

    /**
     * Change the working wavelength grid. The stored absorbance table is untouched.
     */
    public void setWave(SpectralSampleSet wave) {
        this.wave = Objects.requireNonNull(wave, "wave");
    }

    public double getDensity() {
        return density;
    }

    public void setDensity(double density) {
        if (density < 0 || Double.isNaN(density)) {
            throw new IllegalArgumentException("Lens density must be non-negative: " + density);
        }
        this.density = density;
    }

    /**
     * @return unit density absorbance at the working grid, zero outside the stored table
     */
    public double[] absorbance() {
        return WavelengthResampler.interpolate(tableWave, unitDensity, wave);
    }

    /**
     * @return scaled optical density at the working grid
     */
    public double[] opticalDensity() {
        var out = absorbance();
        for (int i = 0; i < out.length; i++) {
            out[i] *= density;
        }
        return out;
    }

    public double[] transmittance() {
        var out = opticalDensity();
        for (int i = 0; i < out.length; i++) {
            out[i] = Math.pow(10, -out[i]);
        }
        return out;
    }

    public double[] absorptance() {
        var out = transmittance();
        for (int i = 0; i < out.length; i++) {
            out[i] = 1 - out[i];
        }
        return out;
    }

    public Lens copy() {
        var copy = new Lens(name, tableWave, unitDensity);
        copy.wave = wave;
        copy.density = density;
        return copy;
    }

    @Override
    public Object get(String parameter, Object... args) {
        return switch (ParameterNames.normalize(parameter)) {
            case "name" -> name;
            case "type" -> "lens";
            case "wave", "wavelength" -> wave.wavelengths();
            case "nwave" -> wave.count();
            case "density", "peakdensity" -> density;
            case "unitdensity", "absorbance" -> absorbance();
            case "opticaldensity", "spectraldensity" -> opticalDensity();
            case "transmittance" -> transmittance();
            case "absorptance" -> absorptance();
            default -> throw new IsetException.UnknownParameterException("lens", parameter);
        };
    }

    @Override
    public void set(String parameter, Object value, Object... args) {
        var key = ParameterNames.normalize(parameter);
        if (value == null) {
            throw new IsetException.MissingValueException(parameter);
        }
        switch (key) {
            case "name" -> setName(value.toString());
            case "wave", "wavelength" -> setWave(value instanceof SpectralSampleSet s ? s
                                                                                     : SpectralSampleSet.of((double[]) value));
            case "density", "peakdensity" -> setDensity(((Number) value).doubleValue());
            default -> throw new IsetException.UnknownParameterException("lens", parameter);
        }
    }
}
