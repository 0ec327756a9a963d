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

package com.hellblazer.iset.oi.sequence;

import com.hellblazer.iset.common.IsetException;
import com.hellblazer.iset.common.SpatialUnit;
import com.hellblazer.iset.oi.OpticalImage;
import com.hellblazer.iset.spectral.SpectralCube;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * A temporal sequence of optical images formed from a fixed and a modulated image. Frames are composed on demand
 * from the two held images, which are private copies taken at construction and never mutated, so frames may be
 * computed concurrently.
 *
 * @author hal.hildebrand
 */
public final class OpticalImageSequence {
    private static final Logger log = LoggerFactory.getLogger(OpticalImageSequence.class);

    /**
     * Spatial supports are compared in microns, rounded to this many decimals
     */
    public static final int SUPPORT_DECIMALS = 7;

    private final OpticalImage     fixed;
    private final OpticalImage     modulated;
    private final SpectralCube     fixedPhotons;
    private final SpectralCube     modulatedPhotons;
    private final double[]         timeAxis;
    private final double[]         modulationFunction;
    private final CompositionMode  composition;
    private final ModulationRegion modulationRegion;
    private final FrameComposer    composer;
    private final boolean[]        regionMask;

    private OpticalImageSequence(Builder builder) {
        if (builder.fixed == null || builder.modulated == null) {
            throw new IsetException.ConstructionException("Fixed and modulated optical images are required");
        }
        if (builder.modulationFunction == null || builder.modulationFunction.length == 0) {
            throw new IsetException.ConstructionException("Modulation function is empty");
        }
        this.fixed = builder.fixed.copy();
        this.modulated = builder.modulated.copy();
        this.modulationFunction = builder.modulationFunction.clone();
        this.timeAxis = expandTimeAxis(builder.timeAxis, modulationFunction.length);
        this.composition = builder.composition;
        this.modulationRegion = builder.modulationRegion;
        this.composer = switch (composition) {
            case ADD -> FrameComposer.ADD;
            case BLEND -> FrameComposer.BLEND;
            case XOR -> builder.xorRule;
        };

        fixedPhotons = fixed.data().photons();
        modulatedPhotons = modulated.data().photons();
        if (fixedPhotons == null || modulatedPhotons == null) {
            throw new IsetException.ConstructionException("Fixed and modulated optical images must hold photons");
        }
        if (!fixed.getWave().equals(modulated.getWave())) {
            throw new IsetException.ConstructionException(
            "Wavelength mismatch: " + fixed.getWave() + " vs " + modulated.getWave());
        }
        var fixedSupport = fixed.geometry().spatialSupport(SpatialUnit.MICRONS);
        var modulatedSupport = modulated.geometry().spatialSupport(SpatialUnit.MICRONS);
        if (fixedSupport.x().length != modulatedSupport.x().length
            || fixedSupport.y().length != modulatedSupport.y().length) {
            throw new IsetException.ConstructionException(
            "Mismatch between spatial dimensions of fixed and modulated images: " + fixed + " vs " + modulated);
        }
        if (!fixedSupport.matches(modulatedSupport, SUPPORT_DECIMALS)) {
            throw new IsetException.ConstructionException(
            "Mismatch between spatial support of fixed and modulated images");
        }

        var rows = fixedPhotons.rows();
        var cols = fixedPhotons.cols();
        regionMask = new boolean[rows * cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                regionMask[r * cols + c] = modulationRegion.contains(fixedSupport.eccentricity(r, c));
            }
        }
        log.debug("Sequence of {} frames, {} composition, region {}", modulationFunction.length, composition,
                  modulationRegion);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static double[] expandTimeAxis(double[] timeAxis, int frames) {
        if (timeAxis == null || timeAxis.length == 0) {
            throw new IsetException.ConstructionException("Time axis is empty");
        }
        double[] expanded;
        if (timeAxis.length == 1) {
            expanded = new double[frames];
            for (int i = 0; i < frames; i++) {
                expanded[i] = timeAxis[0] * i;
            }
        } else if (timeAxis.length != frames) {
            throw new IsetException.ConstructionException(
            "Time axis of " + timeAxis.length + " samples does not match modulation function of " + frames);
        } else {
            expanded = timeAxis.clone();
        }
        for (int i = 1; i < expanded.length; i++) {
            if (expanded[i] < expanded[i - 1]) {
                throw new IsetException.ConstructionException("Time axis decreases at index " + i);
            }
        }
        return expanded;
    }

    /**
     * Compose the frame at a 0-based index. Negative weights are allowed; where the fixed image enforces
     * non-negative photons, composite values below zero are clamped to zero.
     *
     * @return a new optical image, a copy of the fixed image carrying the composite photons
     */
    public OpticalImage frameAtIndex(int index) {
        if (index < 0 || index >= modulationFunction.length) {
            throw new IndexOutOfBoundsException("Frame " + index + " of " + modulationFunction.length);
        }
        var weight = modulationFunction[index];
        var clamp = fixed.getConfiguration().isEnforceNonNegative();
        var composite = fixedPhotons.combine(modulatedPhotons, (pixel, f, m) -> {
            var value = composer.compose(f, m, weight, regionMask[pixel]);
            return clamp ? Math.max(0.0, value) : value;
        });
        var frame = fixed.copy();
        frame.data().setPhotons(composite);
        return frame;
    }

    /**
     * @return every frame in order, each composed as the stream reaches it
     */
    public Stream<OpticalImage> frames() {
        return IntStream.range(0, length()).mapToObj(this::frameAtIndex);
    }

    public int length() {
        return modulationFunction.length;
    }

    public double timeStep() {
        if (timeAxis.length < 2) {
            throw new IllegalStateException("Time step of a single frame sequence is undefined");
        }
        return timeAxis[1] - timeAxis[0];
    }

    /**
     * Number of eye positions that fit in the sequence's duration at the given integration time. The duration
     * includes the last frame's time step.
     *
     * @param integrationTime seconds per eye position
     */
    public int maxEyeMovementsNumGivenIntegrationTime(double integrationTime) {
        if (!(integrationTime > 0)) {
            throw new IllegalArgumentException("Integration time must be positive: " + integrationTime);
        }
        if (timeAxis.length == 1) {
            return 1;
        }
        var duration = timeAxis[timeAxis.length - 1] - timeAxis[0] + timeStep();
        return (int) Math.floor(duration / integrationTime * (1 + 1e-9));
    }

    public double[] timeAxis() {
        return timeAxis.clone();
    }

    public double[] modulationFunction() {
        return modulationFunction.clone();
    }

    public CompositionMode composition() {
        return composition;
    }

    public ModulationRegion modulationRegion() {
        return modulationRegion;
    }

    public OpticalImage fixed() {
        return fixed.copy();
    }

    public OpticalImage modulated() {
        return modulated.copy();
    }

    public SpectralCube fixedPhotons() {
        return fixedPhotons.copy();
    }

    public SpectralCube modulatedPhotons() {
        return modulatedPhotons.copy();
    }

    @Override
    public String toString() {
        return String.format("OpticalImageSequence[%d frames, %s, %s]", length(), composition, modulationRegion);
    }

    public static class Builder {
        private OpticalImage     fixed;
        private OpticalImage     modulated;
        private double[]         timeAxis;
        private double[]         modulationFunction;
        private CompositionMode  composition      = CompositionMode.ADD;
        private ModulationRegion modulationRegion = ModulationRegion.wholeFrame();
        private FrameComposer    xorRule          = FrameComposer.REGION_REPLACE;

        private Builder() {
        }

        public Builder withFixed(OpticalImage fixed) {
            this.fixed = fixed;
            return this;
        }

        public Builder withModulated(OpticalImage modulated) {
            this.modulated = modulated;
            return this;
        }

        /**
         * @param timeAxis seconds, one per frame, or a single time step
         */
        public Builder withTimeAxis(double... timeAxis) {
            this.timeAxis = timeAxis == null ? null : timeAxis.clone();
            return this;
        }

        public Builder withModulationFunction(double... weights) {
            this.modulationFunction = weights == null ? null : weights.clone();
            return this;
        }

        public Builder withComposition(CompositionMode composition) {
            this.composition = Objects.requireNonNull(composition, "composition");
            return this;
        }

        public Builder withModulationRegion(ModulationRegion region) {
            this.modulationRegion = Objects.requireNonNull(region, "modulationRegion");
            return this;
        }

        /**
         * @param rule how XOR composition treats pixels inside the modulation region
         */
        public Builder withXorRule(FrameComposer rule) {
            this.xorRule = Objects.requireNonNull(rule, "xorRule");
            return this;
        }

        public OpticalImageSequence build() {
            return new OpticalImageSequence(this);
        }
    }
}
