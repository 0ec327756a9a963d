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

import com.hellblazer.iset.oi.OpticalImage;

/**
 * Factory helpers for building sequences from already computed optical images.
 *
 * @author hal.hildebrand
 */
public final class OpticalImageSequences {

    /**
     * Default spacing between frames, seconds
     */
    public static final double DEFAULT_SAMPLE_TIME = 0.001;

    private OpticalImageSequences() {
    }

    /**
     * Sequence sampled every millisecond.
     */
    public static OpticalImageSequence fromImages(OpticalImage fixed, OpticalImage modulated,
                                                  CompositionMode composition, double[] modulation) {
        return fromImages(fixed, modulated, composition, modulation, DEFAULT_SAMPLE_TIME);
    }

    /**
     * @param sampleTimes one time per frame, or a single time step
     */
    public static OpticalImageSequence fromImages(OpticalImage fixed, OpticalImage modulated,
                                                  CompositionMode composition, double[] modulation,
                                                  double... sampleTimes) {
        return OpticalImageSequence.builder()
                                   .withFixed(fixed)
                                   .withModulated(modulated)
                                   .withComposition(composition)
                                   .withModulationFunction(modulation)
                                   .withTimeAxis(sampleTimes)
                                   .build();
    }
}
