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

/**
 * Combines one photon value of the fixed and modulated images for a frame.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface FrameComposer {

    FrameComposer ADD = (fixed, modulated, weight, inRegion) -> inRegion ? fixed + weight * modulated : fixed;

    FrameComposer BLEND = (fixed, modulated, weight, inRegion) -> inRegion
                                                                  ? fixed * (1 - weight) + modulated * weight
                                                                  : fixed;

    /**
     * Weighted modulated image inside the region, fixed image outside. The default rule for XOR composition.
     */
    FrameComposer REGION_REPLACE = (fixed, modulated, weight, inRegion) -> inRegion ? weight * modulated : fixed;

    /**
     * Hard switch to the modulated image inside the region wherever the weight is positive.
     */
    FrameComposer REGION_SWITCH = (fixed, modulated, weight, inRegion) -> inRegion && weight > 0 ? modulated : fixed;

    /**
     * @param fixed     photon value of the fixed image
     * @param modulated photon value of the modulated image at the same pixel and wavelength
     * @param weight    modulation weight of the frame
     * @param inRegion  whether the pixel lies in the modulation region
     * @return composite photon value
     */
    double compose(double fixed, double modulated, double weight, boolean inRegion);
}
