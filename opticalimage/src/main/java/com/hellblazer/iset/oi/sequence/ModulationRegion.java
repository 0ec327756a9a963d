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
 * Disc about the image centre where the modulation applies, or the whole frame.
 *
 * @param radiusMicrons radius in microns, NaN for the whole frame
 * @author hal.hildebrand
 */
public record ModulationRegion(double radiusMicrons) {

    private static final ModulationRegion WHOLE_FRAME = new ModulationRegion(Double.NaN);

    public ModulationRegion {
        if (!Double.isNaN(radiusMicrons) && radiusMicrons < 0) {
            throw new IllegalArgumentException("Modulation radius must be non-negative: " + radiusMicrons);
        }
    }

    public static ModulationRegion radiusMicrons(double radius) {
        return new ModulationRegion(radius);
    }

    public static ModulationRegion wholeFrame() {
        return WHOLE_FRAME;
    }

    public boolean isWholeFrame() {
        return Double.isNaN(radiusMicrons);
    }

    /**
     * @param eccentricityMicrons distance from the image centre
     */
    public boolean contains(double eccentricityMicrons) {
        return isWholeFrame() || eccentricityMicrons <= radiusMicrons;
    }
}
