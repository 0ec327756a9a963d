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

package com.hellblazer.iset.common;

import java.util.Locale;

/**
 * Angular units; degrees are the natural unit.
 *
 * @author hal.hildebrand
 */
public enum AngularUnit {
    DEGREES(1.0),
    ARC_MINUTES(60.0),
    ARC_SECONDS(3600.0),
    RADIANS(Math.PI / 180.0);

    private final double perDegree;

    AngularUnit(double perDegree) {
        this.perDegree = perDegree;
    }

    /**
     * Parse {@code deg}, {@code min}, {@code sec} or {@code radians}.
     *
     * @param token unit token; null or blank means degrees
     * @return the unit
     */
    public static AngularUnit parse(String token) {
        if (token == null || token.isBlank()) {
            return DEGREES;
        }
        return switch (token.trim().toLowerCase(Locale.ROOT)) {
            case "deg", "degree", "degrees" -> DEGREES;
            case "min", "arcmin", "minutes" -> ARC_MINUTES;
            case "sec", "arcsec", "seconds" -> ARC_SECONDS;
            case "rad", "radian", "radians" -> RADIANS;
            default -> throw new IllegalArgumentException("Unknown angular unit: " + token);
        };
    }

    /**
     * @param degrees angle in degrees
     * @return angle in this unit
     */
    public double fromDegrees(double degrees) {
        return degrees * perDegree;
    }
}
