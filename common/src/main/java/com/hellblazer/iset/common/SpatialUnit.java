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
import java.util.Set;

/**
 * Spatial units for geometric getters. Values are stored in meters and multiplied by {@link #scale()} on the way
 * out; areas use {@link #areaScale()}.
 *
 * @author hal.hildebrand
 */
public enum SpatialUnit {
    KILOMETERS(1e-3, "km", "kilometer", "kilometers"),
    METERS(1.0, "m", "meter", "meters"),
    CENTIMETERS(1e2, "cm", "centimeter", "centimeters"),
    MILLIMETERS(1e3, "mm", "millimeter", "millimeters"),
    MICRONS(1e6, "um", "micron", "microns", "micrometer", "micrometers"),
    NANOMETERS(1e9, "nm", "nanometer", "nanometers");

    private final double      scale;
    private final Set<String> tokens;

    SpatialUnit(double scale, String... tokens) {
        this.scale = scale;
        this.tokens = Set.of(tokens);
    }

    /**
     * Parse a unit token such as {@code "mm"} or {@code "microns"}.
     *
     * @param token unit token, case insensitive
     * @return the unit
     * @throws IllegalArgumentException if the token is not a spatial unit
     */
    public static SpatialUnit parse(String token) {
        if (token == null || token.isBlank()) {
            return METERS;
        }
        var key = token.trim().toLowerCase(Locale.ROOT);
        for (var unit : values()) {
            if (unit.tokens.contains(key)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown spatial unit: " + token);
    }

    /**
     * @param token candidate token
     * @return true if {@link #parse(String)} would accept it
     */
    public static boolean isUnit(String token) {
        if (token == null) {
            return false;
        }
        var key = token.trim().toLowerCase(Locale.ROOT);
        for (var unit : values()) {
            if (unit.tokens.contains(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return multiplier from meters to this unit
     */
    public double scale() {
        return scale;
    }

    /**
     * @return multiplier from square meters to this unit squared
     */
    public double areaScale() {
        return scale * scale;
    }

    /**
     * Convert a length in meters to this unit.
     *
     * @param meters length in meters
     * @return length in this unit
     */
    public double fromMeters(double meters) {
        return meters * scale;
    }

    /**
     * Convert a length in this unit to meters.
     *
     * @param value length in this unit
     * @return length in meters
     */
    public double toMeters(double value) {
        return value / scale;
    }
}
