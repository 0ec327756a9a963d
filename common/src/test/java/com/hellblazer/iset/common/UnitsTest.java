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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for spatial and angular unit tokens.
 *
 * @author hal.hildebrand
 */
public class UnitsTest {

    @Test
    public void testSpatialTokens() {
        assertEquals(SpatialUnit.METERS, SpatialUnit.parse(null));
        assertEquals(SpatialUnit.METERS, SpatialUnit.parse("m"));
        assertEquals(SpatialUnit.MILLIMETERS, SpatialUnit.parse("MM"));
        assertEquals(SpatialUnit.MICRONS, SpatialUnit.parse("um"));
        assertEquals(SpatialUnit.MICRONS, SpatialUnit.parse("microns"));
        assertEquals(SpatialUnit.NANOMETERS, SpatialUnit.parse("nm"));
        assertThrows(IllegalArgumentException.class, () -> SpatialUnit.parse("furlong"));
        assertTrue(SpatialUnit.isUnit("cm"));
        assertFalse(SpatialUnit.isUnit("deg"));
    }

    @Test
    public void testSpatialScaling() {
        assertEquals(1000.0, SpatialUnit.MILLIMETERS.fromMeters(1.0));
        assertEquals(1e6, SpatialUnit.MILLIMETERS.areaScale());
        assertEquals(0.002, SpatialUnit.MILLIMETERS.toMeters(2.0), 1e-15);
        assertEquals(3e-3, SpatialUnit.KILOMETERS.fromMeters(3.0), 1e-15);
    }

    @Test
    public void testAngularTokens() {
        assertEquals(AngularUnit.DEGREES, AngularUnit.parse(""));
        assertEquals(AngularUnit.ARC_MINUTES, AngularUnit.parse("min"));
        assertEquals(AngularUnit.ARC_SECONDS, AngularUnit.parse("sec"));
        assertEquals(AngularUnit.RADIANS, AngularUnit.parse("radians"));
        assertThrows(IllegalArgumentException.class, () -> AngularUnit.parse("gradians"));

        assertEquals(120.0, AngularUnit.ARC_MINUTES.fromDegrees(2.0));
        assertEquals(Math.PI, AngularUnit.RADIANS.fromDegrees(180.0), 1e-15);
    }
}
