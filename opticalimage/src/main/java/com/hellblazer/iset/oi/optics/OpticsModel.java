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

import java.util.Locale;
import java.util.Objects;

/**
 * How optics propagation forms the optical image.
 *
 * @author hal.hildebrand
 */
public enum OpticsModel {
    DIFFRACTION_LIMITED("diffractionlimited", "dlmtf", "diffraction"),
    SHIFT_INVARIANT("shiftinvariant", "custom", "humanotf", "wvf"),
    RAY_TRACE("raytrace", "rt"),
    SKIP("skip", "none");

    private final String[] tokens;

    OpticsModel(String... tokens) {
        this.tokens = tokens;
    }

    public static OpticsModel parse(String token) {
        Objects.requireNonNull(token, "optics model");
        var key = token.toLowerCase(Locale.ROOT).replace(" ", "").replace("_", "").replace("-", "");
        for (var model : values()) {
            for (var t : model.tokens) {
                if (t.equals(key)) {
                    return model;
                }
            }
        }
        throw new IllegalArgumentException("Unknown optics model: " + token);
    }
}
