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

import java.util.Locale;
import java.util.Objects;

/**
 * How the modulated image enters each frame of a sequence.
 *
 * @author hal.hildebrand
 */
public enum CompositionMode {
    /**
     * fixed + weight * modulated
     */
    ADD,
    /**
     * fixed * (1 - weight) + modulated * weight
     */
    BLEND,
    /**
     * Spatially disjoint: the sequence's {@link FrameComposer} decides inside the modulation region, fixed elsewhere
     */
    XOR;

    public static CompositionMode parse(String token) {
        Objects.requireNonNull(token, "composition");
        return valueOf(token.trim().toUpperCase(Locale.ROOT));
    }
}
