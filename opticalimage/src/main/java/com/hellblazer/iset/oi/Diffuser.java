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

package com.hellblazer.iset.oi;

import java.util.Locale;
import java.util.Objects;

/**
 * Diffuser settings of an optical image. Only the parameters are held here; the blurring itself belongs to optics
 * propagation.
 *
 * @author hal.hildebrand
 */
public final class Diffuser {

    public enum Method {
        SKIP, BLUR, BIREFRINGENT;

        public static Method parse(String token) {
            Objects.requireNonNull(token, "diffuser method");
            return switch (token.trim().toLowerCase(Locale.ROOT)) {
                case "skip", "none" -> SKIP;
                case "blur", "gaussian" -> BLUR;
                case "birefringent" -> BIREFRINGENT;
                default -> throw new IllegalArgumentException("Unknown diffuser method: " + token);
            };
        }
    }

    private Method method = Method.SKIP;
    private double blur;

    public Method getMethod() {
        return method;
    }

    public void setMethod(Method method) {
        this.method = Objects.requireNonNull(method, "method");
    }

    /**
     * @return blur full width half maximum, meters
     */
    public double getBlur() {
        return blur;
    }

    public void setBlur(double meters) {
        if (meters < 0 || Double.isNaN(meters)) {
            throw new IllegalArgumentException("Diffuser blur must be non-negative: " + meters);
        }
        this.blur = meters;
    }

    Diffuser copy() {
        var copy = new Diffuser();
        copy.method = method;
        copy.blur = blur;
        return copy;
    }
}
