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
import java.util.Optional;

/**
 * Normalization and namespace splitting for string parameter names.
 * <p>
 * Names are compared case-insensitively with spaces, underscores and hyphens removed, so {@code "Mean Illuminance"},
 * {@code "mean_illuminance"} and {@code "meanilluminance"} are the same name.
 * <p>
 * A leading namespace token separated by a space or a dot routes the remainder to a nested object:
 * {@code "optics fnumber"}, {@code "optics.fnumber"} and {@code "optics.lens.density"}.
 *
 * @author hal.hildebrand
 */
public final class ParameterNames {

    private ParameterNames() {
    }

    /**
     * A parameter name split into its leading namespace token and the remainder.
     *
     * @param namespace normalized namespace token
     * @param remainder the rest of the name, not yet normalized; empty when the name is the bare namespace
     */
    public record Qualified(String namespace, String remainder) {

        /**
         * @return true if the name addressed the namespace object itself
         */
        public boolean isBare() {
            return remainder.isEmpty();
        }
    }

    /**
     * Normalize a parameter name.
     *
     * @param name raw name
     * @return lower case name without spaces, underscores, hyphens or dots
     */
    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must be defined");
        }
        var sb = new StringBuilder(name.length());
        for (var ch : name.toLowerCase(Locale.ROOT).toCharArray()) {
            if (ch != ' ' && ch != '_' && ch != '-' && ch != '.') {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    /**
     * Split off a namespace token if the name starts with it.
     * <p>
     * The token must be followed by a space or a dot, or be the whole name. {@code "opticsmodel"} is therefore not
     * qualified, while {@code "optics model"} is.
     *
     * @param name      raw name
     * @param namespace namespace token, lower case
     * @return the qualified split, or empty if the name is not in the namespace
     */
    public static Optional<Qualified> qualify(String name, String namespace) {
        if (name == null) {
            return Optional.empty();
        }
        var trimmed = name.trim();
        var lower = trimmed.toLowerCase(Locale.ROOT);
        if (!lower.startsWith(namespace)) {
            return Optional.empty();
        }
        if (lower.length() == namespace.length()) {
            return Optional.of(new Qualified(namespace, ""));
        }
        var separator = lower.charAt(namespace.length());
        if (separator != ' ' && separator != '.') {
            return Optional.empty();
        }
        var remainder = trimmed.substring(namespace.length() + 1).trim();
        return Optional.of(new Qualified(namespace, remainder));
    }
}
