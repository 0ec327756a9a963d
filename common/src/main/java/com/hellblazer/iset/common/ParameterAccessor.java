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

/**
 * String-keyed get/set contract used at the boundary between the data model and its collaborators.
 * <p>
 * Implementations normalize names with {@link ParameterNames#normalize(String)} and fail with
 * {@link IsetException.UnknownParameterException} for names they do not recognize.
 *
 * @author hal.hildebrand
 */
public interface ParameterAccessor {

    /**
     * Read a parameter.
     *
     * @param parameter parameter name
     * @param args      optional qualifiers, such as a unit token
     * @return the value
     */
    Object get(String parameter, Object... args);

    /**
     * Write a parameter.
     *
     * @param parameter parameter name
     * @param value     new value
     * @param args      optional qualifiers
     */
    void set(String parameter, Object value, Object... args);
}
