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

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class MemoizedValueTest {

    @Test
    public void testComputesOnceUntilInvalidated() {
        var counter = new AtomicInteger();
        var value = new MemoizedValue<>(() -> counter.incrementAndGet());
        assertFalse(value.isSet());
        assertTrue(value.peek().isEmpty());

        assertEquals(1, value.get());
        assertEquals(1, value.get());
        assertEquals(1, value.computations());

        value.invalidate();
        assertFalse(value.isSet());
        assertEquals(2, value.get());
        assertEquals(2, value.computations());
    }

    @Test
    public void testExplicitSetBypassesComputation() {
        var value = new MemoizedValue<>(() -> "computed");
        value.set("assigned");
        assertEquals("assigned", value.get());
        assertEquals(0, value.computations());
        assertEquals("assigned", value.peek().orElseThrow());
    }
}
