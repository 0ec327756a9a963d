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

import com.hellblazer.iset.spectral.SpectralCube;
import com.hellblazer.iset.spectral.SpectralSampleSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for wavelength changes and spectral operations on the optical image.
 *
 * @author hal.hildebrand
 */
public class OpticalImageTest {

    private OpticalImage oi;

    @BeforeEach
    public void setUp() {
        oi = TestImages.ramp(4, 5);
    }

    @Test
    @DisplayName("Setting identical wavelengths leaves photons bit-identical")
    public void testSameWaveIsNoOp() {
        var before = oi.data().photons();
        var illuminance = oi.data().illuminance();
        var computations = oi.data().illuminanceComputations();
        oi.setWave(SpectralSampleSet.range(400, 700, 10));
        assertEquals(before, oi.data().photons());
        assertArrayEquals(illuminance[1], oi.data().illuminance()[1]);
        assertEquals(computations, oi.data().illuminanceComputations());
    }

    @Test
    @DisplayName("Interpolating to a sub-range preserves mean illuminance")
    public void testSubRangePreservesMeanIlluminance() {
        var mean = oi.data().meanIlluminance();
        var subRange = SpectralSampleSet.range(450, 650, 5);
        oi.setWave(subRange);

        assertEquals(subRange, oi.getWave());
        var photons = oi.data().photons();
        assertEquals(4, photons.rows());
        assertEquals(5, photons.cols());
        assertEquals(subRange.count(), photons.waves());
        assertEquals(mean, oi.data().meanIlluminance(), mean * 1e-5);
    }

    @Test
    public void testInclusiveEndpointsInterpolate() {
        var mean = oi.data().meanIlluminance();
        oi.setWave(SpectralSampleSet.range(400, 700, 20));
        assertTrue(oi.data().photons().max() > 0);
        assertEquals(mean, oi.data().meanIlluminance(), mean * 1e-5);
    }

    @Test
    @DisplayName("Extending beyond the current range zero-fills the photons")
    public void testExtrapolationZeroFills() {
        var wider = SpectralSampleSet.range(380, 720, 10);
        oi.setWave(wider);
        var photons = oi.data().photons();
        assertEquals(4, photons.rows());
        assertEquals(5, photons.cols());
        assertEquals(wider.count(), photons.waves());
        assertEquals(0.0, photons.max());
        assertEquals(0.0, photons.min());
        assertEquals(0.0, oi.data().meanIlluminance());
    }

    @Test
    public void testLensFollowsWave() {
        var wave = SpectralSampleSet.range(450, 650, 50);
        oi.setWave(wave);
        assertEquals(wave, oi.getOptics().getLens().getWave());
        assertEquals(wave.count(), oi.getOptics().getLens().transmittance().length);
    }

    @Test
    public void testWaveWithoutPhotons() {
        var empty = new OpticalImage();
        empty.setWave(SpectralSampleSet.of(550));
        assertEquals(1, empty.getWave().count());
        assertFalse(empty.data().hasPhotons());
    }

    @Test
    public void testInterpolateWaveAllowsAnyRange() {
        var mean = oi.data().meanIlluminance();
        oi.interpolateWave(SpectralSampleSet.range(390, 710, 10));
        var photons = oi.data().photons();
        assertEquals(33, photons.waves());
        assertEquals(0.0, photons.get(0, 0, 0));
        assertTrue(photons.get(0, 0, 1) > 0);
        assertEquals(mean, oi.data().meanIlluminance(), mean * 1e-5);
    }

    @Test
    public void testApplySpectrum() {
        var uniform = TestImages.uniform(2, 2, 1e15);
        var before = uniform.data().photons();
        var twos = new double[TestImages.WAVE.count()];
        Arrays.fill(twos, 2.0);

        uniform.applySpectrum(twos, SpectralOperation.MULTIPLY);
        assertEquals(2 * before.get(1, 1, 3), uniform.data().photons().get(1, 1, 3), before.get(1, 1, 3) * 1e-6);

        uniform.applySpectrum(twos, SpectralOperation.DIVIDE);
        assertEquals(before.get(1, 1, 3), uniform.data().photons().get(1, 1, 3), before.get(1, 1, 3) * 1e-6);

        var huge = new double[TestImages.WAVE.count()];
        Arrays.fill(huge, 1.0);
        uniform.applySpectrum(huge, SpectralOperation.SUBTRACT);
        assertEquals(0.0, uniform.data().photons().max());

        uniform.applySpectrum(huge, SpectralOperation.ADD);
        assertTrue(uniform.data().photons().min() > 0);

        assertThrows(IllegalArgumentException.class,
                     () -> uniform.applySpectrum(new double[3], SpectralOperation.ADD));
    }

    @Test
    public void testCopyIsIndependent() {
        oi.setName("original");
        oi.setDistance(2.0);
        var copy = oi.copy();
        copy.setName("copy");
        copy.data().setPhotons(SpectralCube.uniform(4, 5, TestImages.WAVE.count(), 0));
        copy.getOptics().setFNumber(8);

        assertEquals("original", oi.getName());
        assertTrue(oi.data().photons().max() > 0);
        assertEquals(4.0, oi.getOptics().getFNumber());
        assertEquals(2.0, copy.getDistance());
    }

    @Test
    public void testDepthMap() {
        assertNull(oi.logicalDepthMap());
        var depth = new double[4][5];
        depth[1][2] = 3.0;
        oi.setDepthMap(depth);
        assertTrue(oi.logicalDepthMap()[1][2]);
        assertFalse(oi.logicalDepthMap()[0][0]);
        assertThrows(IllegalArgumentException.class, () -> oi.setDepthMap(new double[2][2]));
        assertThrows(IllegalArgumentException.class, () -> oi.setDepthMap(new double[0][]));

        depth[1][2] = 0.0;
        assertEquals(3.0, oi.getDepthMap()[1][2]);
        oi.getDepthMap()[1][2] = 0.0;
        assertTrue(oi.logicalDepthMap()[1][2]);
        oi.setDepthMap(null);
        assertNull(oi.getDepthMap());
    }

    @Test
    public void testPrimitiveValidation() {
        assertThrows(IllegalArgumentException.class, () -> oi.setFov(0));
        assertThrows(IllegalArgumentException.class, () -> oi.setFov(180));
        assertThrows(IllegalArgumentException.class, () -> oi.setDistance(-1));
        assertTrue(Double.isNaN(new OpticalImage().getFov()));
    }
}
