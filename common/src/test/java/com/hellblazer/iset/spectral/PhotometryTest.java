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

package com.hellblazer.iset.spectral;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for quanta/energy conversion and the CIE photometric integrals.
 *
 * @author hal.hildebrand
 */
public class PhotometryTest {

    @Test
    public void testTablesLoad() {
        var photometry = Photometry.getDefault();
        assertEquals(380.0, photometry.tableWave().first());
        assertEquals(780.0, photometry.tableWave().last());
    }

    @Test
    public void testLuminosityResampling() {
        var v = Photometry.getDefault().luminosity(SpectralSampleSet.of(300, 550, 555, 900));
        assertEquals(0.0, v[0]);
        assertEquals(0.99495, v[1], 1e-12);
        assertEquals(0.994975, v[2], 1e-12);
        assertEquals(0.0, v[3]);
    }

    @Test
    public void testIlluminanceOfMonochromaticEnergy() {
        var wave = SpectralSampleSet.of(550);
        var energy = SpectralCube.uniform(2, 2, 1, 1.0);
        var lux = Photometry.getDefault().illuminance(wave, energy);
        assertEquals(683.0 * 0.99495, lux[1][0], 1e-9);
    }

    @Test
    public void testIlluminanceScalesWithBinWidth() {
        var wave = SpectralSampleSet.of(550, 560);
        var energy = SpectralCube.ofSpectrum(1, 1, 1.0, 0.0);
        var lux = Photometry.getDefault().illuminance(wave, energy);
        assertEquals(683.0 * 10 * 0.99495, lux[0][0], 1e-9);
    }

    @Test
    public void testXyzLuminanceChannelMatchesIlluminance() {
        var wave = SpectralSampleSet.range(400, 700, 10);
        var energy = SpectralCube.uniform(2, 3, wave.count(), 0.01);
        var photometry = Photometry.getDefault();
        var xyz = photometry.xyz(wave, energy);
        var lux = photometry.illuminance(wave, energy);
        assertEquals(3, xyz[0][0].length);
        assertEquals(lux[1][2], xyz[1][2][1], 1e-9);
        assertTrue(xyz[1][2][0] > 0);
        assertTrue(xyz[1][2][2] > 0);
    }

    @Test
    public void testQuantaEnergyRoundTrip() {
        var wave = SpectralSampleSet.range(400, 700, 100);
        var photons = SpectralCube.uniform(1, 2, wave.count(), 1e15);
        var energy = Quanta.toEnergy(wave, photons);
        // one photon at 500 nm carries h c / 500e-9 joules
        assertEquals(1e15 * Quanta.PLANCK * Quanta.SPEED_OF_LIGHT / 500e-9, energy.get(0, 1, 1), 1e-12);
        var back = Quanta.toQuanta(wave, energy);
        for (int w = 0; w < wave.count(); w++) {
            assertEquals(1e15, back.get(0, 0, w), 1e15 * 1e-12);
        }
    }

    @Test
    public void testShortWavelengthPhotonsCarryMoreEnergy() {
        var perPhoton = Quanta.energyPerPhoton(SpectralSampleSet.of(400, 700));
        assertEquals(700.0 / 400.0, perPhoton[0] / perPhoton[1], 1e-12);
    }
}
