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

import com.hellblazer.iset.common.IsetException;
import com.hellblazer.iset.spectral.Photometry;
import com.hellblazer.iset.spectral.Quanta;
import com.hellblazer.iset.spectral.SamplePrecision;
import com.hellblazer.iset.spectral.SpectralCube;
import com.hellblazer.iset.spectral.SpectralSampleSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for photon storage and derived illuminance.
 *
 * @author hal.hildebrand
 */
public class RadiometricArrayTest {

    private static final SpectralSampleSet WAVE = SpectralSampleSet.range(400, 700, 10);

    private static RadiometricArray array(double photons) {
        var data = new RadiometricArray(WAVE, OpticalImageConfiguration.getDefault());
        data.setPhotons(SpectralCube.uniform(3, 4, WAVE.count(), photons));
        return data;
    }

    @Test
    public void testEmpty() {
        var data = new RadiometricArray(WAVE, OpticalImageConfiguration.getDefault());
        assertFalse(data.hasPhotons());
        assertNull(data.photons());
        assertNull(data.illuminance());
        assertTrue(Double.isNaN(data.meanIlluminance()));
        assertEquals(0, data.rows());
    }

    @Test
    public void testIlluminanceMatchesPhotometry() {
        var data = array(1e15);
        var expected = Photometry.getDefault().illuminance(WAVE, Quanta.toEnergy(WAVE, data.photons()));
        assertEquals(expected[2][3], data.illuminance()[2][3], 1e-9 * expected[2][3]);
        assertEquals(expected[0][0], data.meanIlluminance(), 1e-9 * expected[0][0]);
        assertTrue(data.meanIlluminance() > 0);
    }

    @Test
    @DisplayName("Photon writes invalidate the cached illuminance")
    public void testCacheInvalidation() {
        var data = array(1e15);
        var before = data.illuminance();
        assertArrayEquals(before[2], data.illuminance()[2]);
        var meanBefore = data.meanIlluminance();
        assertEquals(1, data.illuminanceComputations());

        data.setPhotons(SpectralCube.uniform(3, 4, WAVE.count(), 2e15));
        var after = data.illuminance();
        assertEquals(2, data.illuminanceComputations());
        assertEquals(2 * before[1][1], after[1][1], 1e-6 * after[1][1]);
        assertEquals(2 * meanBefore, data.meanIlluminance(), 1e-6 * meanBefore);
    }

    @Test
    public void testWavelengthSubsetWriteInvalidates() {
        var data = array(1e15);
        var before = data.meanIlluminance();
        data.setPhotons(SpectralCube.uniform(3, 4, 1, 0.0), 555);
        assertTrue(data.meanIlluminance() < before);
        assertEquals(0.0, data.photons(550).max());
        assertEquals(1e15, data.photons(560).max(), 1e8);
    }

    @Test
    public void testIlluminanceCanBeStoredDirectly() {
        var data = array(1e15);
        var lux = new double[3][4];
        lux[0][0] = 12;
        data.setIlluminance(lux);
        lux[0][0] = 1e9;
        assertEquals(12.0, data.illuminance()[0][0]);
        assertEquals(1.0, data.meanIlluminance(), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> data.setIlluminance(new double[2][2]));
        assertThrows(IllegalArgumentException.class, () -> data.setIlluminance(new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> data.setIlluminance(new double[3][0]));
    }

    @Test
    @DisplayName("Changing a returned illuminance map leaves the cache intact")
    public void testIlluminanceIsReturnedAsCopy() {
        var data = array(1e15);
        var mean = data.meanIlluminance();
        var map = data.illuminance();
        map[0][0] += 1e9;
        assertNotEquals(map[0][0], data.illuminance()[0][0]);
        assertEquals(mean, data.meanIlluminance());
        assertEquals(1, data.illuminanceComputations());
    }

    @Test
    public void testNearestWavelengthPlanes() {
        var data = new RadiometricArray(WAVE, OpticalImageConfiguration.getDefault());
        var cube = new SpectralCube(1, 1, WAVE.count());
        for (int w = 0; w < WAVE.count(); w++) {
            cube.set(0, 0, w, w);
        }
        data.setPhotons(cube);
        var sub = data.photons(503, 699);
        assertEquals(2, sub.waves());
        assertEquals(10.0, sub.get(0, 0, 0));
        assertEquals(30.0, sub.get(0, 0, 1));
    }

    @Test
    public void testSetMeanIlluminanceRescales() {
        var data = array(1e15);
        data.setMeanIlluminance(50);
        assertEquals(50.0, data.meanIlluminance(), 50 * 1e-6);

        var dark = array(0);
        dark.setMeanIlluminance(50);
        assertEquals(0.0, dark.meanIlluminance());
    }

    @Test
    public void testNonNegativeEnforcement() {
        var data = array(1);
        assertThrows(IsetException.InvalidPhotonValueException.class,
                     () -> data.setPhotons(SpectralCube.uniform(3, 4, WAVE.count(), -1)));
        assertThrows(IsetException.InvalidPhotonValueException.class,
                     () -> data.setPhotons(SpectralCube.uniform(3, 4, WAVE.count(), Double.NaN)));

        var permissive = new RadiometricArray(WAVE, OpticalImageConfiguration.builder()
                                                                             .withEnforceNonNegative(false)
                                                                             .build());
        permissive.setPhotons(SpectralCube.uniform(3, 4, WAVE.count(), -1));
        assertEquals(-1.0, permissive.dataMin());
    }

    @Test
    public void testPhotonRepresentations() {
        assertEquals(2, RadiometricArray.toCube(new double[2][3][4]).rows());
        assertEquals(4, RadiometricArray.toCube(new float[2][3][4]).waves());
        assertEquals(1, RadiometricArray.toCube(new double[2][3]).waves());
        assertThrows(IsetException.PhotonTypeException.class, () -> RadiometricArray.toCube(new int[2][3][4]));
        assertThrows(IsetException.PhotonTypeException.class, () -> RadiometricArray.toCube(null));
    }

    @Test
    public void testWaveCountMismatchRejected() {
        var data = array(1);
        assertThrows(IllegalArgumentException.class, () -> data.setPhotons(SpectralCube.uniform(3, 4, 2, 1)));
    }

    @Test
    public void testSinglePrecisionStorage() {
        var data = array(0.1);
        assertEquals(SamplePrecision.SINGLE, data.precision());
        assertEquals((double) 0.1f, data.photons().get(0, 0, 0));

        data.setPrecision(SamplePrecision.DOUBLE);
        data.setPhotons(SpectralCube.uniform(3, 4, WAVE.count(), 0.1));
        assertEquals(0.1, data.photons().get(0, 0, 0));
    }

    @Test
    public void testRegionOfInterest() {
        var data = new RadiometricArray(WAVE, OpticalImageConfiguration.getDefault());
        var cube = new SpectralCube(2, 2, WAVE.count());
        for (int w = 0; w < WAVE.count(); w++) {
            cube.set(0, 0, w, 2);
            cube.set(1, 1, w, 4);
        }
        data.setPhotons(cube);
        var roi = List.of(PixelLocation.of(0, 0), PixelLocation.of(1, 1));

        var spectra = data.roiPhotons(roi);
        assertEquals(2, spectra.length);
        assertEquals(4.0, spectra[1][5]);
        assertEquals(3.0, data.roiMeanPhotons(roi)[7]);

        var energy = data.roiMeanEnergy(roi);
        assertEquals(3.0 * Quanta.energyPerPhoton(WAVE)[0], energy[0], 1e-30);

        assertThrows(IsetException.InvalidRegionException.class, () -> data.roiPhotons(List.of()));
        assertThrows(IsetException.InvalidRegionException.class,
                     () -> data.roiPhotons(List.of(PixelLocation.of(2, 0))));
    }

    @Test
    public void testEnergySubset() {
        var data = array(1e15);
        var all = data.energy();
        var sub = data.energy(600);
        assertEquals(1, sub.waves());
        assertEquals(all.get(1, 1, 20), sub.get(1, 1, 0));
    }

    @Test
    public void testXyzLuminance() {
        var data = array(1e15);
        assertEquals(data.illuminance()[0][0], data.xyz()[0][0][1], 1e-9 * data.illuminance()[0][0]);
    }

    @Test
    public void testPhotonNoiseIsPoisson() {
        var data = new RadiometricArray(WAVE, OpticalImageConfiguration.getDefault());
        var area = 1e-10;
        var lambda = 8.0;
        data.setPhotons(SpectralCube.uniform(20, 20, WAVE.count(), lambda / (area * 0.050)));
        var noisy = data.photonNoise(new Random(11), area);
        assertEquals(lambda, noisy.mean(), 0.1);
        var variance = 0.0;
        for (int w = 0; w < noisy.waves(); w++) {
            for (int r = 0; r < 20; r++) {
                for (int c = 0; c < 20; c++) {
                    var d = noisy.get(r, c, w) - noisy.mean();
                    variance += d * d;
                    assertEquals(Math.rint(noisy.get(r, c, w)), noisy.get(r, c, w));
                }
            }
        }
        variance /= noisy.size() - 1;
        assertEquals(lambda, variance, 0.5);
    }
}
