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

/**
 * Conversion between photon counts and radiant energy, E = h c / λ per quantum.
 *
 * @author hal.hildebrand
 */
public final class Quanta {

    /** Planck's constant, J s */
    public static final double PLANCK = 6.626176e-34;

    /** Speed of light, m/s */
    public static final double SPEED_OF_LIGHT = 2.99792458e8;

    private Quanta() {
    }

    /**
     * Energy of one photon at each wavelength.
     *
     * @param wave wavelength axis, nm
     * @return joules per photon, per sample
     */
    public static double[] energyPerPhoton(SpectralSampleSet wave) {
        var out = new double[wave.count()];
        for (int i = 0; i < out.length; i++) {
            out[i] = PLANCK * SPEED_OF_LIGHT / (wave.get(i) * 1e-9);
        }
        return out;
    }

    /**
     * Convert a photon cube to energy.
     *
     * @param wave    wavelength axis of the cube
     * @param photons photon cube
     * @return energy cube
     */
    public static SpectralCube toEnergy(SpectralSampleSet wave, SpectralCube photons) {
        return photons.scalePlanes(energyPerPhoton(wave));
    }

    /**
     * Convert an energy cube to photons.
     *
     * @param wave   wavelength axis of the cube
     * @param energy energy cube
     * @return photon cube
     */
    public static SpectralCube toQuanta(SpectralSampleSet wave, SpectralCube energy) {
        var perPhoton = energyPerPhoton(wave);
        var factors = new double[perPhoton.length];
        for (int i = 0; i < factors.length; i++) {
            factors[i] = 1.0 / perPhoton[i];
        }
        return energy.scalePlanes(factors);
    }

    /**
     * Convert one photon spectrum to energy.
     *
     * @param wave    wavelength axis
     * @param photons photons per sample
     * @return energy per sample
     */
    public static double[] toEnergy(SpectralSampleSet wave, double[] photons) {
        var perPhoton = energyPerPhoton(wave);
        var out = new double[photons.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = photons[i] * perPhoton[i];
        }
        return out;
    }

    /**
     * Convert one energy spectrum to photons.
     *
     * @param wave   wavelength axis
     * @param energy energy per sample
     * @return photons per sample
     */
    public static double[] toQuanta(SpectralSampleSet wave, double[] energy) {
        var perPhoton = energyPerPhoton(wave);
        var out = new double[energy.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = energy[i] / perPhoton[i];
        }
        return out;
    }
}
