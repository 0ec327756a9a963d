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

package com.hellblazer.iset.oi.access;

import com.hellblazer.iset.common.IsetException;
import com.hellblazer.iset.oi.Diffuser;
import com.hellblazer.iset.oi.OpticalImage;
import com.hellblazer.iset.oi.PixelLocation;
import com.hellblazer.iset.oi.Scene;
import com.hellblazer.iset.oi.ShiftVariantPsf;
import com.hellblazer.iset.oi.SpatialSupport;
import com.hellblazer.iset.oi.TestImages;
import com.hellblazer.iset.oi.optics.Lens;
import com.hellblazer.iset.oi.optics.Optics;
import com.hellblazer.iset.oi.optics.OpticsModel;
import com.hellblazer.iset.spectral.SpectralCube;
import com.hellblazer.iset.spectral.SpectralSampleSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import javax.vecmath.Vector2d;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the string keyed get/set vocabulary.
 *
 * @author hal.hildebrand
 */
public class OpticalImageAccessorTest {

    private OpticalImage oi;

    private static double number(Object value) {
        return ((Number) value).doubleValue();
    }

    @BeforeEach
    public void setUp() {
        oi = TestImages.uniform(4, 5, 1e15);
    }

    @Test
    public void testIdentity() {
        oi.set("name", "pedestal");
        assertEquals("pedestal", oi.get("name"));
        assertEquals("opticalimage", oi.get("type"));
        oi.set("filename", "pedestal.mat");
        assertEquals("pedestal.mat", oi.get("filename"));
        oi.set("consistency", true);
        assertEquals(Boolean.TRUE, oi.get("consistency"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "mean illuminance", "meanIlluminance", "Mean_Illuminance", "mean illum" })
    public void testAliasesResolveToSameParameter(String name) {
        assertEquals(oi.data().meanIlluminance(), number(oi.get(name)));
    }

    @Test
    public void testSpectral() {
        assertArrayEquals(TestImages.WAVE.wavelengths(), (double[]) oi.get("wavelength"));
        assertEquals(31, oi.get("n wave"));
        assertEquals(10.0, oi.get("bin width"));
        assertEquals(TestImages.WAVE, oi.get("spectrum"));
    }

    @Test
    @DisplayName("Setting wave through the accessor resamples photons")
    public void testSetWave() {
        var mean = oi.data().meanIlluminance();
        oi.set("wave", new double[] { 500, 550, 600 });
        assertEquals(3, oi.get("nwave"));
        assertEquals(3, ((SpectralCube) oi.get("photons")).waves());
        assertEquals(mean, number(oi.get("mean illuminance")), mean * 1e-5);

        oi.set("wave", SpectralSampleSet.range(400, 700, 10));
        assertEquals(0.0, ((SpectralCube) oi.get("photons")).max());
    }

    @Test
    public void testPhotonsAndEnergy() {
        var plane = (SpectralCube) oi.get("photons", 550);
        assertEquals(1, plane.waves());
        var subset = (SpectralCube) oi.get("photons", new double[] { 450, 650 });
        assertEquals(2, subset.waves());
        var energy = (SpectralCube) oi.get("energy");
        assertEquals(31, energy.waves());

        oi.set("photons", SpectralCube.uniform(4, 5, 1, 7.0), 550);
        assertEquals(7.0, ((SpectralCube) oi.get("photons", 550)).get(3, 4, 0));

        oi.set("photons", new float[4][5][31]);
        assertEquals(0.0, number(oi.get("data max")));
    }

    @Test
    public void testIlluminanceInvalidation() {
        var before = (double[][]) oi.get("illuminance");
        oi.set("photons", SpectralCube.uniform(4, 5, 31, 3e15));
        var after = (double[][]) oi.get("illuminance");
        assertEquals(3 * before[0][0], after[0][0], after[0][0] * 1e-6);

        oi.set("mean illuminance", 10.0);
        assertEquals(10.0, number(oi.get("mean illuminance")), 1e-5);
    }

    @Test
    public void testGeometry() {
        assertEquals(4, oi.get("rows"));
        assertEquals(5, oi.get("cols"));
        assertArrayEquals(new int[] { 4, 5 }, (int[]) oi.get("size"));
        assertEquals(PixelLocation.of(2, 2), oi.get("center pixel"));
        assertEquals(0.8, number(oi.get("aspect ratio")), 1e-12);

        var widthM = number(oi.get("width"));
        assertEquals(widthM * 1000, number(oi.get("width", "mm")));
        assertEquals(widthM * 1e6, number(oi.get("width", "um")), widthM * 1e-8);
        var area = number(oi.get("area"));
        assertEquals(area * 1e6, number(oi.get("area", "mm")));
        var hw = (double[]) oi.get("height and width", "mm");
        assertEquals(widthM * 1000, hw[1]);
        assertNotNull((Vector2d) oi.get("sample spacing", "um"));
        assertEquals(5, ((SpatialSupport) oi.get("spatial support", "microns")).x().length);
        assertEquals(number(oi.get("wres", "mm")), number(oi.get("sample size", "mm")), 1e-15);
    }

    @Test
    public void testDistanceAndFov() {
        oi.set("fov", 4.0);
        assertEquals(4.0, oi.get("hfov"));
        assertEquals(4.0, oi.get("horizontal field of view"));

        oi.set("distance", 1.0);
        var image = number(oi.get("image distance"));
        assertEquals(oi.getOptics().imageDistance(1.0), image, 1e-15);
        assertEquals(image * 1000, number(oi.get("focal plane distance", "mm")), 1e-12);
        assertEquals(oi.getOptics().imageDistance(3.0), number(oi.get("distance", 3.0)), 1e-15);

        oi.set("distance", 500.0, "mm");
        assertEquals(0.5, oi.getDistance(), 1e-15);
    }

    @Test
    public void testCompanionScene() {
        var empty = new OpticalImage();
        var scene = Scene.builder().withSize(32, 48).withFov(6).build();
        var accessor = empty.accessor(scene);
        assertEquals(32, accessor.get("rows"));
        assertEquals(48, accessor.get("cols"));
        assertEquals(6.0, accessor.get("fov"));
        assertEquals(128, empty.get("rows"));
    }

    @Test
    public void testRegionOfInterest() {
        var roi = List.of(PixelLocation.of(0, 0), PixelLocation.of(3, 4));
        var spectra = (double[][]) oi.get("roi photons", roi);
        assertEquals(2, spectra.length);
        assertEquals(31, ((double[]) oi.get("roi mean photons", roi)).length);
        assertEquals(31, ((double[]) oi.get("roi mean energy", new int[][] { { 1, 1 } })).length);
        assertEquals(2, ((double[][]) oi.get("roi photons", new int[][] { { 1, 1 }, { 2, 2 } })).length);
        assertEquals(2, ((double[][]) oi.get("roi photons", new int[] { 0, 0 }, new int[] { 3, 4 })).length);
        assertEquals(1, ((double[][]) oi.get("roi photons", (Object) new int[][] { { 1, 1 } })).length);
        assertArrayEquals(spectra[1], ((double[][]) oi.get("roi photons", new int[][] { { 3, 4 } }))[0]);
        assertThrows(IsetException.InvalidRegionException.class,
                     () -> oi.get("roi photons", new int[][] { { 1, 1, 1 } }));
        assertThrows(IsetException.InvalidRegionException.class,
                     () -> oi.get("roi photons", new int[][] { { 9, 9 } }));
        assertEquals(2, ((double[][]) oi.get("roi energy", roi)).length);

        assertThrows(IsetException.MissingValueException.class, () -> oi.get("roi photons"));
        assertThrows(IsetException.InvalidRegionException.class, () -> oi.get("roi photons", List.of()));
    }

    @Test
    public void testNoiseGetters() {
        var noisy = (SpectralCube) oi.get("photons noise", new Random(5));
        assertEquals(4, noisy.rows());
        var energy = (SpectralCube) oi.get("energy noise", new Random(5));
        assertEquals(31, energy.waves());
    }

    @Test
    public void testBitDepth() {
        assertEquals(32, oi.get("bit depth"));
        oi.set("bit depth", 64);
        assertEquals(64, oi.get("bitdepth"));
        assertThrows(IsetException.UnsupportedPrecisionException.class, () -> oi.set("bit depth", 16));
        assertThrows(IllegalArgumentException.class, () -> oi.set("bit depth", 32.7));
        assertEquals(64, oi.get("bit depth"));
        oi.set("bit depth", 32.0);
        assertEquals(32, oi.get("bit depth"));
    }

    @Test
    @DisplayName("Optics and lens names are forwarded to the nested blocks")
    public void testForwarding() {
        assertTrue(oi.get("optics") instanceof Optics);
        assertEquals(4.0, oi.get("optics fnumber"));
        oi.set("optics f number", 2.0);
        assertEquals(2.0, oi.getOptics().getFNumber());
        assertEquals(2.0, oi.get("optics.fnumber"));

        oi.set("optics.lens.density", 0.25);
        assertEquals(0.25, oi.getOptics().getLens().getDensity());
        assertEquals(0.25, oi.get("lens density"));
        assertTrue(oi.get("lens") instanceof Lens);
        assertEquals(31, ((double[]) oi.get("lens transmittance")).length);

        assertEquals(OpticsModel.DIFFRACTION_LIMITED, oi.get("optics model"));
        oi.set("opticsmodel", "shift invariant");
        assertEquals(OpticsModel.SHIFT_INVARIANT, oi.get("optics model"));

        var replacement = new Optics();
        oi.set("optics", replacement);
        assertSame(replacement, oi.getOptics());
        assertEquals(TestImages.WAVE, replacement.getLens().getWave());
    }

    @Test
    public void testDiffuser() {
        assertEquals(Diffuser.Method.SKIP, oi.get("diffuser method"));
        oi.set("diffuser method", "blur");
        oi.set("diffuser blur", 2.0, "um");
        assertEquals(Diffuser.Method.BLUR, oi.get("diffuser method"));
        assertEquals(2e-6, number(oi.get("diffuser blur")), 1e-18);
        assertEquals(2.0, number(oi.get("diffuser blur", "um")), 1e-12);
    }

    @Test
    public void testShiftVariantPsf() {
        assertNull(oi.get("psf struct"));
        var kernels = new double[2][3][1][5][7];
        var psf = new ShiftVariantPsf(kernels, new double[] { 0, 10, 20 }, new double[] { 0, 1e-3 }, "wide angle",
                                      new double[] { 550 });
        oi.set("psf struct", psf);
        assertSame(psf, oi.get("shift variant structure"));
        assertSame(kernels, oi.get("sampled rt psf"));
        assertArrayEquals(new int[] { 5, 7 }, (int[]) oi.get("rt psf size"));
        assertEquals(10.0, oi.get("psf angle step"));
        assertArrayEquals(new double[] { 0, 1 }, (double[]) oi.get("psf image heights", "mm"), 1e-12);
        assertEquals("wide angle", oi.get("raytrace optics name"));
        assertArrayEquals(new double[] { 550 }, (double[]) oi.get("psf wavelength"));
    }

    @Test
    public void testDepthMap() {
        var depth = new double[4][5];
        depth[0][0] = 1.5;
        oi.set("depth map", depth);
        assertEquals(1.5, ((double[][]) oi.get("depthmap"))[0][0]);
        assertTrue(((boolean[][]) oi.get("logical depth map"))[0][0]);
    }

    @Test
    public void testErrors() {
        var unknown = assertThrows(IsetException.UnknownParameterException.class, () -> oi.get("mumble"));
        assertEquals("mumble", unknown.getParameter());
        assertThrows(IsetException.UnknownParameterException.class, () -> oi.set("mumble", 1));
        assertThrows(IsetException.UnknownParameterException.class, () -> oi.get("optics mumble"));

        assertThrows(IsetException.ReadOnlyParameterException.class, () -> oi.set("width", 1.0));
        assertThrows(IsetException.ReadOnlyParameterException.class, () -> oi.set("area", 1.0));
        assertThrows(IsetException.ReadOnlyParameterException.class, () -> oi.set("energy", 1.0));

        assertThrows(IsetException.MissingValueException.class, () -> oi.set("fov", null));
        assertThrows(IsetException.MissingValueException.class, () -> oi.set("photons", null));

        assertThrows(IsetException.PhotonTypeException.class, () -> oi.set("photons", new int[4][5][31]));
        assertThrows(IsetException.PhotonTypeException.class, () -> oi.set("photons", "bright"));
    }

    @Test
    public void testParameterTable() {
        assertEquals(OiParameter.WAVE, OiParameter.lookup("Wavelength").orElseThrow());
        assertEquals(OiParameter.FOV, OiParameter.lookup("w angular").orElseThrow());
        assertTrue(OiParameter.lookup("bogus").isEmpty());
        assertTrue(OiParameter.WIDTH.isUnitScaled());
        assertFalse(OiParameter.WIDTH.isSettable());
        assertTrue(OiParameter.DISTANCE.isSettable());
        assertEquals(OiParameter.Category.PHOTON_DATA, OiParameter.PHOTONS.category());
        for (var p : OiParameter.values()) {
            assertEquals(p, OiParameter.lookup(p.aliases().get(0)).orElseThrow());
        }
    }
}
