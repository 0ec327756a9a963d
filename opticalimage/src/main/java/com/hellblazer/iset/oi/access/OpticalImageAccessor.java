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

import com.hellblazer.iset.common.AngularUnit;
import com.hellblazer.iset.common.IsetException;
import com.hellblazer.iset.common.ParameterAccessor;
import com.hellblazer.iset.common.ParameterNames;
import com.hellblazer.iset.common.SpatialUnit;
import com.hellblazer.iset.oi.Diffuser;
import com.hellblazer.iset.oi.OpticalImage;
import com.hellblazer.iset.oi.PixelLocation;
import com.hellblazer.iset.oi.RadiometricArray;
import com.hellblazer.iset.oi.Scene;
import com.hellblazer.iset.oi.ShiftVariantPsf;
import com.hellblazer.iset.oi.optics.Lens;
import com.hellblazer.iset.oi.optics.Optics;
import com.hellblazer.iset.oi.optics.OpticsModel;
import com.hellblazer.iset.spectral.SamplePrecision;
import com.hellblazer.iset.spectral.SpectralSampleSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * String keyed get/set over an {@link OpticalImage}. Names in the "optics" namespace go to the optics block and names
 * in the "lens" namespace to its lens; everything else must be an {@link OiParameter} alias.
 * <p>
 * Optional trailing arguments:
 * <ul>
 * <li>unit scaled geometry takes a spatial unit token ("m", "mm", "um", ...)</li>
 * <li>photons and energy take a wavelength, a double[] of wavelengths or a {@link SpectralSampleSet}</li>
 * <li>ROI getters take a {@code List<PixelLocation>} or (row, col) int[] pairs; an int[][] passed as the only
 * argument spreads into those pairs</li>
 * <li>noise getters take a {@link Random}</li>
 * <li>angular support takes an angular unit token; frequency getters take "cyclesPerDegree" or a spatial unit</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public final class OpticalImageAccessor implements ParameterAccessor {

    private final OpticalImage oi;
    private final Scene        companion;

    /**
     * @param oi        the image
     * @param companion scene for geometric fallbacks, may be null
     */
    public OpticalImageAccessor(OpticalImage oi, Scene companion) {
        this.oi = oi;
        this.companion = companion;
    }

    @Override
    public Object get(String parameter, Object... args) {
        var opticsName = ParameterNames.qualify(parameter, "optics");
        if (opticsName.isPresent()) {
            var q = opticsName.get();
            return q.isBare() ? oi.getOptics() : oi.getOptics().get(q.remainder(), args);
        }
        var lensName = ParameterNames.qualify(parameter, "lens");
        if (lensName.isPresent()) {
            var q = lensName.get();
            var lens = oi.getOptics().getLens();
            return q.isBare() ? lens : lens.get(q.remainder(), args);
        }
        return get(resolve(parameter), args);
    }

    public Object get(OiParameter parameter, Object... args) {
        var geometry = oi.geometry(companion);
        var data = oi.data();
        var unit = spatialUnit(args);
        var psf = oi.getShiftVariantPsf();
        return switch (parameter) {
            case NAME -> oi.getName();
            case TYPE -> oi.getType();
            case FILENAME -> oi.getFilename();
            case CONSISTENCY -> oi.isConsistent();

            case SPECTRUM -> oi.getWave();
            case WAVE -> oi.getWave().wavelengths();
            case N_WAVE -> oi.getWave().count();
            case BIN_WIDTH -> oi.getWave().binWidth();

            case PHOTONS -> data.photons(wavelengths(args));
            case ENERGY -> data.energy(wavelengths(args));
            case ILLUMINANCE -> data.illuminance();
            case MEAN_ILLUMINANCE -> data.meanIlluminance();
            case XYZ -> data.xyz();
            case PHOTONS_NOISE -> data.photonNoise(random(args), collectingArea());
            case ENERGY_NOISE -> data.energyNoise(random(args), collectingArea());
            case ROI_PHOTONS -> data.roiPhotons(locations(parameter, args));
            case ROI_MEAN_PHOTONS -> data.roiMeanPhotons(locations(parameter, args));
            case ROI_ENERGY -> data.roiEnergy(locations(parameter, args));
            case ROI_MEAN_ENERGY -> data.roiMeanEnergy(locations(parameter, args));
            case DATA_MAX -> data.dataMax();
            case DATA_MIN -> data.dataMin();
            case BIT_DEPTH -> data.precision().bitDepth();

            case ROWS -> geometry.rows();
            case COLS -> geometry.cols();
            case SIZE -> geometry.size();
            case CENTER_PIXEL -> geometry.centerPixel();
            case ASPECT_RATIO -> geometry.aspectRatio();
            case DISTANCE -> {
                if (args.length > 0 && args[0] instanceof Number objectDistance) {
                    yield oi.getOptics().imageDistance(objectDistance.doubleValue());
                }
                yield geometry.imageDistance(unit);
            }
            case FOV -> geometry.fov();
            case VFOV -> geometry.vfov();
            case DIAGONAL_FOV -> geometry.diagonalFov();
            case WIDTH -> geometry.width(unit);
            case HEIGHT -> geometry.height(unit);
            case DIAGONAL -> geometry.diagonal(unit);
            case HEIGHT_AND_WIDTH -> geometry.heightAndWidth(unit);
            case AREA -> geometry.area(unit);
            case SAMPLE_SIZE -> geometry.sampleSize(unit);
            case SAMPLE_SPACING -> geometry.sampleSpacing(unit);
            case H_RESOLUTION -> geometry.heightResolution(unit);
            case W_RESOLUTION -> geometry.widthResolution(unit);
            case SPATIAL_RESOLUTION -> geometry.spatialResolution(unit);
            case DISTANCE_PER_DEGREE -> geometry.distancePerDegree(unit);
            case DEGREES_PER_DISTANCE -> geometry.degreesPerDistance(unit);
            case SPATIAL_SUPPORT -> geometry.spatialSupport(unit);
            case ANGULAR_RESOLUTION -> geometry.angularResolution();
            case H_ANGULAR_RESOLUTION -> geometry.angularResolution()[0];
            case W_ANGULAR_RESOLUTION -> geometry.angularResolution()[1];
            case ANGULAR_SUPPORT -> geometry.angularSupport(AngularUnit.parse(token(args)));
            case FREQUENCY_RESOLUTION, FREQUENCY_SUPPORT -> geometry.frequencyResolution(token(args));
            case MAX_FREQUENCY_RESOLUTION -> geometry.maxFrequencyResolution(token(args));
            case FREQUENCY_SUPPORT_COL -> geometry.frequencySupportCol(token(args));
            case FREQUENCY_SUPPORT_ROW -> geometry.frequencySupportRow(token(args));

            case OPTICS_MODEL -> oi.getOptics().getModel();
            case LENS -> oi.getOptics().getLens();
            case DIFFUSER_METHOD -> oi.getDiffuser().getMethod();
            case DIFFUSER_BLUR -> unit.fromMeters(oi.getDiffuser().getBlur());

            case PSF_STRUCT -> psf;
            case SAMPLED_RT_PSF -> psf == null ? null : psf.psf();
            case RT_PSF_SIZE -> psf == null ? null : psf.kernelSize();
            case PSF_SAMPLE_ANGLES -> psf == null ? null : psf.sampleAngles();
            case PSF_ANGLE_STEP -> psf == null ? null : psf.angleStep();
            case PSF_IMAGE_HEIGHTS -> psf == null ? null : scaled(psf.imageHeights(), unit);
            case PSF_OPTICS_NAME -> psf == null ? null : psf.opticsName();
            case PSF_WAVELENGTH -> psf == null ? null : psf.wavelength();

            case DEPTH_MAP -> oi.getDepthMap();
            case LOGICAL_DEPTH_MAP -> oi.logicalDepthMap();
        };
    }

    @Override
    public void set(String parameter, Object value, Object... args) {
        var opticsName = ParameterNames.qualify(parameter, "optics");
        if (opticsName.isPresent()) {
            var q = opticsName.get();
            if (q.isBare()) {
                if (!(value instanceof Optics optics)) {
                    throw new IsetException.MissingValueException(parameter);
                }
                oi.setOptics(optics);
            } else {
                oi.getOptics().set(q.remainder(), value, args);
            }
            return;
        }
        var lensName = ParameterNames.qualify(parameter, "lens");
        if (lensName.isPresent()) {
            var q = lensName.get();
            if (q.isBare()) {
                if (!(value instanceof Lens lens)) {
                    throw new IsetException.MissingValueException(parameter);
                }
                oi.getOptics().setLens(lens);
            } else {
                oi.getOptics().getLens().set(q.remainder(), value, args);
            }
            return;
        }
        set(resolve(parameter), value, args);
    }

    public void set(OiParameter parameter, Object value, Object... args) {
        if (!parameter.isSettable()) {
            throw new IsetException.ReadOnlyParameterException(parameter.aliases().get(0));
        }
        if (value == null) {
            throw new IsetException.MissingValueException(parameter.aliases().get(0));
        }
        var data = oi.data();
        switch (parameter) {
            case NAME -> oi.setName(value.toString());
            case FILENAME -> oi.setFilename(value.toString());
            case CONSISTENCY -> oi.setConsistency(value instanceof Boolean b ? b : number(parameter, value) != 0);
            case SPECTRUM, WAVE -> oi.setWave(wave(parameter, value));
            case PHOTONS -> data.setPhotons(RadiometricArray.toCube(value), wavelengths(args));
            case ILLUMINANCE -> {
                if (!(value instanceof double[][] lux)) {
                    throw new IllegalArgumentException("Illuminance must be a double[][] map");
                }
                data.setIlluminance(lux);
            }
            case MEAN_ILLUMINANCE -> data.setMeanIlluminance(number(parameter, value));
            case BIT_DEPTH -> data.setPrecision(SamplePrecision.fromBitDepth(bitDepth(parameter, value)));
            case DISTANCE -> oi.setDistance(spatialUnit(args).toMeters(number(parameter, value)));
            case FOV -> oi.setFov(number(parameter, value));
            case OPTICS_MODEL -> oi.getOptics()
                                  .setModel(value instanceof OpticsModel m ? m : OpticsModel.parse(value.toString()));
            case LENS -> {
                if (!(value instanceof Lens lens)) {
                    throw new IllegalArgumentException("Lens must be a Lens");
                }
                oi.getOptics().setLens(lens);
            }
            case DIFFUSER_METHOD -> oi.getDiffuser()
                                     .setMethod(value instanceof Diffuser.Method m ? m
                                                                                   : Diffuser.Method.parse(
                                                                                   value.toString()));
            case DIFFUSER_BLUR -> oi.getDiffuser().setBlur(spatialUnit(args).toMeters(number(parameter, value)));
            case PSF_STRUCT -> {
                if (!(value instanceof ShiftVariantPsf psf)) {
                    throw new IllegalArgumentException("PSF structure must be a ShiftVariantPsf");
                }
                oi.setShiftVariantPsf(psf);
            }
            case DEPTH_MAP -> {
                if (!(value instanceof double[][] depth)) {
                    throw new IllegalArgumentException("Depth map must be a double[][] of meters");
                }
                oi.setDepthMap(depth);
            }
            default -> throw new IsetException.ReadOnlyParameterException(parameter.aliases().get(0));
        }
    }

    private static OiParameter resolve(String parameter) {
        return OiParameter.lookup(parameter)
                          .orElseThrow(
                          () -> new IsetException.UnknownParameterException(ParameterNames.normalize(parameter)));
    }

    private static SpatialUnit spatialUnit(Object[] args) {
        if (args.length > 0 && args[0] instanceof String token && SpatialUnit.isUnit(token)) {
            return SpatialUnit.parse(token);
        }
        if (args.length > 0 && args[0] instanceof SpatialUnit unit) {
            return unit;
        }
        return SpatialUnit.METERS;
    }

    private static String token(Object[] args) {
        return args.length > 0 && args[0] instanceof String s ? s : null;
    }

    private static double[] wavelengths(Object[] args) {
        if (args.length == 0 || args[0] == null) {
            return null;
        }
        if (args[0] instanceof Number n) {
            return new double[] { n.doubleValue() };
        }
        if (args[0] instanceof double[] d) {
            return d;
        }
        if (args[0] instanceof SpectralSampleSet s) {
            return s.wavelengths();
        }
        throw new IllegalArgumentException("Wavelengths must be a number, double[] or SpectralSampleSet");
    }

    private static Random random(Object[] args) {
        for (var arg : args) {
            if (arg instanceof Random r) {
                return r;
            }
        }
        return new Random();
    }

    private static List<PixelLocation> locations(OiParameter parameter, Object[] args) {
        if (args.length == 0 || args[0] == null) {
            throw new IsetException.MissingValueException(parameter.aliases().get(0));
        }
        var out = new ArrayList<PixelLocation>();
        if (args[0] instanceof List<?> list) {
            for (var o : list) {
                if (!(o instanceof PixelLocation p)) {
                    throw new IsetException.InvalidRegionException("Not a pixel location: " + o);
                }
                out.add(p);
            }
        } else if (args[0] instanceof int[][] pairs) {
            addPairs(pairs, out);
        } else if (args[0] instanceof int[]) {
            addPairs(args, out);
        } else {
            throw new IsetException.InvalidRegionException("Region must be a List<PixelLocation> or int[] pairs");
        }
        return out;
    }

    private static void addPairs(Object[] pairs, List<PixelLocation> out) {
        for (var o : pairs) {
            if (!(o instanceof int[] pair) || pair.length != 2) {
                throw new IsetException.InvalidRegionException("Expected (row, col) pairs");
            }
            out.add(new PixelLocation(pair[0], pair[1]));
        }
    }

    private static int bitDepth(OiParameter parameter, Object value) {
        var depth = number(parameter, value);
        if (depth != Math.rint(depth) || Math.abs(depth) > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Bit depth must be an integer, not " + value);
        }
        return (int) depth;
    }

    private static double number(OiParameter parameter, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException(parameter.aliases().get(0) + " requires a number, not " + value);
    }

    private static SpectralSampleSet wave(OiParameter parameter, Object value) {
        if (value instanceof SpectralSampleSet s) {
            return s;
        }
        if (value instanceof double[] d) {
            return SpectralSampleSet.of(d);
        }
        return SpectralSampleSet.of(number(parameter, value));
    }

    private static double[] scaled(double[] meters, SpatialUnit unit) {
        var out = new double[meters.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = unit.fromMeters(meters[i]);
        }
        return out;
    }

    private double collectingArea() {
        var spacing = oi.geometry(companion).sampleSpacing(SpatialUnit.METERS);
        return spacing.x * spacing.y;
    }
}
