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

import com.hellblazer.iset.common.ParameterNames;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of optical image parameters, with the string names each one answers to. Names are matched after
 * {@link ParameterNames#normalize(String) normalization}, so "mean illuminance", "Mean_Illuminance" and
 * "meanilluminance" are the same parameter.
 *
 * @author hal.hildebrand
 */
public enum OiParameter {
    NAME(Category.IDENTITY, Flags.SETTABLE, "name"),
    TYPE(Category.IDENTITY, 0, "type"),
    FILENAME(Category.IDENTITY, Flags.SETTABLE, "filename"),
    CONSISTENCY(Category.IDENTITY, Flags.SETTABLE, "consistency"),

    SPECTRUM(Category.SPECTRAL, Flags.SETTABLE, "spectrum", "wavespectrum"),
    WAVE(Category.SPECTRAL, Flags.SETTABLE, "wave", "wavelength", "datawave", "photonswave", "photonswavelength"),
    N_WAVE(Category.SPECTRAL, 0, "nwave", "nwaves"),
    BIN_WIDTH(Category.SPECTRAL, 0, "binwidth"),

    PHOTONS(Category.PHOTON_DATA, Flags.SETTABLE, "photons", "cphotons"),
    ENERGY(Category.PHOTON_DATA, 0, "energy"),
    ILLUMINANCE(Category.PHOTON_DATA, Flags.SETTABLE, "illuminance", "illum"),
    MEAN_ILLUMINANCE(Category.PHOTON_DATA, Flags.SETTABLE, "meanilluminance", "meanillum"),
    XYZ(Category.PHOTON_DATA, 0, "xyz", "dataxyz"),
    PHOTONS_NOISE(Category.PHOTON_DATA, 0, "photonsnoise", "photonswithnoise"),
    ENERGY_NOISE(Category.PHOTON_DATA, 0, "energynoise", "energywithnoise"),
    ROI_PHOTONS(Category.PHOTON_DATA, 0, "roiphotons"),
    ROI_MEAN_PHOTONS(Category.PHOTON_DATA, 0, "roimeanphotons"),
    ROI_ENERGY(Category.PHOTON_DATA, 0, "roienergy"),
    ROI_MEAN_ENERGY(Category.PHOTON_DATA, 0, "roimeanenergy"),
    DATA_MAX(Category.PHOTON_DATA, 0, "datamax", "dmax"),
    DATA_MIN(Category.PHOTON_DATA, 0, "datamin", "dmin"),
    BIT_DEPTH(Category.PHOTON_DATA, Flags.SETTABLE, "bitdepth", "compressbitdepth"),

    ROWS(Category.GEOMETRY, 0, "rows", "row", "nrows", "nrow"),
    COLS(Category.GEOMETRY, 0, "cols", "col", "ncols", "ncol"),
    SIZE(Category.GEOMETRY, 0, "size"),
    CENTER_PIXEL(Category.GEOMETRY, 0, "centerpixel", "centerpoint"),
    ASPECT_RATIO(Category.GEOMETRY, 0, "aspectratio"),
    DISTANCE(Category.GEOMETRY, Flags.SETTABLE | Flags.UNIT_SCALED, "distance", "imagedistance",
             "focalplanedistance"),
    FOV(Category.GEOMETRY, Flags.SETTABLE, "fov", "hfov", "wangular", "widthangular", "horizontalfieldofview"),
    VFOV(Category.GEOMETRY, 0, "vfov", "hangular", "heightangular", "verticalfieldofview"),
    DIAGONAL_FOV(Category.GEOMETRY, 0, "dangular", "diagonalangular", "diagonalfieldofview"),
    WIDTH(Category.GEOMETRY, Flags.UNIT_SCALED, "width"),
    HEIGHT(Category.GEOMETRY, Flags.UNIT_SCALED, "height"),
    DIAGONAL(Category.GEOMETRY, Flags.UNIT_SCALED, "diagonal", "diagonalsize"),
    HEIGHT_AND_WIDTH(Category.GEOMETRY, Flags.UNIT_SCALED, "heightwidth", "heightandwidth"),
    AREA(Category.GEOMETRY, Flags.UNIT_SCALED, "area", "areameterssquared"),
    SAMPLE_SIZE(Category.GEOMETRY, Flags.UNIT_SCALED, "samplesize"),
    SAMPLE_SPACING(Category.GEOMETRY, Flags.UNIT_SCALED, "samplespacing"),
    H_RESOLUTION(Category.GEOMETRY, Flags.UNIT_SCALED, "hspatialresolution", "heightspatialresolution", "hres"),
    W_RESOLUTION(Category.GEOMETRY, Flags.UNIT_SCALED, "wspatialresolution", "widthspatialresolution", "wres"),
    SPATIAL_RESOLUTION(Category.GEOMETRY, Flags.UNIT_SCALED, "spatialresolution", "distancepersample",
                       "distpersamp"),
    DISTANCE_PER_DEGREE(Category.GEOMETRY, Flags.UNIT_SCALED, "distperdeg", "distanceperdegree"),
    DEGREES_PER_DISTANCE(Category.GEOMETRY, Flags.UNIT_SCALED, "degreesperdistance", "degperdist"),
    SPATIAL_SUPPORT(Category.GEOMETRY, Flags.UNIT_SCALED, "spatialsupport", "spatialsamplingpositions"),
    ANGULAR_RESOLUTION(Category.GEOMETRY, 0, "angularresolution", "degperpixel", "degpersample", "degreepersample",
                       "degreeperpixel"),
    H_ANGULAR_RESOLUTION(Category.GEOMETRY, 0, "hangularresolution", "heightangularresolution"),
    W_ANGULAR_RESOLUTION(Category.GEOMETRY, 0, "wangularresolution", "widthangularresolution"),
    ANGULAR_SUPPORT(Category.GEOMETRY, 0, "angularsupport", "angularsamplingpositions"),
    FREQUENCY_RESOLUTION(Category.GEOMETRY, 0, "frequencyresolution", "freqres"),
    MAX_FREQUENCY_RESOLUTION(Category.GEOMETRY, 0, "maxfrequencyresolution", "maxfreqres"),
    FREQUENCY_SUPPORT(Category.GEOMETRY, 0, "frequencysupport", "fsupportxy", "fsupport2d", "fsupport"),
    FREQUENCY_SUPPORT_COL(Category.GEOMETRY, 0, "frequencysupportcol", "fsupportx"),
    FREQUENCY_SUPPORT_ROW(Category.GEOMETRY, 0, "frequencysupportrow", "fsupporty"),

    OPTICS_MODEL(Category.OPTICS, Flags.SETTABLE, "opticsmodel"),
    LENS(Category.OPTICS, Flags.SETTABLE, "lenspigment"),
    DIFFUSER_METHOD(Category.OPTICS, Flags.SETTABLE, "diffusermethod"),
    DIFFUSER_BLUR(Category.OPTICS, Flags.SETTABLE | Flags.UNIT_SCALED, "diffuserblur"),

    PSF_STRUCT(Category.SHIFT_VARIANT_PSF, Flags.SETTABLE, "psfstruct", "shiftvariantstructure"),
    SAMPLED_RT_PSF(Category.SHIFT_VARIANT_PSF, 0, "svpsf", "sampledrtpsf", "shiftvariantpsf"),
    RT_PSF_SIZE(Category.SHIFT_VARIANT_PSF, 0, "rtpsfsize"),
    PSF_SAMPLE_ANGLES(Category.SHIFT_VARIANT_PSF, 0, "psfsampleangles"),
    PSF_ANGLE_STEP(Category.SHIFT_VARIANT_PSF, 0, "psfanglestep"),
    PSF_IMAGE_HEIGHTS(Category.SHIFT_VARIANT_PSF, Flags.UNIT_SCALED, "psfimageheights"),
    PSF_OPTICS_NAME(Category.SHIFT_VARIANT_PSF, 0, "psfopticsname", "raytraceopticsname"),
    PSF_WAVELENGTH(Category.SHIFT_VARIANT_PSF, 0, "psfwavelength"),

    DEPTH_MAP(Category.DEPTH, Flags.SETTABLE, "depthmap"),
    LOGICAL_DEPTH_MAP(Category.DEPTH, 0, "logicaldepthmap");

    public enum Category {
        IDENTITY, SPECTRAL, PHOTON_DATA, GEOMETRY, OPTICS, SHIFT_VARIANT_PSF, DEPTH
    }

    private static final class Flags {
        static final int SETTABLE    = 1;
        static final int UNIT_SCALED = 2;
    }

    private static final Map<String, OiParameter> BY_NAME;

    static {
        var names = new HashMap<String, OiParameter>();
        for (var p : values()) {
            for (var alias : p.aliases) {
                var previous = names.put(alias, p);
                if (previous != null) {
                    throw new IllegalStateException("Alias " + alias + " claimed by " + previous + " and " + p);
                }
            }
        }
        BY_NAME = Collections.unmodifiableMap(names);
    }

    private final Category     category;
    private final int          flags;
    private final List<String> aliases;

    OiParameter(Category category, int flags, String... aliases) {
        this.category = category;
        this.flags = flags;
        this.aliases = List.of(aliases);
    }

    /**
     * @param name any recognized spelling
     * @return the parameter, empty if the name is not recognized
     */
    public static Optional<OiParameter> lookup(String name) {
        return Optional.ofNullable(BY_NAME.get(ParameterNames.normalize(name)));
    }

    public Category category() {
        return category;
    }

    /**
     * @return normalized names this parameter answers to, canonical name first
     */
    public List<String> aliases() {
        return aliases;
    }

    public boolean isSettable() {
        return (flags & Flags.SETTABLE) != 0;
    }

    /**
     * @return true if the getter accepts a trailing spatial unit
     */
    public boolean isUnitScaled() {
        return (flags & Flags.UNIT_SCALED) != 0;
    }
}
