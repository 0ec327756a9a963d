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

import com.hellblazer.iset.common.AngularUnit;
import com.hellblazer.iset.common.ParameterNames;
import com.hellblazer.iset.common.SpatialUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector2d;

/**
 * Derived geometry of an optical image. Nothing here is stored: every value is recomputed from the row and column
 * counts, the horizontal field of view and the focal plane distance each time it is read. Where the image has no
 * photons, field of view or distance of its own, the companion scene supplies them, and failing that the configured
 * defaults do.
 * <p>
 * Lengths are in meters unless a {@link SpatialUnit} is given; areas scale by the square of the unit.
 *
 * @author hal.hildebrand
 */
public final class OpticalImageGeometry {
    private static final Logger log = LoggerFactory.getLogger(OpticalImageGeometry.class);

    private final OpticalImage              oi;
    private final Scene                     companion;
    private final OpticalImageConfiguration configuration;

    OpticalImageGeometry(OpticalImage oi, Scene companion) {
        this.oi = oi;
        this.companion = companion;
        this.configuration = oi.getConfiguration();
    }

    public int rows() {
        if (oi.data().hasPhotons()) {
            return oi.data().rows();
        }
        if (companion != null) {
            return companion.rows();
        }
        log.info("No photons and no scene for {}, using {} rows", oi.getName(), configuration.getDefaultRows());
        return configuration.getDefaultRows();
    }

    public int cols() {
        if (oi.data().hasPhotons()) {
            return oi.data().cols();
        }
        if (companion != null) {
            return companion.cols();
        }
        log.info("No photons and no scene for {}, using {} cols", oi.getName(), configuration.getDefaultCols());
        return configuration.getDefaultCols();
    }

    public int[] size() {
        return new int[] { rows(), cols() };
    }

    /**
     * @return 0-based centre pixel, floor(size / 2)
     */
    public PixelLocation centerPixel() {
        return new PixelLocation(rows() / 2, cols() / 2);
    }

    public double aspectRatio() {
        return (double) rows() / cols();
    }

    /**
     * @return horizontal field of view, degrees
     */
    public double fov() {
        if (!Double.isNaN(oi.getFov())) {
            return oi.getFov();
        }
        if (companion != null) {
            return companion.fov();
        }
        log.info("No field of view for {}, using {} deg", oi.getName(), configuration.getDefaultFov());
        return configuration.getDefaultFov();
    }

    /**
     * @return distance of the object the optics is focused on, meters
     */
    public double objectDistance() {
        if (oi.getDistance() > 0) {
            return oi.getDistance();
        }
        if (companion != null) {
            return companion.distance();
        }
        return configuration.getDefaultSceneDistance();
    }

    /**
     * @return lens to focal plane distance, meters
     */
    public double imageDistance() {
        return oi.getOptics().imageDistance(objectDistance());
    }

    public double imageDistance(SpatialUnit unit) {
        return unit.fromMeters(imageDistance());
    }

    /**
     * @return vertical field of view, degrees
     */
    public double vfov() {
        return 2 * Math.toDegrees(Math.atan(0.5 * height() / imageDistance()));
    }

    public double diagonalFov() {
        return Math.hypot(fov(), vfov());
    }

    public double width() {
        return 2 * imageDistance() * Math.tan(Math.toRadians(fov() / 2));
    }

    public double width(SpatialUnit unit) {
        return unit.fromMeters(width());
    }

    /**
     * Pixels are square, so height follows from the width per column.
     */
    public double height() {
        return sampleSize() * rows();
    }

    public double height(SpatialUnit unit) {
        return unit.fromMeters(height());
    }

    public double diagonal() {
        return Math.hypot(height(), width());
    }

    public double diagonal(SpatialUnit unit) {
        return unit.fromMeters(diagonal());
    }

    public double area() {
        return height() * width();
    }

    public double area(SpatialUnit unit) {
        return area() * unit.areaScale();
    }

    /**
     * @return (height, width)
     */
    public double[] heightAndWidth(SpatialUnit unit) {
        return new double[] { height(unit), width(unit) };
    }

    public double sampleSize() {
        return width() / cols();
    }

    public double sampleSize(SpatialUnit unit) {
        return unit.fromMeters(sampleSize());
    }

    /**
     * @return (width, height) spacing between samples
     */
    public Vector2d sampleSpacing(SpatialUnit unit) {
        return new Vector2d(width(unit) / cols(), height(unit) / rows());
    }

    public double heightResolution(SpatialUnit unit) {
        return height(unit) / rows();
    }

    public double widthResolution(SpatialUnit unit) {
        return width(unit) / cols();
    }

    /**
     * @return (height, width) distance per sample
     */
    public double[] spatialResolution(SpatialUnit unit) {
        return new double[] { heightResolution(unit), widthResolution(unit) };
    }

    public double distancePerDegree(SpatialUnit unit) {
        return width(unit) / fov();
    }

    public double degreesPerDistance(SpatialUnit unit) {
        return 1.0 / distancePerDegree(unit);
    }

    public SpatialSupport spatialSupport(SpatialUnit unit) {
        return new SpatialSupport(SpatialSupport.centred(cols(), widthResolution(unit)),
                                  SpatialSupport.centred(rows(), heightResolution(unit)));
    }

    /**
     * @return (height, width) degrees per sample
     */
    public double[] angularResolution() {
        var d = imageDistance();
        return new double[] { 2 * Math.toDegrees(Math.atan((heightResolution(SpatialUnit.METERS) / d) / 2)),
                              2 * Math.toDegrees(Math.atan((widthResolution(SpatialUnit.METERS) / d) / 2)) };
    }

    public SpatialSupport angularSupport(AngularUnit unit) {
        var resolution = angularResolution();
        var x = SpatialSupport.centred(cols(), resolution[1]);
        var y = SpatialSupport.centred(rows(), resolution[0]);
        for (int i = 0; i < x.length; i++) {
            x[i] = unit.fromDegrees(x[i]);
        }
        for (int i = 0; i < y.length; i++) {
            y[i] = unit.fromDegrees(y[i]);
        }
        return new SpatialSupport(x, y);
    }

    /**
     * Frequencies represented by the samples, in cycles per degree or, given a spatial unit token, cycles per that
     * unit.
     *
     * @param units null, "cyclesPerDegree" or "cpd" for cycles per degree; otherwise a spatial unit token
     */
    public FrequencySupport frequencyResolution(String units) {
        double maxX;
        double maxY;
        if (cyclesPerDegree(units)) {
            maxX = (cols() / 2.0) / fov();
            maxY = (rows() / 2.0) / vfov();
        } else {
            var spacing = sampleSpacing(SpatialUnit.parse(units));
            maxX = (1 / spacing.x) / 2;
            maxY = (1 / spacing.y) / 2;
        }
        var fx = FrequencySupport.unitFrequencyList(cols());
        var fy = FrequencySupport.unitFrequencyList(rows());
        for (int i = 0; i < fx.length; i++) {
            fx[i] *= maxX;
        }
        for (int i = 0; i < fy.length; i++) {
            fy[i] *= maxY;
        }
        return new FrequencySupport(fx, fy);
    }

    public double maxFrequencyResolution(String units) {
        var support = frequencyResolution(units);
        var max = Double.NEGATIVE_INFINITY;
        for (var f : support.fx()) {
            max = Math.max(max, f);
        }
        for (var f : support.fy()) {
            max = Math.max(max, f);
        }
        return max;
    }

    /**
     * @return column frequencies from zero upward
     */
    public double[] frequencySupportCol(String units) {
        return fromZero(frequencyResolution(units).fx());
    }

    /**
     * @return row frequencies from zero upward
     */
    public double[] frequencySupportRow(String units) {
        return fromZero(frequencyResolution(units).fy());
    }

    private static boolean cyclesPerDegree(String units) {
        if (units == null || units.isBlank()) {
            return true;
        }
        var key = ParameterNames.normalize(units);
        return key.equals("cyclesperdegree") || key.equals("cpd") || key.equals("deg") || key.equals("degrees");
    }

    private static double[] fromZero(double[] frequencies) {
        var start = 0;
        while (start < frequencies.length && frequencies[start] != 0) {
            start++;
        }
        var out = new double[frequencies.length - start];
        System.arraycopy(frequencies, start, out, 0, out.length);
        return out;
    }
}
