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

package com.hellblazer.iset.oi.optics;

import com.hellblazer.iset.common.IsetException;
import com.hellblazer.iset.common.ParameterAccessor;
import com.hellblazer.iset.common.ParameterNames;
import com.hellblazer.iset.common.SpatialUnit;

import java.util.Objects;

/**
 * Optics parameter block owned by an optical image. Names in the "lens" namespace are forwarded to the nested
 * {@link Lens}.
 *
 * @author hal.hildebrand
 */
public final class Optics implements ParameterAccessor {

    public static final double DEFAULT_F_NUMBER     = 4.0;
    public static final double DEFAULT_FOCAL_LENGTH = 0.0039;

    private String      name           = "standard (1/4-inch)";
    private OpticsModel model          = OpticsModel.DIFFRACTION_LIMITED;
    private double      fNumber        = DEFAULT_F_NUMBER;
    private double      focalLength    = DEFAULT_FOCAL_LENGTH;
    private String      offAxisMethod  = "cos4th";
    private Lens        lens;

    public Optics() {
        this(Lens.defaultLens());
    }

    public Optics(Lens lens) {
        this.lens = Objects.requireNonNull(lens, "lens");
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public OpticsModel getModel() {
        return model;
    }

    public void setModel(OpticsModel model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    public double getFNumber() {
        return fNumber;
    }

    public void setFNumber(double fNumber) {
        if (!(fNumber > 0)) {
            throw new IllegalArgumentException("f-number must be positive: " + fNumber);
        }
        this.fNumber = fNumber;
    }

    /**
     * @return focal length, meters
     */
    public double getFocalLength() {
        return focalLength;
    }

    public void setFocalLength(double meters) {
        if (!(meters > 0)) {
            throw new IllegalArgumentException("Focal length must be positive: " + meters);
        }
        this.focalLength = meters;
    }

    public String getOffAxisMethod() {
        return offAxisMethod;
    }

    public void setOffAxisMethod(String offAxisMethod) {
        this.offAxisMethod = Objects.requireNonNull(offAxisMethod, "offAxisMethod");
    }

    public Lens getLens() {
        return lens;
    }

    public void setLens(Lens lens) {
        this.lens = Objects.requireNonNull(lens, "lens");
    }

    /**
     * @return aperture diameter, meters
     */
    public double apertureDiameter() {
        return focalLength / fNumber;
    }

    /**
     * @return optical power, diopters
     */
    public double power() {
        return 1.0 / focalLength;
    }

    /**
     * Thin lens image distance for an object at the given distance. Objects at or inside the focal length have no
     * real image; the focal length is returned for them.
     *
     * @param objectDistance meters
     * @return distance from the lens to the focal plane, meters
     */
    public double imageDistance(double objectDistance) {
        if (!(objectDistance > focalLength) || Double.isInfinite(objectDistance)) {
            return focalLength;
        }
        return 1.0 / (1.0 / focalLength - 1.0 / objectDistance);
    }

    public Optics copy() {
        var copy = new Optics(lens.copy());
        copy.name = name;
        copy.model = model;
        copy.fNumber = fNumber;
        copy.focalLength = focalLength;
        copy.offAxisMethod = offAxisMethod;
        return copy;
    }

    @Override
    public Object get(String parameter, Object... args) {
        var lensName = ParameterNames.qualify(parameter, "lens");
        if (lensName.isPresent()) {
            var q = lensName.get();
            return q.isBare() ? lens : lens.get(q.remainder(), args);
        }
        var unit = SpatialUnit.parse(args.length > 0 && args[0] instanceof String s ? s : null);
        return switch (ParameterNames.normalize(parameter)) {
            case "name" -> name;
            case "type" -> "optics";
            case "model", "opticsmodel" -> model;
            case "fnumber", "f#" -> fNumber;
            case "focallength", "flength" -> unit.fromMeters(focalLength);
            case "aperturediameter", "diameter", "pupildiameter" -> unit.fromMeters(apertureDiameter());
            case "power", "dioptricpower", "diopters" -> power();
            case "offaxismethod", "offaxis", "cos4thflag" -> offAxisMethod;
            case "imagedistance", "focalplanedistance" -> {
                if (args.length == 0 || !(args[0] instanceof Number n)) {
                    yield focalLength;
                }
                yield imageDistance(n.doubleValue());
            }
            default -> throw new IsetException.UnknownParameterException("optics", parameter);
        };
    }

    @Override
    public void set(String parameter, Object value, Object... args) {
        var lensName = ParameterNames.qualify(parameter, "lens");
        if (lensName.isPresent()) {
            var q = lensName.get();
            if (q.isBare()) {
                if (!(value instanceof Lens l)) {
                    throw new IsetException.MissingValueException(parameter);
                }
                setLens(l);
            } else {
                lens.set(q.remainder(), value, args);
            }
            return;
        }
        if (value == null) {
            throw new IsetException.MissingValueException(parameter);
        }
        switch (ParameterNames.normalize(parameter)) {
            case "name" -> setName(value.toString());
            case "model", "opticsmodel" -> setModel(
            value instanceof OpticsModel m ? m : OpticsModel.parse(value.toString()));
            case "fnumber", "f#" -> setFNumber(((Number) value).doubleValue());
            case "focallength", "flength" -> setFocalLength(((Number) value).doubleValue());
            case "offaxismethod", "offaxis", "cos4thflag" -> setOffAxisMethod(value.toString());
            case "aperturediameter", "diameter", "pupildiameter", "power", "dioptricpower", "diopters", "type",
                 "imagedistance", "focalplanedistance" -> throw new IsetException.ReadOnlyParameterException(parameter);
            default -> throw new IsetException.UnknownParameterException("optics", parameter);
        }
    }
}
