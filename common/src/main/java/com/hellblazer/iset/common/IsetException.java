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

/**
 * Sealed exception hierarchy for the spectral image data model.
 * <p>
 * All failures are local and synchronous. Callers in a simulation pipeline treat any of these as fatal to the
 * current computation step.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link ConstructionException} - incompatible temporal sequence inputs</li>
 * <li>{@link UnknownParameterException} - unrecognized accessor name</li>
 * <li>{@link MissingValueException} - accessor invoked without a required value</li>
 * <li>{@link PhotonTypeException} - photon data written with a non floating point representation</li>
 * <li>{@link UnsupportedPrecisionException} - bit depth other than 32 or 64</li>
 * <li>{@link InvalidRegionException} - empty or out of bounds region of interest</li>
 * <li>{@link ReadOnlyParameterException} - attempt to set a derived quantity</li>
 * <li>{@link InvalidPhotonValueException} - negative or NaN photon values</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class IsetException extends RuntimeException
    permits IsetException.ConstructionException,
            IsetException.UnknownParameterException,
            IsetException.MissingValueException,
            IsetException.PhotonTypeException,
            IsetException.UnsupportedPrecisionException,
            IsetException.InvalidRegionException,
            IsetException.ReadOnlyParameterException,
            IsetException.InvalidPhotonValueException {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public IsetException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public IsetException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a temporal sequence is built from a time axis whose length does not match the modulation function,
     * or from fixed and modulated images whose spatial support differs.
     */
    public static final class ConstructionException extends IsetException {

        public ConstructionException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when an accessor name is not recognized, after namespace forwarding fails to match.
     */
    public static final class UnknownParameterException extends IsetException {
        private final String parameter;

        /**
         * @param parameter the normalized parameter name
         */
        public UnknownParameterException(String parameter) {
            super("Unknown parameter: " + parameter);
            this.parameter = parameter;
        }

        /**
         * @param owner     the kind of object that was queried
         * @param parameter the normalized parameter name
         */
        public UnknownParameterException(String owner, String parameter) {
            super(String.format("Unknown %s parameter: %s", owner, parameter));
            this.parameter = parameter;
        }

        /**
         * Gets the offending parameter name.
         *
         * @return normalized parameter name
         */
        public String getParameter() {
            return parameter;
        }
    }

    /**
     * Thrown when a set-style accessor, or a getter that needs an argument, is invoked without the value.
     */
    public static final class MissingValueException extends IsetException {

        public MissingValueException(String parameter) {
            super("Value required for parameter: " + parameter);
        }
    }

    /**
     * Thrown when photon data are supplied in a representation other than single or double precision floating point.
     */
    public static final class PhotonTypeException extends IsetException {

        public PhotonTypeException(Class<?> type) {
            super("Photons must be float[][][], double[][][] or a SpectralCube, not "
                  + (type == null ? "null" : type.getSimpleName()));
        }
    }

    /**
     * Thrown by the legacy bit depth path when given a value other than the two supported floating precisions.
     */
    public static final class UnsupportedPrecisionException extends IsetException {
        private final int bitDepth;

        public UnsupportedPrecisionException(int bitDepth) {
            super("Unsupported bit depth " + bitDepth + " (expected 32 or 64)");
            this.bitDepth = bitDepth;
        }

        public int getBitDepth() {
            return bitDepth;
        }
    }

    /**
     * Thrown when a region of interest is empty or addresses pixels outside the image.
     */
    public static final class InvalidRegionException extends IsetException {

        public InvalidRegionException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when a derived-only quantity is written.
     */
    public static final class ReadOnlyParameterException extends IsetException {

        public ReadOnlyParameterException(String parameter) {
            super("Parameter is derived and cannot be set: " + parameter);
        }
    }

    /**
     * Thrown when photon data containing negative or NaN values are written.
     */
    public static final class InvalidPhotonValueException extends IsetException {

        public InvalidPhotonValueException(String message) {
            super(message);
        }
    }
}
