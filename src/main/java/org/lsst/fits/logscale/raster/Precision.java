package org.lsst.fits.logscale.raster;

import java.nio.Buffer;
import java.nio.DoubleBuffer;
import java.nio.FloatBuffer;
import java.util.Locale;

/**
 * Floating point type used for the working (log domain) raster.
 */
public enum Precision {

    FLOAT32(Float.BYTES) {
        @Override
        Buffer allocate(int size) {
            return FloatBuffer.allocate(size);
        }

        @Override
        double get(Buffer buffer, int index) {
            return ((FloatBuffer) buffer).get(index);
        }

        @Override
        void put(Buffer buffer, int index, double value) {
            ((FloatBuffer) buffer).put(index, (float) value);
        }

        @Override
        public double round(double value) {
            return (float) value;
        }
    },
    FLOAT64(Double.BYTES) {
        @Override
        Buffer allocate(int size) {
            return DoubleBuffer.allocate(size);
        }

        @Override
        double get(Buffer buffer, int index) {
            return ((DoubleBuffer) buffer).get(index);
        }

        @Override
        void put(Buffer buffer, int index, double value) {
            ((DoubleBuffer) buffer).put(index, value);
        }

        @Override
        public double round(double value) {
            return value;
        }
    };

    private final int bytes;

    Precision(int bytes) {
        this.bytes = bytes;
    }

    /**
     * @return The size of one working element in bytes
     */
    public int getBytes() {
        return bytes;
    }

    abstract Buffer allocate(int size);

    abstract double get(Buffer buffer, int index);

    abstract void put(Buffer buffer, int index, double value);

    /**
     * Round a double to the value this precision would store for it.
     *
     * @param value The value to round
     * @return The value as stored
     */
    public abstract double round(double value);

    /**
     * Parse a precision name. Accepts the enum names as well as the common
     * aliases float/float32/32 and double/float64/64, case insensitive.
     *
     * @param name The name to parse
     * @return The precision
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static Precision parse(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "float32":
            case "float":
            case "32":
                return FLOAT32;
            case "float64":
            case "double":
            case "64":
                return FLOAT64;
            default:
                throw new IllegalArgumentException("Unknown precision: " + name);
        }
    }
}
