package org.lsst.fits.logscale.raster;

import java.nio.Buffer;
import java.util.Arrays;

/**
 * Floating point raster used between the log and normalize stages. NaN marks
 * an element with no valid value. Values are always exchanged as doubles and
 * stored at the raster's {@link Precision}.
 */
public class WorkingRaster extends Raster<Buffer> {

    private final Precision precision;

    private WorkingRaster(int width, int height, Precision precision, Buffer buffer) {
        super(width, height, buffer);
        this.precision = precision;
    }

    public static WorkingRaster allocate(int width, int height, Precision precision) {
        return new WorkingRaster(width, height, precision, precision.allocate(width * height));
    }

    /**
     * Build a raster from explicit values, mainly for tests and for callers
     * that already hold log domain data.
     *
     * @param width The raster width
     * @param height The raster height
     * @param precision The storage precision
     * @param values The values in row-major order
     * @return The new raster
     */
    public static WorkingRaster of(int width, int height, Precision precision, double... values) {
        WorkingRaster raster = allocate(width, height, precision);
        if (values.length != raster.getSize()) {
            throw new ShapeMismatchException(String.format("%d values do not fill shape %dx%d", values.length, width, height));
        }
        for (int i = 0; i < values.length; i++) {
            raster.setValue(i, values[i]);
        }
        return raster;
    }

    public Precision getPrecision() {
        return precision;
    }

    public double getValue(int index) {
        return precision.get(getBuffer(), index);
    }

    public double getValue(int x, int y) {
        return getValue(index(x, y));
    }

    public void setValue(int index, double value) {
        precision.put(getBuffer(), index, value);
    }

    public WorkingRaster copy() {
        WorkingRaster copy = allocate(getWidth(), getHeight(), precision);
        for (int i = 0; i < getSize(); i++) {
            copy.setValue(i, getValue(i));
        }
        return copy;
    }

    public double[] toArray() {
        double[] result = new double[getSize()];
        for (int i = 0; i < result.length; i++) {
            result[i] = getValue(i);
        }
        return result;
    }

    /**
     * Bitwise comparison of the stored values, so NaN elements in the same
     * position compare equal.
     *
     * @param other The raster to compare with
     * @return <code>true</code> if shape, precision and all values match
     */
    public boolean sameValues(WorkingRaster other) {
        return hasShape(other.getWidth(), other.getHeight())
                && precision == other.precision
                && Arrays.equals(toArray(), other.toArray());
    }

    @Override
    public String toString() {
        return "WorkingRaster{" + "width=" + getWidth() + ", height=" + getHeight() + ", precision=" + precision + '}';
    }
}
