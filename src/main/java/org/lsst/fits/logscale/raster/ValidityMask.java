package org.lsst.fits.logscale.raster;

import java.util.BitSet;

/**
 * Marks the elements of a raster which satisfied the domain constraint of
 * the log transform (sample &gt; 0). Built once and read only afterwards.
 */
public class ValidityMask {

    private final int width;
    private final int height;
    private final BitSet valid;

    public ValidityMask(int width, int height, BitSet valid) {
        if (valid.length() > width * height) {
            throw new ShapeMismatchException("Validity bits extend beyond shape " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.valid = (BitSet) valid.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isValid(int index) {
        return valid.get(index);
    }

    public boolean isValid(int x, int y) {
        return isValid(x + y * width);
    }

    public int getValidCount() {
        return valid.cardinality();
    }

    public int getInvalidCount() {
        return width * height - valid.cardinality();
    }

    @Override
    public String toString() {
        return "ValidityMask{" + "width=" + width + ", height=" + height + ", valid=" + getValidCount() + '}';
    }
}
