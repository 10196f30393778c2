package org.lsst.fits.logscale.raster;

import java.nio.Buffer;

/**
 * A fixed shape rectangular grid of samples held in a row-major nio buffer.
 *
 * @param <T> The buffer type holding the samples
 */
public abstract class Raster<T extends Buffer> {

    private final int width;
    private final int height;
    private final T buffer;

    /**
     * Create a raster wrapping the given buffer.
     *
     * @param width The number of columns
     * @param height The number of rows
     * @param buffer The sample data, must hold exactly width*height elements
     * @throws ShapeMismatchException if the shape is not positive or the
     * buffer capacity does not match it
     */
    protected Raster(int width, int height, T buffer) {
        if (width <= 0 || height <= 0) {
            throw new ShapeMismatchException("Invalid raster shape " + width + "x" + height);
        }
        if ((long) width * height != buffer.capacity()) {
            throw new ShapeMismatchException(String.format("Buffer capacity %d does not match shape %dx%d", buffer.capacity(), width, height));
        }
        this.width = width;
        this.height = height;
        this.buffer = buffer;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getSize() {
        return width * height;
    }

    public T getBuffer() {
        return buffer;
    }

    public boolean hasShape(int width, int height) {
        return this.width == width && this.height == height;
    }

    /**
     * Fail loudly if this raster does not have the expected shape.
     *
     * @param width The expected width
     * @param height The expected height
     * @throws ShapeMismatchException if the shape differs
     */
    public void checkShape(int width, int height) {
        if (!hasShape(width, height)) {
            throw new ShapeMismatchException(String.format("Expected raster of shape %dx%d but got %dx%d", width, height, this.width, this.height));
        }
    }

    int index(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside " + width + "x" + height);
        }
        return x + y * width;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + "width=" + width + ", height=" + height + '}';
    }
}
