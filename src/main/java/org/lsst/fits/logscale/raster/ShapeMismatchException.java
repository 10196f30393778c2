package org.lsst.fits.logscale.raster;

/**
 * Thrown when a raster does not have the shape a stage was configured for.
 * Shape is invariant across the pipeline, so this always indicates a
 * programming error rather than bad data.
 */
public class ShapeMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ShapeMismatchException(String message) {
        super(message);
    }
}
