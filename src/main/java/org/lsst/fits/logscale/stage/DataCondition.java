package org.lsst.fits.logscale.stage;

/**
 * How normalization resolved the value range it was given.
 */
public enum DataCondition {
    /**
     * A proper range, values were mapped linearly onto 0-255.
     */
    NORMAL,
    /**
     * Every valid value was identical, output is uniformly mid gray.
     */
    FLAT_RANGE,
    /**
     * There were no valid values, output is uniformly zero.
     */
    NO_VALID_DATA
}
