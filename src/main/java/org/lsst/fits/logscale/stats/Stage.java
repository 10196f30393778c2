package org.lsst.fits.logscale.stats;

/**
 * The points in the pipeline at which statistics are recorded, in pipeline
 * order.
 */
public enum Stage {
    ORIGINAL("original"),
    LOG("log"),
    SCALED("scaled"),
    NORMALIZED("normalized");

    private final String key;

    Stage(String key) {
        this.key = key;
    }

    /**
     * @return The name used for this stage in reports
     */
    public String getKey() {
        return key;
    }
}
