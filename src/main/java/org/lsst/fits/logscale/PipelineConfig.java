package org.lsst.fits.logscale;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;
import org.lsst.fits.logscale.raster.Precision;

/**
 * Immutable configuration of one pipeline run. All values are checked when
 * the configuration is built, so a pipeline never sees an invalid one.
 */
public final class PipelineConfig {

    public static final String WIDTH = "width";
    public static final String HEIGHT = "height";
    public static final String SEED = "seed";
    public static final String LOG_THRESHOLD = "log.threshold";
    public static final String LOG_MULTIPLIER = "log.multiplier";
    public static final String PRECISION = "precision";

    public static final int QUANTIZATION_LEVELS = 256;
    /**
     * Largest number of elements a single raster may hold, bounded by the
     * maximum Java array size.
     */
    public static final long MAX_ELEMENTS = Integer.MAX_VALUE - 8;
    private static final String DEFAULTS = "/pipeline.properties";

    private final int width;
    private final int height;
    private final long seed;
    private final double logThreshold;
    private final double logMultiplier;
    private final Precision precision;

    /**
     * @throws InvalidConfigurationException if width, height or threshold are
     * not positive, or threshold or multiplier are not finite
     */
    public PipelineConfig(int width, int height, long seed, double logThreshold, double logMultiplier, Precision precision) {
        if (width <= 0) {
            throw new InvalidConfigurationException("width must be positive: " + width);
        }
        if (height <= 0) {
            throw new InvalidConfigurationException("height must be positive: " + height);
        }
        if ((long) width * height > MAX_ELEMENTS) {
            throw new InvalidConfigurationException(String.format("%dx%d is too large for a single raster", width, height));
        }
        if (!(logThreshold > 0) || Double.isInfinite(logThreshold)) {
            throw new InvalidConfigurationException("log threshold must be positive and finite: " + logThreshold);
        }
        if (!Double.isFinite(logMultiplier)) {
            throw new InvalidConfigurationException("log multiplier must be finite: " + logMultiplier);
        }
        if (precision == null) {
            throw new InvalidConfigurationException("precision must be specified");
        }
        this.width = width;
        this.height = height;
        this.seed = seed;
        this.logThreshold = logThreshold;
        this.logMultiplier = logMultiplier;
        this.precision = precision;
    }

    /**
     * The configuration shipped on the classpath in pipeline.properties.
     *
     * @return The default configuration
     */
    public static PipelineConfig defaults() {
        return fromProperties(loadDefaults());
    }

    static Properties loadDefaults() {
        Properties props = new Properties();
        try (InputStream in = PipelineConfig.class.getResourceAsStream(DEFAULTS)) {
            if (in == null) {
                throw new InvalidConfigurationException("Missing default configuration " + DEFAULTS);
            }
            props.load(in);
        } catch (IOException x) {
            throw new InvalidConfigurationException("Unable to read " + DEFAULTS, x);
        }
        return props;
    }

    /**
     * Build a configuration from properties. Missing keys are taken from the
     * classpath defaults.
     *
     * @param overrides The properties to read
     * @return The validated configuration
     * @throws InvalidConfigurationException if a value cannot be parsed or is
     * out of range
     */
    public static PipelineConfig fromProperties(Properties overrides) {
        Properties props = loadDefaults();
        for (String key : overrides.stringPropertyNames()) {
            props.setProperty(key, overrides.getProperty(key));
        }
        int width = parse(props, WIDTH, Integer::parseInt);
        int height = parse(props, HEIGHT, Integer::parseInt);
        long seed = parse(props, SEED, Long::parseLong);
        double threshold = parse(props, LOG_THRESHOLD, Double::parseDouble);
        double multiplier = parse(props, LOG_MULTIPLIER, Double::parseDouble);
        Precision precision = parse(props, PRECISION, Precision::parse);
        return new PipelineConfig(width, height, seed, threshold, multiplier, precision);
    }

    private static <T> T parse(Properties props, String key, Parser<T> parser) {
        String value = props.getProperty(key);
        if (value == null) {
            throw new InvalidConfigurationException("Missing configuration value: " + key);
        }
        try {
            return parser.parse(value.trim());
        } catch (IllegalArgumentException x) {
            throw new InvalidConfigurationException("Invalid value for " + key + ": " + value, x);
        }
    }

    private interface Parser<T> {

        T parse(String value);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public long getSize() {
        return (long) width * height;
    }

    public long getSeed() {
        return seed;
    }

    public double getLogThreshold() {
        return logThreshold;
    }

    public double getLogMultiplier() {
        return logMultiplier;
    }

    public Precision getPrecision() {
        return precision;
    }

    public int getQuantizationLevels() {
        return QUANTIZATION_LEVELS;
    }

    @Override
    public String toString() {
        return "PipelineConfig{" + "width=" + width + ", height=" + height + ", seed=" + seed + ", logThreshold=" + logThreshold
                + ", logMultiplier=" + logMultiplier + ", precision=" + precision + '}';
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height, seed, logThreshold, logMultiplier, precision);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final PipelineConfig other = (PipelineConfig) obj;
        return this.width == other.width
                && this.height == other.height
                && this.seed == other.seed
                && Double.compare(this.logThreshold, other.logThreshold) == 0
                && Double.compare(this.logMultiplier, other.logMultiplier) == 0
                && this.precision == other.precision;
    }
}
