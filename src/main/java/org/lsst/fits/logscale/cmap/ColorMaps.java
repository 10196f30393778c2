package org.lsst.fits.logscale.cmap;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.lsst.fits.logscale.PipelineConfig;

/**
 * Access to the bundled color maps. Parsed maps are cached so repeated
 * renders do not re-read the resources.
 */
public final class ColorMaps {

    public static final String GREY = "grey";
    public static final String B = "b";
    private static final List<String> AVAILABLE = Collections.unmodifiableList(Arrays.asList(GREY, B));

    private static final LoadingCache<String, RGBColorMap> CACHE = Caffeine.newBuilder()
            .maximumSize(16)
            .build(name -> SAOColorMap.fromResource(name, PipelineConfig.QUANTIZATION_LEVELS));

    private ColorMaps() {
    }

    /**
     * @param name A color map name, see {@link #getAvailable()}
     * @return The color map with one entry per quantization level
     * @throws IllegalArgumentException if the color map does not exist
     */
    public static RGBColorMap get(String name) {
        return CACHE.get(name);
    }

    public static RGBColorMap getDefault() {
        return get(GREY);
    }

    public static List<String> getAvailable() {
        return AVAILABLE;
    }
}
