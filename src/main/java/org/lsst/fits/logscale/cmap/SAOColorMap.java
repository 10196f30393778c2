package org.lsst.fits.logscale.cmap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A color map read from an SAO (ds9) PSEUDOCOLOR file. Each channel is
 * defined by (position,intensity) points in [0,1], linearly interpolated.
 */
public class SAOColorMap extends RGBColorMap {

    private static final Pattern POINT_PATTERN = Pattern.compile("\\(\\s*([0-9.]+)\\s*,\\s*([0-9.]+)\\s*\\)");
    private static final String SUFFIX = ".sao";

    private final int[] rgb;

    private enum Channel {
        RED(16), GREEN(8), BLUE(0);

        private final int shift;

        Channel(int shift) {
            this.shift = shift;
        }
    }

    /**
     * Parse a color map from a stream.
     *
     * @param name Name used in messages and reports
     * @param size Number of levels to generate
     * @param input The .sao content
     * @throws IOException if the content cannot be read or is not a valid
     * PSEUDOCOLOR map
     */
    public SAOColorMap(String name, int size, InputStream input) throws IOException {
        super(name, size);
        this.rgb = tabulate(size, readChannels(name, input));
    }

    /**
     * Load one of the color maps shipped with this package.
     *
     * @param name The color map name, with or without the .sao suffix
     * @param size Number of levels to generate
     * @return The color map
     * @throws IllegalArgumentException if there is no such color map
     */
    public static SAOColorMap fromResource(String name, int size) {
        String baseName = name.endsWith(SUFFIX) ? name.substring(0, name.length() - SUFFIX.length()) : name;
        String resource = baseName + SUFFIX;
        try (InputStream input = SAOColorMap.class.getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalArgumentException("Missing color map: " + resource);
            }
            return new SAOColorMap(baseName, size, input);
        } catch (IOException x) {
            throw new UncheckedIOException("Invalid color map " + resource, x);
        }
    }

    @Override
    public int getRGB(int level) {
        return rgb[level];
    }

    private static Map<Channel, Interpolation> readChannels(String name, InputStream input) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.US_ASCII));
        String scheme = nextLine(reader);
        if (!"PSEUDOCOLOR".equals(scheme)) {
            throw new IOException("Unsupported color scheme in " + name + ": " + scheme);
        }
        Map<Channel, Interpolation> channels = new EnumMap<>(Channel.class);
        Interpolation current = null;
        for (String line = nextLine(reader); line != null; line = nextLine(reader)) {
            if (line.endsWith(":")) {
                Channel channel;
                try {
                    channel = Channel.valueOf(line.substring(0, line.length() - 1).trim());
                } catch (IllegalArgumentException x) {
                    throw new IOException("Unknown channel in " + name + ": " + line, x);
                }
                current = new Interpolation();
                channels.put(channel, current);
            } else if (current == null) {
                throw new IOException("Points before first channel in " + name + ": " + line);
            } else {
                current.readPoints(line);
            }
        }
        for (Channel channel : Channel.values()) {
            Interpolation interpolation = channels.get(channel);
            if (interpolation == null || interpolation.isEmpty()) {
                throw new IOException("No points for " + channel + " in " + name);
            }
        }
        return channels;
    }

    // Skips blank lines and # comments
    private static String nextLine(BufferedReader reader) throws IOException {
        for (;;) {
            String line = reader.readLine();
            if (line == null) {
                return null;
            }
            String content = line.split("#", 2)[0].trim();
            if (!content.isEmpty()) {
                return content;
            }
        }
    }

    private static int[] tabulate(int size, Map<Channel, Interpolation> channels) {
        int[] result = new int[size];
        for (int i = 0; i < size; i++) {
            float f = i / (size - 1.0f);
            int packed = 0;
            for (Channel channel : Channel.values()) {
                int intensity = Math.round(255 * channels.get(channel).get(f));
                packed |= Math.max(0, Math.min(255, intensity)) << channel.shift;
            }
            result[i] = packed;
        }
        return result;
    }

    private static class Interpolation {

        private final List<Float> x = new ArrayList<>();
        private final List<Float> y = new ArrayList<>();

        boolean isEmpty() {
            return x.isEmpty();
        }

        float get(float value) {
            if (value <= x.get(0)) {
                return y.get(0);
            }
            int last = x.size() - 1;
            if (value >= x.get(last)) {
                return y.get(last);
            }
            int found = Collections.binarySearch(x, value);
            if (found >= 0) {
                return y.get(found);
            }
            int above = -found - 1;
            float x1 = x.get(above - 1);
            float x2 = x.get(above);
            float y1 = y.get(above - 1);
            float y2 = y.get(above);
            return y1 + (y2 - y1) * (value - x1) / (x2 - x1);
        }

        void readPoints(String line) throws IOException {
            Matcher matcher = POINT_PATTERN.matcher(line);
            boolean any = false;
            while (matcher.find()) {
                float px = Float.parseFloat(matcher.group(1));
                float py = Float.parseFloat(matcher.group(2));
                if (!x.isEmpty() && px < x.get(x.size() - 1)) {
                    throw new IOException("Points out of order: " + line);
                }
                x.add(px);
                y.add(py);
                any = true;
            }
            if (!any) {
                throw new IOException("No points in line: " + line);
            }
        }
    }
}
