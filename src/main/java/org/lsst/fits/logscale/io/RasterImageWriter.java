package org.lsst.fits.logscale.io;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.lsst.fits.logscale.cmap.ColorMaps;
import org.lsst.fits.logscale.cmap.RGBColorMap;
import org.lsst.fits.logscale.raster.QuantizedRaster;

/**
 * Renders a quantized raster through a color map and writes it as an image.
 */
public class RasterImageWriter {

    public static final String DEFAULT_FORMAT = "png";

    private final RGBColorMap colorMap;
    private final String format;

    public RasterImageWriter() {
        this(ColorMaps.getDefault(), DEFAULT_FORMAT);
    }

    public RasterImageWriter(RGBColorMap colorMap, String format) {
        if (colorMap.getSize() <= QuantizedRaster.MAX_LEVEL) {
            throw new IllegalArgumentException("Color map " + colorMap.getName() + " has too few levels: " + colorMap.getSize());
        }
        this.colorMap = colorMap;
        this.format = format;
    }

    public RGBColorMap getColorMap() {
        return colorMap;
    }

    public BufferedImage render(QuantizedRaster raster) {
        int width = raster.getWidth();
        int height = raster.getHeight();
        int[] lut = colorMap.toLookupTable();
        int[] rgb = new int[raster.getSize()];
        for (int i = 0; i < rgb.length; i++) {
            rgb[i] = lut[raster.getLevel(i)];
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, rgb, 0, width);
        return image;
    }

    public void write(QuantizedRaster raster, File file) throws IOException {
        if (!ImageIO.write(render(raster), format, file)) {
            throw new IOException("No image writer available for format " + format);
        }
    }
}
