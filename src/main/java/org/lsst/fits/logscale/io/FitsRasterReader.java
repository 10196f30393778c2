package org.lsst.fits.logscale.io;

import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.ShortBuffer;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.TruncatedFileException;
import nom.tam.fits.header.Standard;
import nom.tam.util.BufferedFile;
import org.lsst.fits.logscale.PipelineConfig;
import org.lsst.fits.logscale.raster.SourceRaster;

/**
 * Reads unsigned 16 bit sensor data from the first two dimensional image HDU
 * of a FITS file. Data must be BITPIX=16 with BSCALE=1, and BZERO=32768 (the
 * FITS unsigned convention) or BZERO=0 with no negative samples.
 */
public class FitsRasterReader {

    private static final Logger LOG = Logger.getLogger(FitsRasterReader.class.getName());
    private static final int MAX_HDUS = 100;
    private static final int CHUNK_BYTES = 1 << 16;

    static {
        FitsFactory.setUseHierarch(true);
    }

    public SourceRaster read(File file) throws IOException {
        try (BufferedFile bf = new BufferedFile(file)) {
            for (int hdu = 0; hdu < MAX_HDUS; hdu++) {
                Header header = readHeader(bf, file);
                if (isImage(header, hdu) && header.getIntValue(Standard.NAXIS) == 2) {
                    LOG.log(Level.FINE, "Reading image from HDU {0} of {1}", new Object[]{hdu, file});
                    return readImage(bf, header, file);
                }
                bf.seek(bf.getFilePointer() + header.getDataSize());
            }
            throw new IOException("No two dimensional image found in " + file);
        }
    }

    private static Header readHeader(BufferedFile bf, File file) throws IOException {
        try {
            return new Header(bf);
        } catch (TruncatedFileException x) {
            throw new IOException("Truncated FITS header in " + file, x);
        }
    }

    private static boolean isImage(Header header, int hdu) {
        if (hdu == 0) {
            return true;
        }
        String xtension = header.getStringValue(Standard.XTENSION);
        return xtension != null && "IMAGE".equals(xtension.trim());
    }

    private static SourceRaster readImage(BufferedFile bf, Header header, File file) throws IOException {
        int bitpix = header.getIntValue(Standard.BITPIX);
        if (bitpix != 16) {
            throw new IOException("Unsupported BITPIX " + bitpix + " in " + file + ", expected 16");
        }
        double bscale = header.getDoubleValue(Standard.BSCALE, 1.0);
        if (bscale != 1.0) {
            throw new IOException("Unsupported BSCALE " + bscale + " in " + file);
        }
        double bzero = header.getDoubleValue(Standard.BZERO, 0.0);
        if (bzero != 0.0 && bzero != 32768.0) {
            throw new IOException("Unsupported BZERO " + bzero + " in " + file);
        }
        int width = header.getIntValue(Standard.NAXIS1);
        int height = header.getIntValue(Standard.NAXIS2);
        if (width <= 0 || height <= 0) {
            throw new IOException(String.format("Invalid image shape %dx%d in %s", width, height, file));
        }
        long size = (long) width * height;
        if (size > PipelineConfig.MAX_ELEMENTS) {
            throw new IOException(String.format("Image shape %dx%d in %s is too large for a single raster", width, height, file));
        }
        if (bf.getFilePointer() + size * Short.BYTES > file.length()) {
            throw new IOException(String.format("Truncated image data in %s, %dx%d declared", file, width, height));
        }
        short[] data = new short[(int) size];
        byte[] chunk = new byte[CHUNK_BYTES];
        try {
            for (int done = 0; done < data.length;) {
                int n = Math.min(CHUNK_BYTES / Short.BYTES, data.length - done);
                bf.readFully(chunk, 0, n * Short.BYTES);
                // FITS data is always big endian
                ByteBuffer.wrap(chunk, 0, n * Short.BYTES).order(ByteOrder.BIG_ENDIAN).asShortBuffer().get(data, done, n);
                done += n;
            }
        } catch (EOFException x) {
            throw new IOException("Truncated image data in " + file, x);
        }
        int offset = (int) bzero;
        for (int i = 0; i < data.length; i++) {
            int sample = data[i] + offset;
            if (sample < 0) {
                throw new IOException(String.format("Negative sample %d at (%d,%d) in %s", sample, i % width, i / width, file));
            }
            data[i] = (short) sample;
        }
        return new SourceRaster(width, height, ShortBuffer.wrap(data));
    }
}
