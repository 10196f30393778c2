package org.lsst.fits.logscale.io;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.logscale.PipelineResult;

/**
 * Writes the image and the JSON report of a run into an output directory.
 * Both are first written to temporary files and only moved into place once
 * both have been written, so a failure never leaves partial output behind.
 */
public class ArtifactWriter {

    private static final Logger LOG = Logger.getLogger(ArtifactWriter.class.getName());

    private final RasterImageWriter imageWriter;
    private final ReportWriter reportWriter;

    public ArtifactWriter() {
        this(new RasterImageWriter(), new ReportWriter());
    }

    public ArtifactWriter(RasterImageWriter imageWriter, ReportWriter reportWriter) {
        this.imageWriter = imageWriter;
        this.reportWriter = reportWriter;
    }

    /**
     * @param result The completed run
     * @param directory Output directory, created if needed
     * @param baseName File name without extension
     * @return The image and report paths, in that order
     * @throws IOException if either artifact could not be written
     */
    public List<Path> write(PipelineResult result, Path directory, String baseName) throws IOException {
        Files.createDirectories(directory);
        Path image = directory.resolve(baseName + "." + RasterImageWriter.DEFAULT_FORMAT);
        Path report = directory.resolve(baseName + ".json");
        List<Path> pending = new ArrayList<>();
        try {
            Path tmpImage = Files.createTempFile(directory, baseName, ".tmp");
            pending.add(tmpImage);
            imageWriter.write(result.getOutput(), tmpImage.toFile());
            Path tmpReport = Files.createTempFile(directory, baseName, ".tmp");
            pending.add(tmpReport);
            reportWriter.write(result, image.getFileName().toString(), tmpReport.toFile());
            move(tmpImage, image);
            pending.add(image);
            move(tmpReport, report);
        } catch (IOException | RuntimeException x) {
            for (Path path : pending) {
                deleteQuietly(path, x);
            }
            throw x;
        }
        return Arrays.asList(image, report);
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException x) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp, Exception cause) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException x) {
            cause.addSuppressed(x);
            LOG.log(Level.WARNING, "Unable to delete incomplete output " + tmp, x);
        }
    }
}
