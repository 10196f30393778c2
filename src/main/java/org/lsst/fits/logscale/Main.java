package org.lsst.fits.logscale;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.lsst.fits.logscale.io.ArtifactWriter;
import org.lsst.fits.logscale.io.FitsRasterReader;
import org.lsst.fits.logscale.raster.SourceRaster;

/**
 * Command line entry point.
 * <pre>
 * java -jar LogScalePipeline.jar [config.properties] [outputDir]
 * </pre> Configuration is read from the bundled pipeline.properties, then the
 * optional properties file, then system properties prefixed with
 * <code>logscale.</code>. If an <code>input</code> property names a FITS
 * file it is used as the source, otherwise samples are generated from the
 * configured seed.
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final String SYSTEM_PREFIX = "logscale.";
    static final String INPUT = "input";
    static final String BASE_NAME = "processed_log_image";

    public static void main(String[] args) throws IOException {
        configureLogging();
        Properties props = loadProperties(args.length > 0 ? Paths.get(args[0]) : null, System.getProperties());
        Path outputDir = Paths.get(args.length > 1 ? args[1] : ".");
        List<Path> written = run(props, outputDir, new UniformRasterGenerator());
        System.out.println("Image saved as: " + written.get(0));
        System.out.println("Report saved as: " + written.get(1));
    }

    static List<Path> run(Properties props, Path outputDir, RasterGenerator generator) throws IOException {
        PipelineConfig config = PipelineConfig.fromProperties(props);
        SourceRaster source = loadSource(config, props.getProperty(INPUT), generator);
        LogScalePipeline pipeline = new LogScalePipeline(config, new LoggingPipelineListener());
        PipelineResult result = Timed.execute(Level.INFO, () -> pipeline.run(source), "Pipeline took %dms");
        return new ArtifactWriter().write(result, outputDir, BASE_NAME);
    }

    static SourceRaster loadSource(PipelineConfig config, String input, RasterGenerator generator) throws IOException {
        if (input == null || input.trim().isEmpty()) {
            return Timed.execute(Level.FINE, () -> generator.generate(config), "Generating %dx%d source took %dms",
                    config.getWidth(), config.getHeight());
        }
        File file = new File(input.trim());
        return Timed.execute(Level.FINE, () -> new FitsRasterReader().read(file), "Reading %s took %dms", file);
    }

    static Properties loadProperties(Path file, Properties system) throws IOException {
        Properties props = new Properties();
        if (file != null) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
        }
        for (String key : system.stringPropertyNames()) {
            if (key.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(key.substring(SYSTEM_PREFIX.length()), system.getProperty(key));
            }
        }
        return props;
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException x) {
            LOG.log(Level.WARNING, "Unable to read logging configuration", x);
        }
    }
}
