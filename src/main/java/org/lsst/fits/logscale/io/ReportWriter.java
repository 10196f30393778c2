package org.lsst.fits.logscale.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.File;
import java.io.IOException;
import java.util.Map;
import org.lsst.fits.logscale.MemoryEstimate;
import org.lsst.fits.logscale.PipelineConfig;
import org.lsst.fits.logscale.PipelineResult;
import org.lsst.fits.logscale.stats.Stage;
import org.lsst.fits.logscale.stats.StageStatistics;

/**
 * Writes the configuration, memory estimate and per stage statistics of a
 * run as JSON. Undefined values (NaN) are written as null.
 */
public class ReportWriter {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public ObjectNode toJson(PipelineResult result, String imageName) {
        ObjectNode root = mapper.createObjectNode();
        if (imageName != null) {
            root.put("image", imageName);
        }
        PipelineConfig config = result.getConfig();
        ObjectNode configNode = root.putObject("config");
        configNode.put("width", config.getWidth());
        configNode.put("height", config.getHeight());
        configNode.put("seed", config.getSeed());
        configNode.put("logThreshold", config.getLogThreshold());
        configNode.put("logMultiplier", config.getLogMultiplier());
        configNode.put("precision", config.getPrecision().name());
        configNode.put("quantizationLevels", config.getQuantizationLevels());

        MemoryEstimate memory = result.getMemoryEstimate();
        ObjectNode memoryNode = root.putObject("memory");
        memoryNode.put("inputBytes", memory.getInputBytes());
        memoryNode.put("workingBytes", memory.getWorkingBytes());
        memoryNode.put("outputBytes", memory.getOutputBytes());
        memoryNode.put("peakBytes", memory.getPeakBytes());

        ObjectNode stagesNode = root.putObject("stages");
        for (Map.Entry<Stage, StageStatistics> entry : result.getStatistics().getAll().entrySet()) {
            StageStatistics stats = entry.getValue();
            ObjectNode stageNode = stagesNode.putObject(entry.getKey().getKey());
            putNumber(stageNode, "minimum", stats.getMinimum());
            putNumber(stageNode, "maximum", stats.getMaximum());
            putNumber(stageNode, "mean", stats.getMean());
            stageNode.put("validCount", stats.getValidCount());
            stageNode.put("invalidCount", stats.getInvalidCount());
        }
        root.put("rescaledCount", result.getRescaledCount());

        ObjectNode normalization = root.putObject("normalization");
        putNumber(normalization, "inputMinimum", result.getNormalizedRangeMinimum());
        putNumber(normalization, "inputMaximum", result.getNormalizedRangeMaximum());
        normalization.put("condition", result.getCondition().name());
        return root;
    }

    public void write(PipelineResult result, String imageName, File file) throws IOException {
        mapper.writeValue(file, toJson(result, imageName));
    }

    private static void putNumber(ObjectNode node, String name, double value) {
        if (Double.isNaN(value)) {
            node.putNull(name);
        } else {
            node.put(name, value);
        }
    }
}
