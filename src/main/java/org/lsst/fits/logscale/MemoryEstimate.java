package org.lsst.fits.logscale;

/**
 * Expected working set of a pipeline run, in bytes.
 */
public final class MemoryEstimate {

    private final long inputBytes;
    private final long workingBytes;
    private final long outputBytes;

    MemoryEstimate(long inputBytes, long workingBytes, long outputBytes) {
        this.inputBytes = inputBytes;
        this.workingBytes = workingBytes;
        this.outputBytes = outputBytes;
    }

    public long getInputBytes() {
        return inputBytes;
    }

    public long getWorkingBytes() {
        return workingBytes;
    }

    public long getOutputBytes() {
        return outputBytes;
    }

    /**
     * All three buffers may be live at once, so the peak is their sum.
     *
     * @return The estimated peak in bytes
     */
    public long getPeakBytes() {
        return inputBytes + workingBytes + outputBytes;
    }

    @Override
    public String toString() {
        return String.format("input=%s working=%s output=%s peak=%s",
                toMegabytes(inputBytes), toMegabytes(workingBytes), toMegabytes(outputBytes), toMegabytes(getPeakBytes()));
    }

    private static String toMegabytes(long bytes) {
        return String.format("%,.2fMB", bytes / (1024.0 * 1024.0));
    }
}
