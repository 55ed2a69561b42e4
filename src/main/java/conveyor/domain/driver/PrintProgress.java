package conveyor.domain.driver;

/**
 * Progress of a print run as reported by the driver
 */
public record PrintProgress(long currentLine, long totalLines, long currentByte, long totalBytes) {

    /**
     * Get completed fraction in [0,1], by lines when known, by bytes otherwise
     */
    public double fraction() {
        if (totalLines > 0) {
            return Math.min(1.0, (double) currentLine / totalLines);
        }
        if (totalBytes > 0) {
            return Math.min(1.0, (double) currentByte / totalBytes);
        }
        return 0.0;
    }
}
