package com.lidar.exception;

/**
 * Seeding stopped part way. Batches committed before the failure stay imported.
 */
public class CoverageSeedException extends LidarException {

    private final long importedCount;

    public CoverageSeedException(String message, long importedCount, Throwable cause) {
        super(message, cause);
        this.importedCount = importedCount;
    }

    public long getImportedCount() {
        return importedCount;
    }
}
