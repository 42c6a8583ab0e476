package org.janelia.spmjobs.frames;

/**
 * Thrown when a volume cannot be read or it does not have the expected number of dimensions.
 */
public class DataAccessException extends RuntimeException {
    private final String dataPath;

    public DataAccessException(String dataPath, String message) {
        super(message);
        this.dataPath = dataPath;
    }

    public DataAccessException(String dataPath, String message, Throwable cause) {
        super(message, cause);
        this.dataPath = dataPath;
    }

    public String getDataPath() {
        return dataPath;
    }
}
