package org.janelia.spmjobs.options;

/**
 * Thrown when an option value does not satisfy the constraints declared for it.
 */
public class ValidationException extends RuntimeException {
    private final String optionName;

    public ValidationException(String optionName, String message) {
        super(message);
        this.optionName = optionName;
    }

    public ValidationException(String optionName, String message, Throwable cause) {
        super(message, cause);
        this.optionName = optionName;
    }

    public String getOptionName() {
        return optionName;
    }
}
