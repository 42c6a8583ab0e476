package org.janelia.spmjobs.dispatch;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown when a job could not be launched or when the engine reported a failure.
 */
public class DispatchException extends RuntimeException {
    private final String commandLine;
    private final int exitCode;
    private final List<String> errors;

    public DispatchException(String message, String commandLine, int exitCode, List<String> errors) {
        super(message);
        this.commandLine = commandLine;
        this.exitCode = exitCode;
        this.errors = ImmutableList.copyOf(errors);
    }

    public DispatchException(String message, String commandLine, Throwable cause) {
        super(message, cause);
        this.commandLine = commandLine;
        this.exitCode = -1;
        this.errors = ImmutableList.of();
    }

    public String getCommandLine() {
        return commandLine;
    }

    /**
     * @return the process exit code or -1 if the process did not run to completion
     */
    public int getExitCode() {
        return exitCode;
    }

    public List<String> getErrors() {
        return errors;
    }
}
