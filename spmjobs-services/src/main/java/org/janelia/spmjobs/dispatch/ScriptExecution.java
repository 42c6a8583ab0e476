package org.janelia.spmjobs.dispatch;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Captured result of a MATLAB run.
 */
public final class ScriptExecution {
    private final String output;
    private final String error;
    private final String commandLine;
    private final int exitCode;

    public ScriptExecution(String output, String error, String commandLine, int exitCode) {
        this.output = output;
        this.error = error;
        this.commandLine = commandLine;
        this.exitCode = exitCode;
    }

    public String getOutput() {
        return output;
    }

    public String getError() {
        return error;
    }

    public String getCommandLine() {
        return commandLine;
    }

    public int getExitCode() {
        return exitCode;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("commandLine", commandLine)
                .append("exitCode", exitCode)
                .toString();
    }
}
