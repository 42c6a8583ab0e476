package org.janelia.spmjobs.dispatch;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.ToStringBuilder;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a successful dispatch.
 */
public final class JobOutcome {
    private final DispatchMode mode;
    private final Path jobFile;
    private final List<String> outputFiles;
    private final ScriptExecution execution;

    public JobOutcome(DispatchMode mode, Path jobFile, List<String> outputFiles, ScriptExecution execution) {
        this.mode = mode;
        this.jobFile = jobFile;
        this.outputFiles = ImmutableList.copyOf(outputFiles);
        this.execution = execution;
    }

    public DispatchMode getMode() {
        return mode;
    }

    /**
     * @return the generated script in SCRIPT mode or the job structure file in STRUCTURE mode
     */
    public Path getJobFile() {
        return jobFile;
    }

    /**
     * @return the files expected to be written by the job
     */
    public List<String> getOutputFiles() {
        return outputFiles;
    }

    public ScriptExecution getExecution() {
        return execution;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("mode", mode)
                .append("jobFile", jobFile)
                .append("outputFiles", outputFiles)
                .toString();
    }
}
