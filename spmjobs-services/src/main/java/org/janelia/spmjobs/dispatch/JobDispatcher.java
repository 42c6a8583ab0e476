package org.janelia.spmjobs.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.spmjobs.cdi.qualifier.PropertyValue;
import org.janelia.spmjobs.jobspec.JobScriptSerializer;
import org.janelia.spmjobs.jobspec.MatlabCodeBlock;
import org.janelia.spmjobs.jobspec.MatlabJobScripts;
import org.janelia.spmjobs.spmservices.AssembledJob;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Hands an assembled job to SPM and checks that it ran.
 */
@ApplicationScoped
public class JobDispatcher {

    static final String DEFAULT_SCRIPT_NAME = "spmjobs_script";
    static final String DEFAULT_JOB_FILE_NAME = "spmjobs.json";

    private final MatlabScriptRunner scriptRunner;
    private final MatlabErrorChecker errorChecker;
    private final ObjectMapper objectMapper;
    private final MatlabJobScripts jobScripts;
    private final String scriptName;
    private final String jobFileName;
    private final Logger logger;

    @Inject
    public JobDispatcher(MatlabScriptRunner scriptRunner,
                         MatlabErrorChecker errorChecker,
                         ObjectMapper objectMapper,
                         @PropertyValue(name = "SPM.ScriptName") String scriptName,
                         @PropertyValue(name = "SPM.JobFileName") String jobFileName,
                         Logger logger) {
        this.scriptRunner = scriptRunner;
        this.errorChecker = errorChecker;
        this.objectMapper = objectMapper;
        this.jobScripts = new MatlabJobScripts();
        this.scriptName = StringUtils.defaultIfBlank(scriptName, DEFAULT_SCRIPT_NAME);
        this.jobFileName = StringUtils.defaultIfBlank(jobFileName, DEFAULT_JOB_FILE_NAME);
        this.logger = logger;
    }

    /**
     * @return the MATLAB script that runs the job in SCRIPT mode
     */
    public String createScript(AssembledJob job) {
        return jobScripts.createJobScript(job.getFamily(), job.getName(), job.getContents()).getText();
    }

    /**
     * Run the job in the working directory. The job files have fixed names so concurrent dispatches must use
     * different working directories.
     *
     * @throws DispatchException if MATLAB could not be started, exited abnormally or reported an error
     */
    public JobOutcome dispatch(AssembledJob job, DispatchMode mode, Path workingDir) {
        Path jobFile;
        String scriptText;
        switch (mode) {
            case SCRIPT:
                jobFile = workingDir.resolve(scriptName + ".m");
                scriptText = createScript(job);
                break;
            case STRUCTURE:
                jobFile = workingDir.resolve(jobFileName);
                writeJobStructure(job, jobFile);
                scriptText = createBootstrapScript();
                break;
            default:
                throw new IllegalArgumentException("Unsupported dispatch mode " + mode);
        }
        logger.info("Dispatch {} in {} mode from {}", job, mode, workingDir);
        ScriptExecution execution = scriptRunner.runScript(scriptText, workingDir, scriptName);

        List<String> errors = ImmutableList.<String>builder()
                .addAll(errorChecker.collectErrors(execution.getOutput()))
                .addAll(errorChecker.collectErrors(execution.getError()))
                .build();
        if (execution.getExitCode() != 0 || CollectionUtils.isNotEmpty(errors)) {
            logger.error("{} failed with exit code {} and errors {}", job, execution.getExitCode(), errors);
            throw new DispatchException(
                    String.format("%s failed with exit code %d%s", execution.getCommandLine(), execution.getExitCode(),
                            CollectionUtils.isEmpty(errors) ? "" : ": " + String.join("; ", errors)),
                    execution.getCommandLine(),
                    execution.getExitCode(),
                    errors);
        }
        return new JobOutcome(mode, jobFile, job.getExpectedOutputs(), execution);
    }

    private void writeJobStructure(AssembledJob job, Path jobFile) {
        try {
            Files.createDirectories(jobFile.getParent());
            objectMapper.writeValue(jobFile.toFile(), jobScripts.createJobStructure(job.getFamily(), job.getName(), job.getContents()));
            logger.debug("Saved job structure to {}", jobFile);
        } catch (IOException e) {
            logger.error("Error writing job structure to {}", jobFile, e);
            throw new UncheckedIOException(e);
        }
    }

    String createBootstrapScript() {
        MatlabCodeBlock bootstrapCode = new MatlabCodeBlock();
        bootstrapCode.getCodeWriter()
                .assign("spmjob", "jsondecode(fileread(" + JobScriptSerializer.quote(jobFileName) + "))")
                .add("spm_jobman('run', spmjob." + MatlabJobScripts.JOBS_VAR + ");")
                .close();
        return bootstrapCode.toString();
    }
}
