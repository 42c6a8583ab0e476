package org.janelia.spmjobs.dispatch;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.janelia.spmjobs.cdi.qualifier.ApplicationProperties;
import org.janelia.spmjobs.config.ApplicationConfig;
import org.janelia.spmjobs.jobspec.JobScriptSerializer;
import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs MATLAB scripts in a local MATLAB process.
 * <p>
 * The script is invoked from a wrapper passed with <code>-r</code> that optionally adds the SPM location to the
 * MATLAB path, reports any error raised by the script and exits with 1 on error or 0 otherwise.
 * </p>
 */
@ApplicationScoped
public class LocalMatlabScriptRunner implements MatlabScriptRunner {

    static final String MATLAB_CMD_PROPERTY = "Matlab.Cmd";
    static final String MATLAB_ARGS_PROPERTY = "Matlab.Args";
    static final String SPM_PATH_PROPERTY = "SPM.Path";

    private final ApplicationConfig applicationConfig;
    private final Logger logger;

    @Inject
    public LocalMatlabScriptRunner(@ApplicationProperties ApplicationConfig applicationConfig, Logger logger) {
        this.applicationConfig = applicationConfig;
        this.logger = logger;
    }

    @Override
    public ScriptExecution runScript(String scriptText, Path workingDir, String scriptName) {
        List<String> cmd = createCommand(scriptName);
        String commandLine = String.join(" ", cmd);
        File outputFile = workingDir.resolve(scriptName + ".out").toFile();
        File errorFile = workingDir.resolve(scriptName + ".err").toFile();
        try {
            java.nio.file.Files.createDirectories(workingDir);
            Files.asCharSink(workingDir.resolve(scriptName + ".m").toFile(), StandardCharsets.UTF_8).write(scriptText);

            ProcessBuilder processBuilder = new ProcessBuilder(cmd)
                    .directory(workingDir.toFile())
                    .redirectOutput(ProcessBuilder.Redirect.to(outputFile))
                    .redirectError(ProcessBuilder.Redirect.to(errorFile));
            logger.info("Start {} in {}", commandLine, workingDir);
            Process process = processBuilder.start();
            int exitCode = process.waitFor();
            logger.info("{} completed with exit code {}", commandLine, exitCode);
            return new ScriptExecution(
                    readCapturedStream(outputFile),
                    readCapturedStream(errorFile),
                    commandLine,
                    exitCode);
        } catch (IOException e) {
            logger.error("Error running {} in {}", commandLine, workingDir, e);
            throw new DispatchException("Error running " + commandLine + ": " + e.getMessage(), commandLine, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while waiting for {}", commandLine, e);
            throw new DispatchException("Interrupted while waiting for " + commandLine, commandLine, e);
        }
    }

    List<String> createCommand(String scriptName) {
        return ImmutableList.<String>builder()
                .add(applicationConfig.getStringPropertyValue(MATLAB_CMD_PROPERTY, "matlab"))
                .addAll(Splitter.on(' ')
                        .omitEmptyStrings()
                        .trimResults()
                        .split(applicationConfig.getStringPropertyValue(MATLAB_ARGS_PROPERTY, "")))
                .add("-r")
                .add(createWrapper(scriptName))
                .build();
    }

    String createWrapper(String scriptName) {
        StringBuilder wrapperBuilder = new StringBuilder();
        String spmPath = applicationConfig.getStringPropertyValue(SPM_PATH_PROPERTY);
        if (StringUtils.isNotBlank(spmPath)) {
            wrapperBuilder.append("addpath(").append(JobScriptSerializer.quote(spmPath)).append("); ");
        }
        wrapperBuilder
                .append("try, ").append(scriptName).append("; ")
                .append("catch err, disp(getReport(err, 'basic')); exit(1); end; ")
                .append("exit(0);");
        return wrapperBuilder.toString();
    }

    private String readCapturedStream(File capturedStream) throws IOException {
        return capturedStream.exists() ? Files.asCharSource(capturedStream, StandardCharsets.UTF_8).read() : "";
    }
}
