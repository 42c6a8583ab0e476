package org.janelia.spmjobs.dispatch;

import com.google.common.base.Splitter;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.janelia.spmjobs.cdi.qualifier.PropertyValue;
import org.janelia.spmjobs.utils.FileUtils;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

/**
 * Location of the SPM installation. The configured location is used if there is one, otherwise SPM is asked
 * for it the first time it is needed.
 */
@ApplicationScoped
public class SpmEnvironment {

    static final String SPM_DIR_MARKER = "SPMDIR:";
    static final String SPM_DIR_SCRIPT_NAME = "spm_dir_lookup";

    private final MatlabScriptRunner scriptRunner;
    private final Logger logger;
    private final Supplier<String> spmPathSupplier;

    @Inject
    public SpmEnvironment(MatlabScriptRunner scriptRunner,
                          @PropertyValue(name = "SPM.Path") String configuredSpmPath,
                          Logger logger) {
        this.scriptRunner = scriptRunner;
        this.logger = logger;
        if (StringUtils.isNotBlank(configuredSpmPath)) {
            this.spmPathSupplier = () -> configuredSpmPath;
        } else {
            this.spmPathSupplier = Suppliers.memoize(this::discoverSpmPath);
        }
    }

    public String getSpmPath() {
        return spmPathSupplier.get();
    }

    private String discoverSpmPath() {
        Path lookupDir;
        try {
            lookupDir = Files.createTempDirectory("spmdir");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        ScriptExecution execution;
        try {
            execution = scriptRunner.runScript(
                    "fprintf('" + SPM_DIR_MARKER + "%s\\n', spm('dir'));\n",
                    lookupDir,
                    SPM_DIR_SCRIPT_NAME);
        } finally {
            deleteLookupDir(lookupDir);
        }
        String spmPath = null;
        for (String l : Splitter.onPattern("\r?\n").trimResults().split(StringUtils.defaultString(execution.getOutput()))) {
            if (l.startsWith(SPM_DIR_MARKER)) {
                spmPath = l.substring(SPM_DIR_MARKER.length()).trim();
            }
        }
        if (execution.getExitCode() != 0 || StringUtils.isBlank(spmPath)) {
            logger.error("Could not determine the SPM location using {}: {}", execution.getCommandLine(), execution.getError());
            throw new DispatchException("Could not determine the SPM location - check that SPM is on the MATLAB path",
                    execution.getCommandLine(), execution.getExitCode(), Collections.emptyList());
        }
        logger.info("Found SPM in {}", spmPath);
        return spmPath;
    }

    private void deleteLookupDir(Path lookupDir) {
        try {
            FileUtils.deletePath(lookupDir);
        } catch (IOException e) {
            logger.warn("Error deleting SPM lookup directory {}", lookupDir, e);
        }
    }
}
