package org.janelia.spmjobs.dispatch;

import java.nio.file.Path;

public interface MatlabScriptRunner {
    /**
     * Save the script as <code>scriptName.m</code> in the working directory and run it to completion.
     *
     * @param scriptText MATLAB code
     * @param workingDir directory where the script is saved and run
     * @param scriptName script name without the ".m" extension; must be a valid MATLAB identifier
     * @return captured output and exit code
     * @throws DispatchException if MATLAB could not be started
     */
    ScriptExecution runScript(String scriptText, Path workingDir, String scriptName);
}
