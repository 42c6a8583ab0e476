package org.janelia.spmjobs.dispatch;

public enum DispatchMode {
    /**
     * Run the generated MATLAB script.
     */
    SCRIPT,
    /**
     * Save the job structure to a file and run a bootstrap script that loads it.
     */
    STRUCTURE
}
