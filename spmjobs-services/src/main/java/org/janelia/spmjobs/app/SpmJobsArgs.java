package org.janelia.spmjobs.app;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.converters.IParameterSplitter;
import org.janelia.spmjobs.dispatch.DispatchMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SpmJobsArgs {

    /**
     * Input file names and option values may contain commas.
     */
    public static class NoSplitter implements IParameterSplitter {
        @Override
        public List<String> split(String value) {
            return Collections.singletonList(value);
        }
    }

    @Parameter(names = "-op", description = "SPM operation: realign, coreg, normalise or smooth")
    String operation;
    @Parameter(names = {"-i", "-infile"}, description = "Input volume; repeat the flag for multiple inputs", splitter = NoSplitter.class)
    List<String> inputFiles = new ArrayList<>();
    @Parameter(names = "-o", description = "Operation option as name=value, e.g. -o fwhm=5 -o wrap=0,0,1", splitter = NoSplitter.class)
    List<String> operationOptions = new ArrayList<>();
    @Parameter(names = "-flags", description = "JSON object with job fields merged as is into the operation options")
    String flags;
    @Parameter(names = "-write", description = "Write the transformed images", arity = 1)
    Boolean write;
    @Parameter(names = "-mode", description = "Dispatch mode")
    DispatchMode mode = DispatchMode.SCRIPT;
    @Parameter(names = "-cwd", description = "Working directory")
    String workingDir = ".";
    @Parameter(names = "-dryRun", description = "Only print the generated script", arity = 0)
    boolean dryRun = false;
    @Parameter(names = "-spmPath", description = "Print the SPM location and exit", arity = 0)
    boolean displaySpmPath = false;
    @Parameter(names = "-h", description = "Display help", arity = 0, help = true)
    boolean displayUsage = false;
    @DynamicParameter(names = "-D", description = "Dynamic application parameters that could override application properties")
    Map<String, String> appDynamicConfig = new HashMap<>();
}
