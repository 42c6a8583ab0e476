package org.janelia.spmjobs.spmservices;

import com.google.common.collect.ImmutableList;
import org.janelia.spmjobs.jobspec.JobNode;
import org.janelia.spmjobs.jobspec.KeyedGroupNode;
import org.janelia.spmjobs.options.OptionSchema;
import org.janelia.spmjobs.options.OptionSet;
import org.janelia.spmjobs.options.ValidationException;

import java.util.List;
import java.util.Optional;

/**
 * An SPM batch tool. Each operation declares its option schema and how the normalized options and the input frames
 * are laid out in the job.
 */
public abstract class SpmOperation {

    public static final String SPATIAL_FAMILY = "spatial";
    public static final String INFILE_OPTION = "infile";
    public static final String WRITE_OPTION = "write";

    /**
     * @return the SPM job name, e.g. "realign"
     */
    public abstract String getName();

    public List<String> getAliases() {
        return ImmutableList.of();
    }

    public String getFamily() {
        return SPATIAL_FAMILY;
    }

    public abstract OptionSchema getSchema();

    /**
     * @return the prefix SPM adds to the name of the files it writes
     */
    public abstract String getOutputPrefix();

    /**
     * @param write whether the transformed images should be written as well
     * @return the job variant or empty if the operation has a single form
     */
    public abstract Optional<String> getVariantName(boolean write);

    public OptionSet newOptionSet() {
        return getSchema().newOptionSet();
    }

    /**
     * Lay out the job contents.
     *
     * @param normalizedOptions output of the option normalizer
     * @param options user options, used for the values the schema consumes
     * @param frameData frame references of the input files
     * @param write selected variant
     * @return the fields of the job instance
     */
    protected abstract KeyedGroupNode createJobContents(KeyedGroupNode normalizedOptions, OptionSet options, JobNode frameData, boolean write);

    /**
     * The files whose names the output files are derived from.
     */
    protected List<String> getOutputSourceFiles(OptionSet options, List<String> inputFiles) {
        return inputFiles;
    }

    protected String getRequiredString(OptionSet options, String optionName) {
        return options.getValue(optionName)
                .map(String::valueOf)
                .orElseThrow(() -> new ValidationException(optionName, optionName + " is required by " + getName()));
    }

    KeyedGroupNode getGroup(KeyedGroupNode normalizedOptions, String groupName) {
        return normalizedOptions.getGroup(groupName).orElseGet(KeyedGroupNode::empty);
    }

    @Override
    public String toString() {
        return getName();
    }
}
