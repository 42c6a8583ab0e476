package org.janelia.spmjobs.spmservices;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.spmjobs.jobspec.KeyedGroupNode;
import org.janelia.spmjobs.jobspec.MatlabJobScripts;

import java.util.List;

/**
 * A job ready to be serialized: the contents of the single job instance, the files it reads and the files it
 * is expected to write.
 */
public final class AssembledJob {
    private final String family;
    private final String name;
    private final String variant;
    private final KeyedGroupNode contents;
    private final List<String> inputFiles;
    private final List<String> expectedOutputs;
    private final List<String> unsupportedOptions;

    AssembledJob(String family,
                 String name,
                 String variant,
                 KeyedGroupNode contents,
                 List<String> inputFiles,
                 List<String> expectedOutputs,
                 List<String> unsupportedOptions) {
        this.family = family;
        this.name = name;
        this.variant = variant;
        this.contents = contents;
        this.inputFiles = ImmutableList.copyOf(inputFiles);
        this.expectedOutputs = ImmutableList.copyOf(expectedOutputs);
        this.unsupportedOptions = ImmutableList.copyOf(unsupportedOptions);
    }

    public String getFamily() {
        return family;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the structural variant or null if the operation has only one form
     */
    public String getVariant() {
        return variant;
    }

    public KeyedGroupNode getContents() {
        return contents;
    }

    public String getRootPrefix() {
        return MatlabJobScripts.rootPrefix(family, name);
    }

    public List<String> getInputFiles() {
        return inputFiles;
    }

    public List<String> getExpectedOutputs() {
        return expectedOutputs;
    }

    public List<String> getUnsupportedOptions() {
        return unsupportedOptions;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("family", family)
                .append("name", name)
                .append("variant", variant)
                .append("inputFiles", inputFiles)
                .toString();
    }
}
