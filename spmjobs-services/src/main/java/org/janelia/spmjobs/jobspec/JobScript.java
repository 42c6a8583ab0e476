package org.janelia.spmjobs.jobspec;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Complete MATLAB text of a job together with the root variable it assigns.
 */
public final class JobScript {
    private final String rootPrefix;
    private final String text;

    JobScript(String rootPrefix, String text) {
        this.rootPrefix = rootPrefix;
        this.text = text;
    }

    public String getRootPrefix() {
        return rootPrefix;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("rootPrefix", rootPrefix)
                .toString();
    }
}
