package org.janelia.spmjobs.options;

import com.google.common.collect.ImmutableList;
import org.janelia.spmjobs.jobspec.KeyedGroupNode;

import java.util.List;

public final class NormalizationResult {
    private final KeyedGroupNode normalizedOptions;
    private final List<String> unsupportedOptions;

    NormalizationResult(KeyedGroupNode normalizedOptions, List<String> unsupportedOptions) {
        this.normalizedOptions = normalizedOptions;
        this.unsupportedOptions = ImmutableList.copyOf(unsupportedOptions);
    }

    public KeyedGroupNode getNormalizedOptions() {
        return normalizedOptions;
    }

    /**
     * @return the names of the options that were set but are not known by the schema; they are not part of the output
     */
    public List<String> getUnsupportedOptions() {
        return unsupportedOptions;
    }
}
