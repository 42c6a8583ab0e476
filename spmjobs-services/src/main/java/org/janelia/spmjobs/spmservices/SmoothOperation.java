package org.janelia.spmjobs.spmservices;

import com.google.common.collect.ImmutableList;
import jakarta.enterprise.context.Dependent;
import jakarta.inject.Named;
import org.janelia.spmjobs.jobspec.JobNode;
import org.janelia.spmjobs.jobspec.KeyedGroupNode;
import org.janelia.spmjobs.options.Coercion;
import org.janelia.spmjobs.options.OptionSchema;
import org.janelia.spmjobs.options.OptionSet;
import org.janelia.spmjobs.options.OptionSpec;

import java.util.Optional;

/**
 * 3D gaussian smoothing (spm_smooth).
 */
@Dependent
@Named("smooth")
public class SmoothOperation extends SpmOperation {

    private static final OptionSchema SCHEMA = OptionSchema.builder("smooth")
            .defaultValue("fwhm", ImmutableList.of())
            .defaultValue("dtype", 0)
            .consumes(INFILE_OPTION)
            .option(OptionSpec.of("fwhm", "fwhm").coerce(Coercion.FLOAT).withLength(3))
            .option(OptionSpec.of("data_type", "dtype").coerce(Coercion.INT))
            .build();

    @Override
    public String getName() {
        return "smooth";
    }

    @Override
    public OptionSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public String getOutputPrefix() {
        return "s";
    }

    @Override
    public Optional<String> getVariantName(boolean write) {
        return Optional.empty();
    }

    @Override
    protected KeyedGroupNode createJobContents(KeyedGroupNode normalizedOptions, OptionSet options, JobNode frameData, boolean write) {
        return KeyedGroupNode.builder()
                .put("data", frameData)
                .putAll(normalizedOptions)
                .build();
    }
}
