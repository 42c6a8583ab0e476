package org.janelia.spmjobs.spmservices;

import com.google.common.collect.ImmutableList;
import jakarta.enterprise.context.Dependent;
import jakarta.inject.Named;
import org.janelia.spmjobs.jobspec.JobNode;
import org.janelia.spmjobs.jobspec.KeyedGroupNode;
import org.janelia.spmjobs.jobspec.ScalarNode;
import org.janelia.spmjobs.options.Coercion;
import org.janelia.spmjobs.options.OptionSchema;
import org.janelia.spmjobs.options.OptionSet;
import org.janelia.spmjobs.options.OptionSpec;

import java.util.List;
import java.util.Optional;

/**
 * Between modality rigid body registration (spm_coreg) of a source image to a target image. The estimated
 * transformation is also applied to the input files.
 */
@Dependent
@Named("coreg")
public class CoregisterOperation extends SpmOperation {

    static final String TARGET_OPTION = "target";
    static final String SOURCE_OPTION = "source";

    private static final OptionSchema SCHEMA = OptionSchema.builder("coreg")
            .group("eoptions")
            .group("roptions")
            .consumes(TARGET_OPTION, SOURCE_OPTION, INFILE_OPTION, WRITE_OPTION)
            .option(OptionSpec.of("cost_function", "eoptions.cost_fun"))
            .option(OptionSpec.of("separation", "eoptions.sep").coerce(Coercion.FLOAT))
            .option(OptionSpec.of("tolerance", "eoptions.tol").coerce(Coercion.FLOAT).withLength(12))
            .option(OptionSpec.of("fwhm", "eoptions.fwhm").coerce(Coercion.FLOAT))
            .option(OptionSpec.of("write_interp", "roptions.interp"))
            .option(OptionSpec.of("write_wrap", "roptions.wrap").withLength(3))
            .option(OptionSpec.of("write_mask", "roptions.mask").coerce(Coercion.INT))
            .build();

    @Override
    public String getName() {
        return "coreg";
    }

    @Override
    public List<String> getAliases() {
        return ImmutableList.of("coregister");
    }

    @Override
    public OptionSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public String getOutputPrefix() {
        return "r";
    }

    @Override
    public Optional<String> getVariantName(boolean write) {
        return Optional.of(write ? "estwrite" : "estimate");
    }

    @Override
    protected KeyedGroupNode createJobContents(KeyedGroupNode normalizedOptions, OptionSet options, JobNode frameData, boolean write) {
        KeyedGroupNode.Builder contentsBuilder = KeyedGroupNode.builder()
                .put("ref", ScalarNode.of(getRequiredString(options, TARGET_OPTION)))
                .put("source", ScalarNode.of(getRequiredString(options, SOURCE_OPTION)))
                .put("other", frameData)
                .put("eoptions", getGroup(normalizedOptions, "eoptions"));
        if (write) {
            contentsBuilder.put("roptions", getGroup(normalizedOptions, "roptions"));
        }
        return contentsBuilder.build();
    }

    @Override
    protected List<String> getOutputSourceFiles(OptionSet options, List<String> inputFiles) {
        return ImmutableList.<String>builder()
                .add(getRequiredString(options, SOURCE_OPTION))
                .addAll(inputFiles)
                .build();
    }
}
