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

import java.util.List;
import java.util.Optional;

/**
 * Non-linear warping of a source image to a template (spm_normalise); the warp is applied to the input files.
 */
@Dependent
@Named("normalise")
public class NormalizeOperation extends SpmOperation {

    static final String SOURCE_OPTION = "source";

    private static final OptionSchema SCHEMA = OptionSchema.builder("normalise")
            .group("subj")
            .group("eoptions")
            .group("roptions")
            .consumes(INFILE_OPTION, WRITE_OPTION)
            .option(OptionSpec.of("template", "eoptions.template"))
            .option(OptionSpec.of(SOURCE_OPTION, "subj.source"))
            .option(OptionSpec.of("source_weight", "subj.wtsrc"))
            .option(OptionSpec.of("template_weight", "eoptions.weight"))
            .option(OptionSpec.of("source_image_smoothing", "eoptions.smosrc").coerce(Coercion.FLOAT))
            .option(OptionSpec.of("template_image_smoothing", "eoptions.smoref").coerce(Coercion.FLOAT))
            .option(OptionSpec.of("affine_regularization_type", "eoptions.regtype"))
            .option(OptionSpec.of("DCT_period_cutoff", "eoptions.cutoff"))
            .option(OptionSpec.of("nonlinear_iterations", "eoptions.nits"))
            .option(OptionSpec.of("nonlinear_regularization", "eoptions.reg").coerce(Coercion.FLOAT))
            .option(OptionSpec.of("write_preserve", "roptions.preserve"))
            .option(OptionSpec.of("write_bounding_box", "roptions.bb").withLength(6))
            .option(OptionSpec.of("write_voxel_sizes", "roptions.vox").withLength(3))
            .option(OptionSpec.of("write_interp", "roptions.interp"))
            .option(OptionSpec.of("write_wrap", "roptions.wrap").withLength(3))
            .build();

    @Override
    public String getName() {
        return "normalise";
    }

    @Override
    public List<String> getAliases() {
        return ImmutableList.of("normalize");
    }

    @Override
    public OptionSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public String getOutputPrefix() {
        return "w";
    }

    @Override
    public Optional<String> getVariantName(boolean write) {
        return Optional.of(write ? "estwrite" : "est");
    }

    @Override
    protected KeyedGroupNode createJobContents(KeyedGroupNode normalizedOptions, OptionSet options, JobNode frameData, boolean write) {
        getRequiredString(options, SOURCE_OPTION);
        KeyedGroupNode subj = KeyedGroupNode.builder()
                .putAll(getGroup(normalizedOptions, "subj"))
                .put("resample", frameData)
                .build();
        KeyedGroupNode.Builder contentsBuilder = KeyedGroupNode.builder()
                .put("subj", subj)
                .put("eoptions", getGroup(normalizedOptions, "eoptions"));
        if (write) {
            contentsBuilder.put("roptions", getGroup(normalizedOptions, "roptions"));
        }
        return contentsBuilder.build();
    }
}
