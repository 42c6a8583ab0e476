package org.janelia.spmjobs.spmservices;

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
 * Within modality rigid body alignment (spm_realign). Resliced images are prefixed with "r".
 */
@Dependent
@Named("realign")
public class RealignOperation extends SpmOperation {

    private static final OptionSchema SCHEMA = OptionSchema.builder("realign")
            .group("eoptions")
            .group("roptions")
            .consumes(INFILE_OPTION, WRITE_OPTION)
            .option(OptionSpec.of("quality", "eoptions.quality").coerce(Coercion.FLOAT))
            .option(OptionSpec.of("fwhm", "eoptions.fwhm").coerce(Coercion.FLOAT))
            .option(OptionSpec.of("separation", "eoptions.sep").coerce(Coercion.FLOAT))
            .option(OptionSpec.of("register_to_mean", "eoptions.rtm").coerce(Coercion.FLAG))
            .option(OptionSpec.of("weight_img", "eoptions.weight"))
            .option(OptionSpec.of("interp", "eoptions.interp").coerce(Coercion.FLOAT))
            .option(OptionSpec.of("wrap", "eoptions.wrap").withLength(3))
            .option(OptionSpec.of("write_which", "roptions.which").withLength(2))
            .option(OptionSpec.of("write_interp", "roptions.interp"))
            .option(OptionSpec.of("write_wrap", "roptions.wrap").withLength(3))
            .option(OptionSpec.of("write_mask", "roptions.mask").coerce(Coercion.INT))
            .build();

    @Override
    public String getName() {
        return "realign";
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
                .put("data", frameData)
                .put("eoptions", getGroup(normalizedOptions, "eoptions"));
        if (write) {
            contentsBuilder.put("roptions", getGroup(normalizedOptions, "roptions"));
        }
        return contentsBuilder.build();
    }
}
