package org.janelia.spmjobs.options;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.janelia.spmjobs.jobspec.JobNodes;
import org.janelia.spmjobs.jobspec.KeyedGroupNode;
import org.slf4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validates the options that are set and places them in the job fields declared by an {@link OptionSchema}.
 * <p>
 * Options are processed in schema order. Options unknown to the schema are reported and skipped.
 * The {@value OptionSchema#FLAGS_OPTION} option is a map merged at the top level of the result, after every
 * other option, without any validation.
 * </p>
 */
@ApplicationScoped
public class OptionNormalizer {

    private final Logger logger;

    @Inject
    public OptionNormalizer(Logger logger) {
        this.logger = logger;
    }

    public NormalizationResult normalize(OptionSchema schema, OptionSet options) {
        Map<String, Object> presentOptions = options.presentOptions();
        KeyedGroupNode.Builder normalizedOptionsBuilder = KeyedGroupNode.builder().putAll(schema.getDefaults());

        schema.getSpecs().stream()
                .filter(spec -> presentOptions.containsKey(spec.getOptionName()))
                .forEach(spec -> {
                    Object value = presentOptions.get(spec.getOptionName());
                    normalizedOptionsBuilder.putPath(spec.getTargetPathComponents(), spec.toJobNode(value));
                });

        List<String> unsupportedOptions = presentOptions.keySet().stream()
                .filter(optionName -> !schema.recognizes(optionName))
                .collect(Collectors.toList());
        unsupportedOptions.forEach(optionName -> logger.warn("Option {} not supported by {} - ignored", optionName, schema));

        if (presentOptions.containsKey(OptionSchema.FLAGS_OPTION)) {
            mergeFlags(presentOptions.get(OptionSchema.FLAGS_OPTION), normalizedOptionsBuilder);
        }
        return new NormalizationResult(normalizedOptionsBuilder.build(), unsupportedOptions);
    }

    private void mergeFlags(Object flags, KeyedGroupNode.Builder normalizedOptionsBuilder) {
        if (!(flags instanceof Map)) {
            throw new ValidationException(OptionSchema.FLAGS_OPTION, OptionSchema.FLAGS_OPTION + " must be a map of job fields");
        }
        ((Map<?, ?>) flags).forEach((k, v) -> {
            try {
                normalizedOptionsBuilder.put(String.valueOf(k), JobNodes.fromObject(v));
            } catch (IllegalArgumentException e) {
                throw new ValidationException(OptionSchema.FLAGS_OPTION, "Invalid " + OptionSchema.FLAGS_OPTION + " entry " + k + ": " + e.getMessage(), e);
            }
        });
        logger.debug("Merged {} into the job options", flags);
    }
}
