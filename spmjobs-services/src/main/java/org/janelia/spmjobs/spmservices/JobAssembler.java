package org.janelia.spmjobs.spmservices;

import com.google.common.collect.ImmutableList;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.spmjobs.frames.FrameEnumerator;
import org.janelia.spmjobs.frames.FrameReference;
import org.janelia.spmjobs.jobspec.JobNode;
import org.janelia.spmjobs.jobspec.JobNodes;
import org.janelia.spmjobs.jobspec.KeyedGroupNode;
import org.janelia.spmjobs.jobspec.OrderedGroupNode;
import org.janelia.spmjobs.jobspec.StringArrayNode;
import org.janelia.spmjobs.options.NormalizationResult;
import org.janelia.spmjobs.options.OptionNormalizer;
import org.janelia.spmjobs.options.OptionSet;
import org.janelia.spmjobs.options.ValidationException;
import org.janelia.spmjobs.utils.FileUtils;
import org.slf4j.Logger;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Combines the normalized options of an operation with the frames of its input files into a single job.
 */
@ApplicationScoped
public class JobAssembler {

    private final FrameEnumerator frameEnumerator;
    private final OptionNormalizer optionNormalizer;
    private final Logger logger;

    @Inject
    public JobAssembler(FrameEnumerator frameEnumerator, OptionNormalizer optionNormalizer, Logger logger) {
        this.frameEnumerator = frameEnumerator;
        this.optionNormalizer = optionNormalizer;
        this.logger = logger;
    }

    public AssembledJob assemble(SpmOperation operation, OptionSet options) {
        NormalizationResult normalizationResult = optionNormalizer.normalize(operation.getSchema(), options);
        List<String> inputFiles = getInputFiles(options);
        JobNode frameData = createFrameData(inputFiles);
        // operations without a write switch always write their output
        boolean write = !operation.getSchema().recognizes(SpmOperation.WRITE_OPTION) || isWrite(options);

        KeyedGroupNode jobInstance = operation.createJobContents(normalizationResult.getNormalizedOptions(), options, frameData, write);
        Optional<String> variant = operation.getVariantName(write);
        KeyedGroupNode contents = variant
                .map(variantName -> KeyedGroupNode.builder().put(variantName, jobInstance).build())
                .orElse(jobInstance);

        List<String> expectedOutputs;
        if (write) {
            expectedOutputs = FileUtils.prefixFileNames(operation.getOutputSourceFiles(options, inputFiles), operation.getOutputPrefix());
        } else {
            expectedOutputs = operation.getOutputSourceFiles(options, inputFiles);
        }
        AssembledJob assembledJob = new AssembledJob(
                operation.getFamily(),
                operation.getName(),
                variant.orElse(null),
                contents,
                inputFiles,
                expectedOutputs,
                normalizationResult.getUnsupportedOptions());
        logger.info("Assembled {}", assembledJob);
        return assembledJob;
    }

    private List<String> getInputFiles(OptionSet options) {
        Object infile = options.get(SpmOperation.INFILE_OPTION);
        if (infile == OptionSet.ABSENT) {
            throw new ValidationException(SpmOperation.INFILE_OPTION, SpmOperation.INFILE_OPTION + " is required");
        }
        List<?> infileList = JobNodes.asList(infile);
        List<String> inputFiles;
        if (infileList == null) {
            inputFiles = ImmutableList.of(String.valueOf(infile));
        } else {
            inputFiles = infileList.stream().map(String::valueOf).collect(Collectors.toList());
        }
        if (CollectionUtils.isEmpty(inputFiles) || inputFiles.stream().anyMatch(StringUtils::isBlank)) {
            throw new ValidationException(SpmOperation.INFILE_OPTION, SpmOperation.INFILE_OPTION + " cannot be empty");
        }
        return inputFiles;
    }

    private JobNode createFrameData(List<String> inputFiles) {
        if (inputFiles.size() == 1) {
            return toStringArray(frameEnumerator.enumerate(inputFiles.get(0)));
        } else {
            return new OrderedGroupNode(frameEnumerator.enumerateMultiple(inputFiles).stream()
                    .map(this::toStringArray)
                    .collect(Collectors.toList()));
        }
    }

    private StringArrayNode toStringArray(List<FrameReference> frames) {
        return StringArrayNode.fromObjects(frames);
    }

    private boolean isWrite(OptionSet options) {
        Object write = options.get(SpmOperation.WRITE_OPTION);
        if (write == OptionSet.ABSENT) {
            return true;
        } else if (write instanceof Boolean) {
            return (Boolean) write;
        } else if (write instanceof Number) {
            return ((Number) write).doubleValue() != 0;
        } else {
            return Boolean.parseBoolean(String.valueOf(write).trim());
        }
    }
}
