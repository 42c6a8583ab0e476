package org.janelia.spmjobs.app;

import com.beust.jcommander.JCommander;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import jakarta.enterprise.context.Dependent;
import jakarta.enterprise.inject.se.SeContainer;
import jakarta.enterprise.inject.se.SeContainerInitializer;
import jakarta.inject.Inject;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.spmjobs.cdi.ApplicationConfigProvider;
import org.janelia.spmjobs.dispatch.JobDispatcher;
import org.janelia.spmjobs.dispatch.JobOutcome;
import org.janelia.spmjobs.dispatch.SpmEnvironment;
import org.janelia.spmjobs.options.Coercion;
import org.janelia.spmjobs.options.OptionSchema;
import org.janelia.spmjobs.options.OptionSet;
import org.janelia.spmjobs.spmservices.AssembledJob;
import org.janelia.spmjobs.spmservices.JobAssembler;
import org.janelia.spmjobs.spmservices.SpmOperation;
import org.janelia.spmjobs.spmservices.SpmOperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: builds an SPM job from the command line options and runs it.
 */
@Dependent
public class SpmJobsApp {

    private static final Logger LOG = LoggerFactory.getLogger(SpmJobsApp.class);

    public static void main(String[] args) {
        int exitCode = 0;
        try {
            final SpmJobsArgs appArgs = parseAppArgs(args, new SpmJobsArgs());
            SeContainerInitializer containerInit = SeContainerInitializer.newInstance();
            try (SeContainer container = containerInit.initialize()) {
                SpmJobsApp app = container.select(SpmJobsApp.class).get();
                if (appArgs.displayUsage) {
                    app.displayUsage(appArgs, System.out);
                } else {
                    app.run(appArgs, System.out);
                }
            }
        } catch (Throwable e) {
            LOG.error("Error running SPM job", e);
            exitCode = 1;
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static SpmJobsArgs parseAppArgs(String[] args, SpmJobsArgs appArgs) {
        JCommander cmdline = new JCommander(appArgs);
        cmdline.parse(args);
        // update the dynamic config
        ApplicationConfigProvider.setAppDynamicArgs(appArgs.appDynamicConfig);
        return appArgs;
    }

    static void displayAppUsage(SpmJobsArgs appArgs, List<SpmOperation> operations, PrintStream out) {
        StringBuilder output = new StringBuilder();
        JCommander cmdline = new JCommander(appArgs);
        cmdline.getUsageFormatter().usage(output);
        output.append("  Operation options (-o name=value):\n");
        operations.forEach(operation -> output.append(describeOperation(operation)));
        out.print(output);
    }

    /**
     * One line per option: the option name, the job field it sets and its value constraints.
     */
    static String describeOperation(SpmOperation operation) {
        StringBuilder description = new StringBuilder("    ").append(operation.getName());
        if (CollectionUtils.isNotEmpty(operation.getAliases())) {
            description.append(" (").append(String.join(", ", operation.getAliases())).append(')');
        }
        description.append('\n');
        OptionSchema schema = operation.getSchema();
        schema.getConsumedOptions().forEach(optionName -> description.append("      ").append(optionName).append('\n'));
        schema.getSpecs().forEach(spec -> {
            description.append("      ").append(spec.getOptionName()).append(" -> ").append(spec.getTargetPath());
            List<String> constraints = new ArrayList<>();
            if (spec.getCoercion() != Coercion.NONE) {
                constraints.add(spec.getCoercion().name());
            }
            if (spec.getRequiredLength() != null) {
                constraints.add(spec.getRequiredLength() + " values");
            }
            if (!constraints.isEmpty()) {
                description.append(" (").append(String.join(", ", constraints)).append(')');
            }
            description.append('\n');
        });
        description.append("      ").append(OptionSchema.FLAGS_OPTION).append(" -> merged into the job as is\n");
        return description.toString();
    }

    private final SpmOperationRegistry operationRegistry;
    private final OptionValueParser optionValueParser;
    private final JobAssembler jobAssembler;
    private final JobDispatcher jobDispatcher;
    private final SpmEnvironment spmEnvironment;
    private final Logger logger;

    @Inject
    public SpmJobsApp(SpmOperationRegistry operationRegistry,
                      OptionValueParser optionValueParser,
                      JobAssembler jobAssembler,
                      JobDispatcher jobDispatcher,
                      SpmEnvironment spmEnvironment,
                      Logger logger) {
        this.operationRegistry = operationRegistry;
        this.optionValueParser = optionValueParser;
        this.jobAssembler = jobAssembler;
        this.jobDispatcher = jobDispatcher;
        this.spmEnvironment = spmEnvironment;
        this.logger = logger;
    }

    void displayUsage(SpmJobsArgs appArgs, PrintStream out) {
        displayAppUsage(appArgs, operationRegistry.getOperations(), out);
    }

    void run(SpmJobsArgs appArgs, PrintStream out) {
        if (appArgs.displaySpmPath) {
            out.println(spmEnvironment.getSpmPath());
            return;
        }
        Preconditions.checkArgument(StringUtils.isNotBlank(appArgs.operation),
                "No operation specified - supported operations: %s", operationRegistry.getOperationNames());
        SpmOperation operation = operationRegistry.getOperation(appArgs.operation);
        OptionSet options = createOptions(operation, appArgs);
        logger.debug("Run {} with {}", operation, options);

        AssembledJob job = jobAssembler.assemble(operation, options);
        if (appArgs.dryRun) {
            out.print(jobDispatcher.createScript(job));
            return;
        }
        JobOutcome outcome = jobDispatcher.dispatch(job, appArgs.mode, Paths.get(appArgs.workingDir).toAbsolutePath());
        logger.info("Completed {}", outcome);
        outcome.getOutputFiles().forEach(out::println);
    }

    OptionSet createOptions(SpmOperation operation, SpmJobsArgs appArgs) {
        OptionSet options = operation.newOptionSet();
        if (appArgs.inputFiles.size() == 1) {
            options.set(SpmOperation.INFILE_OPTION, appArgs.inputFiles.get(0));
        } else if (appArgs.inputFiles.size() > 1) {
            options.set(SpmOperation.INFILE_OPTION, appArgs.inputFiles);
        }
        appArgs.operationOptions.forEach(nameValue -> {
            List<String> nameValueParts = Splitter.on('=').limit(2).trimResults().splitToList(nameValue);
            if (nameValueParts.size() != 2 || StringUtils.isBlank(nameValueParts.get(0))) {
                throw new IllegalArgumentException("Invalid operation option " + nameValue + " - expected name=value");
            }
            options.set(nameValueParts.get(0), optionValueParser.parse(nameValueParts.get(1)));
        });
        if (StringUtils.isNotBlank(appArgs.flags)) {
            options.set(OptionSchema.FLAGS_OPTION, optionValueParser.parseFlags(appArgs.flags));
        }
        if (appArgs.write != null) {
            options.set(SpmOperation.WRITE_OPTION, appArgs.write);
        }
        return options;
    }
}
