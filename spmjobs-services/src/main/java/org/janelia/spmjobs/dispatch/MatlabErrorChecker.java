package org.janelia.spmjobs.dispatch;

import com.google.common.base.Splitter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Finds the lines of MATLAB output that report an error.
 */
@ApplicationScoped
public class MatlabErrorChecker {

    private static final Pattern MATLAB_ERROR_PATTERN = Pattern.compile("^\\s*(\\?\\?\\? |Error using|Error in|Undefined function).*");

    private final Logger logger;

    @Inject
    public MatlabErrorChecker(Logger logger) {
        this.logger = logger;
    }

    public List<String> collectErrors(String processOutput) {
        if (StringUtils.isBlank(processOutput)) {
            return Collections.emptyList();
        }
        List<String> errors = StreamSupport.stream(Splitter.onPattern("\r?\n").split(processOutput).spliterator(), false)
                .filter(this::hasErrors)
                .collect(Collectors.toList());
        errors.forEach(e -> logger.error("MATLAB error: {}", e));
        return errors;
    }

    boolean hasErrors(String l) {
        return StringUtils.isNotBlank(l) && MATLAB_ERROR_PATTERN.matcher(l).matches();
    }
}
