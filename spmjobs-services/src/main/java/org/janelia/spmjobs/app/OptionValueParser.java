package org.janelia.spmjobs.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Splitter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.janelia.spmjobs.options.OptionSchema;
import org.janelia.spmjobs.options.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Converts command line option values to typed values: comma separated lists, integers, decimals,
 * booleans and otherwise strings.
 */
@ApplicationScoped
public class OptionValueParser {

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    private final ObjectMapper objectMapper;

    @Inject
    public OptionValueParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Object parse(String value) {
        if (value != null && value.contains(",")) {
            return StreamSupport.stream(Splitter.on(',').trimResults().split(value).spliterator(), false)
                    .map(this::parseScalar)
                    .collect(Collectors.toList());
        } else {
            return parseScalar(value);
        }
    }

    Object parseScalar(String value) {
        String trimmedValue = StringUtils.trimToEmpty(value);
        if ("true".equalsIgnoreCase(trimmedValue) || "false".equalsIgnoreCase(trimmedValue)) {
            return Boolean.valueOf(trimmedValue);
        } else if (INTEGER_PATTERN.matcher(trimmedValue).matches()) {
            try {
                return Long.valueOf(trimmedValue);
            } catch (NumberFormatException e) {
                return Double.valueOf(trimmedValue);
            }
        } else if (DECIMAL_PATTERN.matcher(trimmedValue).matches()) {
            return Double.valueOf(trimmedValue);
        } else {
            return trimmedValue;
        }
    }

    public Map<String, Object> parseFlags(String flagsJson) {
        try {
            Map<String, Object> flags = objectMapper.readValue(flagsJson, new TypeReference<LinkedHashMap<String, Object>>() {});
            if (flags == null) {
                throw new ValidationException(OptionSchema.FLAGS_OPTION, "No job fields in " + OptionSchema.FLAGS_OPTION);
            }
            return flags;
        } catch (JsonProcessingException e) {
            throw new ValidationException(OptionSchema.FLAGS_OPTION, OptionSchema.FLAGS_OPTION + " must be a JSON object: " + e.getOriginalMessage(), e);
        }
    }
}
