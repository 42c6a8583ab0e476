package org.janelia.spmjobs.options;

import org.apache.commons.lang3.StringUtils;
import org.janelia.spmjobs.jobspec.JobNodes;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Value conversions applied to an option before it is placed in the job. A conversion applied to a list
 * or an array converts every element.
 */
public enum Coercion {
    NONE {
        @Override
        Object convertScalar(String optionName, Object value) {
            return value;
        }
    },
    FLOAT {
        @Override
        Object convertScalar(String optionName, Object value) {
            double doubleValue;
            if (value instanceof Number) {
                doubleValue = ((Number) value).doubleValue();
            } else if (value instanceof Boolean) {
                doubleValue = (Boolean) value ? 1.0 : 0.0;
            } else if (value instanceof String && StringUtils.isNotBlank((String) value)) {
                try {
                    doubleValue = Double.parseDouble(((String) value).trim());
                } catch (NumberFormatException e) {
                    throw new ValidationException(optionName, optionName + " must be a number: " + value, e);
                }
            } else {
                throw new ValidationException(optionName, optionName + " must be a number: " + value);
            }
            return checkFinite(optionName, doubleValue);
        }
    },
    INT {
        @Override
        Object convertScalar(String optionName, Object value) {
            if (value instanceof Number) {
                return ((Number) value).longValue();
            } else if (value instanceof Boolean) {
                return (Boolean) value ? 1L : 0L;
            } else if (value instanceof String && StringUtils.isNotBlank((String) value)) {
                try {
                    return (long) checkFinite(optionName, Double.parseDouble(((String) value).trim()));
                } catch (NumberFormatException e) {
                    throw new ValidationException(optionName, optionName + " must be an integer: " + value, e);
                }
            } else {
                throw new ValidationException(optionName, optionName + " must be an integer: " + value);
            }
        }
    },
    FLAG {
        @Override
        Object convertScalar(String optionName, Object value) {
            if (value instanceof Boolean) {
                return (Boolean) value ? 1L : 0L;
            } else if (value instanceof Number) {
                return ((Number) value).doubleValue() != 0 ? 1L : 0L;
            } else if (value instanceof String) {
                return Boolean.parseBoolean(((String) value).trim()) ? 1L : 0L;
            } else {
                throw new ValidationException(optionName, optionName + " must be a boolean: " + value);
            }
        }
    };

    abstract Object convertScalar(String optionName, Object value);

    private static double checkFinite(String optionName, double value) {
        if (!Double.isFinite(value)) {
            throw new ValidationException(optionName, optionName + " must be a finite number: " + value);
        }
        return value;
    }

    public Object apply(String optionName, Object value) {
        if (this == NONE) {
            return value;
        }
        List<Object> elements = JobNodes.asList(value);
        if (elements == null) {
            return convertScalar(optionName, value);
        } else {
            return elements.stream()
                    .map(element -> apply(optionName, element))
                    .collect(Collectors.toList());
        }
    }
}
