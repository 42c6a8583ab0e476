package org.janelia.spmjobs.options;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.spmjobs.jobspec.JobNode;
import org.janelia.spmjobs.jobspec.JobNodes;

import java.util.List;

/**
 * One row of an option schema: the user option name, the dotted path of the job field it sets,
 * the value conversion and, for list options, the required number of elements.
 */
public final class OptionSpec {
    private final String optionName;
    private final String targetPath;
    private final Coercion coercion;
    private final Integer requiredLength;

    public static OptionSpec of(String optionName, String targetPath) {
        return new OptionSpec(optionName, targetPath, Coercion.NONE, null);
    }

    private OptionSpec(String optionName, String targetPath, Coercion coercion, Integer requiredLength) {
        Preconditions.checkArgument(StringUtils.isNotBlank(optionName), "Option name is required");
        Preconditions.checkArgument(StringUtils.isNotBlank(targetPath), "Target path is required for %s", optionName);
        Preconditions.checkArgument(requiredLength == null || requiredLength > 0, "Invalid length for %s", optionName);
        this.optionName = optionName;
        this.targetPath = targetPath;
        this.coercion = coercion;
        this.requiredLength = requiredLength;
    }

    public OptionSpec coerce(Coercion coercion) {
        return new OptionSpec(optionName, targetPath, coercion, requiredLength);
    }

    public OptionSpec withLength(int length) {
        return new OptionSpec(optionName, targetPath, coercion, length);
    }

    public String getOptionName() {
        return optionName;
    }

    public String getTargetPath() {
        return targetPath;
    }

    public String[] getTargetPathComponents() {
        return Splitter.on('.').splitToList(targetPath).toArray(new String[0]);
    }

    public Coercion getCoercion() {
        return coercion;
    }

    public Integer getRequiredLength() {
        return requiredLength;
    }

    /**
     * Check the value against this spec and convert it to a job node.
     *
     * @throws ValidationException if the value does not have the required length or cannot be converted
     */
    public JobNode toJobNode(Object value) {
        if (requiredLength != null) {
            List<Object> elements = JobNodes.asList(value);
            if (elements == null || elements.size() != requiredLength) {
                throw new ValidationException(optionName, optionName + " must have exactly " + requiredLength + " elements");
            }
        }
        Object convertedValue = coercion.apply(optionName, value);
        try {
            return JobNodes.fromObject(convertedValue);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(optionName, "Invalid value for " + optionName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("optionName", optionName)
                .append("targetPath", targetPath)
                .append("coercion", coercion)
                .append("requiredLength", requiredLength)
                .toString();
    }
}
