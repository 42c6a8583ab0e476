package org.janelia.spmjobs.jobspec;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A number, a string or a boolean.
 */
public final class ScalarNode extends JobNode {
    private final Object value;

    public static ScalarNode of(String value) {
        return new ScalarNode(value);
    }

    public static ScalarNode of(Number value) {
        return new ScalarNode(value);
    }

    public static ScalarNode of(Boolean value) {
        return new ScalarNode(value);
    }

    private ScalarNode(Object value) {
        Preconditions.checkArgument(value != null, "Scalar value cannot be null");
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    public boolean isString() {
        return value instanceof String;
    }

    @Override
    public <T> T accept(JobNodeVisitor<T> visitor) {
        return visitor.visitScalar(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((ScalarNode) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
