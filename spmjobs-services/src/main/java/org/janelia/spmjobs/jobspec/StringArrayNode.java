package org.janelia.spmjobs.jobspec;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Homogeneous list of strings, such as a list of frame references, written as a cell array literal.
 */
public final class StringArrayNode extends JobNode {
    private final List<String> values;

    public static StringArrayNode of(String... values) {
        return new StringArrayNode(ImmutableList.copyOf(values));
    }

    public static StringArrayNode fromObjects(Collection<?> values) {
        return new StringArrayNode(values.stream().map(String::valueOf).collect(Collectors.toList()));
    }

    public StringArrayNode(List<String> values) {
        this.values = ImmutableList.copyOf(values);
    }

    public List<String> getValues() {
        return values;
    }

    @Override
    public <T> T accept(JobNodeVisitor<T> visitor) {
        return visitor.visitStringArray(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((StringArrayNode) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
