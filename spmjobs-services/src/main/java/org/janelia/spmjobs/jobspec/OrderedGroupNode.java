package org.janelia.spmjobs.jobspec;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Positional list of nodes, addressed with 1-based indexes in the generated script.
 */
public final class OrderedGroupNode extends JobNode {
    private final List<JobNode> elements;

    public static OrderedGroupNode of(JobNode... elements) {
        return new OrderedGroupNode(ImmutableList.copyOf(elements));
    }

    public OrderedGroupNode(List<? extends JobNode> elements) {
        this.elements = ImmutableList.copyOf(elements);
    }

    public List<JobNode> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    @Override
    public <T> T accept(JobNodeVisitor<T> visitor) {
        return visitor.visitOrderedGroup(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return elements.equals(((OrderedGroupNode) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
