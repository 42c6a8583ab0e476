package org.janelia.spmjobs.jobspec;

public interface JobNodeVisitor<T> {
    T visitScalar(ScalarNode node);
    T visitOrderedGroup(OrderedGroupNode node);
    T visitKeyedGroup(KeyedGroupNode node);
    T visitStringArray(StringArrayNode node);
}
