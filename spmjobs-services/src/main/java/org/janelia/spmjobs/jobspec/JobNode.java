package org.janelia.spmjobs.jobspec;

/**
 * Node of a job description. There are exactly four kinds of nodes: {@link ScalarNode},
 * {@link OrderedGroupNode}, {@link KeyedGroupNode} and {@link StringArrayNode}; any processing
 * of a job tree is done with a {@link JobNodeVisitor}.
 */
public abstract class JobNode {

    JobNode() {
    }

    public abstract <T> T accept(JobNodeVisitor<T> visitor);

}
