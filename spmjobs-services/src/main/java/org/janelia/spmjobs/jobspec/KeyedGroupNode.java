package org.janelia.spmjobs.jobspec;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named fields in insertion order. The order is kept in the generated script.
 */
public final class KeyedGroupNode extends JobNode {

    public static class Builder {
        private final Map<String, JobNode> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, JobNode value) {
            Preconditions.checkArgument(StringUtils.isNotBlank(key), "Field name cannot be blank");
            Preconditions.checkArgument(value != null, "No value set for %s", key);
            fields.put(key, value);
            return this;
        }

        public Builder putAll(KeyedGroupNode other) {
            fields.putAll(other.fields);
            return this;
        }

        /**
         * Set the value of a nested field creating any intermediate group that does not exist yet.
         */
        public Builder putPath(String[] path, JobNode value) {
            Preconditions.checkArgument(path.length > 0, "Empty field path");
            if (path.length == 1) {
                return put(path[0], value);
            }
            JobNode current = fields.get(path[0]);
            Builder nestedBuilder = KeyedGroupNode.builder();
            if (current instanceof KeyedGroupNode) {
                nestedBuilder.putAll((KeyedGroupNode) current);
            } else if (current != null) {
                throw new IllegalArgumentException("Field " + path[0] + " is not a group");
            }
            String[] remainingPath = new String[path.length - 1];
            System.arraycopy(path, 1, remainingPath, 0, remainingPath.length);
            nestedBuilder.putPath(remainingPath, value);
            return put(path[0], nestedBuilder.build());
        }

        public KeyedGroupNode build() {
            return new KeyedGroupNode(fields);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static KeyedGroupNode empty() {
        return new KeyedGroupNode(Collections.emptyMap());
    }

    private final Map<String, JobNode> fields;

    private KeyedGroupNode(Map<String, JobNode> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, JobNode> getFields() {
        return fields;
    }

    public Set<String> keys() {
        return fields.keySet();
    }

    public Optional<JobNode> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public Optional<KeyedGroupNode> getGroup(String key) {
        return get(key)
                .filter(n -> n instanceof KeyedGroupNode)
                .map(n -> (KeyedGroupNode) n);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    @Override
    public <T> T accept(JobNodeVisitor<T> visitor) {
        return visitor.visitKeyedGroup(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        // field order is significant for the generated script
        return fields.equals(((KeyedGroupNode) o).fields)
                && ImmutableList.copyOf(fields.keySet()).equals(ImmutableList.copyOf(((KeyedGroupNode) o).fields.keySet()));
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
