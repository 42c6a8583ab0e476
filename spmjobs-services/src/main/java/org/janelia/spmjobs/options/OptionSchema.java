package org.janelia.spmjobs.options;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.janelia.spmjobs.jobspec.JobNode;
import org.janelia.spmjobs.jobspec.JobNodes;
import org.janelia.spmjobs.jobspec.KeyedGroupNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declares the options of an operation: the fields that are always present in the normalized output,
 * the options mapped to job fields and the options recognized but consumed elsewhere.
 */
public final class OptionSchema {

    public static final String FLAGS_OPTION = "flags";

    public static class Builder {
        private final String name;
        private final Map<String, JobNode> defaults = new LinkedHashMap<>();
        private final Set<String> consumedOptions = new LinkedHashSet<>();
        private final List<OptionSpec> specs = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Add a sub-group that is always present in the output, even when empty.
         */
        public Builder group(String groupName) {
            defaults.put(groupName, KeyedGroupNode.empty());
            return this;
        }

        public Builder defaultValue(String fieldName, Object value) {
            defaults.put(fieldName, JobNodes.fromObject(value));
            return this;
        }

        public Builder consumes(String... optionNames) {
            consumedOptions.addAll(ImmutableList.copyOf(optionNames));
            return this;
        }

        public Builder option(OptionSpec spec) {
            Preconditions.checkArgument(specs.stream().noneMatch(s -> s.getOptionName().equals(spec.getOptionName())),
                    "Option %s is already declared by %s", spec.getOptionName(), name);
            specs.add(spec);
            return this;
        }

        public OptionSchema build() {
            return new OptionSchema(name, defaults, consumedOptions, specs);
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    private final String name;
    private final KeyedGroupNode defaults;
    private final Set<String> consumedOptions;
    private final List<OptionSpec> specs;

    private OptionSchema(String name, Map<String, JobNode> defaults, Set<String> consumedOptions, List<OptionSpec> specs) {
        this.name = name;
        KeyedGroupNode.Builder defaultsBuilder = KeyedGroupNode.builder();
        defaults.forEach(defaultsBuilder::put);
        this.defaults = defaultsBuilder.build();
        this.consumedOptions = ImmutableSet.copyOf(consumedOptions);
        this.specs = ImmutableList.copyOf(specs);
    }

    public String getName() {
        return name;
    }

    public KeyedGroupNode getDefaults() {
        return defaults;
    }

    public Set<String> getConsumedOptions() {
        return consumedOptions;
    }

    public List<OptionSpec> getSpecs() {
        return specs;
    }

    /**
     * @return all option names known by this schema: consumed options, mapped options and {@value #FLAGS_OPTION}
     */
    public Set<String> getOptionNames() {
        Set<String> optionNames = new LinkedHashSet<>(consumedOptions);
        specs.forEach(s -> optionNames.add(s.getOptionName()));
        optionNames.add(FLAGS_OPTION);
        return optionNames;
    }

    public boolean recognizes(String optionName) {
        return getOptionNames().contains(optionName);
    }

    /**
     * @return a new option set with every known option absent
     */
    public OptionSet newOptionSet() {
        return new OptionSet(getOptionNames());
    }

    @Override
    public String toString() {
        return name;
    }
}
