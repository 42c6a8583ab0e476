package org.janelia.spmjobs.options;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * User options of an operation. Every known option starts out {@link #ABSENT}; an absent option is
 * different from an option set to an empty value.
 */
public class OptionSet {

    public static final Object ABSENT = new Object() {
        @Override
        public String toString() {
            return "<absent>";
        }
    };

    private final Map<String, Object> options = new LinkedHashMap<>();

    public OptionSet(Collection<String> optionNames) {
        optionNames.forEach(name -> options.put(name, ABSENT));
    }

    private OptionSet(Map<String, Object> options) {
        this.options.putAll(options);
    }

    /**
     * Set an option. Setting an option to null is the same as unsetting it.
     */
    public OptionSet set(String name, Object value) {
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "Option name cannot be blank");
        options.put(name, value == null ? ABSENT : value);
        return this;
    }

    public OptionSet unset(String name) {
        options.put(name, ABSENT);
        return this;
    }

    /**
     * @return the option value or {@link #ABSENT}
     */
    public Object get(String name) {
        return options.getOrDefault(name, ABSENT);
    }

    public Optional<Object> getValue(String name) {
        Object value = get(name);
        return value == ABSENT ? Optional.empty() : Optional.of(value);
    }

    public boolean isPresent(String name) {
        return get(name) != ABSENT;
    }

    public Set<String> names() {
        return options.keySet();
    }

    /**
     * @return the options that have a value, in the order in which they were declared or first set
     */
    public Map<String, Object> presentOptions() {
        ImmutableMap.Builder<String, Object> presentOptionsBuilder = ImmutableMap.builder();
        options.forEach((k, v) -> {
            if (v != ABSENT) presentOptionsBuilder.put(k, v);
        });
        return presentOptionsBuilder.build();
    }

    public OptionSet copy() {
        return new OptionSet(options);
    }

    @Override
    public String toString() {
        return options.toString();
    }
}
