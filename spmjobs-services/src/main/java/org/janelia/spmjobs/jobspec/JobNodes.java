package org.janelia.spmjobs.jobspec;

import com.google.common.collect.ImmutableList;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Conversions between job trees and plain java values (maps, lists, arrays and scalars).
 */
public class JobNodes {

    /**
     * Convert a plain value to a job node.
     * <ul>
     *     <li>maps become keyed groups, iterated in the map's order</li>
     *     <li>String arrays and non empty collections of strings become string arrays (MATLAB cell arrays of strings)</li>
     *     <li>other arrays and collections become ordered groups</li>
     *     <li>strings, numbers and booleans become scalars</li>
     * </ul>
     *
     * @param value value to convert
     * @return the corresponding node
     * @throws IllegalArgumentException if the value or any nested value cannot be represented
     */
    public static JobNode fromObject(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Null values cannot be part of a job");
        } else if (value instanceof JobNode) {
            return (JobNode) value;
        } else if (value instanceof CharSequence) {
            return ScalarNode.of(value.toString());
        } else if (value instanceof Number) {
            return ScalarNode.of((Number) value);
        } else if (value instanceof Boolean) {
            return ScalarNode.of((Boolean) value);
        } else if (value instanceof String[]) {
            return StringArrayNode.of((String[]) value);
        } else if (value instanceof Map) {
            KeyedGroupNode.Builder groupBuilder = KeyedGroupNode.builder();
            ((Map<?, ?>) value).forEach((k, v) -> groupBuilder.put(String.valueOf(k), fromObject(v)));
            return groupBuilder.build();
        } else if (isStringCollection(value)) {
            return StringArrayNode.fromObjects((Collection<?>) value);
        } else if (value instanceof Collection) {
            return new OrderedGroupNode(((Collection<?>) value).stream()
                    .map(JobNodes::fromObject)
                    .collect(Collectors.toList()));
        } else if (value.getClass().isArray()) {
            return new OrderedGroupNode(asList(value).stream()
                    .map(JobNodes::fromObject)
                    .collect(Collectors.toList()));
        } else {
            throw new IllegalArgumentException("Unsupported job value type " + value.getClass().getName() + ": " + value);
        }
    }

    private static boolean isStringCollection(Object value) {
        if (!(value instanceof Collection)) {
            return false;
        }
        Collection<?> elements = (Collection<?>) value;
        return !elements.isEmpty() && elements.stream().allMatch(e -> e instanceof CharSequence);
    }

    /**
     * @return the elements of a collection or of an array (of objects or primitives) or null if the value is neither.
     */
    public static List<Object> asList(Object value) {
        if (value instanceof Collection) {
            return ImmutableList.copyOf((Collection<?>) value);
        } else if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return elements;
        } else {
            return null;
        }
    }

    /**
     * Convert a job node to plain java values: keyed groups become ordered maps, ordered groups and
     * string arrays become lists and scalars are returned as they are.
     */
    public static Object toObject(JobNode node) {
        return node.accept(new JobNodeVisitor<Object>() {
            @Override
            public Object visitScalar(ScalarNode node) {
                return node.getValue();
            }

            @Override
            public Object visitOrderedGroup(OrderedGroupNode node) {
                return node.getElements().stream()
                        .map(JobNodes::toObject)
                        .collect(Collectors.toList());
            }

            @Override
            public Object visitKeyedGroup(KeyedGroupNode node) {
                Map<String, Object> fields = new LinkedHashMap<>();
                node.getFields().forEach((k, v) -> fields.put(k, toObject(v)));
                return fields;
            }

            @Override
            public Object visitStringArray(StringArrayNode node) {
                return new ArrayList<>(node.getValues());
            }
        });
    }
}
