package org.janelia.spmjobs.jobspec;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Generates the MATLAB assignments that build a job structure.
 * <p>
 * Ordered groups are addressed as <code>prefix(i)</code> with i starting at 1, keyed group fields as
 * <code>prefix.field</code>, string arrays are written as cell array literals with one quoted string per line,
 * strings are quoted and any other scalar is written as is.
 * </p>
 */
public class JobScriptSerializer {

    private static final String ASSIGNMENT_END = ";\n";
    private static final String CONTINUATION = "...\n";

    public String serialize(String prefix, JobNode node) {
        return node.accept(new JobNodeVisitor<String>() {
            @Override
            public String visitScalar(ScalarNode node) {
                if (node.isString()) {
                    return prefix + " = " + quote((String) node.getValue()) + ASSIGNMENT_END;
                } else {
                    return prefix + " = " + formatValue(node.getValue()) + ASSIGNMENT_END;
                }
            }

            @Override
            public String visitOrderedGroup(OrderedGroupNode node) {
                return IntStream.range(0, node.size())
                        .mapToObj(i -> serialize(prefix + "(" + (i + 1) + ")", node.getElements().get(i)))
                        .collect(Collectors.joining());
            }

            @Override
            public String visitKeyedGroup(KeyedGroupNode node) {
                return node.getFields().entrySet().stream()
                        .map(field -> serialize(prefix + "." + field.getKey(), field.getValue()))
                        .collect(Collectors.joining());
            }

            @Override
            public String visitStringArray(StringArrayNode node) {
                StringBuilder assignmentBuilder = new StringBuilder();
                assignmentBuilder.append(prefix).append(" = {").append(CONTINUATION);
                node.getValues().forEach(v -> assignmentBuilder.append(quote(v)).append(';').append(CONTINUATION));
                assignmentBuilder.append('}').append(ASSIGNMENT_END);
                return assignmentBuilder.toString();
            }
        });
    }

    private static String formatValue(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double doubleValue = ((Number) value).doubleValue();
            if (Double.isNaN(doubleValue)) {
                return "NaN";
            } else if (Double.isInfinite(doubleValue)) {
                return doubleValue > 0 ? "Inf" : "-Inf";
            }
        }
        return value.toString();
    }

    public static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
