package org.janelia.spmjobs.spmservices;

import com.google.common.collect.ImmutableList;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Looks up operations by their SPM name or by one of their aliases.
 */
@ApplicationScoped
public class SpmOperationRegistry {

    private final List<SpmOperation> operations;

    @Inject
    public SpmOperationRegistry(@Any Instance<SpmOperation> operationSource) {
        this((Iterable<SpmOperation>) operationSource);
    }

    public SpmOperationRegistry(Iterable<SpmOperation> operations) {
        this.operations = ImmutableList.copyOf(operations);
    }

    public Optional<SpmOperation> findOperation(String operationName) {
        return operations.stream()
                .filter(op -> op.getName().equalsIgnoreCase(operationName)
                        || op.getAliases().stream().anyMatch(alias -> alias.equalsIgnoreCase(operationName)))
                .findFirst();
    }

    public SpmOperation getOperation(String operationName) {
        return findOperation(operationName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown operation " + operationName + " - supported operations: " + getOperationNames()));
    }

    public List<SpmOperation> getOperations() {
        return operations;
    }

    public List<String> getOperationNames() {
        return operations.stream().map(SpmOperation::getName).collect(Collectors.toList());
    }
}
