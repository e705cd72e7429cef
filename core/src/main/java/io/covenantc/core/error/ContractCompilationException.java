package io.covenantc.core.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Terminal failure of one contract instance's compilation. Aggregates every fatal branch failure
 * in branch declaration order; {@link #reasons()} is the flattened reason list in that same order.
 * No templates are returned alongside this exception.
 */
public final class ContractCompilationException extends CompilationException {

    private static final long serialVersionUID = 1L;

    private final String contract;
    private final transient List<BranchCompilationException> failures;

    public ContractCompilationException(String contract, List<BranchCompilationException> failures) {
        super(
                buildMessage(contract, failures),
                failures.isEmpty() ? null : failures.get(0),
                flatten(failures),
                Phase.RESOLUTION);
        this.contract = contract;
        this.failures = List.copyOf(failures);
        failures.stream().skip(1).forEach(this::addSuppressed);
    }

    /** Name of the contract type whose instance failed to compile. */
    public String contract() {
        return contract;
    }

    /** The fatal branch failures, in branch declaration order. */
    public List<BranchCompilationException> failures() {
        return failures;
    }

    private static List<String> flatten(List<BranchCompilationException> failures) {
        return failures.stream().flatMap(f -> f.reasons().stream()).collect(Collectors.toList());
    }

    private static String buildMessage(String contract, List<BranchCompilationException> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("failures must not be empty");
        }
        return "Compilation of contract '" + contract + "' failed: "
                + failures.stream().flatMap(f -> f.reasons().stream()).collect(Collectors.joining("; "));
    }
}
