package io.covenantc.core.error;

import java.util.List;

/**
 * Abstract parent for failures scoped to a single branch. Whether such a failure is fatal depends
 * on the branch's inclusion verdict: under {@code SKIPPABLE} or {@code NULLABLE} the compiler
 * drops the branch, otherwise the failure is collected into a {@link ContractCompilationException}.
 */
public abstract class BranchCompilationException extends CompilationException {

    private static final long serialVersionUID = 1L;

    private final String branch;

    protected BranchCompilationException(String message, String branch) {
        super(message, null, Phase.RESOLUTION);
        this.branch = branch;
    }

    protected BranchCompilationException(String message, Throwable cause, String branch) {
        super(message, cause, null, Phase.RESOLUTION);
        this.branch = branch;
    }

    protected BranchCompilationException(String message, List<String> reasons, String branch) {
        super(message, reasons, Phase.RESOLUTION);
        this.branch = branch;
    }

    /** Name of the branch that failed, or {@code null} if raised outside a branch. */
    public String branch() {
        return branch;
    }
}
