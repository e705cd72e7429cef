package io.covenantc.core.error;

/**
 * Thrown when a branch's guard or production function fails, either up front or while its
 * template stream is being consumed, or when the branch exceeds the template budget.
 */
public final class ProductionFailureException extends BranchCompilationException {

    private static final long serialVersionUID = 1L;

    public ProductionFailureException(String message, String branch) {
        super(message, branch);
    }

    public ProductionFailureException(String message, Throwable cause, String branch) {
        super(message, cause, branch);
    }
}
