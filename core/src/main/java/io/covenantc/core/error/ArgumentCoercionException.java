package io.covenantc.core.error;

/** Thrown when a branch cannot coerce the caller's stateful arguments into its own argument type. */
public final class ArgumentCoercionException extends BranchCompilationException {

    private static final long serialVersionUID = 1L;

    public ArgumentCoercionException(String message, String branch) {
        super(message, branch);
    }

    public ArgumentCoercionException(String message, Throwable cause, String branch) {
        super(message, cause, branch);
    }
}
