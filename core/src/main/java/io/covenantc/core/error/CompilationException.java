package io.covenantc.core.error;

import java.util.List;

/**
 * Abstract base for all contract compilation exceptions. Never thrown directly; use the concrete
 * subclasses under {@link BranchCompilationException}, {@link ContractCompilationException} or
 * {@link DeclarationException}.
 */
public abstract class CompilationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        DECLARATION,
        RESOLUTION
    }

    private final Phase phase;
    private final List<String> reasons;

    protected CompilationException(String message, List<String> reasons, Phase phase) {
        super(message);
        this.reasons = reasons != null ? List.copyOf(reasons) : List.of(message);
        this.phase = phase;
    }

    protected CompilationException(String message, Throwable cause, List<String> reasons, Phase phase) {
        super(message, cause);
        this.reasons = reasons != null ? List.copyOf(reasons) : List.of(message);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** Ordered, human-readable reasons. Never empty; a single-reason error carries its message. */
    public List<String> reasons() {
        return reasons;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
