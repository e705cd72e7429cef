package io.covenantc.core.error;

/** Thrown when a {@code REQUIRED} branch produced neither templates nor an error. */
public final class EmptyRequiredBranchException extends BranchCompilationException {

    private static final long serialVersionUID = 1L;

    public EmptyRequiredBranchException(String branch) {
        super("Required branch '" + branch + "' produced no transaction templates", branch);
    }
}
