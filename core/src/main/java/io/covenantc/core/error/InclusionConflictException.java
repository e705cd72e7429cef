package io.covenantc.core.error;

import java.util.List;

/**
 * Thrown when a branch's conditional-compile-if rules fold to {@code FAIL}, including the
 * synthesized {@code NEVER}/{@code REQUIRED} conflict. Always fatal for the contract instance.
 */
public final class InclusionConflictException extends BranchCompilationException {

    private static final long serialVersionUID = 1L;

    /** Reason reported for a {@code FAIL} verdict that carries none. */
    public static final String UNSPECIFIED_REASON = "conditional compilation failed without a reason";

    public InclusionConflictException(List<String> reasons, String branch) {
        this(branch, reasons == null || reasons.isEmpty() ? List.of(UNSPECIFIED_REASON) : reasons);
    }

    private InclusionConflictException(String branch, List<String> reasons) {
        super("Branch '" + branch + "' failed conditional compilation: " + String.join("; ", reasons), reasons, branch);
    }
}
