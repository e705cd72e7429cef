package io.covenantc.core.engine;

/**
 * Upper bound on the number of templates a single branch may produce. A branch exceeding it fails
 * with a production failure, so an unbounded template stream cannot stall compilation.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxTemplatesPerBranch maximum number of templates per branch (default: 1024)
 */
public record TemplateBudget(int maxTemplatesPerBranch) {

    /** Default budget: 1024 templates per branch. */
    public static final TemplateBudget DEFAULT = new TemplateBudget(1024);

    public TemplateBudget {
        if (maxTemplatesPerBranch <= 0) {
            throw new IllegalArgumentException(
                    "maxTemplatesPerBranch must be positive, got: " + maxTemplatesPerBranch);
        }
    }
}
