package io.covenantc.core.model;

/**
 * Rule producing an inclusion verdict for a branch. Kept separate from the branch's production
 * function so that a branch can be analysed without running it.
 *
 * <p>Implementations MUST NOT mutate the contract instance. They are re-evaluated on every
 * compilation.
 *
 * @param <C> the contract instance type
 */
@FunctionalInterface
public interface ConditionallyCompileIf<C> {

    /**
     * Computes the verdict for the given instance.
     *
     * @param self    the contract instance, read-only
     * @param context the compilation context
     * @return the verdict, never null
     */
    ConditionalCompileType evaluate(C self, CompilationContext context);

    /** A rule that always yields the given verdict. */
    static <C> ConditionallyCompileIf<C> always(ConditionalCompileType verdict) {
        return (self, context) -> verdict;
    }
}
