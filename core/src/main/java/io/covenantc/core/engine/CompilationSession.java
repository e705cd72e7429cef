package io.covenantc.core.engine;

import io.covenantc.core.model.CompilationContext;
import io.covenantc.core.model.Guard;
import io.covenantc.core.spi.Clause;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Scope of the guard memo. A {@link Guard.Policy#CACHE} guard is evaluated at most once per
 * (contract instance, guard) pair for the lifetime of a session; both keys are compared by
 * identity. {@link Guard.Policy#FRESH} guards bypass the memo.
 *
 * <p>
 * Not thread-safe: a session belongs to one compilation flow and is discarded when that flow
 * ends. Independent flows use independent sessions; nothing is shared between them.
 */
public final class CompilationSession {

    private final Map<Object, Map<Guard<?>, Clause>> memo = new IdentityHashMap<>();
    private int guardInvocations;

    /** Creates an empty session. Usually obtained from {@link ContractCompiler#newSession()}. */
    public CompilationSession() {}

    /**
     * Evaluates one guard for the given instance, honouring its caching policy.
     *
     * @param guard   the guard
     * @param self    the contract instance; the memo key for cached guards
     * @param context the compilation context
     * @return the clause, identical to the stored one for a cached guard already evaluated
     */
    public <C> Clause evaluate(Guard<C> guard, C self, CompilationContext context) {
        if (!guard.isCached()) {
            guardInvocations++;
            return guard.compute(self, context);
        }
        Map<Guard<?>, Clause> perInstance = memo.computeIfAbsent(self, k -> new IdentityHashMap<>());
        Clause cached = perInstance.get(guard);
        if (cached != null) {
            return cached;
        }
        guardInvocations++;
        Clause computed = guard.compute(self, context);
        perInstance.put(guard, computed);
        return computed;
    }

    /** Number of clauses currently memoized across all instances. */
    public int cachedClauseCount() {
        return memo.values().stream().mapToInt(Map::size).sum();
    }

    /** Number of times an underlying guard function has been invoked through this session. */
    public int guardInvocations() {
        return guardInvocations;
    }
}
