package io.covenantc.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.covenantc.core.spi.TxTemplate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Uniform calling convention for branches. Hides the branch-specific argument type behind the
 * contract-wide stateful argument type {@code A}, so that branches with different argument types
 * can live in one ordered collection and be resolved by one loop.
 *
 * @param <C> the contract instance type
 * @param <A> the contract-wide stateful argument type
 */
public interface CallableAsFoF<C, A> {

    /**
     * Coerces {@code arguments} to the branch's own argument type, then invokes its production
     * function.
     *
     * @return a lazy, single-use stream of templates
     * @throws io.covenantc.core.error.ArgumentCoercionException if the arguments cannot be coerced
     * @throws io.covenantc.core.error.ProductionFailureException if production fails up front
     */
    Stream<TxTemplate> call(C self, CompilationContext context, A arguments);

    /** The branch's conditional-compile-if rules, in declared order. */
    List<ConditionallyCompileIf<C>> conditionalCompileIfs();

    /** The branch's guards, in declared order. */
    List<Guard<C>> guards();

    /** The branch name, unique within its contract type. */
    String name();

    /**
     * JSON Schema describing the branch-specific argument type, for callers deciding what
     * arguments to send. Descriptive only unless the compiler runs in strict schema mode.
     */
    Optional<JsonNode> schema();
}
