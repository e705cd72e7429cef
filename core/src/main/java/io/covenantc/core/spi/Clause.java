package io.covenantc.core.spi;

/**
 * An unlocking predicate produced by a {@link io.covenantc.core.model.Guard}. Opaque to the
 * compiler: clauses are collected per branch in guard order and treated as an implicit conjunction.
 * How clauses of different branches are composed into a script is up to the consumer of the
 * compiled contract.
 *
 * <p>Implementations SHOULD be immutable and implement {@code equals}/{@code hashCode} by value.
 */
public interface Clause {

    /** Short human-readable rendering, used in log lines and error messages. */
    String describe();
}
