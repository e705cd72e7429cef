package io.covenantc.core.spi;

/**
 * A transaction template produced by a branch. The compiler never inspects the payload; it only
 * pairs each template with the clauses guarding the branch that produced it.
 */
public interface TxTemplate {

    /** Identifier of the template, unique within one compiled contract. Used for logging only. */
    String id();
}
