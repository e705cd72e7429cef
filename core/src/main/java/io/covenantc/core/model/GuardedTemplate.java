package io.covenantc.core.model;

import io.covenantc.core.spi.Clause;
import io.covenantc.core.spi.TxTemplate;
import java.util.List;

/**
 * A template paired with the clauses that must all hold before it may execute.
 *
 * @param branch     name of the branch that produced the template
 * @param conditions guard clauses of that branch, in guard order
 * @param template   the template
 */
public record GuardedTemplate(String branch, List<Clause> conditions, TxTemplate template) {

    /** Canonical constructor with defensive copy. */
    public GuardedTemplate {
        conditions = List.copyOf(conditions);
    }
}
