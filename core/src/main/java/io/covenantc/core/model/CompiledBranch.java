package io.covenantc.core.model;

import io.covenantc.core.spi.Clause;
import io.covenantc.core.spi.TxTemplate;
import java.util.List;
import java.util.Objects;

/**
 * A branch that made it into a compiled contract: its guard clauses (an implicit conjunction, in
 * guard order) and the templates it produced, in production order. Never empty.
 *
 * @param name       branch name
 * @param verdict    the folded inclusion verdict the branch was resolved under
 * @param conditions guard clauses, in declared guard order
 * @param templates  produced templates, at least one
 */
public record CompiledBranch(
        String name, ConditionalCompileType verdict, List<Clause> conditions, List<TxTemplate> templates) {

    /** Canonical constructor with defensive copies. */
    public CompiledBranch {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(verdict, "verdict must not be null");
        conditions = List.copyOf(conditions);
        templates = List.copyOf(templates);
        if (templates.isEmpty()) {
            throw new IllegalArgumentException("compiled branch '" + name + "' must carry at least one template");
        }
    }
}
