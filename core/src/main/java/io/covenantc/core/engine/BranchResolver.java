package io.covenantc.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.networknt.schema.JsonSchema;
import io.covenantc.core.error.ArgumentCoercionException;
import io.covenantc.core.error.BranchCompilationException;
import io.covenantc.core.error.EmptyRequiredBranchException;
import io.covenantc.core.error.InclusionConflictException;
import io.covenantc.core.error.ProductionFailureException;
import io.covenantc.core.model.CallableAsFoF;
import io.covenantc.core.model.CompilationContext;
import io.covenantc.core.model.CompiledBranch;
import io.covenantc.core.model.ConditionalCompileType;
import io.covenantc.core.model.Guard;
import io.covenantc.core.schema.ArgumentCoercers;
import io.covenantc.core.schema.ArgumentSchemas;
import io.covenantc.core.spi.Clause;
import io.covenantc.core.spi.TxTemplate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Resolves a single branch of a contract instance: folds its inclusion rules, evaluates its guards
 * through the session memo, calls it with the stateful arguments and drains its template stream.
 *
 * <p>
 * Failures are classified against the folded verdict: recovered by pruning under
 * {@code SKIPPABLE}/{@code NULLABLE}, fatal otherwise. Stateless and thread-safe; the session
 * passed in is not.
 */
final class BranchResolver {

    private final TemplateBudget budget;
    private final SchemaValidationMode schemaValidationMode;

    BranchResolver(TemplateBudget budget, SchemaValidationMode schemaValidationMode) {
        this.budget = budget;
        this.schemaValidationMode = schemaValidationMode;
    }

    <C, A> BranchOutcome resolve(
            CallableAsFoF<C, A> branch,
            Optional<JsonSchema> schema,
            C self,
            CompilationContext context,
            A arguments,
            CompilationSession session) {
        String name = branch.name();
        ConditionalCompileType verdict = verdict(branch, self, context);
        if (verdict.isFail()) {
            return BranchOutcome.failed(name, verdict, new InclusionConflictException(verdict.reasons(), name));
        }
        if (verdict.isNever()) {
            return BranchOutcome.excluded(name);
        }

        List<Clause> conditions;
        List<TxTemplate> templates;
        try {
            conditions = evaluateGuards(branch, self, context, session);
            if (schemaValidationMode == SchemaValidationMode.STRICT) {
                enforceSchema(branch, schema, arguments);
            }
            templates = drain(branch, self, context, arguments);
        } catch (BranchCompilationException e) {
            return verdict.isPrunable()
                    ? BranchOutcome.pruned(name, verdict, e)
                    : BranchOutcome.failed(name, verdict, e);
        }

        if (templates.isEmpty()) {
            if (verdict.kind() == ConditionalCompileType.Kind.REQUIRED) {
                return BranchOutcome.failed(name, verdict, new EmptyRequiredBranchException(name));
            }
            return BranchOutcome.pruned(name, verdict, null);
        }
        return BranchOutcome.included(new CompiledBranch(name, verdict, conditions, templates));
    }

    /**
     * Folds the inclusion rules only. Used once the instance has already failed, so that every
     * {@code FAIL} verdict is reported without running guards or production functions.
     */
    <C, A> BranchOutcome screen(CallableAsFoF<C, A> branch, C self, CompilationContext context) {
        ConditionalCompileType verdict = verdict(branch, self, context);
        if (verdict.isFail()) {
            return BranchOutcome.failed(
                    branch.name(), verdict, new InclusionConflictException(verdict.reasons(), branch.name()));
        }
        return BranchOutcome.skipped(branch.name(), verdict);
    }

    private <C, A> ConditionalCompileType verdict(CallableAsFoF<C, A> branch, C self, CompilationContext context) {
        try {
            return ConditionalCompileType.fold(branch.conditionalCompileIfs(), self, context);
        } catch (RuntimeException e) {
            return ConditionalCompileType.fail(
                    "Conditional compile rule of branch '" + branch.name() + "' threw: " + e.getMessage());
        }
    }

    private <C, A> List<Clause> evaluateGuards(
            CallableAsFoF<C, A> branch, C self, CompilationContext context, CompilationSession session) {
        List<Clause> clauses = new ArrayList<>(branch.guards().size());
        for (Guard<C> guard : branch.guards()) {
            try {
                clauses.add(session.evaluate(guard, self, context));
            } catch (RuntimeException e) {
                throw new ProductionFailureException(
                        "Guard '" + guard.name() + "' of branch '" + branch.name() + "' failed: " + e.getMessage(),
                        e,
                        branch.name());
            }
        }
        return clauses;
    }

    private <C, A> void enforceSchema(CallableAsFoF<C, A> branch, Optional<JsonSchema> schema, A arguments) {
        if (schema.isEmpty()) {
            return;
        }
        List<String> violations;
        try {
            JsonNode tree;
            if (arguments == null) {
                tree = NullNode.getInstance();
            } else if (arguments instanceof JsonNode) {
                tree = (JsonNode) arguments;
            } else {
                tree = ArgumentCoercers.mapper().valueToTree(arguments);
            }
            violations = ArgumentSchemas.validate(schema.get(), tree);
        } catch (RuntimeException e) {
            throw new ArgumentCoercionException(
                    "Arguments of branch '" + branch.name() + "' cannot be checked against its schema: "
                            + e.getMessage(),
                    e,
                    branch.name());
        }
        if (!violations.isEmpty()) {
            throw new ArgumentCoercionException(
                    "Arguments violate schema of branch '" + branch.name() + "': " + String.join("; ", violations),
                    branch.name());
        }
    }

    private <C, A> List<TxTemplate> drain(CallableAsFoF<C, A> branch, C self, CompilationContext context, A arguments) {
        String name = branch.name();
        List<TxTemplate> templates = new ArrayList<>();
        try (Stream<TxTemplate> stream = branch.call(self, context, arguments)) {
            if (stream == null) {
                throw new ProductionFailureException("Branch '" + name + "' returned no template stream", name);
            }
            Iterator<TxTemplate> it = stream.iterator();
            while (it.hasNext()) {
                TxTemplate template = it.next();
                if (template == null) {
                    throw new ProductionFailureException("Branch '" + name + "' produced a null template", name);
                }
                if (templates.size() >= budget.maxTemplatesPerBranch()) {
                    throw new ProductionFailureException(
                            String.format(
                                    "Branch '%s' exceeded template budget: more than %d templates",
                                    name, budget.maxTemplatesPerBranch()),
                            name);
                }
                templates.add(template);
            }
        } catch (BranchCompilationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProductionFailureException(
                    "Branch '" + name + "' failed to produce templates: " + e.getMessage(), e, name);
        }
        return templates;
    }
}
