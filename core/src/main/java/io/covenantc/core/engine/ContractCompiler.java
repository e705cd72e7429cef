package io.covenantc.core.engine;

import io.covenantc.core.config.CompilerConfig;
import io.covenantc.core.error.BranchCompilationException;
import io.covenantc.core.error.ContractCompilationException;
import io.covenantc.core.model.CallableAsFoF;
import io.covenantc.core.model.CompilationContext;
import io.covenantc.core.model.CompiledBranch;
import io.covenantc.core.model.CompiledContract;
import io.covenantc.core.model.ContractType;
import io.covenantc.core.spi.CompilationListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Compiles contract instances into guarded transaction templates.
 *
 * <p>
 * For one instance, every branch of its {@link ContractType} is resolved in order through
 * {@link CallableAsFoF}: inclusion rules are folded, guards evaluated through the session memo,
 * arguments coerced and templates drained. Compilation either fully succeeds with every included
 * branch, or fails with a {@link ContractCompilationException} aggregating all fatal branch
 * failures in declaration order. After the first fatal failure no further guard or production
 * function runs; the remaining branches' inclusion rules are still folded so that every
 * {@code FAIL} verdict is reported.
 *
 * <p>
 * Thread-safe: the compiler is immutable. Each compilation flow uses its own
 * {@link CompilationSession}.
 */
public final class ContractCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ContractCompiler.class);

    /** MDC key carrying the path of the contract being compiled. */
    static final String MDC_CONTRACT_PATH = "contractPath";

    private final BranchResolver resolver;
    private final boolean logBranchOutcomes;
    private final CompilationListener listener;

    /** Creates a compiler with the default budget and lenient schema handling. */
    public ContractCompiler() {
        this(TemplateBudget.DEFAULT, SchemaValidationMode.LENIENT, true, null);
    }

    /**
     * Creates a compiler with a custom budget and schema mode.
     *
     * @param budget               per-branch template budget
     * @param schemaValidationMode STRICT or LENIENT
     */
    public ContractCompiler(TemplateBudget budget, SchemaValidationMode schemaValidationMode) {
        this(budget, schemaValidationMode, true, null);
    }

    /**
     * Creates a compiler with all options.
     *
     * @param budget               per-branch template budget
     * @param schemaValidationMode STRICT or LENIENT
     * @param logBranchOutcomes    log one DEBUG line per resolved branch
     * @param listener             optional compilation listener, may be null
     */
    public ContractCompiler(
            TemplateBudget budget,
            SchemaValidationMode schemaValidationMode,
            boolean logBranchOutcomes,
            CompilationListener listener) {
        this.resolver = new BranchResolver(
                Objects.requireNonNull(budget, "budget must not be null"),
                Objects.requireNonNull(schemaValidationMode, "schemaValidationMode must not be null"));
        this.logBranchOutcomes = logBranchOutcomes;
        this.listener = listener; // nullable
    }

    /** Creates a compiler from loaded configuration. */
    public static ContractCompiler fromConfig(CompilerConfig config) {
        return fromConfig(config, null);
    }

    /** Creates a compiler from loaded configuration with an optional listener. */
    public static ContractCompiler fromConfig(CompilerConfig config, CompilationListener listener) {
        Objects.requireNonNull(config, "config must not be null");
        return new ContractCompiler(
                new TemplateBudget(config.maxTemplatesPerBranch()),
                SchemaValidationMode.parse(config.schemaValidation()),
                config.logBranchOutcomes(),
                listener);
    }

    /** Opens a new session; cached guard clauses live as long as it does. */
    public CompilationSession newSession() {
        return new CompilationSession();
    }

    /**
     * Compiles an instance with the contract type's default stateful arguments, in a fresh session.
     *
     * @throws ContractCompilationException if any fatal branch failure occurs
     */
    public <C, A> CompiledContract compile(ContractType<C, A> type, C self, CompilationContext context) {
        Objects.requireNonNull(type, "type must not be null");
        return compile(newSession(), type, self, context, type.defaultArguments());
    }

    /**
     * Compiles an instance with the given stateful arguments, in a fresh session.
     *
     * @throws ContractCompilationException if any fatal branch failure occurs
     */
    public <C, A> CompiledContract compile(ContractType<C, A> type, C self, CompilationContext context, A arguments) {
        return compile(newSession(), type, self, context, arguments);
    }

    /**
     * Compiles an instance within an existing session, reusing clauses of cached guards already
     * evaluated for the same instance.
     *
     * @param session   the session owning the guard memo
     * @param type      the contract type declaring the branches
     * @param self      the contract instance, read-only
     * @param context   the compilation context
     * @param arguments stateful arguments passed to every argument-taking branch, may be null
     * @return the compiled contract
     * @throws ContractCompilationException if any fatal branch failure occurs
     */
    public <C, A> CompiledContract compile(
            CompilationSession session, ContractType<C, A> type, C self, CompilationContext context, A arguments) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(self, "self must not be null");
        Objects.requireNonNull(context, "context must not be null");

        MDC.put(MDC_CONTRACT_PATH, context.path());
        try {
            return compileInternal(session, type, self, context, arguments);
        } finally {
            MDC.remove(MDC_CONTRACT_PATH);
        }
    }

    private <C, A> CompiledContract compileInternal(
            CompilationSession session, ContractType<C, A> type, C self, CompilationContext context, A arguments) {
        long startNanos = System.nanoTime();
        List<CompiledBranch> included = new ArrayList<>();
        List<String> pruned = new ArrayList<>();
        List<String> excluded = new ArrayList<>();
        List<BranchCompilationException> failures = new ArrayList<>();

        for (CallableAsFoF<C, A> branch : type.branches()) {
            BranchOutcome outcome = failures.isEmpty()
                    ? resolver.resolve(branch, type.compiledSchema(branch.name()), self, context, arguments, session)
                    : resolver.screen(branch, self, context);
            logOutcome(type, outcome);
            switch (outcome.type()) {
                case INCLUDED -> {
                    included.add(outcome.compiled());
                    notifyBranchIncluded(type, context, outcome);
                }
                case PRUNED -> {
                    pruned.add(outcome.branch());
                    notifyBranchPruned(type, context, outcome);
                }
                case EXCLUDED -> {
                    excluded.add(outcome.branch());
                    notifyBranchExcluded(type, context, outcome);
                }
                case FAILED -> failures.add(outcome.failure());
                case SKIPPED -> {
                    // instance already failed
                }
            }
        }

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        if (!failures.isEmpty()) {
            ContractCompilationException error = new ContractCompilationException(type.name(), failures);
            LOG.warn(
                    "contract.failed contract={} path={} failures={} reasons={}",
                    type.name(),
                    context.path(),
                    failures.size(),
                    error.reasons());
            notifyCompilationFailed(type, context, error.reasons(), elapsedMs);
            throw error;
        }

        CompiledContract compiled = new CompiledContract(type.name(), context.path(), included, pruned, excluded);
        LOG.info(
                "contract.compiled contract={} path={} branches={} templates={} pruned={} excluded={} duration_ms={}",
                type.name(),
                context.path(),
                included.size(),
                compiled.templateCount(),
                pruned.size(),
                excluded.size(),
                elapsedMs);
        notifyCompilationCompleted(type, context, compiled, elapsedMs);
        return compiled;
    }

    private void logOutcome(ContractType<?, ?> type, BranchOutcome outcome) {
        if (!logBranchOutcomes || !LOG.isDebugEnabled()) {
            return;
        }
        if (outcome.failure() != null) {
            LOG.debug(
                    "branch.{} contract={} branch={} verdict={} error={}",
                    outcome.type().name().toLowerCase(Locale.ROOT),
                    type.name(),
                    outcome.branch(),
                    outcome.verdict(),
                    outcome.failure().getMessage());
        } else {
            LOG.debug(
                    "branch.{} contract={} branch={} verdict={}",
                    outcome.type().name().toLowerCase(Locale.ROOT),
                    type.name(),
                    outcome.branch(),
                    outcome.verdict());
        }
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged, never propagated.

    private void notifyBranchIncluded(ContractType<?, ?> type, CompilationContext context, BranchOutcome outcome) {
        if (listener == null) return;
        try {
            listener.onBranchIncluded(new CompilationListener.BranchIncludedEvent(
                    type.name(),
                    context.path(),
                    outcome.branch(),
                    outcome.verdict().kind(),
                    outcome.compiled().templates().size()));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onBranchIncluded failed", e);
        }
    }

    private void notifyBranchPruned(ContractType<?, ?> type, CompilationContext context, BranchOutcome outcome) {
        if (listener == null) return;
        try {
            listener.onBranchPruned(new CompilationListener.BranchPrunedEvent(
                    type.name(),
                    context.path(),
                    outcome.branch(),
                    outcome.verdict().kind(),
                    outcome.failure() != null ? outcome.failure().getMessage() : null));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onBranchPruned failed", e);
        }
    }

    private void notifyBranchExcluded(ContractType<?, ?> type, CompilationContext context, BranchOutcome outcome) {
        if (listener == null) return;
        try {
            listener.onBranchExcluded(
                    new CompilationListener.BranchExcludedEvent(type.name(), context.path(), outcome.branch()));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onBranchExcluded failed", e);
        }
    }

    private void notifyCompilationCompleted(
            ContractType<?, ?> type, CompilationContext context, CompiledContract compiled, long durationMs) {
        if (listener == null) return;
        try {
            listener.onCompilationCompleted(new CompilationListener.CompilationCompletedEvent(
                    type.name(), context.path(), compiled.branches().size(), compiled.templateCount(), durationMs));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onCompilationCompleted failed", e);
        }
    }

    private void notifyCompilationFailed(
            ContractType<?, ?> type, CompilationContext context, List<String> reasons, long durationMs) {
        if (listener == null) return;
        try {
            listener.onCompilationFailed(
                    new CompilationListener.CompilationFailedEvent(type.name(), context.path(), reasons, durationMs));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onCompilationFailed failed", e);
        }
    }
}
