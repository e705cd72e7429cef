package io.covenantc.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.covenantc.core.config.CompilerConfig;
import io.covenantc.core.error.ArgumentCoercionException;
import io.covenantc.core.error.ContractCompilationException;
import io.covenantc.core.error.EmptyRequiredBranchException;
import io.covenantc.core.error.InclusionConflictException;
import io.covenantc.core.error.ProductionFailureException;
import io.covenantc.core.model.CompiledContract;
import io.covenantc.core.model.ConditionalCompileType;
import io.covenantc.core.model.ContractType;
import io.covenantc.core.model.FinishOrFunc;
import io.covenantc.core.model.Guard;
import io.covenantc.core.model.GuardedTemplate;
import io.covenantc.core.model.ThenFunc;
import io.covenantc.core.schema.ArgumentCoercers;
import io.covenantc.core.spi.TxTemplate;
import io.covenantc.core.testkit.CountingClauseFunction;
import io.covenantc.core.testkit.TestClause;
import io.covenantc.core.testkit.TestContracts;
import io.covenantc.core.testkit.TestTemplate;
import io.covenantc.core.testkit.Vault;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

/** Tests for {@link ContractCompiler}: inclusion verdicts, pruning, aggregation and guard caching. */
class ContractCompilerTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final ContractCompiler compiler = new ContractCompiler();
    private final Vault vault = Vault.of("alice", 1_000);

    private static ThenFunc<Vault> then(String name, ConditionalCompileType verdict, String... templates) {
        return ThenFunc.<Vault>builder(name)
                .conditionalCompileIf(TestContracts.verdict(verdict))
                .producer((v, ctx) -> TestTemplate.stream(templates))
                .build();
    }

    private static ThenFunc<Vault> throwing(String name, ConditionalCompileType verdict) {
        return ThenFunc.<Vault>builder(name)
                .conditionalCompileIf(TestContracts.verdict(verdict))
                .producer((v, ctx) -> {
                    throw new IllegalStateException("oracle unreachable");
                })
                .build();
    }

    @SafeVarargs
    private static ContractType<Vault, JsonNode> contract(ThenFunc<Vault>... branches) {
        ContractType.Builder<Vault, JsonNode> builder = ContractType.builder("Test");
        for (ThenFunc<Vault> branch : branches) {
            builder.then(branch);
        }
        return builder.build();
    }

    private static List<String> ids(CompiledContract compiled) {
        List<String> ids = new ArrayList<>();
        compiled.guardedTemplates().forEach(g -> ids.add(g.template().id()));
        return ids;
    }

    @Nested
    class VaultContract {

        @Test
        void compilesThenBranchesAndPrunesWithdrawWithoutArguments() {
            CompiledContract compiled = compiler.compile(TestContracts.vault(), vault, TestContracts.CONTEXT);

            assertThat(compiled.contract()).isEqualTo("Vault");
            assertThat(compiled.path()).isEqualTo("/");
            assertThat(ids(compiled)).containsExactly("spend-all", "recover-half", "recover-all");
            assertThat(compiled.pruned()).containsExactly("withdraw");
            assertThat(compiled.excluded()).isEmpty();
            assertThat(compiled.templateCount()).isEqualTo(3);
        }

        @Test
        void withdrawIncludedWithValidArguments() throws Exception {
            JsonNode args = JSON.readTree("{\"to\": \"bob\", \"amount\": 250}");

            CompiledContract compiled = compiler.compile(TestContracts.vault(), vault, TestContracts.CONTEXT, args);

            assertThat(ids(compiled)).containsExactly("spend-all", "recover-half", "recover-all", "withdraw-bob");
            assertThat(compiled.branch("withdraw").verdict()).isEqualTo(ConditionalCompileType.SKIPPABLE);
            assertThat(compiled.pruned()).isEmpty();
        }

        @Test
        void frozenVaultExcludesRecovery() {
            CompiledContract compiled =
                    compiler.compile(TestContracts.vault(), vault.frozen(), TestContracts.CONTEXT);

            assertThat(compiled.excluded()).containsExactly("recover");
            assertThat(compiled.branch("recover")).isNull();
            assertThat(ids(compiled)).containsExactly("spend-all");
        }

        @Test
        void templatesCarryTheirBranchClauses() {
            CompiledContract compiled = compiler.compile(TestContracts.vault(), vault, TestContracts.CONTEXT);

            GuardedTemplate spend = compiled.guardedTemplates().get(0);
            assertThat(spend.branch()).isEqualTo("spend");
            assertThat(spend.conditions()).containsExactly(TestClause.of("sig(alice)"));
            assertThat(compiled.branch("recover").conditions()).containsExactly(TestClause.of("sig(alice-recovery)"));
        }
    }

    @Nested
    class Verdicts {

        @Test
        void failVerdictRaisesItsReasonsAndReturnsNoTemplates() {
            ContractType<Vault, JsonNode> type = contract(
                    then("ok", ConditionalCompileType.NO_CONSTRAINT, "t1"),
                    then("bad", ConditionalCompileType.fail("x incompatible"), "t2"));

            ContractCompilationException e = catchThrowableOfType(
                    () -> compiler.compile(type, vault, TestContracts.CONTEXT), ContractCompilationException.class);

            assertThat(e.reasons()).containsExactly("x incompatible");
            assertThat(e.contract()).isEqualTo("Test");
            assertThat(e.failures()).singleElement().isInstanceOf(InclusionConflictException.class);
            assertThat(e.failures().get(0).branch()).isEqualTo("bad");
        }

        @Test
        void failVerdictWithoutReasonsStillReportsOne() {
            ContractCompilationException e = catchThrowableOfType(
                    () -> compiler.compile(contract(then("bad", ConditionalCompileType.fail())), vault, TestContracts.CONTEXT),
                    ContractCompilationException.class);

            assertThat(e.reasons()).containsExactly(InclusionConflictException.UNSPECIFIED_REASON);
            assertThat(e.getMessage()).doesNotEndWith("failed: ");
        }

        @Test
        void neverAndRequiredOnOneBranchFails() {
            ThenFunc<Vault> conflicted = ThenFunc.<Vault>builder("conflicted")
                    .conditionalCompileIf(TestContracts.verdict(ConditionalCompileType.REQUIRED))
                    .conditionalCompileIf(TestContracts.verdict(ConditionalCompileType.NEVER))
                    .producer((v, ctx) -> TestTemplate.stream("t"))
                    .build();

            assertThatThrownBy(() -> compiler.compile(contract(conflicted), vault, TestContracts.CONTEXT))
                    .isInstanceOf(ContractCompilationException.class)
                    .satisfies(e -> assertThat(((ContractCompilationException) e).reasons())
                            .containsExactly(ConditionalCompileType.NEVER_REQUIRED_CONFLICT));
        }

        @Test
        void neverBranchIsNeverCalled() {
            AtomicInteger calls = new AtomicInteger();
            ThenFunc<Vault> never = ThenFunc.<Vault>builder("never")
                    .guard(Guard.fresh("g", (v, ctx) -> {
                        calls.incrementAndGet();
                        return TestClause.of("g");
                    }))
                    .conditionalCompileIf(TestContracts.verdict(ConditionalCompileType.NEVER))
                    .producer((v, ctx) -> {
                        calls.incrementAndGet();
                        return TestTemplate.stream("t");
                    })
                    .build();

            CompiledContract compiled = compiler.compile(contract(never), vault, TestContracts.CONTEXT);

            assertThat(compiled.excluded()).containsExactly("never");
            assertThat(calls).hasValue(0);
        }

        @Test
        void nullableEmptyBranchIsPruned() {
            CompiledContract compiled = compiler.compile(
                    contract(then("empty", ConditionalCompileType.NULLABLE), then("ok", ConditionalCompileType.NO_CONSTRAINT, "t")),
                    vault,
                    TestContracts.CONTEXT);

            assertThat(compiled.pruned()).containsExactly("empty");
            assertThat(ids(compiled)).containsExactly("t");
        }

        @Test
        void noConstraintEmptyBranchIsPruned() {
            CompiledContract compiled =
                    compiler.compile(contract(then("empty", ConditionalCompileType.NO_CONSTRAINT)), vault, TestContracts.CONTEXT);

            assertThat(compiled.pruned()).containsExactly("empty");
            assertThat(compiled.branches()).isEmpty();
        }

        @Test
        void requiredEmptyBranchFails() {
            ContractCompilationException e = catchThrowableOfType(
                    () -> compiler.compile(contract(then("must", ConditionalCompileType.REQUIRED)), vault, TestContracts.CONTEXT),
                    ContractCompilationException.class);

            assertThat(e.failures()).singleElement().isInstanceOf(EmptyRequiredBranchException.class);
        }

        @Test
        void skippableAndNullableProductionErrorsArePruned() {
            CompiledContract compiled = compiler.compile(
                    contract(
                            throwing("skip", ConditionalCompileType.SKIPPABLE),
                            throwing("null", ConditionalCompileType.NULLABLE),
                            then("ok", ConditionalCompileType.NO_CONSTRAINT, "t")),
                    vault,
                    TestContracts.CONTEXT);

            assertThat(compiled.pruned()).containsExactly("skip", "null");
            assertThat(ids(compiled)).containsExactly("t");
        }

        @Test
        void productionErrorWithoutConstraintIsFatal() {
            ContractCompilationException e = catchThrowableOfType(
                    () -> compiler.compile(contract(throwing("risky", ConditionalCompileType.NO_CONSTRAINT)), vault, TestContracts.CONTEXT),
                    ContractCompilationException.class);

            assertThat(e.failures()).singleElement().isInstanceOf(ProductionFailureException.class);
            assertThat(e.getCause()).hasRootCauseInstanceOf(IllegalStateException.class);
            assertThat(e.reasons().get(0)).contains("risky").contains("oracle unreachable");
        }

        @Test
        void throwingRuleBecomesFailReason() {
            ThenFunc<Vault> branch = ThenFunc.<Vault>builder("flaky")
                    .conditionalCompileIf((v, ctx) -> {
                        throw new IllegalArgumentException("bad state");
                    })
                    .producer((v, ctx) -> TestTemplate.stream("t"))
                    .build();

            ContractCompilationException e = catchThrowableOfType(
                    () -> compiler.compile(contract(branch), vault, TestContracts.CONTEXT), ContractCompilationException.class);

            assertThat(e.reasons()).containsExactly("Conditional compile rule of branch 'flaky' threw: bad state");
        }

        @Test
        void nullStreamAndNullTemplateAreProductionFailures() {
            ThenFunc<Vault> nullStream = ThenFunc.<Vault>builder("nullStream").producer((v, ctx) -> null).build();
            ThenFunc<Vault> nullTemplate = ThenFunc.<Vault>builder("nullTemplate")
                    .producer((v, ctx) -> Stream.of(TestTemplate.of("a"), (TxTemplate) null))
                    .build();

            assertThatThrownBy(() -> compiler.compile(contract(nullStream), vault, TestContracts.CONTEXT))
                    .isInstanceOf(ContractCompilationException.class)
                    .hasMessageContaining("returned no template stream");
            assertThatThrownBy(() -> compiler.compile(contract(nullTemplate), vault, TestContracts.CONTEXT))
                    .isInstanceOf(ContractCompilationException.class)
                    .hasMessageContaining("produced a null template");
        }
    }

    @Nested
    class Arguments {

        private ContractType<Vault, JsonNode> withdrawUnder(ConditionalCompileType verdict) {
            return ContractType.<Vault, JsonNode>builder("Withdrawals")
                    .finishOr(FinishOrFunc.<Vault, JsonNode, TestContracts.Withdraw>builder(
                                    "withdraw",
                                    ArgumentCoercers.json(TestContracts.Withdraw.class),
                                    (v, ctx, w) -> TestTemplate.stream("withdraw-" + w.to()))
                            .conditionalCompileIf(TestContracts.verdict(verdict))
                            .build())
                    .build();
        }

        @Test
        void skippableCoercionFailureIsOmitted() throws Exception {
            JsonNode wrong = JSON.readTree("{\"recipient\": \"bob\"}");

            CompiledContract compiled = compiler.compile(
                    withdrawUnder(ConditionalCompileType.SKIPPABLE), vault, TestContracts.CONTEXT, wrong);

            assertThat(compiled.branches()).isEmpty();
            assertThat(compiled.pruned()).containsExactly("withdraw");
        }

        @Test
        void requiredCoercionFailureIsFatal() throws Exception {
            JsonNode wrong = JSON.readTree("{\"recipient\": \"bob\"}");

            ContractCompilationException e = catchThrowableOfType(
                    () -> compiler.compile(withdrawUnder(ConditionalCompileType.REQUIRED), vault, TestContracts.CONTEXT, wrong),
                    ContractCompilationException.class);

            assertThat(e.failures()).singleElement().isInstanceOf(ArgumentCoercionException.class);
            assertThat(e.failures().get(0).branch()).isEqualTo("withdraw");
        }

        @Test
        void defaultArgumentsUsedWhenNoneSupplied() {
            ContractType<Vault, JsonNode> type = ContractType.<Vault, JsonNode>builder("Defaults")
                    .finishOr(FinishOrFunc.<Vault, JsonNode, TestContracts.Withdraw>builder(
                                    "withdraw",
                                    ArgumentCoercers.json(TestContracts.Withdraw.class),
                                    (v, ctx, w) -> TestTemplate.stream("withdraw-" + w.to()))
                            .build())
                    .defaultArguments(() -> JSON.createObjectNode().put("to", "self").put("amount", 0))
                    .build();

            assertThat(ids(compiler.compile(type, vault, TestContracts.CONTEXT))).containsExactly("withdraw-self");
        }
    }

    @Nested
    class Aggregation {

        @Test
        void laterBranchesOnlyScreenedAfterFirstFailure() {
            AtomicInteger laterCalls = new AtomicInteger();
            ThenFunc<Vault> later = ThenFunc.<Vault>builder("later")
                    .guard(Guard.fresh("g", (v, ctx) -> {
                        laterCalls.incrementAndGet();
                        return TestClause.of("g");
                    }))
                    .producer((v, ctx) -> {
                        laterCalls.incrementAndGet();
                        return TestTemplate.stream("t");
                    })
                    .build();
            ContractType<Vault, JsonNode> type = contract(
                    then("first", ConditionalCompileType.fail("first broken")),
                    later,
                    then("third", ConditionalCompileType.fail("third broken"), "t3"));

            ContractCompilationException e = catchThrowableOfType(
                    () -> compiler.compile(type, vault, TestContracts.CONTEXT), ContractCompilationException.class);

            assertThat(e.reasons()).containsExactly("first broken", "third broken");
            assertThat(e.failures()).extracting(f -> f.branch()).containsExactly("first", "third");
            assertThat(e.getSuppressed()).hasSize(1);
            assertThat(laterCalls).hasValue(0);
        }
    }

    @Nested
    class Sessions {

        @Test
        void cachedGuardEvaluatedOnceAcrossCompilationsInOneSession() {
            CountingClauseFunction<Vault> cached = CountingClauseFunction.returning("sig(recovery)");
            CountingClauseFunction<Vault> fresh = CountingClauseFunction.returning("after(144)");
            ThenFunc<Vault> branch = ThenFunc.<Vault>builder("recover")
                    .guard(Guard.cache("recovery", cached))
                    .guard(Guard.fresh("timelock", fresh))
                    .producer((v, ctx) -> TestTemplate.stream("t"))
                    .build();
            ContractType<Vault, JsonNode> type = contract(branch);
            CompilationSession session = compiler.newSession();

            CompiledContract first = compiler.compile(session, type, vault, TestContracts.CONTEXT, null);
            CompiledContract second = compiler.compile(session, type, vault, TestContracts.CONTEXT, null);

            assertThat(cached.calls()).isEqualTo(1);
            assertThat(fresh.calls()).isEqualTo(2);
            assertThat(second.branch("recover").conditions().get(0))
                    .isSameAs(first.branch("recover").conditions().get(0));
        }

        @Test
        void separateCompilationsUseSeparateSessions() {
            CountingClauseFunction<Vault> cached = CountingClauseFunction.returning("sig(recovery)");
            ContractType<Vault, JsonNode> type = contract(ThenFunc.<Vault>builder("recover")
                    .guard(Guard.cache("recovery", cached))
                    .producer((v, ctx) -> TestTemplate.stream("t"))
                    .build());

            compiler.compile(type, vault, TestContracts.CONTEXT);
            compiler.compile(type, vault, TestContracts.CONTEXT);

            assertThat(cached.calls()).isEqualTo(2);
        }

        @Test
        void guardSharedByBranchesEvaluatedOnceWhenCached() {
            CountingClauseFunction<Vault> fn = CountingClauseFunction.returning("sig(alice)");
            Guard<Vault> shared = Guard.cache("owner", fn);
            ContractType<Vault, JsonNode> type = contract(
                    ThenFunc.<Vault>builder("a").guard(shared).producer((v, ctx) -> TestTemplate.stream("a")).build(),
                    ThenFunc.<Vault>builder("b").guard(shared).producer((v, ctx) -> TestTemplate.stream("b")).build());

            compiler.compile(type, vault, TestContracts.CONTEXT);

            assertThat(fn.calls()).isEqualTo(1);
        }

        @Test
        void throwingGuardPrunesSkippableBranch() {
            ThenFunc<Vault> branch = ThenFunc.<Vault>builder("lookup")
                    .guard(Guard.fresh("remote", (v, ctx) -> {
                        throw new IllegalStateException("timeout");
                    }))
                    .conditionalCompileIf(TestContracts.verdict(ConditionalCompileType.SKIPPABLE))
                    .producer((v, ctx) -> TestTemplate.stream("t"))
                    .build();

            assertThat(compiler.compile(contract(branch), vault, TestContracts.CONTEXT).pruned())
                    .containsExactly("lookup");
        }
    }

    @Test
    void contextPathRecordedAndMdcCleared() {
        CompiledContract compiled =
                compiler.compile(TestContracts.vault(), vault, TestContracts.CONTEXT.derive("vault"));

        assertThat(compiled.path()).isEqualTo("/vault");
        assertThat(MDC.get(ContractCompiler.MDC_CONTRACT_PATH)).isNull();
    }

    @Test
    void mdcClearedAfterFailure() {
        assertThatThrownBy(() -> compiler.compile(
                        contract(then("bad", ConditionalCompileType.fail("no"))), vault, TestContracts.CONTEXT))
                .isInstanceOf(ContractCompilationException.class);
        assertThat(MDC.get(ContractCompiler.MDC_CONTRACT_PATH)).isNull();
    }

    @Test
    void fromConfigAppliesBudget() {
        ContractCompiler limited = ContractCompiler.fromConfig(
                CompilerConfig.builder().maxTemplatesPerBranch(1).build());

        assertThatThrownBy(() -> limited.compile(TestContracts.vault(), vault, TestContracts.CONTEXT))
                .isInstanceOf(ContractCompilationException.class)
                .hasMessageContaining("exceeded template budget");
    }
}
