package io.covenantc.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import io.covenantc.core.error.DeclarationException;
import io.covenantc.core.schema.ArgumentSchemas;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Declaration of a contract type: its name, its branches and the default stateful arguments used
 * when the caller supplies none.
 *
 * <p>
 * Built once per contract type and shared by every instance and every compilation. Thread-safe:
 * all fields are final and collections are unmodifiable.
 *
 * @param <C> the contract instance type
 * @param <A> the contract-wide stateful argument type
 */
public final class ContractType<C, A> {

    private final String name;
    private final List<ThenFunc<C>> thenFns;
    private final List<CallableAsFoF<C, A>> finishOrFns;
    private final List<CallableAsFoF<C, A>> branches;
    private final Supplier<A> defaultArguments;
    private final Map<String, JsonSchema> compiledSchemas;

    private ContractType(
            String name,
            List<ThenFunc<C>> thenFns,
            List<CallableAsFoF<C, A>> finishOrFns,
            Supplier<A> defaults,
            Map<String, JsonSchema> compiledSchemas) {
        this.name = name;
        this.thenFns = List.copyOf(thenFns);
        this.finishOrFns = List.copyOf(finishOrFns);
        List<CallableAsFoF<C, A>> all = new ArrayList<>(thenFns.size() + finishOrFns.size());
        for (ThenFunc<C> then : thenFns) {
            all.add(then.asCallable());
        }
        all.addAll(finishOrFns);
        this.branches = Collections.unmodifiableList(all);
        this.defaultArguments = defaults;
        this.compiledSchemas = Map.copyOf(compiledSchemas);
    }

    /**
     * Returns a new {@link Builder}.
     *
     * @param name the contract type name
     */
    public static <C, A> Builder<C, A> builder(String name) {
        return new Builder<>(name);
    }

    public String name() {
        return name;
    }

    /** The argument-less branches, in declared order. */
    public List<ThenFunc<C>> thenFns() {
        return thenFns;
    }

    /** The argument-taking branches, in declared order. */
    public List<CallableAsFoF<C, A>> finishOrFns() {
        return finishOrFns;
    }

    /**
     * Every branch behind the uniform calling convention, in resolution order: then-branches
     * first, then finish-or branches, each group in declared order.
     */
    public List<CallableAsFoF<C, A>> branches() {
        return branches;
    }

    /** Looks up a branch by name. */
    public Optional<CallableAsFoF<C, A>> branch(String branchName) {
        return branches.stream().filter(b -> b.name().equals(branchName)).findFirst();
    }

    /** Published argument schemas keyed by branch name, in resolution order. */
    public Map<String, JsonNode> schemas() {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        for (CallableAsFoF<C, A> branch : branches) {
            branch.schema().ifPresent(s -> out.put(branch.name(), s));
        }
        return Collections.unmodifiableMap(out);
    }

    /** The compiled argument schema of a branch, checked and compiled once at declaration. */
    public Optional<JsonSchema> compiledSchema(String branchName) {
        return Optional.ofNullable(compiledSchemas.get(branchName));
    }

    /** Default stateful arguments, or {@code null} when the type declares none. */
    public A defaultArguments() {
        return defaultArguments != null ? defaultArguments.get() : null;
    }

    @Override
    public String toString() {
        return "ContractType[" + name + ", branches=" + branches.size() + "]";
    }

    /**
     * Builder for {@link ContractType}. {@link #build()} rejects blank or duplicate branch names
     * and malformed argument schemas with a {@link DeclarationException}.
     */
    public static final class Builder<C, A> {

        private final String name;
        private final List<ThenFunc<C>> thenFns = new ArrayList<>();
        private final List<CallableAsFoF<C, A>> finishOrFns = new ArrayList<>();
        private Supplier<A> defaultArguments;

        private Builder(String name) {
            this.name = name;
        }

        public Builder<C, A> then(ThenFunc<C> branch) {
            thenFns.add(Objects.requireNonNull(branch, "branch must not be null"));
            return this;
        }

        public Builder<C, A> finishOr(CallableAsFoF<C, A> branch) {
            finishOrFns.add(Objects.requireNonNull(branch, "branch must not be null"));
            return this;
        }

        public Builder<C, A> defaultArguments(Supplier<A> defaults) {
            this.defaultArguments = defaults;
            return this;
        }

        public ContractType<C, A> build() {
            if (name == null || name.isBlank()) {
                throw new DeclarationException("Contract type name must not be null or blank", name);
            }
            Set<String> seen = new HashSet<>();
            List<String> names = new ArrayList<>();
            thenFns.forEach(t -> names.add(t.name()));
            finishOrFns.forEach(f -> names.add(f.name()));
            for (String branchName : names) {
                if (branchName == null || branchName.isBlank()) {
                    throw new DeclarationException("Branch name must not be null or blank", name);
                }
                if (!seen.add(branchName)) {
                    throw new DeclarationException("Duplicate branch name '" + branchName + "'", name);
                }
            }
            Map<String, JsonSchema> compiled = new HashMap<>();
            for (CallableAsFoF<C, A> branch : finishOrFns) {
                branch.schema()
                        .ifPresent(s -> compiled.put(branch.name(), ArgumentSchemas.compile(s, branch.name(), name)));
            }
            return new ContractType<>(name, thenFns, finishOrFns, defaultArguments, compiled);
        }
    }
}
