package io.covenantc.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.covenantc.core.spi.TxTemplate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A branch without arguments: a list of guards and a template generator. Every template returned
 * is permitted only if the conjunction of all guard clauses holds.
 *
 * <p>
 * Immutable. Declared once per contract type and shared by every instance.
 *
 * @param name                  branch name, unique within the contract type
 * @param guards                guards in declared order
 * @param conditionalCompileIfs inclusion rules in declared order
 * @param producer              generates the branch's templates
 * @param <C>                   the contract instance type
 */
public record ThenFunc<C>(
        String name,
        List<Guard<C>> guards,
        List<ConditionallyCompileIf<C>> conditionalCompileIfs,
        Producer<C> producer) {

    /**
     * Template generator of a {@link ThenFunc}. Should return as few templates as possible,
     * preferring to split alternatives across several branches.
     *
     * @param <C> the contract instance type
     */
    @FunctionalInterface
    public interface Producer<C> {
        Stream<TxTemplate> produce(C self, CompilationContext context);
    }

    /** Validates fields and copies lists. */
    public ThenFunc {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(producer, "producer must not be null");
        guards = guards != null ? List.copyOf(guards) : List.of();
        conditionalCompileIfs = conditionalCompileIfs != null ? List.copyOf(conditionalCompileIfs) : List.of();
    }

    /** Creates a builder for a branch over contract type {@code C}. */
    public static <C> Builder<C> builder(String name) {
        return new Builder<>(name);
    }

    /**
     * Adapts this branch to the uniform calling convention. The stateful arguments are ignored
     * and the branch has no schema.
     */
    public <A> CallableAsFoF<C, A> asCallable() {
        return new Callable<>(this);
    }

    private record Callable<C, A>(ThenFunc<C> branch) implements CallableAsFoF<C, A> {

        @Override
        public Stream<TxTemplate> call(C self, CompilationContext context, A arguments) {
            return branch.producer().produce(self, context);
        }

        @Override
        public List<ConditionallyCompileIf<C>> conditionalCompileIfs() {
            return branch.conditionalCompileIfs();
        }

        @Override
        public List<Guard<C>> guards() {
            return branch.guards();
        }

        @Override
        public String name() {
            return branch.name();
        }

        @Override
        public Optional<JsonNode> schema() {
            return Optional.empty();
        }
    }

    /** Builder for {@link ThenFunc}. */
    public static final class Builder<C> {

        private final String name;
        private final List<Guard<C>> guards = new ArrayList<>();
        private final List<ConditionallyCompileIf<C>> conditionalCompileIfs = new ArrayList<>();
        private Producer<C> producer;

        private Builder(String name) {
            this.name = name;
        }

        public Builder<C> guard(Guard<C> guard) {
            guards.add(Objects.requireNonNull(guard, "guard must not be null"));
            return this;
        }

        public Builder<C> conditionalCompileIf(ConditionallyCompileIf<C> rule) {
            conditionalCompileIfs.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public Builder<C> producer(Producer<C> producer) {
            this.producer = producer;
            return this;
        }

        public ThenFunc<C> build() {
            return new ThenFunc<>(name, guards, conditionalCompileIfs, producer);
        }
    }
}
