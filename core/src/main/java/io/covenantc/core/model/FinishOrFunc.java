package io.covenantc.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.covenantc.core.error.ArgumentCoercionException;
import io.covenantc.core.spi.TxTemplate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A branch that takes caller-supplied arguments. The contract-wide stateful arguments {@code A}
 * are coerced to the branch's own argument type {@code S} before the production function runs;
 * templates it returns are suggestions, not binding.
 *
 * <p>
 * Immutable. Declared once per contract type and shared by every instance.
 *
 * @param name                  branch name, unique within the contract type
 * @param coercer               converts stateful arguments to the branch argument type
 * @param guards                guards in declared order
 * @param conditionalCompileIfs inclusion rules in declared order
 * @param producer              generates the branch's templates from coerced arguments
 * @param argumentSchema        JSON Schema of {@code S}, or {@code null} if none is published
 * @param <C>                   the contract instance type
 * @param <A>                   the contract-wide stateful argument type
 * @param <S>                   the branch-specific argument type
 */
public record FinishOrFunc<C, A, S>(
        String name,
        Coercer<A, S> coercer,
        List<Guard<C>> guards,
        List<ConditionallyCompileIf<C>> conditionalCompileIfs,
        Producer<C, S> producer,
        JsonNode argumentSchema)
        implements CallableAsFoF<C, A> {

    /**
     * Converts stateful arguments to a branch argument type.
     *
     * @param <A> the contract-wide stateful argument type
     * @param <S> the branch-specific argument type
     */
    @FunctionalInterface
    public interface Coercer<A, S> {
        /**
         * @throws ArgumentCoercionException if the arguments do not fit the branch
         */
        S coerce(A arguments);
    }

    /**
     * Template generator of a {@link FinishOrFunc}.
     *
     * @param <C> the contract instance type
     * @param <S> the branch-specific argument type
     */
    @FunctionalInterface
    public interface Producer<C, S> {
        Stream<TxTemplate> produce(C self, CompilationContext context, S arguments);
    }

    /** Validates fields and copies lists. */
    public FinishOrFunc {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(coercer, "coercer must not be null");
        Objects.requireNonNull(producer, "producer must not be null");
        guards = guards != null ? List.copyOf(guards) : List.of();
        conditionalCompileIfs = conditionalCompileIfs != null ? List.copyOf(conditionalCompileIfs) : List.of();
    }

    /**
     * Creates a builder.
     *
     * @param name     branch name
     * @param coercer  stateful-argument coercion
     * @param producer template generator
     */
    public static <C, A, S> Builder<C, A, S> builder(String name, Coercer<A, S> coercer, Producer<C, S> producer) {
        return new Builder<>(name, coercer, producer);
    }

    @Override
    public Stream<TxTemplate> call(C self, CompilationContext context, A arguments) {
        return producer.produce(self, context, coerce(arguments));
    }

    @Override
    public Optional<JsonNode> schema() {
        return Optional.ofNullable(argumentSchema);
    }

    private S coerce(A arguments) {
        try {
            return coercer.coerce(arguments);
        } catch (ArgumentCoercionException e) {
            if (e.branch() != null) {
                throw e;
            }
            throw new ArgumentCoercionException(e.getMessage(), e, name);
        } catch (RuntimeException e) {
            throw new ArgumentCoercionException(
                    "Branch '" + name + "' rejected stateful arguments: " + e.getMessage(), e, name);
        }
    }

    /** Builder for {@link FinishOrFunc}. */
    public static final class Builder<C, A, S> {

        private final String name;
        private final Coercer<A, S> coercer;
        private final Producer<C, S> producer;
        private final List<Guard<C>> guards = new ArrayList<>();
        private final List<ConditionallyCompileIf<C>> conditionalCompileIfs = new ArrayList<>();
        private JsonNode argumentSchema;

        private Builder(String name, Coercer<A, S> coercer, Producer<C, S> producer) {
            this.name = name;
            this.coercer = coercer;
            this.producer = producer;
        }

        public Builder<C, A, S> guard(Guard<C> guard) {
            guards.add(Objects.requireNonNull(guard, "guard must not be null"));
            return this;
        }

        public Builder<C, A, S> conditionalCompileIf(ConditionallyCompileIf<C> rule) {
            conditionalCompileIfs.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public Builder<C, A, S> argumentSchema(JsonNode schema) {
            this.argumentSchema = schema;
            return this;
        }

        public FinishOrFunc<C, A, S> build() {
            return new FinishOrFunc<>(name, coercer, guards, conditionalCompileIfs, producer, argumentSchema);
        }
    }
}
