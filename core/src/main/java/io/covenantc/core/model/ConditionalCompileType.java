package io.covenantc.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inclusion verdict for a branch. Exactly one of six kinds:
 *
 * <ul>
 * <li>{@link Kind#NO_CONSTRAINT} — identity, changes nothing.
 * <li>{@link Kind#SKIPPABLE} — the branch may be omitted without error.
 * <li>{@link Kind#NULLABLE} — the branch is pruned silently if it errors or produces nothing.
 * <li>{@link Kind#REQUIRED} — the branch must contribute templates.
 * <li>{@link Kind#NEVER} — the branch must not be used at all.
 * <li>{@link Kind#FAIL} — unconditional failure carrying ordered reasons.
 * </ul>
 *
 * <p>
 * Verdicts are immutable and combined with {@link #merge}. Precedence:
 * {@code FAIL} over everything, {@code NEVER}/{@code REQUIRED} (conflicting with each other)
 * over {@code SKIPPABLE} over {@code NULLABLE} over {@code NO_CONSTRAINT}.
 */
public final class ConditionalCompileType {

    /** The kind of verdict. */
    public enum Kind {
        NO_CONSTRAINT,
        SKIPPABLE,
        NULLABLE,
        REQUIRED,
        NEVER,
        FAIL
    }

    /** Reason synthesized when {@code NEVER} meets {@code REQUIRED}. */
    public static final String NEVER_REQUIRED_CONFLICT = "Never and Required incompatible";

    public static final ConditionalCompileType NO_CONSTRAINT = new ConditionalCompileType(Kind.NO_CONSTRAINT, List.of());
    public static final ConditionalCompileType SKIPPABLE = new ConditionalCompileType(Kind.SKIPPABLE, List.of());
    public static final ConditionalCompileType NULLABLE = new ConditionalCompileType(Kind.NULLABLE, List.of());
    public static final ConditionalCompileType REQUIRED = new ConditionalCompileType(Kind.REQUIRED, List.of());
    public static final ConditionalCompileType NEVER = new ConditionalCompileType(Kind.NEVER, List.of());

    private final Kind kind;
    private final List<String> reasons;

    private ConditionalCompileType(Kind kind, List<String> reasons) {
        this.kind = kind;
        this.reasons = reasons;
    }

    /** Creates a {@code FAIL} verdict with the given reasons, in order. */
    public static ConditionalCompileType fail(List<String> reasons) {
        Objects.requireNonNull(reasons, "reasons must not be null");
        return new ConditionalCompileType(Kind.FAIL, List.copyOf(reasons));
    }

    /** Creates a {@code FAIL} verdict with the given reasons, in order. */
    public static ConditionalCompileType fail(String... reasons) {
        return fail(List.of(reasons));
    }

    /**
     * Folds the given rules left to right, starting from {@code NO_CONSTRAINT}. Declaration order
     * of the rules decides the order of {@code FAIL} reasons in the result.
     *
     * @param rules   the branch's conditional-compile-if rules, in declared order
     * @param self    the contract instance
     * @param context the compilation context
     * @return the merged verdict
     */
    public static <C> ConditionalCompileType fold(
            List<? extends ConditionallyCompileIf<C>> rules, C self, CompilationContext context) {
        ConditionalCompileType verdict = NO_CONSTRAINT;
        for (ConditionallyCompileIf<C> rule : rules) {
            verdict = verdict.merge(rule.evaluate(self, context));
        }
        return verdict;
    }

    /**
     * Merges this verdict with another. Total over all pairs; commutative except for the order of
     * reasons when both sides are {@code FAIL}, which are concatenated as {@code this ++ other}.
     */
    public ConditionalCompileType merge(ConditionalCompileType other) {
        Objects.requireNonNull(other, "other must not be null");
        if (kind == Kind.NO_CONSTRAINT) {
            return other;
        }
        if (other.kind == Kind.NO_CONSTRAINT) {
            return this;
        }
        if (kind == Kind.FAIL && other.kind == Kind.FAIL) {
            List<String> joined = new ArrayList<>(reasons.size() + other.reasons.size());
            joined.addAll(reasons);
            joined.addAll(other.reasons);
            return fail(joined);
        }
        if (kind == Kind.FAIL) {
            return this;
        }
        if (other.kind == Kind.FAIL) {
            return other;
        }
        if (isConflict(kind, other.kind)) {
            return fail(NEVER_REQUIRED_CONFLICT);
        }
        if (kind == Kind.NEVER || other.kind == Kind.NEVER) {
            return NEVER;
        }
        if (kind == Kind.REQUIRED || other.kind == Kind.REQUIRED) {
            return REQUIRED;
        }
        if (kind == Kind.SKIPPABLE || other.kind == Kind.SKIPPABLE) {
            return SKIPPABLE;
        }
        return NULLABLE;
    }

    private static boolean isConflict(Kind a, Kind b) {
        return (a == Kind.NEVER && b == Kind.REQUIRED) || (a == Kind.REQUIRED && b == Kind.NEVER);
    }

    public Kind kind() {
        return kind;
    }

    /** Reasons of a {@code FAIL} verdict; empty for every other kind. */
    public List<String> reasons() {
        return reasons;
    }

    public boolean isFail() {
        return kind == Kind.FAIL;
    }

    public boolean isNever() {
        return kind == Kind.NEVER;
    }

    /** {@code true} when failures and empty output of the branch are recovered by pruning it. */
    public boolean isPrunable() {
        return kind == Kind.SKIPPABLE || kind == Kind.NULLABLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConditionalCompileType)) {
            return false;
        }
        ConditionalCompileType that = (ConditionalCompileType) o;
        return kind == that.kind && reasons.equals(that.reasons);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, reasons);
    }

    @Override
    public String toString() {
        return kind == Kind.FAIL ? "Fail" + reasons : kind.name();
    }
}
