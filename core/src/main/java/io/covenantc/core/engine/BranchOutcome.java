package io.covenantc.core.engine;

import io.covenantc.core.error.BranchCompilationException;
import io.covenantc.core.model.CompiledBranch;
import io.covenantc.core.model.ConditionalCompileType;

/**
 * Result of resolving one branch. Exactly one of:
 *
 * <ul>
 * <li>{@link Type#INCLUDED} — {@code compiled} holds the branch's clauses and templates.
 * <li>{@link Type#PRUNED} — dropped under a prunable verdict; {@code failure} holds the recovered
 * error, or is null when the branch simply produced nothing.
 * <li>{@link Type#EXCLUDED} — verdict was {@code NEVER}; nothing was evaluated.
 * <li>{@link Type#FAILED} — fatal for the contract instance; {@code failure} is set.
 * <li>{@link Type#SKIPPED} — not resolved because the instance had already failed.
 * </ul>
 */
record BranchOutcome(
        Type type,
        String branch,
        ConditionalCompileType verdict,
        CompiledBranch compiled,
        BranchCompilationException failure) {

    enum Type {
        INCLUDED,
        PRUNED,
        EXCLUDED,
        FAILED,
        SKIPPED
    }

    static BranchOutcome included(CompiledBranch compiled) {
        return new BranchOutcome(Type.INCLUDED, compiled.name(), compiled.verdict(), compiled, null);
    }

    static BranchOutcome pruned(String branch, ConditionalCompileType verdict, BranchCompilationException cause) {
        return new BranchOutcome(Type.PRUNED, branch, verdict, null, cause);
    }

    static BranchOutcome excluded(String branch) {
        return new BranchOutcome(Type.EXCLUDED, branch, ConditionalCompileType.NEVER, null, null);
    }

    static BranchOutcome failed(String branch, ConditionalCompileType verdict, BranchCompilationException failure) {
        return new BranchOutcome(Type.FAILED, branch, verdict, null, failure);
    }

    static BranchOutcome skipped(String branch, ConditionalCompileType verdict) {
        return new BranchOutcome(Type.SKIPPED, branch, verdict, null, null);
    }
}
