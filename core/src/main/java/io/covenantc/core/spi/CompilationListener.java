package io.covenantc.core.spi;

import io.covenantc.core.model.ConditionalCompileType;
import java.util.List;

/**
 * SPI for observability hooks on contract compilation.
 *
 * <p>
 * Integrations provide concrete implementations that bridge to their metrics or tracing stack;
 * the core has no telemetry dependency.
 *
 * <p>
 * All methods receive immutable event objects. Implementations MUST be non-blocking. Exceptions
 * thrown by listeners are caught by the compiler and logged; they do NOT affect compilation.
 */
public interface CompilationListener {

    /**
     * Called when a branch contributes templates to the compiled contract.
     *
     * @param event contains contract, path, branch, verdict, templateCount
     */
    default void onBranchIncluded(BranchIncludedEvent event) {}

    /**
     * Called when a branch is dropped under a prunable verdict.
     *
     * @param event contains contract, path, branch, verdict and the recovered error detail, if any
     */
    default void onBranchPruned(BranchPrunedEvent event) {}

    /**
     * Called when a branch is excluded by a {@code NEVER} verdict.
     *
     * @param event contains contract, path, branch
     */
    default void onBranchExcluded(BranchExcludedEvent event) {}

    /**
     * Called when a contract instance compiles successfully.
     *
     * @param event contains contract, path, branchCount, templateCount, durationMs
     */
    default void onCompilationCompleted(CompilationCompletedEvent event) {}

    /**
     * Called when a contract instance fails to compile.
     *
     * @param event contains contract, path, reasons, durationMs
     */
    default void onCompilationFailed(CompilationFailedEvent event) {}

    // --- Event records ---

    /** Event emitted when a branch is included. */
    record BranchIncludedEvent(
            String contract, String path, String branch, ConditionalCompileType.Kind verdict, int templateCount) {}

    /** Event emitted when a branch is pruned; {@code errorDetail} is null for empty output. */
    record BranchPrunedEvent(
            String contract, String path, String branch, ConditionalCompileType.Kind verdict, String errorDetail) {}

    /** Event emitted when a branch is excluded. */
    record BranchExcludedEvent(String contract, String path, String branch) {}

    /** Event emitted when a contract instance compiles. */
    record CompilationCompletedEvent(String contract, String path, int branchCount, int templateCount, long durationMs) {}

    /** Event emitted when a contract instance fails to compile. */
    record CompilationFailedEvent(String contract, String path, List<String> reasons, long durationMs) {}
}
