package io.covenantc.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Successful compilation of one contract instance. Holds every included branch in resolution
 * order, plus the names of branches that were pruned (failed or empty under a prunable verdict)
 * or excluded ({@code NEVER}).
 *
 * @param contract contract type name
 * @param path     location of the instance in the compilation tree
 * @param branches included branches, in resolution order
 * @param pruned   names of pruned branches, in resolution order
 * @param excluded names of excluded branches, in resolution order
 */
public record CompiledContract(
        String contract, String path, List<CompiledBranch> branches, List<String> pruned, List<String> excluded) {

    /** Canonical constructor with defensive copies. */
    public CompiledContract {
        Objects.requireNonNull(contract, "contract must not be null");
        branches = List.copyOf(branches);
        pruned = List.copyOf(pruned);
        excluded = List.copyOf(excluded);
    }

    /** Flattens the included branches into (conditions, template) pairs, in resolution order. */
    public List<GuardedTemplate> guardedTemplates() {
        List<GuardedTemplate> out = new ArrayList<>();
        for (CompiledBranch branch : branches) {
            branch.templates()
                    .forEach(t -> out.add(new GuardedTemplate(branch.name(), branch.conditions(), t)));
        }
        return out;
    }

    /** Total number of templates across all included branches. */
    public int templateCount() {
        return branches.stream().mapToInt(b -> b.templates().size()).sum();
    }

    /** Looks up an included branch by name, or {@code null} if it was not included. */
    public CompiledBranch branch(String name) {
        return branches.stream().filter(b -> b.name().equals(name)).findFirst().orElse(null);
    }
}
