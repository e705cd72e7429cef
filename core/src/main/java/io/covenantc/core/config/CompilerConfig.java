package io.covenantc.core.config;

import java.util.Locale;
import java.util.Set;

/**
 * Settings of a {@code ContractCompiler}.
 *
 * <p>
 * Use {@link #builder()} to construct instances; every field has a default.
 *
 * @param schemaValidation      {@code lenient} (schemas descriptive only) or {@code strict}
 *                              (stateful arguments validated against branch schemas)
 * @param maxTemplatesPerBranch template budget per branch
 * @param logBranchOutcomes     log one DEBUG line per resolved branch
 */
public record CompilerConfig(String schemaValidation, int maxTemplatesPerBranch, boolean logBranchOutcomes) {

    private static final Set<String> SCHEMA_MODES = Set.of("lenient", "strict");

    /** Defaults: lenient schemas, 1024 templates per branch, branch outcome logging on. */
    public static final CompilerConfig DEFAULT = builder().build();

    /** Validates and normalizes fields. */
    public CompilerConfig {
        schemaValidation = schemaValidation == null ? "lenient" : schemaValidation.trim().toLowerCase(Locale.ROOT);
        if (!SCHEMA_MODES.contains(schemaValidation)) {
            throw new ConfigLoadException(
                    "schema-validation must be 'lenient' or 'strict', got: '" + schemaValidation + "'");
        }
        if (maxTemplatesPerBranch <= 0) {
            throw new ConfigLoadException(
                    "max-templates-per-branch must be positive, got: " + maxTemplatesPerBranch);
        }
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CompilerConfig}. */
    public static final class Builder {

        private String schemaValidation = "lenient";
        private int maxTemplatesPerBranch = 1024;
        private boolean logBranchOutcomes = true;

        private Builder() {}

        public Builder schemaValidation(String schemaValidation) {
            this.schemaValidation = schemaValidation;
            return this;
        }

        public Builder maxTemplatesPerBranch(int maxTemplatesPerBranch) {
            this.maxTemplatesPerBranch = maxTemplatesPerBranch;
            return this;
        }

        public Builder logBranchOutcomes(boolean logBranchOutcomes) {
            this.logBranchOutcomes = logBranchOutcomes;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(schemaValidation, maxTemplatesPerBranch, logBranchOutcomes);
        }
    }
}
