package io.covenantc.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link CompilerConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>
 * Recognized keys live under a {@code compiler:} root:
 *
 * <pre>
 * compiler:
 *   schema-validation: strict
 *   max-templates-per-branch: 256
 *   log-branch-outcomes: false
 * </pre>
 *
 * <p>
 * Missing keys receive the defaults of {@link CompilerConfig.Builder}. Each key can be overridden
 * by an environment variable ({@code COVENANTC_SCHEMA_VALIDATION},
 * {@code COVENANTC_MAX_TEMPLATES_PER_BRANCH}, {@code COVENANTC_LOG_BRANCH_OUTCOMES}). An env var
 * counts as set only if it is defined AND non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_SCHEMA_VALIDATION = "COVENANTC_SCHEMA_VALIDATION";
    static final String ENV_MAX_TEMPLATES = "COVENANTC_MAX_TEMPLATES_PER_BRANCH";
    static final String ENV_LOG_BRANCH_OUTCOMES = "COVENANTC_LOG_BRANCH_OUTCOMES";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CompilerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from the supplied lookup.
     * Returning {@code null} from {@code envLookup} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CompilerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /** Builds configuration from defaults and environment variables only. */
    public static CompilerConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static CompilerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CompilerConfig.Builder builder = CompilerConfig.builder();

        JsonNode compiler = root.path("compiler");
        if (compiler.has("schema-validation"))
            builder.schemaValidation(compiler.get("schema-validation").asText());
        if (compiler.has("max-templates-per-branch"))
            builder.maxTemplatesPerBranch(compiler.get("max-templates-per-branch").asInt());
        if (compiler.has("log-branch-outcomes"))
            builder.logBranchOutcomes(compiler.get("log-branch-outcomes").asBoolean());

        envString(envLookup, ENV_SCHEMA_VALIDATION, builder::schemaValidation);
        envInt(envLookup, ENV_MAX_TEMPLATES, builder::maxTemplatesPerBranch);
        envBool(envLookup, ENV_LOG_BRANCH_OUTCOMES, builder::logBranchOutcomes);

        return builder.build();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: '" + raw + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
