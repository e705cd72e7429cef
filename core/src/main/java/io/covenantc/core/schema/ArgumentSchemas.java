package io.covenantc.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.covenantc.core.error.DeclarationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JSON Schema 2020-12 handling for branch argument schemas. Schemas are checked for structure
 * when a contract type is declared, and optionally enforced on stateful arguments at compile time
 * (strict schema mode).
 *
 * <p>
 * Thread-safe: the schema factory is shared and compiled schemas are immutable.
 */
public final class ArgumentSchemas {

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static final Set<String> VALID_TYPES =
            Set.of("object", "array", "string", "number", "integer", "boolean", "null");

    private ArgumentSchemas() {
        // utility class
    }

    /**
     * Checks that {@code schema} is a usable JSON Schema document and compiles it.
     *
     * @param schema   the schema document
     * @param branch   branch declaring the schema, for error messages
     * @param contract contract type being declared, for error messages
     * @return the compiled schema, kept with the contract type for strict-mode validation
     * @throws DeclarationException if the schema is malformed
     */
    public static JsonSchema compile(JsonNode schema, String branch, String contract) {
        if (schema == null || !(schema.isObject() || schema.isBoolean())) {
            throw new DeclarationException(
                    "Argument schema of branch '" + branch + "' must be a JSON object or boolean", contract);
        }
        JsonNode typeNode = schema.get("type");
        if (typeNode != null) {
            List<JsonNode> types = typeNode.isArray() ? toList(typeNode) : List.of(typeNode);
            for (JsonNode type : types) {
                if (!type.isTextual() || !VALID_TYPES.contains(type.asText())) {
                    throw new DeclarationException(
                            "Argument schema of branch '" + branch + "' has invalid type '" + type
                                    + "'; expected one of " + VALID_TYPES,
                            contract);
                }
            }
        }
        try {
            return SCHEMA_FACTORY.getSchema(schema);
        } catch (JsonSchemaException e) {
            throw new DeclarationException(
                    "Argument schema of branch '" + branch + "' is invalid: " + e.getMessage(), e, contract);
        }
    }

    /**
     * Validates {@code arguments} against a schema compiled by {@link #compile}.
     *
     * @return validation messages in the library's order; empty when the arguments conform
     */
    public static List<String> validate(JsonSchema schema, JsonNode arguments) {
        Set<ValidationMessage> errors = schema.validate(arguments);
        return errors.stream().map(ValidationMessage::getMessage).collect(Collectors.toList());
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> out = new ArrayList<>();
        array.forEach(out::add);
        return out;
    }
}
