package io.covenantc.core.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.covenantc.core.error.ArgumentCoercionException;
import io.covenantc.core.model.FinishOrFunc;
import java.util.Objects;

/**
 * Ready-made coercions for contracts whose stateful arguments are JSON trees.
 *
 * <p>
 * The mapper fails on unknown properties so that arguments meant for one branch are not silently
 * accepted by another.
 */
public final class ArgumentCoercers {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ArgumentCoercers() {
        // utility class
    }

    /**
     * Coerces a JSON tree to {@code type} with Jackson data binding. A missing or JSON-null tree is
     * rejected.
     *
     * @param type the branch argument type
     * @return a coercer throwing {@link ArgumentCoercionException} on mismatch
     */
    public static <S> FinishOrFunc.Coercer<JsonNode, S> json(Class<S> type) {
        Objects.requireNonNull(type, "type must not be null");
        return arguments -> {
            if (arguments == null || arguments.isNull() || arguments.isMissingNode()) {
                throw new ArgumentCoercionException(
                        "No arguments supplied for " + type.getSimpleName(), (String) null);
            }
            try {
                return MAPPER.treeToValue(arguments, type);
            } catch (JsonProcessingException e) {
                throw new ArgumentCoercionException(
                        "Cannot coerce arguments to " + type.getSimpleName() + ": " + e.getOriginalMessage(),
                        e,
                        null);
            }
        };
    }

    /** Passes the stateful arguments through unchanged. */
    public static <A> FinishOrFunc.Coercer<A, A> identity() {
        return arguments -> arguments;
    }

    /** The shared mapper, for callers building JSON arguments the same way the coercers read them. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
