package io.covenantc.core.error;

/**
 * Thrown while a contract type is being declared: blank or duplicate branch names, or an argument
 * schema that is not a valid JSON Schema document.
 */
public final class DeclarationException extends CompilationException {

    private static final long serialVersionUID = 1L;

    private final String contract;

    public DeclarationException(String message, String contract) {
        super(message, null, Phase.DECLARATION);
        this.contract = contract;
    }

    public DeclarationException(String message, Throwable cause, String contract) {
        super(message, cause, null, Phase.DECLARATION);
        this.contract = contract;
    }

    /** The contract type being declared, or {@code null} if not yet named. */
    public String contract() {
        return contract;
    }
}
