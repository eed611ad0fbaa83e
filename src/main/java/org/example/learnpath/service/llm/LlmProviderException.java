package org.example.learnpath.service.llm;

/**
 * Thrown by an {@link LlmProvider} when a generation request cannot be completed.
 */
public class LlmProviderException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        PROVIDER_ERROR,
        RATE_LIMITED
    }

    private final Kind kind;

    public LlmProviderException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LlmProviderException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public LlmProviderException(String message) {
        this(Kind.PROVIDER_ERROR, message);
    }

    public Kind getKind() {
        return kind;
    }
}
