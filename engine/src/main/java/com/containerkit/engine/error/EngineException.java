package com.containerkit.engine.error;

/**
 * Thrown when an orchestration call fails for infrastructure reasons
 * (unknown tool, malformed arguments, overload, timeout).
 *
 * Tool-level failures are not exceptions: they come back as
 * {@code ToolOutput.success() == false}. This type is reserved for the
 * engine itself refusing or aborting a call.
 *
 * Unchecked so callers only catch it when they have a recovery strategy.
 */
public class EngineException extends RuntimeException {

    public enum Kind { NOT_FOUND, VALIDATION, RESOURCE, TIMEOUT, INTERNAL }

    private final Kind kind;

    public EngineException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EngineException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public static EngineException notFound(String message) {
        return new EngineException(Kind.NOT_FOUND, message);
    }

    public static EngineException validation(String message) {
        return new EngineException(Kind.VALIDATION, message);
    }

    public static EngineException resource(String message) {
        return new EngineException(Kind.RESOURCE, message);
    }

    public static EngineException timeout(String message) {
        return new EngineException(Kind.TIMEOUT, message);
    }

    public static EngineException internal(String message, Throwable cause) {
        return new EngineException(Kind.INTERNAL, message, cause);
    }
}
