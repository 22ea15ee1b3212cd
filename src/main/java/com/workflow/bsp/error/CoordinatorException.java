package com.workflow.bsp.error;

/**
 * Terminal failure of an execution. {@link Kind#ABORTED} always carries the
 * error that caused the abort as its cause.
 */
public class CoordinatorException extends BspException {

    public enum Kind {
        LIMIT_EXCEEDED,
        ABORTED
    }

    private final Kind kind;

    public CoordinatorException(Kind kind, String message, long superstep, String nodeName, Throwable cause) {
        super(kind + ": " + message, superstep, nodeName, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
