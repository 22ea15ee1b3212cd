package com.workflow.bsp.error;

/**
 * Raised while compiling a graph. Always fatal: a graph that fails validation
 * is never executed.
 */
public class GraphValidationException extends BspException {

    public enum Kind {
        /** The control edges contain a cycle. */
        CONTROL_CYCLE,
        /** Two nodes declare writes to the same non-reducing channel. */
        DUPLICATE_WRITER,
        /** A node or channel name is declared twice. */
        DUPLICATE_NAME,
        /** A node, edge or entry point refers to an undeclared node or channel. */
        UNKNOWN_REFERENCE
    }

    private final Kind kind;

    public GraphValidationException(Kind kind, String message) {
        this(kind, message, null);
    }

    public GraphValidationException(Kind kind, String message, String nodeName) {
        super(kind + ": " + message, NO_SUPERSTEP, nodeName);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
