package com.workflow.bsp.error;

/**
 * Root of the engine's error hierarchy.
 *
 * Every error carries the superstep it was raised in and, where applicable, the
 * name of the node involved, so a failure can be diagnosed from the exception
 * alone without re-executing the graph. Errors raised outside a superstep
 * (compile time, standalone channel use) report {@link #NO_SUPERSTEP}.
 */
public class BspException extends RuntimeException {
    public static final long NO_SUPERSTEP = -1;

    private final long superstep;
    private final String nodeName;

    public BspException(String message, long superstep, String nodeName, Throwable cause) {
        super(describe(message, superstep, nodeName), cause);
        this.superstep = superstep;
        this.nodeName = nodeName;
    }

    public BspException(String message, long superstep, String nodeName) {
        this(message, superstep, nodeName, null);
    }

    public long superstep() {
        return superstep;
    }

    /** @return the node involved, or null when the error is not tied to a node. */
    public String nodeName() {
        return nodeName;
    }

    private static String describe(String message, long superstep, String nodeName) {
        if (superstep == NO_SUPERSTEP && nodeName == null)
            return message;
        StringBuilder sb = new StringBuilder(message).append(" [");
        if (superstep != NO_SUPERSTEP)
            sb.append("superstep=").append(superstep);
        if (nodeName != null) {
            if (superstep != NO_SUPERSTEP)
                sb.append(", ");
            sb.append("node=").append(nodeName);
        }
        return sb.append(']').toString();
    }
}
