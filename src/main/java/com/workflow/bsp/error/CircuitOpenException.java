package com.workflow.bsp.error;

/**
 * Raised inside a task when the node's circuit breaker is open and the compute
 * unit was not called. Handled like any other task failure.
 */
public class CircuitOpenException extends BspException {
    public CircuitOpenException(String nodeName, long superstep) {
        super("Circuit breaker is open", superstep, nodeName);
    }
}
