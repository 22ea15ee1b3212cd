package com.workflow.bsp.engine;

/**
 * A task that failed and whose writes were discarded.
 *
 * @param nodeName  node the task ran
 * @param superstep superstep it ran in
 * @param attempts  attempts made, retries included
 * @param error     what the last attempt threw
 */
public record TaskFailure(String nodeName, long superstep, int attempts, Throwable error) {
}
