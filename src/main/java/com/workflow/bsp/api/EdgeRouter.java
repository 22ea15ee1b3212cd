package com.workflow.bsp.api;

import java.util.Collection;

/**
 * Selects the targets of a conditional edge from the output of its source
 * node. Every returned name must be one of the targets declared with the edge.
 */
@FunctionalInterface
public interface EdgeRouter {
    Collection<String> route(NodeOutput output);
}
