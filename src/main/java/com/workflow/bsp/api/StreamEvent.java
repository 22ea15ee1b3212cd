package com.workflow.bsp.api;

import java.util.List;
import java.util.Map;

/**
 * Emitted once per completed task after the write phase of its superstep.
 *
 * @param nodeName  the node whose writes were applied
 * @param deltas    channel name to the update values the node wrote
 * @param superstep superstep sequence number
 */
public record StreamEvent(String nodeName, Map<String, List<Object>> deltas, long superstep) {
}
