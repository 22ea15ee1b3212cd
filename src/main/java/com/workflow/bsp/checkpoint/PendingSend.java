package com.workflow.bsp.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A send carried over to the next superstep, with its payload encoded so it
 * survives a save and load.
 *
 * @param node        target node
 * @param payloadType class name of the payload, null when there is none
 * @param payload     encoded payload
 */
public record PendingSend(String node, String payloadType, JsonNode payload) {
}
