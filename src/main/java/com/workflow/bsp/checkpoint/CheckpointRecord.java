package com.workflow.bsp.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * A saved checkpoint: encoded channel checkpoints keyed by channel name, plus
 * metadata.
 */
public record CheckpointRecord(CheckpointMetadata metadata, Map<String, JsonNode> channels) {

    public String id() {
        return metadata.getCheckpointId();
    }

    public long generation() {
        return metadata.getGeneration();
    }
}
