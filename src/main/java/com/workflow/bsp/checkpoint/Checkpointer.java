package com.workflow.bsp.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.workflow.bsp.error.CheckpointException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence collaborator for checkpoints. Implementations wrap every
 * failure of their backend in {@link CheckpointException}.
 */
public interface Checkpointer {

    /**
     * Stores a checkpoint.
     *
     * @return the id of the stored checkpoint
     */
    String save(String executionId, long generation, Map<String, JsonNode> channels, CheckpointMetadata metadata);

    /**
     * @param checkpointId the checkpoint to load, or null for the latest
     * @return the checkpoint, or empty if there is none
     */
    Optional<CheckpointRecord> load(String executionId, String checkpointId);

    /** @return metadata of at most {@code limit} checkpoints, newest first. */
    List<CheckpointMetadata> list(String executionId, int limit);

    void delete(String executionId, String checkpointId);

    /** Removes every checkpoint of the execution. */
    void deleteExecution(String executionId);
}
