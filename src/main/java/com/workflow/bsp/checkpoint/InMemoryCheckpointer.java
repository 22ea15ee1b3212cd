package com.workflow.bsp.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.workflow.bsp.error.CheckpointException;
import com.workflow.bsp.util.Jsons;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import lombok.extern.log4j.Log4j2;

/**
 * Checkpointer keeping everything on the heap, per execution in save order.
 *
 * Metadata goes through a Jackson round trip on save and on load, so a stored
 * checkpoint shares no mutable state with its caller and anything that would
 * not survive a real backend fails here too.
 */
@Log4j2
public final class InMemoryCheckpointer implements Checkpointer {
    private final Map<String, List<CheckpointRecord>> byExecution = new HashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public synchronized String save(String executionId, long generation, Map<String, JsonNode> channels,
            CheckpointMetadata metadata) {
        String id = "ckpt-" + executionId + "-" + generation + "-" + ids.incrementAndGet();
        CheckpointMetadata stored = copy(metadata);
        stored.setExecutionId(executionId);
        stored.setGeneration(generation);
        stored.setCheckpointId(id);
        stored.setCreatedAt(System.currentTimeMillis());
        Map<String, JsonNode> encoded = new LinkedHashMap<>();
        channels.forEach((name, node) -> encoded.put(name, node == null ? null : node.deepCopy()));
        byExecution.computeIfAbsent(executionId, k -> new ArrayList<>()).add(new CheckpointRecord(stored, encoded));
        log.debug("Saved checkpoint {} (generation {}, superstep {})", id, generation, stored.getSuperstep());
        return id;
    }

    @Override
    public synchronized Optional<CheckpointRecord> load(String executionId, String checkpointId) {
        List<CheckpointRecord> records = byExecution.get(executionId);
        if (records == null || records.isEmpty())
            return Optional.empty();
        if (checkpointId == null)
            return Optional.of(detach(records.get(records.size() - 1)));
        for (CheckpointRecord r : records)
            if (r.id().equals(checkpointId))
                return Optional.of(detach(r));
        return Optional.empty();
    }

    @Override
    public synchronized List<CheckpointMetadata> list(String executionId, int limit) {
        List<CheckpointRecord> records = byExecution.getOrDefault(executionId, List.of());
        List<CheckpointMetadata> out = new ArrayList<>();
        for (int i = records.size() - 1; i >= 0 && out.size() < limit; i--)
            out.add(copy(records.get(i).metadata()));
        return out;
    }

    @Override
    public synchronized void delete(String executionId, String checkpointId) {
        List<CheckpointRecord> records = byExecution.get(executionId);
        if (records == null || !records.removeIf(r -> r.id().equals(checkpointId)))
            throw new CheckpointException("No checkpoint " + checkpointId + " for execution " + executionId, null);
    }

    @Override
    public synchronized void deleteExecution(String executionId) {
        List<CheckpointRecord> removed = byExecution.remove(executionId);
        log.debug("Deleted {} checkpoint(s) of execution {}", removed == null ? 0 : removed.size(), executionId);
    }

    private static CheckpointRecord detach(CheckpointRecord r) {
        Map<String, JsonNode> channels = new LinkedHashMap<>();
        r.channels().forEach((name, node) -> channels.put(name, node == null ? null : node.deepCopy()));
        return new CheckpointRecord(copy(r.metadata()), channels);
    }

    private static CheckpointMetadata copy(CheckpointMetadata metadata) {
        try {
            return Jsons.mapper().convertValue(metadata, CheckpointMetadata.class);
        } catch (IllegalArgumentException e) {
            throw new CheckpointException("Checkpoint metadata is not serializable", e);
        }
    }
}
