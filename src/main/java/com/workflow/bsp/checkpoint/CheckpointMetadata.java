package com.workflow.bsp.checkpoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything beyond channel state needed to resume an execution at a superstep
 * boundary. Plain bean so checkpointers can bind it with Jackson.
 */
@Data
@NoArgsConstructor
public class CheckpointMetadata {

    /** Why a checkpoint was taken. */
    public enum Source {
        /** Input applied, before the first superstep. */
        INPUT,
        /** End of a regular superstep. */
        LOOP,
        /** End of the superstep an interrupt paused after. */
        INTERRUPT
    }

    private String executionId;
    /** Assigned by the checkpointer on save. */
    private String checkpointId;
    private String parentId;
    private long generation;
    private long superstep;
    private Source source;
    /** Epoch millis, assigned by the checkpointer on save. */
    private long createdAt;
    private Map<String, Long> channelVersions = new LinkedHashMap<>();
    private Map<String, Map<String, Long>> versionsSeen = new LinkedHashMap<>();
    private List<String> pendingNext = new ArrayList<>();
    private List<PendingSend> pendingSends = new ArrayList<>();
    /** Entry nodes have not run yet. */
    private boolean entryPending;
}
