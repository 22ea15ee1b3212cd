package com.workflow.bsp.engine;

import com.workflow.bsp.scheduler.FailurePolicy;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.Data;

/**
 * Per-execution settings of a {@link SuperstepCoordinator}.
 */
@Data
public class ExecutionConfig {
    /** Upper bound on executed supersteps; exceeding it is LIMIT_EXCEEDED. */
    private int maxSupersteps = 25;

    /** Wall-clock limit of one execute phase, null for none. */
    private Duration superstepTimeout;

    private FailurePolicy failurePolicy = FailurePolicy.FAIL_FAST;

    /** How often a timed-out superstep is re-executed before the execution aborts. */
    private int superstepRetries = 0;

    /** Save a checkpoint after every superstep. Pauses always save one. */
    private boolean checkpointEveryStep = true;

    /** Ring buffer size of the stream publisher, a power of two. */
    private int streamBufferSize = 1024;

    /** Nodes after whose supersteps the execution always pauses. */
    private Set<String> interruptAfter = new LinkedHashSet<>();
}
