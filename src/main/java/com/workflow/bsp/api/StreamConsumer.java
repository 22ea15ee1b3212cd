package com.workflow.bsp.api;

/**
 * Receives stream events in order, on a dedicated thread. A slow consumer
 * slows the coordinator down; events are never dropped.
 */
@FunctionalInterface
public interface StreamConsumer {
    void onEvent(StreamEvent event);
}
