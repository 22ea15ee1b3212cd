package com.workflow.bsp.disruptor;

import com.workflow.bsp.api.StreamEvent;

import java.util.List;
import java.util.Map;

/**
 * A mutable holder for one stream event inside the ring buffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated when the ring buffer
 * is constructed and reused for every event published through their slot. The
 * handler clears a slot once its event was delivered so the slot does not keep
 * the deltas reachable.
 */
public final class StreamEventSlot {
    private String nodeName;
    private Map<String, List<Object>> deltas;
    private long superstep = -1;

    /**
     * Configures the slot for one completed task.
     *
     * @param nodeName  Node whose writes were applied.
     * @param deltas    Update values per channel.
     * @param superstep Superstep the writes were applied in.
     */
    public void set(String nodeName, Map<String, List<Object>> deltas, long superstep) {
        this.nodeName = nodeName;
        this.deltas = deltas;
        this.superstep = superstep;
    }

    public String nodeName() {
        return nodeName;
    }

    public long superstep() {
        return superstep;
    }

    public StreamEvent toEvent() {
        return new StreamEvent(nodeName, deltas, superstep);
    }

    public void clear() {
        nodeName = null;
        deltas = null;
        superstep = -1;
    }
}
