package com.workflow.bsp.channel;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.workflow.bsp.error.EmptyChannelException;
import com.workflow.bsp.error.InvalidUpdateException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Barrier whose participant count is only known at runtime. Participants may
 * arrive before the count is set; the barrier is satisfied once a count is set
 * and at least that many distinct participants have arrived. A reset keeps the
 * count and forgets the arrivals.
 */
public final class DynamicBarrierChannel extends Channel<Boolean, Object, DynamicBarrierChannel.Snapshot> {

    public record Snapshot(Integer expected, List<String> arrived) {
    }

    private final boolean resetOnSatisfied;
    private final Set<String> arrived = new LinkedHashSet<>();
    private Integer expected;

    DynamicBarrierChannel(String name, boolean resetOnSatisfied) {
        super(name, Object.class);
        this.resetOnSatisfied = resetOnSatisfied;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.DYNAMIC_BARRIER;
    }

    @Override
    public Boolean get() {
        if (!isSatisfied()) {
            String waiting = expected == null ? "participant count" : (expected - arrived.size()) + " more participant(s)";
            throw new EmptyChannelException(name(), "barrier still waiting for " + waiting);
        }
        return Boolean.TRUE;
    }

    @Override
    public boolean isAvailable() {
        return isSatisfied();
    }

    public boolean isSatisfied() {
        return expected != null && arrived.size() >= expected;
    }

    /** @return the required participant count, or null if not set yet. */
    public Integer expected() {
        return expected;
    }

    public int arrivedCount() {
        return arrived.size();
    }

    boolean expect(int participants) {
        if (participants <= 0)
            throw new InvalidUpdateException(name(), "participant count must be positive: " + participants);
        if (expected != null && expected == participants)
            return false;
        expected = participants;
        return true;
    }

    @Override
    public boolean update(List<Object> updates) {
        for (Object u : updates) {
            if (u instanceof BarrierSignal signal) {
                if (signal.isExpect() && signal.expected() <= 0)
                    throw new InvalidUpdateException(name(), "participant count must be positive: " + signal.expected());
            } else if (!(u instanceof String)) {
                throw new InvalidUpdateException(name(), "expected a participant name or BarrierSignal but got "
                        + u.getClass().getSimpleName());
            }
        }
        boolean changed = false;
        for (Object u : updates) {
            if (u instanceof BarrierSignal signal) {
                changed |= signal.isExpect() ? expect(signal.expected()) : arrived.add(signal.participant());
            } else {
                changed |= arrived.add((String) u);
            }
        }
        return changed;
    }

    @Override
    public boolean consume() {
        if (resetOnSatisfied && isSatisfied()) {
            arrived.clear();
            return true;
        }
        return false;
    }

    @Override
    public Snapshot checkpoint() {
        return new Snapshot(expected, new ArrayList<>(new TreeSet<>(arrived)));
    }

    @Override
    public void restore(Snapshot checkpoint) {
        arrived.clear();
        expected = null;
        if (checkpoint == null)
            return;
        expected = checkpoint.expected();
        if (checkpoint.arrived() != null)
            arrived.addAll(checkpoint.arrived());
    }

    @Override
    public JavaType checkpointType(TypeFactory types) {
        return types.constructType(Snapshot.class);
    }
}
