package com.workflow.bsp.channel;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.workflow.bsp.error.ChannelSerializationException;
import com.workflow.bsp.error.EmptyChannelException;
import com.workflow.bsp.error.InvalidUpdateException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Synchronization point for a fixed set of named participants.
 *
 * Each update is a participant name. {@link #get()} returns {@code TRUE} once
 * every participant has written and fails with EmptyChannel before that, so a
 * node reading the barrier is only triggered when it is satisfied. With
 * {@code resetOnSatisfied} the barrier starts over after the superstep in
 * which it was read while satisfied.
 */
public final class NamedBarrierChannel extends Channel<Boolean, String, List<String>> {
    private final Set<String> participants;
    private final boolean resetOnSatisfied;
    private final Set<String> seen = new LinkedHashSet<>();

    NamedBarrierChannel(String name, Set<String> participants, boolean resetOnSatisfied) {
        super(name, String.class);
        if (participants.isEmpty())
            throw new IllegalArgumentException("Barrier '" + name + "' needs at least one participant");
        this.participants = Collections.unmodifiableSet(new LinkedHashSet<>(participants));
        this.resetOnSatisfied = resetOnSatisfied;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.NAMED_BARRIER;
    }

    @Override
    public Boolean get() {
        if (!isSatisfied())
            throw new EmptyChannelException(name(), "barrier still waiting for " + missing());
        return Boolean.TRUE;
    }

    @Override
    public boolean isAvailable() {
        return isSatisfied();
    }

    public boolean isSatisfied() {
        return seen.size() == participants.size();
    }

    public Set<String> participants() {
        return participants;
    }

    public Set<String> missing() {
        Set<String> out = new TreeSet<>(participants);
        out.removeAll(seen);
        return out;
    }

    @Override
    public boolean update(List<String> updates) {
        for (String participant : updates)
            if (!participants.contains(participant))
                throw new InvalidUpdateException(name(), "'" + participant + "' is not a participant of " + participants);
        boolean changed = false;
        for (String participant : updates)
            changed |= seen.add(participant);
        return changed;
    }

    @Override
    public boolean consume() {
        if (resetOnSatisfied && isSatisfied()) {
            seen.clear();
            return true;
        }
        return false;
    }

    @Override
    public List<String> checkpoint() {
        return new ArrayList<>(new TreeSet<>(seen));
    }

    @Override
    public void restore(List<String> checkpoint) {
        seen.clear();
        if (checkpoint == null)
            return;
        for (String participant : checkpoint) {
            if (!participants.contains(participant))
                throw new ChannelSerializationException(name(), "unknown participant in checkpoint: " + participant, null);
            seen.add(participant);
        }
    }

    @Override
    public JavaType checkpointType(TypeFactory types) {
        return types.constructCollectionType(List.class, String.class);
    }
}
