package com.workflow.bsp.channel;

import java.util.Objects;

/**
 * Update payload for a {@link DynamicBarrierChannel}: either the number of
 * participants to wait for, or the arrival of one participant. A plain
 * {@code String} update is shorthand for {@link #arrive(String)}.
 */
public final class BarrierSignal {
    private final Integer expected;
    private final String participant;

    private BarrierSignal(Integer expected, String participant) {
        this.expected = expected;
        this.participant = participant;
    }

    public static BarrierSignal expect(int participants) {
        return new BarrierSignal(participants, null);
    }

    public static BarrierSignal arrive(String participant) {
        return new BarrierSignal(null, Objects.requireNonNull(participant, "participant"));
    }

    public boolean isExpect() {
        return expected != null;
    }

    public int expected() {
        return expected;
    }

    public String participant() {
        return participant;
    }

    @Override
    public String toString() {
        return isExpect() ? "expect(" + expected + ")" : "arrive(" + participant + ")";
    }
}
