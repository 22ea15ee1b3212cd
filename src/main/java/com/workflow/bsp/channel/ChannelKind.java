package com.workflow.bsp.channel;

/**
 * The closed set of channel variants. The tag is fixed when a channel is
 * constructed and is what the registry and coordinator switch on.
 */
public enum ChannelKind {
    LAST_VALUE(false),
    BINARY_OPERATOR(true),
    TOPIC(true),
    EPHEMERAL_VALUE(false),
    ANY_VALUE(false),
    UNTRACKED_VALUE(false),
    NAMED_BARRIER(true),
    DYNAMIC_BARRIER(true);

    private final boolean reducing;

    ChannelKind(boolean reducing) {
        this.reducing = reducing;
    }

    /**
     * @return true if several tasks may write this kind of channel in the same
     *         superstep.
     */
    public boolean isReducing() {
        return reducing;
    }

    public boolean isBarrier() {
        return this == NAMED_BARRIER || this == DYNAMIC_BARRIER;
    }
}
