package com.workflow.bsp.channel;

/**
 * Last-value semantics for process-local scratch state. The registry leaves it
 * out of checkpoints, so it comes back empty after a resume.
 */
public final class UntrackedValueChannel<V> extends LastValueChannel<V> {

    UntrackedValueChannel(String name, Class<?> valueType, V defaultValue) {
        super(name, valueType, defaultValue);
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.UNTRACKED_VALUE;
    }

    @Override
    public boolean tracked() {
        return false;
    }
}
