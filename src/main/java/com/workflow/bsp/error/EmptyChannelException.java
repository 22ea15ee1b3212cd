package com.workflow.bsp.error;

/** Thrown by {@code get()} on a channel that was never written and has no default. */
public class EmptyChannelException extends ChannelException {
    public EmptyChannelException(String channelName) {
        super(channelName, "channel is empty", null);
    }

    public EmptyChannelException(String channelName, String message) {
        super(channelName, message, null);
    }
}
