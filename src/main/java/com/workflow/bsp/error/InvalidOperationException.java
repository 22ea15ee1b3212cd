package com.workflow.bsp.error;

/**
 * A variant-specific operation was called on a channel of another variant,
 * e.g. subscribing to a channel that is not a topic.
 */
public class InvalidOperationException extends ChannelException {
    public InvalidOperationException(String channelName, String message) {
        super(channelName, message, null);
    }
}
