package com.workflow.bsp.error;

/**
 * Base class for failures raised by a channel or the channel registry.
 */
public abstract class ChannelException extends BspException {
    private final String channelName;

    protected ChannelException(String channelName, String message, Throwable cause) {
        super("Channel '" + channelName + "': " + message, NO_SUPERSTEP, null, cause);
        this.channelName = channelName;
    }

    public String channelName() {
        return channelName;
    }
}
