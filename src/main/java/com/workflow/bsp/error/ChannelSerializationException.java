package com.workflow.bsp.error;

/** A channel checkpoint could not be encoded or decoded. */
public class ChannelSerializationException extends ChannelException {
    public ChannelSerializationException(String channelName, String message, Throwable cause) {
        super(channelName, message, cause);
    }
}
