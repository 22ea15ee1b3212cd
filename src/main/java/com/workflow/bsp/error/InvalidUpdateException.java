package com.workflow.bsp.error;

/** An update batch the channel variant cannot accept. */
public class InvalidUpdateException extends ChannelException {
    public InvalidUpdateException(String channelName, String message) {
        super(channelName, message, null);
    }

    public InvalidUpdateException(String channelName, String message, Throwable cause) {
        super(channelName, message, cause);
    }
}
