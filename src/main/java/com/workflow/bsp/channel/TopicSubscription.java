package com.workflow.bsp.channel;

/** Handle returned by {@link ChannelRegistry#subscribe}. */
public interface TopicSubscription {

    String id();

    /** @return values queued for this subscriber but not yet delivered. */
    int pending();

    /** @return number of deliveries whose callback threw. */
    long failedDeliveries();

    /** Stops delivery. Queued values are discarded. */
    void cancel();

    boolean isActive();
}
