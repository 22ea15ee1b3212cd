package com.workflow.bsp.channel;

/** How a topic hands published values to its subscribers. */
public enum DeliveryMode {
    /** A value is removed before the subscriber sees it; a failing subscriber loses it. */
    AT_MOST_ONCE,
    /** A value stays queued for a subscriber until its callback returns normally. */
    AT_LEAST_ONCE
}
