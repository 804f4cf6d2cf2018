package com.queueserve.event;

/**
 * Classifies the change that triggered an {@link OrderEvent}.
 */
public enum OrderEventType {

    /** Order accepted and stored as PENDING; it joins the back of the queue. */
    CREATED,

    /** Status moved forward to anything other than READY. */
    ADVANCED,

    /** Status moved to READY -- the order leaves the queue and the customer should come to the counter. */
    READY
}
