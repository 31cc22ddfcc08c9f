package com.intteq.consumer.dispatch;

/**
 * Point in the dispatch sequence at which a delivery is acknowledged.
 */
public enum AckMode {

    /** The broker acknowledges on delivery; the dispatcher never calls ack or nack. */
    AUTO_ACK,

    /** Acknowledge right after the handler returns, before any publish. */
    ACK_ON_INVOKE,

    /** Acknowledge after the handler's return value has been published. */
    ACK_ON_PUBLISH
}
