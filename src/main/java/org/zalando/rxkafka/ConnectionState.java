package org.zalando.rxkafka;

/**
 * States of a {@link Connection}, as observed by its topics.
 */
public enum ConnectionState {

    DISCONNECTED,

    CONNECTED,

    /**
     * Terminal. All topics of a closed connection are released.
     */
    CLOSED
}
