package org.zalando.rxkafka;

import static java.util.Objects.requireNonNull;

/**
 * Indicates that an operation required an established connection, but the owning connection was gone or not
 * connected. The operation may be retried once the connection is re-established.
 */
@SuppressWarnings("serial")
public class NotConnectedException extends RuntimeException {

    private final String topic;

    public NotConnectedException(final String topic) {
        this(topic, String.format("Connection of topic '%s' is not established.", topic));
    }

    protected NotConnectedException(final String topic, final String message) {
        super(message);
        this.topic = requireNonNull(topic);
    }

    public String getTopic() {
        return topic;
    }
}
