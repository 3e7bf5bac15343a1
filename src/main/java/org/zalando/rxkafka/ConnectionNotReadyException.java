package org.zalando.rxkafka;

/**
 * Indicates that a topic requested with {@link TopicDescriptor#isValidatedEagerly() eager validation} could not be
 * created, because its connection was not established at that time.
 */
@SuppressWarnings("serial")
public class ConnectionNotReadyException extends NotConnectedException {

    public ConnectionNotReadyException(final String topic, final String connectionName) {
        super(topic,
            String.format("Cannot create topic '%s': connection '%s' is not established.", topic, connectionName));
    }
}
