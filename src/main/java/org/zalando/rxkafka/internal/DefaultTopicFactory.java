package org.zalando.rxkafka.internal;

import static java.util.Objects.requireNonNull;

import javax.inject.Inject;

import org.zalando.rxkafka.Connection;
import org.zalando.rxkafka.Topic;
import org.zalando.rxkafka.TopicDescriptor;
import org.zalando.rxkafka.TopicFactory;
import org.zalando.rxkafka.TopicRegistry;
import org.zalando.rxkafka.inject.Kafka;

public final class DefaultTopicFactory implements TopicFactory {

    private final TopicRegistry registry;
    private final Connection connection;

    @Inject
    DefaultTopicFactory(final TopicRegistry registry, @Kafka final Connection connection) {
        this.registry = requireNonNull(registry);
        this.connection = requireNonNull(connection);
    }

    @Override
    public Topic create(final TopicDescriptor descriptor) {
        return registry.createTopic(requireNonNull(descriptor), connection);
    }
}
