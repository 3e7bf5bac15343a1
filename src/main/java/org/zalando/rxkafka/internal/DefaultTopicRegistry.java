package org.zalando.rxkafka.internal;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.zalando.rxkafka.Connection;
import org.zalando.rxkafka.ConnectionNotReadyException;
import org.zalando.rxkafka.ConnectionState;
import org.zalando.rxkafka.Topic;
import org.zalando.rxkafka.TopicConflictException;
import org.zalando.rxkafka.TopicDescriptor;
import org.zalando.rxkafka.TopicName;
import org.zalando.rxkafka.TopicRegistry;
import org.zalando.rxkafka.conf.TopicConf;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.MapMaker;

/**
 * Keeps track of the topics of any number of connections. Connections are only weakly referenced; once a connection
 * is {@link ConnectionState#CLOSED closed}, all of its topics are released.
 */
public final class DefaultTopicRegistry implements TopicRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultTopicRegistry.class);

    private final Map<Connection, ConnectionTopics> connections = new MapMaker().weakKeys().makeMap();

    private static final class ConnectionTopics {
        final String connectionName;
        final Map<TopicName, DefaultTopic> topics = new LinkedHashMap<>();
        boolean closed;

        ConnectionTopics(final String connectionName) {
            this.connectionName = connectionName;
        }
    }

    @Inject
    public DefaultTopicRegistry() {
        // nothing to inject
    }

    @Override
    public synchronized Topic createTopic(final TopicDescriptor descriptor, final Connection connection) {
        requireNonNull(descriptor);
        requireNonNull(connection);

        final TopicName name = descriptor.getName();
        final TopicConf conf = TopicConf.create(descriptor.getConfig(), connection.getTopicDefaults());

        if (descriptor.isValidatedEagerly() && !connection.isConnected()) {
            throw new ConnectionNotReadyException(name.toString(), connection.getName());
        }

        final ConnectionTopics owned = topicsOf(connection);
        checkState(!owned.closed, "Connection [%s] is closed.", owned.connectionName);

        final DefaultTopic existing = owned.topics.get(name);
        if (existing != null) {
            if (!existing.getConf().equals(conf)) {
                throw new TopicConflictException(name.toString(), existing.getConf().getOverlay(),
                    conf.getOverlay());
            }

            if (descriptor.isValidatedEagerly()) {
                existing.toNativeHandle();
            }

            LOG.debug("Reusing [{}] on [{}].", existing, owned.connectionName);
            return existing;
        }

        final DefaultTopic topic = new DefaultTopic(name, conf, connection, released -> remove(owned, released));
        if (descriptor.isValidatedEagerly()) {
            topic.toNativeHandle();
        }

        owned.topics.put(name, topic);
        LOG.debug("Created [{}] on [{}].", topic, owned.connectionName);
        return topic;
    }

    @Override
    public synchronized Optional<Topic> find(final Connection connection, final String name) {
        final TopicName topicName = TopicName.of(name);
        final ConnectionTopics owned = connections.get(requireNonNull(connection));
        return owned == null ? Optional.empty() : Optional.ofNullable(owned.topics.get(topicName));
    }

    @Override
    public synchronized List<Topic> topics(final Connection connection) {
        final ConnectionTopics owned = connections.get(requireNonNull(connection));
        return owned == null ? ImmutableList.of() : ImmutableList.copyOf(owned.topics.values());
    }

    private ConnectionTopics topicsOf(final Connection connection) {
        final ConnectionTopics existing = connections.get(connection);
        if (existing != null) {
            return existing;
        }

        final ConnectionTopics owned = new ConnectionTopics(connection.getName());
        connections.put(connection, owned);

        // the subscription must not capture the connection, it would never become weakly reachable otherwise
        connection.states()                                                //
                  .takeUntil(state -> state == ConnectionState.CLOSED)    //
                  .ignoreElements()                                        //
                  .subscribe(() -> closed(owned), error -> {
                      LOG.warn("State of connection [{}] failed, releasing its topics: [{}]", owned.connectionName,
                          error.getMessage(), error);
                      closed(owned);
                  });
        return owned;
    }

    private synchronized void closed(final ConnectionTopics owned) {
        if (owned.closed) {
            return;
        }

        owned.closed = true;
        connections.values().removeIf(candidate -> candidate == owned);

        final List<DefaultTopic> topics = ImmutableList.copyOf(owned.topics.values());
        LOG.debug("Connection [{}] closed, releasing [{}] topics.", owned.connectionName, topics.size());
        topics.forEach(DefaultTopic::release);
        owned.topics.clear();
    }

    private synchronized void remove(final ConnectionTopics owned, final DefaultTopic topic) {
        owned.topics.remove(topic.getTopicName(), topic);
    }
}
