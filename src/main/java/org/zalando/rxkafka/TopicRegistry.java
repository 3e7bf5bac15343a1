package org.zalando.rxkafka;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.zalando.rxkafka.conf.InvalidConfigException;

/**
 * Hands out {@link Topic topics}, at most one per connection and topic name.
 */
public interface TopicRegistry {

    /**
     * Creates a topic, deferring the connection check to its first use.
     *
     * @throws  NullPointerException      if at least one of the parameters is {@code null}
     * @throws  IllegalArgumentException  if {@code name} is empty or {@code config} is malformed
     * @throws  TopicConflictException    if a topic with the same name but a different configuration already exists
     *                                    on {@code connection}
     *
     * @see     #createTopic(TopicDescriptor, Connection)
     */
    default Topic createTopic(final String name, final Map<String, String> config, final Connection connection) {
        return createTopic(TopicDescriptor.named(name).config(config).build(), connection);
    }

    /**
     * Creates the topic described by {@code descriptor} on {@code connection}. If the same topic with an equal
     * configuration already exists on {@code connection}, the existing topic is returned.
     *
     * @throws  NullPointerException          if at least one of the parameters is {@code null}
     * @throws  InvalidConfigException        if the configuration is malformed
     * @throws  TopicConflictException        if a topic with the same name but a different configuration already
     *                                        exists on {@code connection}
     * @throws  ConnectionNotReadyException   if the descriptor requests eager validation and {@code connection} is not
     *                                        established
     */
    Topic createTopic(TopicDescriptor descriptor, Connection connection);

    /**
     * @return  the unreleased topic of the given name on {@code connection}, if any
     */
    Optional<Topic> find(Connection connection, String name);

    /**
     * @return  all unreleased topics of {@code connection}, in the order they were created
     */
    List<Topic> topics(Connection connection);
}
