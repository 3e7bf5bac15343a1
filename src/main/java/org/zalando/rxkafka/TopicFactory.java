package org.zalando.rxkafka;

import java.util.Map;

/**
 * Creates ready-to-use {@link Topic topics} on a fixed connection.
 */
public interface TopicFactory {

    /**
     * Creates a topic for the given {@code descriptor}.
     *
     * @throws  NullPointerException  if {@code descriptor} is {@code null}
     *
     * @see     TopicRegistry#createTopic(TopicDescriptor, Connection)
     */
    Topic create(TopicDescriptor descriptor);

    default Topic create(final String name, final Map<String, String> config) {
        return create(TopicDescriptor.named(name).config(config).build());
    }
}
