package org.zalando.rxkafka;

import static java.util.Objects.requireNonNull;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Indicates that a topic was requested with a configuration that differs from the one of an existing topic with the
 * same name on the same connection.
 */
@SuppressWarnings("serial")
public class TopicConflictException extends IllegalStateException {

    private final String topic;
    private final Map<String, String> existing;
    private final Map<String, String> requested;

    public TopicConflictException(final String topic, final Map<String, String> existing,
            final Map<String, String> requested) {
        this.topic = requireNonNull(topic);
        this.existing = ImmutableMap.copyOf(existing);
        this.requested = ImmutableMap.copyOf(requested);
    }

    @Override
    public String getMessage() {
        return String.format("Topic '%s' already exists with configuration %s, requested %s.", topic, existing,
                requested);
    }

    public String getTopic() {
        return topic;
    }

    public Map<String, String> getExisting() {
        return existing;
    }

    public Map<String, String> getRequested() {
        return requested;
    }
}
