package org.zalando.rxkafka;

import static java.util.Objects.requireNonNull;

/**
 * Indicates that a configuration property of a topic became invalid after the topic was created. The topic can't be
 * used reliably any more and should be recreated.
 */
@SuppressWarnings("serial")
public class ConfigInvalidException extends RuntimeException {

    private final String topic;
    private final String key;
    private final String problem;

    public ConfigInvalidException(final String topic, final String key, final String problem) {
        this.topic = requireNonNull(topic);
        this.key = requireNonNull(key);
        this.problem = requireNonNull(problem);
    }

    @Override
    public String getMessage() {
        return String.format("Configuration of topic '%s' retroactively invalid for '%s': %s", topic, key, problem);
    }

    public String getTopic() {
        return topic;
    }

    public String getKey() {
        return key;
    }

    public String getProblem() {
        return problem;
    }
}
