package org.zalando.rxkafka.conf;

import static java.util.Objects.requireNonNull;

/**
 * Indicates that a topic configuration could not be created because one of its properties is unknown or has an
 * invalid value.
 */
@SuppressWarnings("serial")
public class InvalidConfigException extends IllegalArgumentException {

    private final String key;
    private final ConfResult result;

    public InvalidConfigException(final String key, final ConfResult result, final String message) {
        super(message);
        this.key = requireNonNull(key);
        this.result = requireNonNull(result);
    }

    public String getKey() {
        return key;
    }

    /**
     * @return  either {@link ConfResult#UNKNOWN} or {@link ConfResult#INVALID}
     */
    public ConfResult getResult() {
        return result;
    }
}
