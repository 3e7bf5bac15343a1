package org.zalando.rxkafka.conf;

/**
 * Outcome of setting or looking up a topic configuration property.
 */
public enum ConfResult {

    /**
     * The property is known and its value is valid.
     */
    OK,

    /**
     * The property is not a topic property, or has no value.
     */
    UNKNOWN,

    /**
     * The property is known, but its value is not valid.
     */
    INVALID
}
