package org.zalando.rxkafka;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/**
 * The name of a topic. A {@link TopicRegistry} keeps at most one unreleased {@link Topic} per connection and name;
 * names are case sensitive and compared verbatim, so {@code "Orders"} and {@code "orders"} are distinct topics.
 *
 * @see  TopicDescriptor#named(TopicName)
 */
public final class TopicName {

    private final String name;

    private TopicName(final String name) {
        checkArgument(name.length() > 0, "topic name may not be empty");
        this.name = name;
    }

    /**
     * Creates a topic name. The name is taken as is, without trimming or case folding.
     *
     * @throws  NullPointerException      if {@code name} is {@code null}
     * @throws  IllegalArgumentException  if {@code name} is empty
     */
    public static TopicName of(final String name) {
        return new TopicName(requireNonNull(name));
    }

    /**
     * @return  the name exactly as it was given to {@link #of(String)}
     */
    @Override
    public String toString() {
        return name;
    }

    @Override
    public int hashCode() {
        return Objects.hash(TopicName.class, name);
    }

    @Override
    public boolean equals(final Object obj) {
        return obj == this || (obj instanceof TopicName && name.equals(((TopicName) obj).name));
    }
}
