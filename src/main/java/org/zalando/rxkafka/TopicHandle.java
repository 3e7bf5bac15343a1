package org.zalando.rxkafka;

import static java.util.Objects.requireNonNull;

import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.MoreObjects;
import com.google.common.primitives.Longs;

/**
 * Opaque reference to the client's native topic object. Only the {@link Connection} that created a handle knows how
 * to use it.
 */
public final class TopicHandle {

    private static final AtomicLong IDS = new AtomicLong();

    private final long id;
    private final TopicName topic;
    private final String connectionName;

    private TopicHandle(final long id, final TopicName topic, final String connectionName) {
        this.id = id;
        this.topic = topic;
        this.connectionName = connectionName;
    }

    /**
     * Allocates a new, process-unique handle.
     *
     * @throws  NullPointerException  if at least one of the parameters is {@code null}
     */
    public static TopicHandle allocate(final TopicName topic, final String connectionName) {
        return new TopicHandle(IDS.incrementAndGet(), requireNonNull(topic), requireNonNull(connectionName));
    }

    public long getId() {
        return id;
    }

    public TopicName getTopic() {
        return topic;
    }

    public String getConnectionName() {
        return connectionName;
    }

    @Override
    public boolean equals(final Object obj) {
        return obj == this || (obj instanceof TopicHandle && id == ((TopicHandle) obj).id);
    }

    @Override
    public int hashCode() {
        return Longs.hashCode(id);
    }

    @Override
    public String toString() {
        return
            MoreObjects.toStringHelper(this)                  //
                       .add("id", id)                         //
                       .add("topic", topic)                   //
                       .add("connection", connectionName)     //
                       .toString();
    }
}
