package org.zalando.rxkafka;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkState;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.zalando.rxkafka.conf.TopicConf;
import org.zalando.rxkafka.domain.TopicMetadata;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import io.reactivex.Observable;
import io.reactivex.subjects.BehaviorSubject;
import io.reactivex.subjects.Subject;

/**
 * In-memory {@link Connection}. State changes are driven explicitly via {@link #connect()}, {@link #disconnect()} and
 * {@link #close()}.
 */
public final class DefaultConnection implements Connection {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultConnection.class);

    private final String name;
    private final Map<String, String> topicDefaults;
    private final ConcurrentMap<TopicName, TopicMetadata> metadata = new ConcurrentHashMap<>();
    private final Subject<ConnectionState> states;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    public static final class Builder {
        String name;
        final Map<String, String> topicDefaults = new LinkedHashMap<>();

        Builder() {
            // package private
        }

        /**
         * Required: Specifies the name of the connection being built.
         *
         * @throws  NullPointerException  if {@code name} is {@code null}
         */
        public Builder name(final String name) {
            this.name = requireNonNull(name);
            return this;
        }

        /**
         * Adds a topic configuration default.
         *
         * @throws  NullPointerException  if at least one of the parameters is {@code null}
         */
        public Builder topicDefault(final String key, final String value) {
            topicDefaults.put(requireNonNull(key), requireNonNull(value));
            return this;
        }

        /**
         * Adds all given topic configuration defaults.
         *
         * @throws  NullPointerException  if {@code defaults} is or contains {@code null}
         */
        public Builder topicDefaults(final Map<String, String> defaults) {
            defaults.forEach(this::topicDefault);
            return this;
        }

        /**
         * @throws  IllegalStateException  if no name was specified
         */
        public DefaultConnection build() {
            checkState(name != null, "No connection name provided.");
            return new DefaultConnection(this);
        }
    }

    private DefaultConnection(final Builder builder) {
        this.name = builder.name;
        this.topicDefaults = new LinkedHashMap<>(builder.topicDefaults);
        this.states = BehaviorSubject.createDefault(state).toSerialized();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public ConnectionState getState() {
        return state;
    }

    /**
     * @throws  IllegalStateException  if this connection is closed
     */
    public void connect() {
        transitionTo(ConnectionState.CONNECTED);
    }

    /**
     * @throws  IllegalStateException  if this connection is closed
     */
    public void disconnect() {
        transitionTo(ConnectionState.DISCONNECTED);
    }

    /**
     * Closes this connection. Idempotent.
     */
    public synchronized void close() {
        if (state == ConnectionState.CLOSED) {
            return;
        }

        LOG.debug("Closing connection [{}].", name);
        state = ConnectionState.CLOSED;
        states.onNext(ConnectionState.CLOSED);
        states.onComplete();
    }

    // emits while holding the monitor so that observers see transitions in order
    private synchronized void transitionTo(final ConnectionState next) {
        checkState(state != ConnectionState.CLOSED, "Connection [%s] is closed.", name);
        if (state == next) {
            return;
        }

        LOG.debug("Connection [{}] is now [{}].", name, next);
        state = next;
        states.onNext(next);
    }

    @Override
    public Map<String, String> getTopicDefaults() {
        synchronized (topicDefaults) {
            return ImmutableMap.copyOf(topicDefaults);
        }
    }

    /**
     * Sets a topic configuration default. The value isn't validated here; topics inheriting it will report it as
     * invalid when it is looked up.
     *
     * @throws  NullPointerException  if at least one of the parameters is {@code null}
     */
    public void setTopicDefault(final String key, final String value) {
        requireNonNull(key);
        requireNonNull(value);
        synchronized (topicDefaults) {
            topicDefaults.put(key, value);
        }
    }

    public void removeTopicDefault(final String key) {
        requireNonNull(key);
        synchronized (topicDefaults) {
            topicDefaults.remove(key);
        }
    }

    @Override
    public TopicHandle createTopicHandle(final TopicName topicName, final TopicConf conf) {
        requireNonNull(topicName);
        requireNonNull(conf);
        checkState(state != ConnectionState.CLOSED, "Connection [%s] is closed.", name);

        final TopicHandle handle = TopicHandle.allocate(topicName, name);
        LOG.trace("Created [{}] with [{}].", handle, conf);
        return handle;
    }

    /**
     * Replaces the cluster metadata known for a topic.
     *
     * @throws  NullPointerException  if {@code topicMetadata} is {@code null}
     */
    public void updateMetadata(final TopicMetadata topicMetadata) {
        metadata.put(TopicName.of(topicMetadata.getTopic()), topicMetadata);
    }

    @Override
    public Optional<TopicMetadata> getMetadata(final TopicName topicName) {
        return Optional.ofNullable(metadata.get(requireNonNull(topicName)));
    }

    @Override
    public Observable<ConnectionState> states() {
        return states.hide();
    }

    @Override
    public String toString() {
        return
            MoreObjects.toStringHelper(this)  //
                       .add("name", name)     //
                       .add("state", state)   //
                       .toString();
    }
}
