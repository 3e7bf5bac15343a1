package org.zalando.rxkafka.internal;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkState;

import java.lang.ref.WeakReference;

import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.zalando.rxkafka.ConfigInvalidException;
import org.zalando.rxkafka.Connection;
import org.zalando.rxkafka.NotConnectedException;
import org.zalando.rxkafka.Topic;
import org.zalando.rxkafka.TopicHandle;
import org.zalando.rxkafka.TopicName;
import org.zalando.rxkafka.conf.ConfLookup;
import org.zalando.rxkafka.conf.ConfProperty;
import org.zalando.rxkafka.conf.TopicConf;
import org.zalando.rxkafka.domain.PartitionMetadata;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

final class DefaultTopic implements Topic {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultTopic.class);

    private final TopicName name;
    private final TopicConf conf;

    // topics never keep their connection alive
    private final WeakReference<Connection> connection;
    private final Consumer<? super DefaultTopic> onRelease;

    private volatile TopicHandle handle;
    private volatile boolean released;

    DefaultTopic(final TopicName name, final TopicConf conf, final Connection connection,
            final Consumer<? super DefaultTopic> onRelease) {
        this.name = requireNonNull(name);
        this.conf = requireNonNull(conf);
        this.connection = new WeakReference<>(requireNonNull(connection));
        this.onRelease = requireNonNull(onRelease);
    }

    @Override
    public String name() {
        return name.toString();
    }

    TopicName getTopicName() {
        return name;
    }

    TopicConf getConf() {
        return conf;
    }

    @Override
    public Optional<String> get(final String key) {
        final ConfLookup lookup = conf.get(requireNonNull(key), inheritedDefaults());
        switch (lookup.getResult()) {

            case UNKNOWN :
                return Optional.empty();

            case INVALID :
                throw new ConfigInvalidException(name(), key, lookup.getProblem());

            case OK :
                return Optional.of(lookup.getValue());

            default :
                throw new AssertionError("Unexpected lookup result: " + lookup);
        }
    }

    @Override
    public Map<String, String> getConfig() {
        final ImmutableMap.Builder<String, String> config = ImmutableMap.builder();
        for (final Map.Entry<ConfProperty, ConfLookup> entry : conf.dump(inheritedDefaults()).entrySet()) {
            final ConfLookup lookup = entry.getValue();
            switch (lookup.getResult()) {

                case INVALID :
                    throw new ConfigInvalidException(name(), entry.getKey().getName(), lookup.getProblem());

                case OK :
                    config.put(entry.getKey().getName(), lookup.getValue());
                    break;

                default :
                    break;
            }
        }

        return config.build();
    }

    @Override
    public TopicHandle toNativeHandle() {
        final Connection owner = checkConnected();

        TopicHandle current = handle;
        if (current == null) {
            synchronized (this) {
                checkState(!released, "Topic '%s' has been released.", name);
                current = handle;
                if (current == null) {
                    current = handle = owner.createTopicHandle(name, conf);
                    LOG.debug("Created native handle [{}] for topic [{}].", current, name);
                }
            }
        }

        return current;
    }

    @Override
    public boolean isPartitionAvailable(final int partition) {
        final Connection owner = checkConnected();
        return owner.getMetadata(name)                                    //
                    .flatMap(metadata -> metadata.getPartition(partition)) //
                    .map(PartitionMetadata::hasLeader)                    //
                    .orElse(false);
    }

    @Override
    public void release() {
        synchronized (this) {
            if (released) {
                return;
            }

            released = true;
            handle = null;
        }

        LOG.debug("Released topic [{}].", name);
        onRelease.accept(this);
    }

    @Override
    public boolean isReleased() {
        return released;
    }

    @VisibleForTesting
    boolean hasNativeHandle() {
        return handle != null;
    }

    // checked on every call, connections may come and go during the lifetime of a topic
    private Connection checkConnected() {
        checkState(!released, "Topic '%s' has been released.", name);

        final Connection owner = connection.get();
        if (owner == null || !owner.isConnected()) {
            throw new NotConnectedException(name());
        }

        return owner;
    }

    private Map<String, String> inheritedDefaults() {
        final Connection owner = connection.get();
        return owner == null ? ImmutableMap.of() : owner.getTopicDefaults();
    }

    @Override
    public String toString() {
        return
            MoreObjects.toStringHelper(this)                 //
                       .add("name", name)                    //
                       .add("config", conf.getOverlay())     //
                       .add("released", released)            //
                       .toString();
    }
}
