package org.zalando.rxkafka;

import java.util.Map;
import java.util.Optional;

import org.zalando.rxkafka.conf.TopicConf;
import org.zalando.rxkafka.domain.TopicMetadata;

import io.reactivex.Observable;

/**
 * A client connection that owns topics.
 *
 * <p>Topics only ever read from their connection. All state changes happen through the connection itself, which is
 * responsible for their thread safety.</p>
 */
public interface Connection {

    /**
     * @return  the name of this connection, used for logging and in {@link TopicHandle topic handles}
     */
    String getName();

    /**
     * Whether network operations are currently permitted. Must be a cheap, non-blocking read.
     */
    boolean isConnected();

    /**
     * Returns the topic configuration defaults currently configured on this connection. Keys that aren't topic
     * properties are ignored by topics. Values are not validated by the connection.
     *
     * @return  a snapshot of the current defaults, never {@code null}
     */
    Map<String, String> getTopicDefaults();

    /**
     * Creates the native topic object for {@code name}.
     *
     * @throws  NullPointerException   if at least one of the parameters is {@code null}
     * @throws  IllegalStateException  if this connection is closed
     */
    TopicHandle createTopicHandle(TopicName name, TopicConf conf);

    /**
     * @return  the most recent cluster metadata for the given topic, or {@link Optional#empty() empty} if nothing is
     *          known about it
     */
    Optional<TopicMetadata> getMetadata(TopicName name);

    /**
     * Emits the current state upon subscription, followed by every state change. Completes after emitting
     * {@link ConnectionState#CLOSED}.
     */
    Observable<ConnectionState> states();
}
