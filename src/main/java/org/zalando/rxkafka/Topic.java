package org.zalando.rxkafka;

import java.util.Map;
import java.util.Optional;

/**
 * A topic handed out by a {@link TopicRegistry}.
 *
 * <p>Lifecycle: a topic is created, used while its connection is established, and finally {@link #release()
 * released}. The connection is checked on every network-bound operation; the name and the configuration are always
 * available.</p>
 */
public interface Topic {

    /**
     * @return  the name of this topic, exactly as it was requested
     */
    String name();

    /**
     * Looks up a configuration property of this topic. The value is resolved on every call from the topic's own
     * configuration and the defaults currently configured on its connection.
     *
     * @param   key  canonical name or alias of the property
     *
     * @return  the resolved value, or {@link Optional#empty() empty} if {@code key} is not a topic property or has no
     *          value (which includes the empty key)
     *
     * @throws  NullPointerException    if {@code key} is {@code null}
     * @throws  ConfigInvalidException  if the resolved value became invalid after this topic was created
     */
    Optional<String> get(String key);

    /**
     * Returns every configuration property that currently has a value, own properties first.
     *
     * @throws  ConfigInvalidException  if one of the values became invalid after this topic was created
     */
    Map<String, String> getConfig();

    /**
     * Returns the native handle for this topic, creating it upon first use.
     *
     * @throws  NotConnectedException  if the owning connection is gone or not established at the time of the call
     * @throws  IllegalStateException  if this topic has been released
     */
    TopicHandle toNativeHandle();

    /**
     * Whether the given partition exists and currently has a leader, according to the connection's metadata.
     *
     * @throws  NotConnectedException  if the owning connection is gone or not established at the time of the call
     * @throws  IllegalStateException  if this topic has been released
     */
    boolean isPartitionAvailable(int partition);

    /**
     * Releases this topic. Idempotent.
     */
    void release();

    boolean isReleased();
}
