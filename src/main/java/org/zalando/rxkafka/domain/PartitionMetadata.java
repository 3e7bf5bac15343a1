package org.zalando.rxkafka.domain;

import org.immutables.value.Value;

/**
 * Cluster metadata of a single topic partition.
 */
@Value.Immutable
public interface PartitionMetadata {

    int NO_LEADER = -1;

    int getId();

    /**
     * Id of the broker currently leading this partition, or {@link #NO_LEADER}.
     */
    @Value.Default
    default int getLeader() {
        return NO_LEADER;
    }

    default boolean hasLeader() {
        return getLeader() >= 0;
    }
}
