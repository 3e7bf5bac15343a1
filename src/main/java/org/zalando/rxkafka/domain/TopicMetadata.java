package org.zalando.rxkafka.domain;

import java.util.List;
import java.util.Optional;

import org.immutables.value.Value;

/**
 * Cluster metadata of a topic, as last reported to a connection.
 */
@Value.Immutable
public interface TopicMetadata {

    String getTopic();

    List<PartitionMetadata> getPartitions();

    default Optional<PartitionMetadata> getPartition(final int id) {
        return getPartitions().stream().filter(partition -> partition.getId() == id).findFirst();
    }
}
