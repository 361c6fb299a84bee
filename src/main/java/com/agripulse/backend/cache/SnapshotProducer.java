package com.agripulse.backend.cache;

import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Mono;

/**
 * Builds one snapshot for a topic from upstream calls.
 *
 * <p>Upstream failures must be absorbed inside the producer: a failed sub-call
 * is replaced by its fallback value and the rest of the snapshot is assembled
 * from whatever succeeded. An error signal is reserved for bugs.
 */
@FunctionalInterface
public interface SnapshotProducer {

    Mono<ObjectNode> produce(TopicKey topic);
}
