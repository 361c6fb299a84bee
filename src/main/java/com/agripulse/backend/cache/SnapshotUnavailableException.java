package com.agripulse.backend.cache;

/**
 * The cache has nothing for a topic and producing it on demand failed too.
 */
public class SnapshotUnavailableException extends RuntimeException {

    private final transient TopicKey topic;

    public SnapshotUnavailableException(TopicKey topic, String message) {
        super(message);
        this.topic = topic;
    }

    public SnapshotUnavailableException(TopicKey topic, Throwable cause) {
        super("Snapshot unavailable for " + topic + ": " + cause.getMessage(), cause);
        this.topic = topic;
    }

    public TopicKey topic() {
        return topic;
    }
}
