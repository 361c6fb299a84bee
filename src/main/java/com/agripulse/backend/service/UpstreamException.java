package com.agripulse.backend.service;

/**
 * A third-party API answered with an error status or an unusable body.
 */
public class UpstreamException extends RuntimeException {

    private final String source;

    public UpstreamException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
