package com.pickem.pickem_api.service;

/**
 * Participants or pick summaries could not be loaded, or came back malformed.
 * Thrown before any aggregation takes place.
 */
public class UpstreamFetchException extends RuntimeException {

    public UpstreamFetchException(String message) {
        super(message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
