package com.pipedef.publisher;

/**
 * Thrown when the publisher is invoked with missing or invalid parameters, before any module is loaded.
 */
public final class PublisherConfigException extends RuntimeException {

    public PublisherConfigException(String message) {
        super(message);
    }
}
