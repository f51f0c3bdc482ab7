package com.quakesentinel.collectors.p2pquake;

/**
 * A feed response that could not be interpreted: wrong content type, broken JSON or a record missing
 * required fields.
 */
public class FeedFormatException extends RuntimeException {
    public FeedFormatException(String message) {
        super(message);
    }

    public FeedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
