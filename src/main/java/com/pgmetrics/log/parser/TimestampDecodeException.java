package com.pgmetrics.log.parser;

/**
 * A timestamp captured by the prefix pattern could not be decoded.
 */
public class TimestampDecodeException extends Exception {

    private static final long serialVersionUID = 1L;

    public TimestampDecodeException(String message) {
        super(message);
    }

    public TimestampDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
