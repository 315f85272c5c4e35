package com.pgmetrics.log.prefix;

/**
 * Raised when the server's log_line_prefix is missing or cannot be turned
 * into a usable pattern.
 */
public class LogConfigurationException extends Exception {

    private static final long serialVersionUID = 1L;

    public LogConfigurationException(String message) {
        super(message);
    }

    public LogConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
