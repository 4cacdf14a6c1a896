package com.cassandra.log.parser;

/**
 * Raised when extraction fails above the level of an individual line.
 */
public class LogParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LogParseException(String message) {
        super(message);
    }

    public LogParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
