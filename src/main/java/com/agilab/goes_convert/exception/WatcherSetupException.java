package com.agilab.goes_convert.exception;

/**
 * Thrown when the watch root cannot be monitored. Unlike {@link PipelineException} this is fatal for the monitor.
 */
public class WatcherSetupException extends RuntimeException {

    public WatcherSetupException(String message) {
        super(message);
    }

    public WatcherSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
