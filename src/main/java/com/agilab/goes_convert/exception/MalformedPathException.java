package com.agilab.goes_convert.exception;

/**
 * Exception thrown when a source path does not follow the goestools layout.
 */
public final class MalformedPathException extends RuntimeException implements PipelineException {
    private final String filePath;

    public MalformedPathException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }

    public MalformedPathException(String filePath, String message) {
        super(message);
        this.filePath = filePath;
    }

    @Override
    public String getFilePath() {
        return filePath;
    }
}
