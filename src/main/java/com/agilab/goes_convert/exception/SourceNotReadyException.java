package com.agilab.goes_convert.exception;

/**
 * Exception thrown when a source file does not become readable in time.
 */
public final class SourceNotReadyException extends RuntimeException implements PipelineException {
    private final String filePath;

    public SourceNotReadyException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }

    public SourceNotReadyException(String filePath, String message) {
        super(message);
        this.filePath = filePath;
    }

    @Override
    public String getFilePath() {
        return filePath;
    }
}
