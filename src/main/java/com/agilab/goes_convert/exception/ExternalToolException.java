package com.agilab.goes_convert.exception;

/**
 * Exception thrown when the image tool fails, times out or cannot be started.
 */
public final class ExternalToolException extends RuntimeException implements PipelineException {
    private final String filePath;

    public ExternalToolException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }

    public ExternalToolException(String filePath, String message) {
        super(message);
        this.filePath = filePath;
    }

    @Override
    public String getFilePath() {
        return filePath;
    }
}
