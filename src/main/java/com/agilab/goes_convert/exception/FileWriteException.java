package com.agilab.goes_convert.exception;

/**
 * Raised when a derivative cannot be put on disk: creating a {@code <processDir>/<model>/<date>/<channel>}
 * folder fails, or copying the source frame into it fails. Unlike a tool failure this ends the worker.
 */
public final class FileWriteException extends RuntimeException implements PipelineException {
    private final String filePath;

    public FileWriteException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }

    public FileWriteException(String filePath, String message) {
        super(message);
        this.filePath = filePath;
    }

    @Override
    public String getFilePath() {
        return filePath;
    }
}
