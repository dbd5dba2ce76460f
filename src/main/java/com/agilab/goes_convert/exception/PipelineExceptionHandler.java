package com.agilab.goes_convert.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Classifies and logs per-file pipeline failures.
 */
@Slf4j
@Component
public class PipelineExceptionHandler {

    public String getErrorType(PipelineException exception) {
        if (exception instanceof MalformedPathException) {
            return "MALFORMED_PATH";
        } else if (exception instanceof SourceNotReadyException) {
            return "SOURCE_NOT_READY";
        } else if (exception instanceof ExternalToolException) {
            return "EXTERNAL_TOOL";
        }
        return "WRITE_ERROR";
    }

    public void logException(PipelineException exception) {
        var errorType = getErrorType(exception);
        var filePath = exception.getFilePath();

        if (exception instanceof SourceNotReadyException || exception instanceof ExternalToolException) {
            log.warn("[{}] {} - {}", errorType, filePath, exception.getMessage());
        } else {
            log.error("[{}] {} - {}", errorType, filePath, exception.getMessage(), exception.getCause());
        }
    }
}
