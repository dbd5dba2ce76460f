package com.agilab.goes_convert.exception;

/**
 * Sealed hierarchy for failures raised while processing a single source file.
 */
public sealed interface PipelineException
        permits MalformedPathException, SourceNotReadyException, ExternalToolException, FileWriteException {

    String getFilePath();
    String getMessage();
    Throwable getCause();
}
