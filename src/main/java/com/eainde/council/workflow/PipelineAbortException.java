package com.eainde.council.workflow;

/** A run that could not start: unparseable input, unknown application, or a status that forbids evaluation. */
public class PipelineAbortException extends RuntimeException {

    public PipelineAbortException(String message) {
        super(message);
    }

    public PipelineAbortException(String message, Throwable cause) {
        super(message, cause);
    }
}
