package com.williamcallahan.omnibus_engine.exception;

/**
 * Slicing the work out of the omnibus failed. Any partial output has already been removed.
 * RETRYABLE: Yes (the next request starts a fresh extraction)
 */
public class ExtractionFailedException extends VirtualBookContentException {

    public ExtractionFailedException(String virtualBookId, Throwable cause) {
        super("Failed to extract virtual book " + virtualBookId + " from omnibus"
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""),
              virtualBookId, cause);
    }

    protected ExtractionFailedException(String message, String virtualBookId, Throwable cause) {
        super(message, virtualBookId, cause);
    }
}
