package com.williamcallahan.omnibus_engine.exception;

/**
 * The virtual book, or the omnibus it belongs to, is unknown.
 * RETRYABLE: No
 */
public class VirtualBookContentNotFoundException extends VirtualBookContentException {

    public VirtualBookContentNotFoundException(String virtualBookId, String message) {
        super(message, virtualBookId, null);
    }

    public VirtualBookContentNotFoundException(String virtualBookId, String message, Throwable cause) {
        super(message, virtualBookId, cause);
    }
}
