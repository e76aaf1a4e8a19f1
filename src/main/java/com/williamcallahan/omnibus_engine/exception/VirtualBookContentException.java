package com.williamcallahan.omnibus_engine.exception;

/**
 * Base type for failures while materializing the content of a virtual book.
 * Subclasses let the file-serving layer tell "not found" apart from internal errors.
 *
 * @author William Callahan
 */
public abstract class VirtualBookContentException extends RuntimeException {

    private final String virtualBookId;

    protected VirtualBookContentException(String message, String virtualBookId, Throwable cause) {
        super(message, cause);
        this.virtualBookId = virtualBookId;
    }

    public String getVirtualBookId() {
        return virtualBookId;
    }
}
