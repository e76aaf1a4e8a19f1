package com.williamcallahan.omnibus_engine.exception;

/**
 * The stored location of the omnibus file is malformed or the file is missing on disk.
 * RETRYABLE: No (until the library is re-scanned)
 */
public class InvalidOmnibusReferenceException extends VirtualBookContentNotFoundException {

    private final String omnibusUrl;

    public InvalidOmnibusReferenceException(String virtualBookId, String omnibusUrl, String reason) {
        super(virtualBookId, "Invalid omnibus reference " + omnibusUrl + " for virtual book " + virtualBookId + ": " + reason);
        this.omnibusUrl = omnibusUrl;
    }

    public InvalidOmnibusReferenceException(String virtualBookId, String omnibusUrl, String reason, Throwable cause) {
        super(virtualBookId, "Invalid omnibus reference " + omnibusUrl + " for virtual book " + virtualBookId + ": " + reason, cause);
        this.omnibusUrl = omnibusUrl;
    }

    public String getOmnibusUrl() {
        return omnibusUrl;
    }
}
