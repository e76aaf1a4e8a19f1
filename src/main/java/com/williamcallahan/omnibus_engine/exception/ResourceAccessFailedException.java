package com.williamcallahan.omnibus_engine.exception;

import java.nio.file.Path;

/**
 * The extracted file exists in the cache but cannot be opened as a resource.
 * RETRYABLE: No
 */
public class ResourceAccessFailedException extends VirtualBookContentException {

    public ResourceAccessFailedException(String virtualBookId, Path file, Throwable cause) {
        super("Failed to access extracted work " + file + " for virtual book " + virtualBookId, virtualBookId, cause);
    }
}
