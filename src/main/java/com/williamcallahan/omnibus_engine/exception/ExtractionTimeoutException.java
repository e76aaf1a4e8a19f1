package com.williamcallahan.omnibus_engine.exception;

import java.time.Duration;

/**
 * Extraction did not finish within the caller-supplied timeout.
 * RETRYABLE: Yes
 */
public class ExtractionTimeoutException extends ExtractionFailedException {

    private final Duration timeout;

    public ExtractionTimeoutException(String virtualBookId, Duration timeout) {
        super("Extraction of virtual book " + virtualBookId + " timed out after " + timeout.toMillis() + " ms",
              virtualBookId, null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
