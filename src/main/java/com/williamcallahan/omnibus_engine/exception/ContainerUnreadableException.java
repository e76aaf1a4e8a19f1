package com.williamcallahan.omnibus_engine.exception;

/**
 * The container archive could not be opened or its package documents could not be parsed.
 * Work extraction treats this as "not an omnibus" and never lets it reach callers.
 *
 * @author William Callahan
 */
public class ContainerUnreadableException extends RuntimeException {

    private final String containerName;

    public ContainerUnreadableException(String containerName, String reason) {
        super("Unreadable container " + containerName + ": " + reason);
        this.containerName = containerName;
    }

    public ContainerUnreadableException(String containerName, String reason, Throwable cause) {
        super("Unreadable container " + containerName + ": " + reason, cause);
        this.containerName = containerName;
    }

    public String getContainerName() {
        return containerName;
    }
}
