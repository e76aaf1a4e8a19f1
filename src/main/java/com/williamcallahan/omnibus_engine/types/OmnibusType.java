package com.williamcallahan.omnibus_engine.types;

/**
 * Result of metadata-based omnibus detection.
 */
public enum OmnibusType {
    DELPHI_CLASSICS,
    GENERIC_OMNIBUS,
    NONE;

    public boolean isOmnibus() {
        return this != NONE;
    }
}
