package com.williamcallahan.omnibus_engine.types;

/**
 * Result of scanning one library file for omnibus content.
 *
 * @param omnibusId id of the scanned container record
 * @param omnibusType detected omnibus type, {@link OmnibusType#NONE} for regular books
 * @param virtualBooksCreated number of virtual book records now stored for the container
 */
public record ScanResult(String omnibusId, OmnibusType omnibusType, int virtualBooksCreated) {

    public static ScanResult notAnOmnibus(String omnibusId) {
        return new ScanResult(omnibusId, OmnibusType.NONE, 0);
    }
}
