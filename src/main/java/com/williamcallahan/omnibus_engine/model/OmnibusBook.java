package com.williamcallahan.omnibus_engine.model;

import java.time.Instant;

/**
 * Library record of a container file that may hold several works.
 *
 * @param id stable identifier of the library record
 * @param name display name, usually the file name without extension
 * @param url location of the backing file, a {@code file:} URI
 * @param mediaType detected media type of the file
 * @param fileLastModified last modification time of the backing file
 * @param fileSize size of the backing file in bytes
 */
public record OmnibusBook(
    String id,
    String name,
    String url,
    String mediaType,
    Instant fileLastModified,
    long fileSize
) {

    public static final String EPUB_MEDIA_TYPE = "application/epub+zip";

    public boolean isEpub() {
        return EPUB_MEDIA_TYPE.equalsIgnoreCase(mediaType);
    }
}
