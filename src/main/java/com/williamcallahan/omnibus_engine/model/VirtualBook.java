/**
 * Durable record of one work partitioned out of an omnibus
 *
 * @author William Callahan
 *
 * Features:
 * - Holds a weak back-reference to the owning container by id only
 * - Keeps the container location, not the location of any extracted file
 * - Carries the ordinal used for sorting works inside the omnibus
 */
package com.williamcallahan.omnibus_engine.model;

import java.time.Instant;

public record VirtualBook(
    String id,
    String omnibusId,
    String title,
    String sortTitle,
    float number,
    float numberSort,
    Instant fileLastModified,
    long fileSize,
    BookMetadata metadata,
    String url
) {

    public VirtualBook {
        metadata = metadata == null ? BookMetadata.empty() : metadata;
        sortTitle = sortTitle == null ? title : sortTitle;
    }

    /**
     * Href of the first document of the work, taken from the fragment of {@link #url()}.
     * Returns an empty string when the url carries no work href.
     */
    public String workHref() {
        if (url == null) {
            return "";
        }
        int hash = url.indexOf('#');
        return hash < 0 ? "" : url.substring(hash + 1);
    }
}
