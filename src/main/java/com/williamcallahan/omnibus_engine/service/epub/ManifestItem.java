package com.williamcallahan.omnibus_engine.service.epub;

import java.util.Locale;

/**
 * Entry of the OPF manifest.
 *
 * @param id manifest id
 * @param href archive path of the resource, resolved against the package document
 * @param mediaType declared media type
 * @param properties EPUB 3 properties attribute, may be empty
 */
public record ManifestItem(String id, String href, String mediaType, String properties) {

    public ManifestItem {
        mediaType = mediaType == null ? "" : mediaType.trim().toLowerCase(Locale.ROOT);
        properties = properties == null ? "" : properties.trim();
    }

    public boolean isContentDocument() {
        return mediaType.equals("application/xhtml+xml") || mediaType.equals("text/html");
    }

    public boolean isStylesheet() {
        return mediaType.equals("text/css");
    }

    public boolean isNcx() {
        return mediaType.equals("application/x-dtbncx+xml");
    }

    public boolean hasProperty(String property) {
        for (String p : properties.split("\\s+")) {
            if (p.equals(property)) {
                return true;
            }
        }
        return false;
    }
}
