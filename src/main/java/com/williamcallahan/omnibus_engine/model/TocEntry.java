package com.williamcallahan.omnibus_engine.model;

import java.util.List;

/**
 * Node of an EPUB table of contents as parsed from the NCX or navigation document.
 *
 * @param title entry label, may be null when the source omits it
 * @param href archive-relative href of the target document, fragment included, may be null
 * @param children nested entries in document order
 */
public record TocEntry(String title, String href, List<TocEntry> children) {

    public TocEntry {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static TocEntry leaf(String title, String href) {
        return new TocEntry(title, href, List.of());
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
