package com.williamcallahan.omnibus_engine.model;

import java.util.List;

/**
 * Descriptive metadata stored alongside a virtual book record.
 */
public record BookMetadata(
    String title,
    List<String> authors,
    String summary,
    String language,
    String publisher
) {

    public BookMetadata {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    public static BookMetadata empty() {
        return new BookMetadata(null, List.of(), null, null, null);
    }
}
