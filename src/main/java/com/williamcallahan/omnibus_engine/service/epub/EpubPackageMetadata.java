package com.williamcallahan.omnibus_engine.service.epub;

import java.util.List;

/**
 * Dublin Core metadata of an EPUB package document. Every list keeps document order.
 */
public record EpubPackageMetadata(
    List<String> titles,
    List<String> creators,
    List<String> descriptions,
    String language,
    List<String> publishers,
    List<String> identifiers,
    List<String> dates,
    List<String> subjects,
    List<String> rights
) {

    public EpubPackageMetadata {
        titles = copy(titles);
        creators = copy(creators);
        descriptions = copy(descriptions);
        publishers = copy(publishers);
        identifiers = copy(identifiers);
        dates = copy(dates);
        subjects = copy(subjects);
        rights = copy(rights);
    }

    public static EpubPackageMetadata empty() {
        return new EpubPackageMetadata(null, null, null, null, null, null, null, null, null);
    }

    public String firstTitle() {
        return titles.isEmpty() ? null : titles.get(0);
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
