package com.williamcallahan.omnibus_engine.util;

import com.williamcallahan.omnibus_engine.types.WorkType;

import java.util.Locale;

/**
 * Infers the literary type of a work from keywords in its title.
 * Rules are evaluated in order and the first match wins.
 */
public final class WorkTypeClassifier {

    private WorkTypeClassifier() {
        // Utility class
    }

    /**
     * Classifies a title. Total: null or blank input yields {@link WorkType#GENERIC_ENTRY}.
     */
    public static WorkType classify(String title) {
        if (title == null || title.isBlank()) {
            return WorkType.GENERIC_ENTRY;
        }
        String lower = title.toLowerCase(Locale.ROOT);

        if (lower.contains("sonnet")) return WorkType.POEM;
        if (lower.contains("poem")) return WorkType.POEM;
        if (lower.contains("play")) return WorkType.PLAY;
        if (lower.contains("act") && lower.contains("scene")) return WorkType.PLAY;
        if (lower.contains("essay")) return WorkType.ESSAY;
        if (lower.contains("letter")) return WorkType.LETTER;
        if (lower.contains("chapter")) return WorkType.DELPHI_CHAPTER;
        if (lower.contains("short") && lower.contains("story")) return WorkType.SHORT_STORY;
        if (lower.contains("novel")) return WorkType.NOVEL;
        return WorkType.GENERIC_ENTRY;
    }

    /**
     * Classifies a title, falling back to the title of the enclosing collection
     * when the work title itself carries no keyword. A collection called
     * "Selected Poems" makes its untyped entries poems.
     *
     * @param title work title
     * @param collectionTitle title of the omnibus or section, may be null
     */
    public static WorkType classify(String title, String collectionTitle) {
        WorkType byTitle = classify(title);
        if (byTitle != WorkType.GENERIC_ENTRY) {
            return byTitle;
        }
        return classify(collectionTitle);
    }
}
