package com.williamcallahan.omnibus_engine.model;

import com.williamcallahan.omnibus_engine.types.WorkType;

import java.util.Map;

/**
 * A single logical work partitioned out of an omnibus.
 * Produced per extraction run; the scan pipeline persists it as a {@link VirtualBook}.
 *
 * @param title normalized title
 * @param href archive-relative href of the first document of the work, fragment included
 * @param position 1-based ordinal, scoped to the section for Delphi-style layouts
 * @param type inferred literary type
 * @param metadata container metadata merged with work-specific keys
 */
public record Work(String title, String href, int position, WorkType type, Map<String, String> metadata) {

    public Work {
        if (position < 1) {
            throw new IllegalArgumentException("Work position must be >= 1, got " + position);
        }
        title = title == null ? "" : title;
        href = href == null ? "" : href;
        type = type == null ? WorkType.GENERIC_ENTRY : type;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
