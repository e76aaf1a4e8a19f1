package com.williamcallahan.omnibus_engine.types;

/**
 * Literary type of a single work carved out of an omnibus.
 */
public enum WorkType {
    NOVEL,
    SHORT_STORY,
    ESSAY,
    PLAY,
    POEM,
    LETTER,
    /** Entry nested under a section heading, Delphi Classics style */
    DELPHI_CHAPTER,
    GENERIC_ENTRY,
    /** Spine document emitted by the fallback partitioner */
    OTHER
}
