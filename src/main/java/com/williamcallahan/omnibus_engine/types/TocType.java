package com.williamcallahan.omnibus_engine.types;

/**
 * Structural shape of an omnibus table of contents.
 * Derived on every extraction run and never persisted.
 *
 * @author William Callahan
 */
public enum TocType {
    /** Complete-works layout where plays are top-level entries */
    SHAKESPEARE,
    /** Sections whose children are the individual works */
    DELPHI_CLASSICS,
    /** Every top-level entry is a work */
    GENERIC,
    /** Could not determine a structure; spine fallback applies */
    UNKNOWN
}
