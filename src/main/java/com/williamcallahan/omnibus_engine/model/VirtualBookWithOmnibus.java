package com.williamcallahan.omnibus_engine.model;

/**
 * A virtual book together with the container record it was carved out of.
 */
public record VirtualBookWithOmnibus(VirtualBook virtualBook, OmnibusBook omnibus) {
}
