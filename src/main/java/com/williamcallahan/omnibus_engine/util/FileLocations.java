package com.williamcallahan.omnibus_engine.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Converts stored library locations into local file paths.
 */
public final class FileLocations {

    private FileLocations() {
    }

    /**
     * Accepts a {@code file:} URI or a plain filesystem path. Any fragment or query is ignored.
     *
     * @throws IllegalArgumentException when the location is blank, malformed or not local
     */
    public static Path toPath(String location) {
        if (!ValidationUtils.hasText(location)) {
            throw new IllegalArgumentException("no location stored");
        }
        try {
            URI uri = URI.create(location);
            if (uri.getScheme() == null) {
                return Path.of(stripFragment(location));
            }
            if (!"file".equalsIgnoreCase(uri.getScheme())) {
                throw new IllegalArgumentException("unsupported scheme " + uri.getScheme());
            }
            return Path.of(new URI(uri.getScheme(), uri.getSchemeSpecificPart(), null));
        } catch (URISyntaxException | FileSystemNotFoundException | InvalidPathException e) {
            throw new IllegalArgumentException("malformed location " + location, e);
        }
    }

    private static String stripFragment(String location) {
        int hash = location.indexOf('#');
        return hash < 0 ? location : location.substring(0, hash);
    }
}
