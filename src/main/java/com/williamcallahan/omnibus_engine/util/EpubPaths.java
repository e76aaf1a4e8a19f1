package com.williamcallahan.omnibus_engine.util;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Helpers for archive-relative paths inside an EPUB container.
 * All paths use forward slashes and never start with a slash.
 */
public final class EpubPaths {

    private EpubPaths() {
        // Utility class
    }

    /**
     * Directory part of an archive path including the trailing slash, or "" at the root.
     */
    public static String directoryOf(String path) {
        if (path == null) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash + 1);
    }

    /**
     * Removes a {@code #fragment} suffix.
     */
    public static String stripFragment(String href) {
        if (href == null) {
            return "";
        }
        int hash = href.indexOf('#');
        return hash < 0 ? href : href.substring(0, hash);
    }

    /**
     * Returns the fragment without the leading '#', or null when there is none.
     */
    public static String fragmentOf(String href) {
        if (href == null) {
            return null;
        }
        int hash = href.indexOf('#');
        return hash < 0 || hash == href.length() - 1 ? null : href.substring(hash + 1);
    }

    /**
     * Whether the reference points outside the archive (scheme, protocol-relative, or data URI).
     */
    public static boolean isExternal(String reference) {
        if (reference == null || reference.isBlank()) {
            return true;
        }
        String trimmed = reference.trim();
        return trimmed.startsWith("//") || trimmed.matches("^[a-zA-Z][a-zA-Z0-9+.\\-]*:.*");
    }

    /**
     * Resolves a reference found in a document at {@code baseDir} to a normalized archive path.
     * Query and fragment are dropped, percent-escapes decoded and dot segments collapsed.
     *
     * @return the archive path, or null when the reference escapes the archive root or is external
     */
    public static String resolve(String baseDir, String reference) {
        if (isExternal(reference)) {
            return null;
        }
        String ref = stripFragment(reference.trim());
        int query = ref.indexOf('?');
        if (query >= 0) {
            ref = ref.substring(0, query);
        }
        if (ref.isEmpty()) {
            return null;
        }
        ref = decode(ref);
        String combined = ref.startsWith("/") ? ref.substring(1) : (baseDir == null ? "" : baseDir) + ref;
        return normalize(combined);
    }

    /**
     * Collapses "." and ".." segments. Returns null when ".." climbs above the root.
     */
    public static String normalize(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }

    /**
     * Expresses {@code target} relative to the directory {@code fromDir}; both are archive paths.
     */
    public static String relativize(String fromDir, String target) {
        String[] from = fromDir == null || fromDir.isEmpty() ? new String[0] : fromDir.split("/");
        String[] to = target.split("/");
        int common = 0;
        while (common < from.length && common < to.length - 1 && from[common].equals(to[common])) {
            common++;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = common; i < from.length; i++) {
            sb.append("../");
        }
        for (int i = common; i < to.length; i++) {
            sb.append(to[i]);
            if (i < to.length - 1) {
                sb.append('/');
            }
        }
        return sb.toString();
    }

    private static String decode(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        try {
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
