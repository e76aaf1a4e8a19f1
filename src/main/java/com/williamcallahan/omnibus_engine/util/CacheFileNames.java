package com.williamcallahan.omnibus_engine.util;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Deterministic file names for extracted works in the local cache directory.
 */
public final class CacheFileNames {

    public static final String EXTRACTED_EXTENSION = ".epub";
    public static final String TEMP_EXTENSION = ".part";
    public static final String SOURCE_STAMP_EXTENSION = ".source";

    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[^A-Za-z0-9._-]");

    private CacheFileNames() {
        // Utility class
    }

    /**
     * Builds {@code <omnibus-basename>-<virtualBookId>.epub}.
     * Characters outside {@code [A-Za-z0-9._-]} are replaced so an id can never escape the cache directory.
     *
     * @param omnibusFile backing file of the omnibus
     * @param virtualBookId id of the virtual book being extracted
     */
    public static String extractedFileName(Path omnibusFile, String virtualBookId) {
        return sanitize(baseName(omnibusFile)) + "-" + sanitize(virtualBookId) + EXTRACTED_EXTENSION;
    }

    public static boolean isTempFile(Path file) {
        return file.getFileName().toString().endsWith(TEMP_EXTENSION);
    }

    /**
     * Name of the file next to an extraction that records which version of the omnibus it was sliced from.
     */
    public static String sourceStampFileName(String extractedFileName) {
        return extractedFileName + SOURCE_STAMP_EXTENSION;
    }

    public static boolean isSourceStampFile(Path file) {
        return file.getFileName().toString().endsWith(SOURCE_STAMP_EXTENSION);
    }

    /**
     * Inverse of {@link #sourceStampFileName(String)}.
     */
    public static String extractedFileNameOfStamp(Path stampFile) {
        String name = stampFile.getFileName().toString();
        return name.substring(0, name.length() - SOURCE_STAMP_EXTENSION.length());
    }

    static String baseName(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static String sanitize(String value) {
        if (value == null || value.isEmpty()) {
            return "_";
        }
        String cleaned = UNSAFE_CHARACTERS.matcher(value).replaceAll("_");
        // No hidden files
        return cleaned.startsWith(".") ? "_" + cleaned.substring(1) : cleaned;
    }
}
