package com.williamcallahan.omnibus_engine.service.epub;

import com.williamcallahan.omnibus_engine.model.TocEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed view of an EPUB archive: package metadata, manifest, reading order and table of contents.
 * All hrefs are archive paths; TOC hrefs may carry a fragment.
 *
 * @param name file name of the archive, used for logging
 * @param packagePath archive path of the OPF package document
 * @param metadata Dublin Core metadata
 * @param manifest manifest items keyed by archive path, in manifest order
 * @param spine archive paths of the spine items in reading order
 * @param toc top-level table of contents entries
 */
public record EpubContainer(
    String name,
    String packagePath,
    EpubPackageMetadata metadata,
    Map<String, ManifestItem> manifest,
    List<String> spine,
    List<TocEntry> toc
) {

    public EpubContainer {
        metadata = metadata == null ? EpubPackageMetadata.empty() : metadata;
        manifest = manifest == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(manifest));
        spine = spine == null ? List.of() : List.copyOf(spine);
        toc = toc == null ? List.of() : List.copyOf(toc);
    }

    public Optional<ManifestItem> manifestItem(String archivePath) {
        return Optional.ofNullable(manifest.get(archivePath));
    }
}
