package com.williamcallahan.omnibus_engine.service.epub;

import com.williamcallahan.omnibus_engine.exception.ContainerUnreadableException;

import java.nio.file.Path;

/**
 * Opens an EPUB archive and exposes its table of contents, spine and package metadata.
 */
public interface EpubContainerReader {

    /**
     * @param epubFile archive on the local filesystem
     * @return the parsed container
     * @throws ContainerUnreadableException when the archive or its package documents cannot be read
     */
    EpubContainer open(Path epubFile);
}
