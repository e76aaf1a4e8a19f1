package com.williamcallahan.omnibus_engine.service.epub;

import com.williamcallahan.omnibus_engine.model.Work;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a standalone archive holding only the content that belongs to one work.
 */
public interface ArchiveSlicer {

    /**
     * @param work work to carve out; its href names the first document of the work
     * @param sourceContainer omnibus archive, opened read-only
     * @param destination file to write; created or truncated
     * @throws IOException when the source cannot be read, the work is not found in it,
     *                     the destination cannot be written, or the thread is interrupted
     */
    void extract(Work work, Path sourceContainer, Path destination) throws IOException;
}
