package com.williamcallahan.omnibus_engine.repository;

import com.williamcallahan.omnibus_engine.model.VirtualBook;
import com.williamcallahan.omnibus_engine.model.VirtualBookWithOmnibus;

import java.util.List;
import java.util.Optional;

/**
 * Storage of the virtual books carved out of omnibus containers.
 * Records are created and replaced by a scan and removed together with their omnibus.
 */
public interface VirtualBookRepository {

    Optional<VirtualBook> findById(String id);

    /**
     * Resolves a virtual book together with the omnibus it belongs to.
     * Empty when either record is missing.
     */
    Optional<VirtualBookWithOmnibus> findWithOmnibus(String id);

    /**
     * Virtual books of one omnibus ordered by their ordinal.
     */
    List<VirtualBook> findByOmnibusId(String omnibusId);

    /**
     * Atomically replaces every stored virtual book of the omnibus with the given ones.
     */
    void replaceForOmnibus(String omnibusId, List<VirtualBook> virtualBooks);

    int deleteByOmnibusId(String omnibusId);

    boolean existsByOmnibusId(String omnibusId);
}
