package com.williamcallahan.omnibus_engine.repository;

import com.williamcallahan.omnibus_engine.model.OmnibusBook;

import java.util.Optional;

/**
 * Read access to the library records of container files.
 */
public interface OmnibusBookRepository {

    Optional<OmnibusBook> findById(String id);
}
