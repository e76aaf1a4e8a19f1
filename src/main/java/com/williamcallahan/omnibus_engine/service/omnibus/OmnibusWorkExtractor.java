package com.williamcallahan.omnibus_engine.service.omnibus;

import com.williamcallahan.omnibus_engine.model.Work;
import com.williamcallahan.omnibus_engine.service.epub.ContainerMetadataReader;
import com.williamcallahan.omnibus_engine.service.epub.EpubContainer;
import com.williamcallahan.omnibus_engine.service.epub.EpubContainerReader;
import com.williamcallahan.omnibus_engine.types.TocType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Splits an omnibus container into its individual works.
 * Never throws: an unreadable container or unexpected failure yields an empty list,
 * which callers treat as "not an omnibus".
 */
@Service
public class OmnibusWorkExtractor {

    private static final Logger logger = LoggerFactory.getLogger(OmnibusWorkExtractor.class);

    private final EpubContainerReader containerReader;
    private final ContainerMetadataReader metadataReader;
    private final TocStructureClassifier tocClassifier;
    private final WorkExtractionStrategies strategies;

    public OmnibusWorkExtractor(EpubContainerReader containerReader,
                                ContainerMetadataReader metadataReader,
                                TocStructureClassifier tocClassifier,
                                WorkExtractionStrategies strategies) {
        this.containerReader = containerReader;
        this.metadataReader = metadataReader;
        this.tocClassifier = tocClassifier;
        this.strategies = strategies;
    }

    public List<Work> extractWorks(Path containerFile) {
        try {
            return extractWorks(containerReader.open(containerFile));
        } catch (Exception e) {
            logger.error("Error extracting works from {}: {}", containerFile, e.getMessage(), e);
            return List.of();
        }
    }

    /**
     * Partitions an already opened container. Lets the scan pipeline reuse the container it opened for detection.
     */
    public List<Work> extractWorks(EpubContainer container) {
        try {
            Map<String, String> metadata = metadataReader.read(container);
            TocType tocType = tocClassifier.classify(container.toc());
            logger.debug("Table of contents of {} classified as {}", container.name(), tocType);

            List<Work> works = strategies.extract(tocType, container.toc(), metadata);
            if (works.isEmpty()) {
                works = strategies.fallback(container.spine(), metadata);
            }
            logger.info("Extracted {} works from {} ({})", works.size(), container.name(), tocType);
            return works;
        } catch (Exception e) {
            logger.error("Error extracting works from {}: {}", container.name(), e.getMessage(), e);
            return List.of();
        }
    }
}
