/**
 * Turns a scanned library file into the virtual book records of its works
 *
 * @author William Callahan
 *
 * Features:
 * - Skips anything that is not an EPUB
 * - Opens the container once for both detection and partitioning
 * - Derives stable virtual book ids so re-scans keep ids for unchanged works
 * - Replaces the stored records of an omnibus as a whole and evicts their cached extractions
 */
package com.williamcallahan.omnibus_engine.service.omnibus;

import com.williamcallahan.omnibus_engine.exception.ContainerUnreadableException;
import com.williamcallahan.omnibus_engine.model.BookMetadata;
import com.williamcallahan.omnibus_engine.model.OmnibusBook;
import com.williamcallahan.omnibus_engine.model.VirtualBook;
import com.williamcallahan.omnibus_engine.model.Work;
import com.williamcallahan.omnibus_engine.repository.VirtualBookRepository;
import com.williamcallahan.omnibus_engine.service.content.SubdocumentExtractionService;
import com.williamcallahan.omnibus_engine.service.epub.ContainerMetadataReader;
import com.williamcallahan.omnibus_engine.service.epub.EpubContainer;
import com.williamcallahan.omnibus_engine.service.epub.EpubContainerReader;
import com.williamcallahan.omnibus_engine.types.OmnibusType;
import com.williamcallahan.omnibus_engine.types.ScanResult;
import com.williamcallahan.omnibus_engine.util.FileLocations;
import com.williamcallahan.omnibus_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
public class OmnibusScanService {

    private static final Logger logger = LoggerFactory.getLogger(OmnibusScanService.class);

    static final String SUMMARY_PREFIX = "Part of omnibus: ";

    private final EpubContainerReader containerReader;
    private final OmnibusDetector omnibusDetector;
    private final OmnibusWorkExtractor workExtractor;
    private final VirtualBookRepository virtualBookRepository;
    private final SubdocumentExtractionService extractionService;

    public OmnibusScanService(EpubContainerReader containerReader,
                              OmnibusDetector omnibusDetector,
                              OmnibusWorkExtractor workExtractor,
                              VirtualBookRepository virtualBookRepository,
                              SubdocumentExtractionService extractionService) {
        this.containerReader = containerReader;
        this.omnibusDetector = omnibusDetector;
        this.workExtractor = workExtractor;
        this.virtualBookRepository = virtualBookRepository;
        this.extractionService = extractionService;
    }

    public ScanResult scan(OmnibusBook omnibus) {
        if (!omnibus.isEpub()) {
            logger.debug("Skipping {}: media type {} is not EPUB", omnibus.name(), omnibus.mediaType());
            return ScanResult.notAnOmnibus(omnibus.id());
        }

        Path file;
        EpubContainer container;
        try {
            file = FileLocations.toPath(omnibus.url());
            container = containerReader.open(file);
        } catch (IllegalArgumentException | ContainerUnreadableException e) {
            logger.error("Cannot scan {} for works: {}", omnibus.name(), e.getMessage(), e);
            return ScanResult.notAnOmnibus(omnibus.id());
        }

        OmnibusType omnibusType = omnibusDetector.detect(container);
        List<String> previousIds = virtualBookRepository.findByOmnibusId(omnibus.id()).stream()
                .map(VirtualBook::id)
                .collect(Collectors.toList());

        if (!omnibusType.isOmnibus()) {
            if (!previousIds.isEmpty()) {
                extractionService.evictExtractions(file, previousIds);
                int removed = virtualBookRepository.deleteByOmnibusId(omnibus.id());
                logger.info("{} is no longer detected as an omnibus, removed {} virtual books", omnibus.name(), removed);
            }
            return ScanResult.notAnOmnibus(omnibus.id());
        }

        List<Work> works = workExtractor.extractWorks(container);
        List<VirtualBook> virtualBooks = new ArrayList<>(works.size());
        for (Work work : works) {
            if (!ValidationUtils.hasText(work.href())) {
                logger.debug("Skipping work '{}' of {}: no document to slice", work.title(), omnibus.name());
                continue;
            }
            virtualBooks.add(toVirtualBook(omnibus, work, virtualBooks.size() + 1));
        }

        extractionService.evictExtractions(file, previousIds);
        virtualBookRepository.replaceForOmnibus(omnibus.id(), virtualBooks);
        logger.info("Scanned {} as {}: {} virtual books", omnibus.name(), omnibusType, virtualBooks.size());
        return new ScanResult(omnibus.id(), omnibusType, virtualBooks.size());
    }

    static VirtualBook toVirtualBook(OmnibusBook omnibus, Work work, int ordinal) {
        return new VirtualBook(
                virtualBookId(omnibus.id(), work),
                omnibus.id(),
                work.title(),
                work.title(),
                ordinal,
                ordinal,
                omnibus.fileLastModified(),
                omnibus.fileSize(),
                toBookMetadata(omnibus, work),
                omnibus.url() + "#" + work.href());
    }

    /**
     * Name-based UUID of the omnibus id, the work's position path and its href.
     * Stable across re-scans of unchanged content.
     */
    static String virtualBookId(String omnibusId, Work work) {
        String section = work.metadata().get(WorkExtractionStrategies.SECTION_KEY);
        String positionPath = ValidationUtils.hasText(section) ? section + "/" + work.position() : String.valueOf(work.position());
        String key = omnibusId + ":" + positionPath + ":" + work.href();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    static BookMetadata toBookMetadata(OmnibusBook omnibus, Work work) {
        Map<String, String> metadata = work.metadata();
        List<String> authors = new ArrayList<>();
        String author = metadata.get(WorkExtractionStrategies.AUTHOR_KEY);
        if (ValidationUtils.hasText(author)) {
            authors.add(author);
        } else {
            for (int i = 0; metadata.containsKey(ContainerMetadataReader.AUTHOR_PREFIX + i); i++) {
                authors.add(metadata.get(ContainerMetadataReader.AUTHOR_PREFIX + i));
            }
        }

        String summary = SUMMARY_PREFIX + omnibus.name();
        String description = metadata.get(ContainerMetadataReader.DESCRIPTION);
        if (ValidationUtils.hasText(description)) {
            summary = summary + "\n\n" + description;
        }
        return new BookMetadata(
                work.title(),
                authors,
                summary,
                metadata.get(ContainerMetadataReader.LANGUAGE),
                metadata.get(ContainerMetadataReader.PUBLISHER));
    }
}
