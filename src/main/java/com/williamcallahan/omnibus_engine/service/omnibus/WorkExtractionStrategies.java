/**
 * Partitioning algorithms that turn a classified table of contents into an ordered list of works
 *
 * @author William Callahan
 *
 * Features:
 * - One strategy per TOC shape, looked up from an EnumMap built with an exhaustive switch
 * - Spine-based fallback so a non-empty container always yields works
 * - Container metadata merged into every work, with strategy-specific keys layered on top
 */
package com.williamcallahan.omnibus_engine.service.omnibus;

import com.williamcallahan.omnibus_engine.model.TocEntry;
import com.williamcallahan.omnibus_engine.model.Work;
import com.williamcallahan.omnibus_engine.service.epub.ContainerMetadataReader;
import com.williamcallahan.omnibus_engine.types.TocType;
import com.williamcallahan.omnibus_engine.types.WorkType;
import com.williamcallahan.omnibus_engine.util.TitleNormalizer;
import com.williamcallahan.omnibus_engine.util.ValidationUtils;
import com.williamcallahan.omnibus_engine.util.WorkTypeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class WorkExtractionStrategies {

    private static final Logger logger = LoggerFactory.getLogger(WorkExtractionStrategies.class);

    public static final String AUTHOR_KEY = "author";
    public static final String SECTION_KEY = "section";
    static final String SHAKESPEARE_AUTHOR = "William Shakespeare";

    /**
     * Partitions a table of contents of a known shape.
     */
    @FunctionalInterface
    interface Strategy {
        List<Work> extract(List<TocEntry> toc, Map<String, String> containerMetadata);
    }

    private final Map<TocType, Strategy> strategies = new EnumMap<>(TocType.class);

    public WorkExtractionStrategies() {
        for (TocType type : TocType.values()) {
            strategies.put(type, strategyFor(type));
        }
    }

    private Strategy strategyFor(TocType type) {
        return switch (type) {
            case SHAKESPEARE -> this::shakespeare;
            case DELPHI_CLASSICS -> this::delphiClassics;
            case GENERIC -> this::generic;
            case UNKNOWN -> (toc, metadata) -> List.of();
        };
    }

    /**
     * Runs the strategy registered for the given shape. May return an empty list,
     * in which case the caller falls back to {@link #fallback(List, Map)}.
     */
    public List<Work> extract(TocType type, List<TocEntry> toc, Map<String, String> containerMetadata) {
        return strategies.get(type).extract(toc, containerMetadata == null ? Map.of() : containerMetadata);
    }

    /**
     * One work per top-level entry, attributed to Shakespeare. Untitled entries are skipped
     * and positions keep the entry's index in the TOC.
     */
    List<Work> shakespeare(List<TocEntry> toc, Map<String, String> containerMetadata) {
        logger.info("Partitioning Shakespeare-style table of contents with {} entries", toc.size());
        String collectionTitle = containerMetadata.get(ContainerMetadataReader.TITLE);
        List<Work> works = new ArrayList<>();
        for (int i = 0; i < toc.size(); i++) {
            TocEntry entry = toc.get(i);
            if (entry.title() == null) {
                continue;
            }
            String title = TitleNormalizer.normalize(entry.title());
            works.add(new Work(title, entry.href(), i + 1,
                    WorkTypeClassifier.classify(title, collectionTitle),
                    merge(containerMetadata, AUTHOR_KEY, SHAKESPEARE_AUTHOR)));
        }
        return works;
    }

    /**
     * One work per child of each top-level section. Positions restart at 1 in every section.
     */
    List<Work> delphiClassics(List<TocEntry> toc, Map<String, String> containerMetadata) {
        logger.info("Partitioning Delphi Classics table of contents with {} sections", toc.size());
        List<Work> works = new ArrayList<>();
        for (TocEntry section : toc) {
            String sectionTitle = section.title() == null ? "" : section.title();
            List<TocEntry> children = section.children();
            for (int i = 0; i < children.size(); i++) {
                TocEntry child = children.get(i);
                works.add(new Work(titleOrPlaceholder(child.title(), i + 1), child.href(), i + 1,
                        WorkType.DELPHI_CHAPTER,
                        merge(containerMetadata, SECTION_KEY, sectionTitle)));
            }
        }
        return works;
    }

    /**
     * One work per top-level entry with container metadata only.
     */
    List<Work> generic(List<TocEntry> toc, Map<String, String> containerMetadata) {
        logger.info("Partitioning generic table of contents with {} entries", toc.size());
        String collectionTitle = containerMetadata.get(ContainerMetadataReader.TITLE);
        List<Work> works = new ArrayList<>();
        for (int i = 0; i < toc.size(); i++) {
            TocEntry entry = toc.get(i);
            String title = titleOrPlaceholder(entry.title(), i + 1);
            works.add(new Work(title, entry.href(), i + 1,
                    WorkTypeClassifier.classify(title, collectionTitle),
                    containerMetadata));
        }
        return works;
    }

    /**
     * One work per spine document, ignoring the table of contents entirely.
     */
    public List<Work> fallback(List<String> spine, Map<String, String> containerMetadata) {
        if (spine == null || spine.isEmpty()) {
            return List.of();
        }
        logger.info("Falling back to spine partitioning over {} documents", spine.size());
        Map<String, String> metadata = containerMetadata == null ? Map.of() : containerMetadata;
        List<Work> works = new ArrayList<>(spine.size());
        for (int i = 0; i < spine.size(); i++) {
            works.add(new Work("Work " + (i + 1), spine.get(i), i + 1, WorkType.OTHER, metadata));
        }
        return works;
    }

    private static String titleOrPlaceholder(String rawTitle, int position) {
        String normalized = TitleNormalizer.normalize(rawTitle);
        return ValidationUtils.hasText(normalized) ? normalized : "Work " + position;
    }

    private static Map<String, String> merge(Map<String, String> base, String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(base);
        merged.put(key, value);
        return merged;
    }
}
