package com.williamcallahan.omnibus_engine.service.omnibus;

import com.williamcallahan.omnibus_engine.config.OmnibusConfigurationProperties;
import com.williamcallahan.omnibus_engine.model.TocEntry;
import com.williamcallahan.omnibus_engine.types.TocType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Tags the structural shape of a table of contents so the matching partitioning strategy can run.
 * The Shakespeare keyword check runs before the shape checks because complete-works layouts
 * often also look like Delphi sections.
 */
@Component
public class TocStructureClassifier {

    private final List<String> shakespeareKeywords;

    public TocStructureClassifier(OmnibusConfigurationProperties properties) {
        this.shakespeareKeywords = properties.getDetection().getShakespeareKeywords().stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Total: every input, including null and the empty TOC, yields exactly one tag.
     */
    public TocType classify(List<TocEntry> toc) {
        if (toc == null || toc.isEmpty()) {
            return TocType.UNKNOWN;
        }

        boolean hasPlayTitle = toc.stream()
                .map(entry -> entry.title() == null ? "" : entry.title().toLowerCase(Locale.ROOT))
                .anyMatch(title -> shakespeareKeywords.stream().anyMatch(title::contains));
        if (hasPlayTitle) {
            return TocType.SHAKESPEARE;
        }

        TocEntry first = toc.get(0);
        if (!first.children().isEmpty() && first.children().stream().allMatch(TocEntry::isLeaf)) {
            return TocType.DELPHI_CLASSICS;
        }

        if (toc.size() > 1) {
            return TocType.GENERIC;
        }
        return TocType.UNKNOWN;
    }
}
