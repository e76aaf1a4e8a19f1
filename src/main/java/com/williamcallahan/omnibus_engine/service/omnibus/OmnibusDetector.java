package com.williamcallahan.omnibus_engine.service.omnibus;

import com.williamcallahan.omnibus_engine.config.OmnibusConfigurationProperties;
import com.williamcallahan.omnibus_engine.service.epub.EpubContainer;
import com.williamcallahan.omnibus_engine.service.epub.EpubPackageMetadata;
import com.williamcallahan.omnibus_engine.types.OmnibusType;
import com.williamcallahan.omnibus_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides from package metadata alone whether a container is an omnibus edition.
 * Publisher is the strongest signal, then title keywords, then multiple authors.
 */
@Component
public class OmnibusDetector {

    private static final Logger logger = LoggerFactory.getLogger(OmnibusDetector.class);

    private final List<Pattern> delphiPublisherPatterns;
    private final List<Pattern> omnibusTitlePatterns;

    public OmnibusDetector(OmnibusConfigurationProperties properties) {
        this.delphiPublisherPatterns = compile(properties.getDetection().getDelphiPublisherPatterns());
        this.omnibusTitlePatterns = compile(properties.getDetection().getOmnibusTitlePatterns());
    }

    public OmnibusType detect(EpubContainer container) {
        try {
            EpubPackageMetadata metadata = container.metadata();

            for (String publisher : metadata.publishers()) {
                String lower = publisher.toLowerCase(Locale.ROOT);
                if (delphiPublisherPatterns.stream().anyMatch(p -> p.matcher(lower).matches())) {
                    logger.debug("Detected Delphi Classics omnibus {} by publisher '{}'", container.name(), publisher);
                    return OmnibusType.DELPHI_CLASSICS;
                }
            }

            String title = metadata.firstTitle();
            if (ValidationUtils.hasText(title)) {
                String lower = title.toLowerCase(Locale.ROOT);
                if (omnibusTitlePatterns.stream().anyMatch(p -> p.matcher(lower).find())) {
                    logger.debug("Detected generic omnibus {} by title '{}'", container.name(), title);
                    return OmnibusType.GENERIC_OMNIBUS;
                }
            }

            long authors = metadata.creators().stream().filter(ValidationUtils::hasText).distinct().count();
            if (authors > 1) {
                logger.debug("Detected possible omnibus {} with {} authors", container.name(), authors);
                return OmnibusType.GENERIC_OMNIBUS;
            }
        } catch (RuntimeException e) {
            logger.error("Error detecting omnibus for {}: {}", container.name(), e.getMessage(), e);
        }
        return OmnibusType.NONE;
    }

    private static List<Pattern> compile(List<String> patterns) {
        return patterns.stream()
                .filter(ValidationUtils::hasText)
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toUnmodifiableList());
    }
}
