package com.williamcallahan.omnibus_engine.service.epub;

import com.williamcallahan.omnibus_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Flattens container-level metadata into the string map merged into every extracted work.
 * Each field is read on its own; a failure drops that field and never aborts the run.
 */
@Component
public class ContainerMetadataReader {

    private static final Logger logger = LoggerFactory.getLogger(ContainerMetadataReader.class);

    public static final String TITLE = "title";
    public static final String AUTHOR_PREFIX = "author";
    public static final String AUTHORS = "authors";
    public static final String DESCRIPTION = "description";
    public static final String LANGUAGE = "language";
    public static final String PUBLISHER = "publisher";

    public Map<String, String> read(EpubContainer container) {
        Map<String, String> metadata = new LinkedHashMap<>();
        EpubPackageMetadata source = container.metadata();
        String containerName = container.name();

        readField(containerName, TITLE, () -> {
            String title = source.firstTitle();
            if (ValidationUtils.hasText(title)) {
                metadata.put(TITLE, title);
            }
        });
        readField(containerName, AUTHORS, () -> {
            List<String> authors = source.creators().stream()
                    .map(String::trim)
                    .filter(ValidationUtils::hasText)
                    .collect(Collectors.toList());
            for (int i = 0; i < authors.size(); i++) {
                metadata.put(AUTHOR_PREFIX + i, authors.get(i));
            }
            if (!authors.isEmpty()) {
                metadata.put(AUTHORS, String.join(", ", authors));
            }
        });
        readField(containerName, DESCRIPTION, () -> firstInto(source.descriptions(), v -> metadata.put(DESCRIPTION, v)));
        readField(containerName, LANGUAGE, () -> {
            if (ValidationUtils.hasText(source.language())) {
                metadata.put(LANGUAGE, source.language());
            }
        });
        readField(containerName, PUBLISHER, () -> {
            if (!source.publishers().isEmpty()) {
                metadata.put(PUBLISHER, String.join(", ", source.publishers()));
            }
        });
        return metadata;
    }

    private void readField(String containerName, String field, Runnable reader) {
        try {
            reader.run();
        } catch (RuntimeException e) {
            logger.warn("Could not read metadata field '{}' from {}: {}", field, containerName, e.getMessage(), e);
        }
    }

    private static void firstInto(List<String> values, Consumer<String> sink) {
        values.stream().filter(ValidationUtils::hasText).findFirst().ifPresent(sink);
    }
}
