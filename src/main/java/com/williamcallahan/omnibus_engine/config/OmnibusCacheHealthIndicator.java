/**
 * Health indicator for the extracted-work cache directory
 * Reports whether the directory exists, is writable and how many files it holds
 *
 * @author William Callahan
 */

package com.williamcallahan.omnibus_engine.config;

import com.williamcallahan.omnibus_engine.util.CacheFileNames;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

@Component("omnibusCacheHealthIndicator")
public class OmnibusCacheHealthIndicator implements HealthIndicator {

    private final Path cacheDirectory;

    public OmnibusCacheHealthIndicator(OmnibusConfigurationProperties properties) {
        this.cacheDirectory = properties.getCache().getDir();
    }

    @Override
    public Health health() {
        if (!Files.exists(cacheDirectory)) {
            // Created lazily on the first extraction
            return Health.up()
                .withDetail("omnibus_cache_status", "not_created")
                .withDetail("directory", cacheDirectory.toString())
                .build();
        }
        if (!Files.isDirectory(cacheDirectory) || !Files.isWritable(cacheDirectory)) {
            return Health.down()
                .withDetail("omnibus_cache_status", "not_writable")
                .withDetail("directory", cacheDirectory.toString())
                .build();
        }
        try (Stream<Path> files = Files.list(cacheDirectory)) {
            long count = files.filter(Files::isRegularFile)
                    .filter(file -> !CacheFileNames.isSourceStampFile(file))
                    .count();
            return Health.up()
                .withDetail("omnibus_cache_status", "available")
                .withDetail("directory", cacheDirectory.toString())
                .withDetail("files", count)
                .build();
        } catch (IOException e) {
            return Health.down(e)
                .withDetail("omnibus_cache_status", "unreadable")
                .withDetail("directory", cacheDirectory.toString())
                .build();
        }
    }
}
