/**
 * Scheduler for evicting old extracted works from the local cache
 * - Runs at a fixed delay configured by app.omnibus.cache.cleanup-interval
 * - Removes files older than app.omnibus.cache.max-age-hours
 * - Never lets a failure escape into the scheduling thread
 *
 * @author William Callahan
 */
package com.williamcallahan.omnibus_engine.scheduler;

import com.williamcallahan.omnibus_engine.config.OmnibusConfigurationProperties;
import com.williamcallahan.omnibus_engine.service.content.SubdocumentExtractionService;
import com.williamcallahan.omnibus_engine.types.CacheCleanupSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class OmnibusCacheCleanupScheduler {

    private static final Logger logger = LoggerFactory.getLogger(OmnibusCacheCleanupScheduler.class);

    private final SubdocumentExtractionService extractionService;
    private final OmnibusConfigurationProperties properties;

    public OmnibusCacheCleanupScheduler(SubdocumentExtractionService extractionService,
                                        OmnibusConfigurationProperties properties) {
        this.extractionService = extractionService;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${app.omnibus.cache.cleanup-interval:PT6H}",
               initialDelayString = "${app.omnibus.cache.cleanup-initial-delay:PT5M}")
    public void cleanupExtractedWorks() {
        if (!properties.getCache().isCleanupEnabled()) {
            logger.debug("Omnibus cache cleanup disabled via configuration");
            return;
        }
        long start = System.currentTimeMillis();
        try {
            CacheCleanupSummary summary = extractionService.cleanupCache(properties.getCache().getMaxAgeHours());
            logger.info("Omnibus cache cleanup finished in {} ms: scanned={}, deleted={}, failed={}, inFlight={}",
                    System.currentTimeMillis() - start, summary.scanned(), summary.deleted(),
                    summary.failed(), summary.skippedInFlight());
        } catch (Exception e) {
            logger.error("Omnibus cache cleanup failed: {}", e.getMessage(), e);
        }
    }
}
