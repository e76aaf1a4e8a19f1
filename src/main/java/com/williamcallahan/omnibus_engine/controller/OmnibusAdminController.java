package com.williamcallahan.omnibus_engine.controller;

import com.williamcallahan.omnibus_engine.config.OmnibusConfigurationProperties;
import com.williamcallahan.omnibus_engine.controller.support.ErrorResponseUtils;
import com.williamcallahan.omnibus_engine.service.content.SubdocumentExtractionService;
import com.williamcallahan.omnibus_engine.types.CacheCleanupSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative operations on the extracted-work cache.
 */
@RestController
@RequestMapping("/api/admin/omnibus")
@Slf4j
public class OmnibusAdminController {

    private final SubdocumentExtractionService extractionService;
    private final OmnibusConfigurationProperties properties;

    public OmnibusAdminController(SubdocumentExtractionService extractionService,
                                  OmnibusConfigurationProperties properties) {
        this.extractionService = extractionService;
        this.properties = properties;
    }

    /**
     * Triggers a cache cleanup now. Without {@code maxAgeHours} the configured age applies.
     */
    @PostMapping("/cache/cleanup")
    public ResponseEntity<?> cleanupCache(@RequestParam(required = false) Long maxAgeHours) {
        long age = maxAgeHours != null ? maxAgeHours : properties.getCache().getMaxAgeHours();
        log.info("Manual omnibus cache cleanup requested with max age {} hours", age);
        try {
            CacheCleanupSummary summary = extractionService.cleanupCache(age);
            return ResponseEntity.ok(summary);
        } catch (Exception e) {
            log.error("Manual omnibus cache cleanup failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorResponseUtils.errorBody("Cache cleanup failed", e.getMessage()));
        }
    }
}
