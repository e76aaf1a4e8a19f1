/**
 * Service for tracking omnibus extraction and cache metrics
 * Provides counters and timers for the extracted-work cache
 *
 * @author William Callahan
 */

package com.williamcallahan.omnibus_engine.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class OmnibusMetricsService {

    // Counters
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter extractionFailures;
    private final Counter extractionTimeouts;
    private final Counter evictedFiles;

    // Gauges
    private final AtomicInteger activeExtractions = new AtomicInteger(0);

    // Timers
    private final Timer slicingTimer;

    public OmnibusMetricsService(MeterRegistry meterRegistry) {
        this.cacheHits = Counter.builder("omnibus.cache.hits")
            .description("Content requests served from an already extracted file")
            .register(meterRegistry);

        this.cacheMisses = Counter.builder("omnibus.cache.misses")
            .description("Content requests that required slicing the omnibus")
            .register(meterRegistry);

        this.extractionFailures = Counter.builder("omnibus.extraction.failures")
            .description("Number of failed work extractions")
            .register(meterRegistry);

        this.extractionTimeouts = Counter.builder("omnibus.extraction.timeouts")
            .description("Number of content requests that timed out waiting for extraction")
            .register(meterRegistry);

        this.evictedFiles = Counter.builder("omnibus.cache.evicted")
            .description("Number of extracted files removed from the cache")
            .register(meterRegistry);

        Gauge.builder("omnibus.extraction.active", activeExtractions, AtomicInteger::get)
            .description("Number of extractions currently running")
            .register(meterRegistry);

        this.slicingTimer = Timer.builder("omnibus.extraction.duration")
            .description("Time spent slicing a work out of an omnibus")
            .register(meterRegistry);
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordExtractionFailure() {
        extractionFailures.increment();
    }

    public void recordExtractionTimeout() {
        extractionTimeouts.increment();
    }

    public void recordEvictions(int count) {
        if (count > 0) {
            evictedFiles.increment(count);
        }
    }

    public void extractionStarted() {
        activeExtractions.incrementAndGet();
    }

    public void extractionFinished(long durationNanos) {
        activeExtractions.decrementAndGet();
        slicingTimer.record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
