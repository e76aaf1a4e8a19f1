/**
 * Materializes the content of virtual books as standalone EPUB files in a local cache
 *
 * @author William Callahan
 *
 * Features:
 * - Deterministic cache file per (omnibus, virtual book) pair
 * - At most one slicing run per cache file, concurrent requests join the running one
 * - Slices into a temporary file and renames it into place, so readers and cleanup never see partial output
 * - Caller-bounded waiting with cancellation and cleanup of the partial file on timeout
 * - Serves a cached file only while the omnibus still matches the version recorded when it was sliced
 * - Age-based eviction that leaves running extractions alone
 */
package com.williamcallahan.omnibus_engine.service.content;

import com.williamcallahan.omnibus_engine.config.OmnibusConfigurationProperties;
import com.williamcallahan.omnibus_engine.exception.ExtractionFailedException;
import com.williamcallahan.omnibus_engine.exception.ExtractionTimeoutException;
import com.williamcallahan.omnibus_engine.exception.InvalidOmnibusReferenceException;
import com.williamcallahan.omnibus_engine.exception.ResourceAccessFailedException;
import com.williamcallahan.omnibus_engine.exception.VirtualBookContentNotFoundException;
import com.williamcallahan.omnibus_engine.model.BookMetadata;
import com.williamcallahan.omnibus_engine.model.OmnibusBook;
import com.williamcallahan.omnibus_engine.model.VirtualBook;
import com.williamcallahan.omnibus_engine.model.VirtualBookWithOmnibus;
import com.williamcallahan.omnibus_engine.model.Work;
import com.williamcallahan.omnibus_engine.monitoring.OmnibusMetricsService;
import com.williamcallahan.omnibus_engine.repository.VirtualBookRepository;
import com.williamcallahan.omnibus_engine.service.epub.ArchiveSlicer;
import com.williamcallahan.omnibus_engine.service.epub.ContainerMetadataReader;
import com.williamcallahan.omnibus_engine.types.CacheCleanupSummary;
import com.williamcallahan.omnibus_engine.types.WorkType;
import com.williamcallahan.omnibus_engine.util.CacheFileNames;
import com.williamcallahan.omnibus_engine.util.FileLocations;
import com.williamcallahan.omnibus_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.core.io.UrlResource;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class SubdocumentExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(SubdocumentExtractionService.class);

    private static final long MILLIS_PER_HOUR = TimeUnit.HOURS.toMillis(1);

    private final VirtualBookRepository virtualBookRepository;
    private final ArchiveSlicer archiveSlicer;
    private final AsyncTaskExecutor extractionExecutor;
    private final OmnibusMetricsService metricsService;
    private final Path configuredCacheDirectory;
    private final Duration defaultTimeout;
    private final boolean invalidateOnSourceChange;
    private final Clock clock;

    // Keyed by cache file name
    private final Map<String, InFlightExtraction> inFlight = new ConcurrentHashMap<>();
    // File names of temporary files being written right now
    private final Set<String> activeTempFiles = ConcurrentHashMap.newKeySet();

    private volatile Path cacheDirectory;

    @Autowired
    public SubdocumentExtractionService(VirtualBookRepository virtualBookRepository,
                                        ArchiveSlicer archiveSlicer,
                                        @Qualifier("omnibusExtractionExecutor") AsyncTaskExecutor extractionExecutor,
                                        OmnibusMetricsService metricsService,
                                        OmnibusConfigurationProperties properties) {
        this(virtualBookRepository, archiveSlicer, extractionExecutor, metricsService, properties, Clock.systemUTC());
    }

    SubdocumentExtractionService(VirtualBookRepository virtualBookRepository,
                                 ArchiveSlicer archiveSlicer,
                                 AsyncTaskExecutor extractionExecutor,
                                 OmnibusMetricsService metricsService,
                                 OmnibusConfigurationProperties properties,
                                 Clock clock) {
        this.virtualBookRepository = virtualBookRepository;
        this.archiveSlicer = archiveSlicer;
        this.extractionExecutor = extractionExecutor;
        this.metricsService = metricsService;
        this.configuredCacheDirectory = properties.getCache().getDir();
        this.defaultTimeout = properties.getExtraction().getTimeout();
        this.invalidateOnSourceChange = properties.getCache().isInvalidateOnSourceChange();
        this.clock = clock;
    }

    /**
     * Returns the extracted EPUB of a virtual book, slicing it out of its omnibus on a cache miss.
     * Waits at most the configured extraction timeout.
     *
     * @throws VirtualBookContentNotFoundException when the virtual book or its omnibus is unknown
     * @throws InvalidOmnibusReferenceException when the omnibus file location is malformed or missing
     * @throws ExtractionTimeoutException when slicing does not finish in time
     * @throws ExtractionFailedException when slicing fails
     * @throws ResourceAccessFailedException when the extracted file cannot be opened
     */
    public Resource getContent(String virtualBookId) {
        return getContent(virtualBookId, defaultTimeout);
    }

    public Resource getContent(String virtualBookId, Duration timeout) {
        VirtualBookWithOmnibus resolved = virtualBookRepository.findWithOmnibus(virtualBookId)
                .orElseThrow(() -> new VirtualBookContentNotFoundException(virtualBookId,
                        "Virtual book " + virtualBookId + " or its omnibus does not exist"));
        VirtualBook virtualBook = resolved.virtualBook();
        Path omnibusFile = resolveOmnibusFile(virtualBookId, resolved.omnibus());
        if (!Files.isRegularFile(omnibusFile)) {
            throw new InvalidOmnibusReferenceException(virtualBookId, resolved.omnibus().url(), "file does not exist");
        }

        Work work = toWork(virtualBook);
        if (!ValidationUtils.hasText(work.href())) {
            throw new VirtualBookContentNotFoundException(virtualBookId,
                    "Virtual book " + virtualBookId + " does not point at a document inside its omnibus");
        }

        Path directory = cacheDirectory(virtualBookId);
        String fileName = CacheFileNames.extractedFileName(omnibusFile, virtualBookId);
        Path target = directory.resolve(fileName);

        if (isFresh(target, omnibusFile)) {
            metricsService.recordCacheHit();
            logger.debug("Serving cached extraction {} for virtual book {}", fileName, virtualBookId);
            return toResource(virtualBookId, target);
        }

        metricsService.recordCacheMiss();
        Path extracted = awaitExtraction(virtualBookId, fileName, work, omnibusFile, target, directory, timeout);
        return toResource(virtualBookId, extracted);
    }

    /**
     * Whether content can be served for the virtual book: the record resolves and its omnibus file exists.
     * Never throws.
     */
    public boolean contentExists(String virtualBookId) {
        try {
            return virtualBookRepository.findWithOmnibus(virtualBookId)
                    .map(resolved -> Files.isRegularFile(resolveOmnibusFile(virtualBookId, resolved.omnibus())))
                    .orElse(false);
        } catch (Exception e) {
            logger.warn("Could not check content of virtual book {}: {}", virtualBookId, e.getMessage());
            return false;
        }
    }

    /**
     * Deletes cached files at least {@code maxAgeHours} old. Zero or a negative age deletes every file;
     * an age too large to represent deletes nothing. Files written by a running extraction are skipped.
     * Deletion failures are logged and counted, never thrown.
     */
    public CacheCleanupSummary cleanupCache(long maxAgeHours) {
        Path directory = cacheDirectory != null ? cacheDirectory : configuredCacheDirectory;
        if (!Files.isDirectory(directory)) {
            return CacheCleanupSummary.empty();
        }
        boolean evictAll = maxAgeHours <= 0;
        if (!evictAll && maxAgeHours > Long.MAX_VALUE / MILLIS_PER_HOUR) {
            logger.debug("Cache max age of {} hours exceeds any file age; nothing to evict", maxAgeHours);
            return countOnly(directory);
        }
        long maxAgeMillis = evictAll ? 0 : maxAgeHours * MILLIS_PER_HOUR;
        long now = clock.millis();

        int scanned = 0;
        int deleted = 0;
        int failed = 0;
        int skipped = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                if (CacheFileNames.isSourceStampFile(file)) {
                    removeOrphanedStamp(file);
                    continue;
                }
                if (activeTempFiles.contains(file.getFileName().toString())) {
                    scanned++;
                    skipped++;
                    continue;
                }
                switch (evictIfDue(file, now, maxAgeMillis, evictAll)) {
                    case DELETED -> {
                        scanned++;
                        deleted++;
                    }
                    case FAILED -> {
                        scanned++;
                        failed++;
                    }
                    case KEPT -> scanned++;
                    case VANISHED -> {
                        // Renamed into place or removed by someone else since the listing
                    }
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to list cache directory {}: {}", directory, e.getMessage());
        }

        metricsService.recordEvictions(deleted);
        CacheCleanupSummary summary = new CacheCleanupSummary(scanned, deleted, failed, skipped);
        logger.info("Omnibus cache cleanup in {}: {}", directory, summary);
        return summary;
    }

    /**
     * Deletes one cached file when it is due, together with its source stamp.
     */
    EvictionOutcome evictIfDue(Path file, long now, long maxAgeMillis, boolean evictAll) {
        try {
            long age = now - Files.getLastModifiedTime(file).toMillis();
            if (!evictAll && age < maxAgeMillis) {
                return EvictionOutcome.KEPT;
            }
            if (CacheFileNames.isTempFile(file)) {
                logger.debug("Removing orphaned partial extraction {}", file.getFileName());
            }
            boolean removed = Files.deleteIfExists(file);
            deleteQuietly(stampFileOf(file));
            return removed ? EvictionOutcome.DELETED : EvictionOutcome.VANISHED;
        } catch (NoSuchFileException e) {
            logger.debug("Cached file {} disappeared during cleanup", file.getFileName());
            return EvictionOutcome.VANISHED;
        } catch (IOException e) {
            logger.warn("Failed to delete cached file {}: {}", file, e.getMessage());
            return EvictionOutcome.FAILED;
        }
    }

    /**
     * Removes the cached extractions of the given virtual books of one omnibus,
     * used when the omnibus is re-scanned. Returns the number of files removed.
     */
    public int evictExtractions(Path omnibusFile, Collection<String> virtualBookIds) {
        Path directory = cacheDirectory != null ? cacheDirectory : configuredCacheDirectory;
        if (virtualBookIds == null || virtualBookIds.isEmpty() || !Files.isDirectory(directory)) {
            return 0;
        }
        int removed = 0;
        for (String id : virtualBookIds) {
            Path cached = directory.resolve(CacheFileNames.extractedFileName(omnibusFile, id));
            try {
                if (Files.deleteIfExists(cached)) {
                    removed++;
                }
                Files.deleteIfExists(stampFileOf(cached));
            } catch (IOException e) {
                logger.warn("Failed to evict cached extraction {}: {}", cached, e.getMessage());
            }
        }
        metricsService.recordEvictions(removed);
        return removed;
    }

    /**
     * Rebuilds the work descriptor the slicer needs from a stored virtual book.
     */
    static Work toWork(VirtualBook virtualBook) {
        BookMetadata bookMetadata = virtualBook.metadata();
        Map<String, String> metadata = new LinkedHashMap<>();
        if (ValidationUtils.hasText(bookMetadata.title())) {
            metadata.put(ContainerMetadataReader.TITLE, bookMetadata.title());
        }
        for (int i = 0; i < bookMetadata.authors().size(); i++) {
            metadata.put(ContainerMetadataReader.AUTHOR_PREFIX + i, bookMetadata.authors().get(i));
        }
        if (!bookMetadata.authors().isEmpty()) {
            metadata.put(ContainerMetadataReader.AUTHORS, String.join(", ", bookMetadata.authors()));
        }
        if (ValidationUtils.hasText(bookMetadata.summary())) {
            metadata.put(ContainerMetadataReader.DESCRIPTION, bookMetadata.summary());
        }
        if (ValidationUtils.hasText(bookMetadata.language())) {
            metadata.put(ContainerMetadataReader.LANGUAGE, bookMetadata.language());
        }
        int position = Math.max(1, (int) virtualBook.number());
        return new Work(virtualBook.title(), virtualBook.workHref(), position, WorkType.GENERIC_ENTRY, metadata);
    }

    static Path resolveOmnibusFile(String virtualBookId, OmnibusBook omnibus) {
        try {
            return FileLocations.toPath(omnibus.url());
        } catch (IllegalArgumentException e) {
            throw new InvalidOmnibusReferenceException(virtualBookId, omnibus.url(), e.getMessage(), e);
        }
    }

    private Path awaitExtraction(String virtualBookId, String fileName, Work work, Path omnibusFile,
                                 Path target, Path directory, Duration timeout) {
        InFlightExtraction candidate = new InFlightExtraction();
        InFlightExtraction existing = inFlight.putIfAbsent(fileName, candidate);
        InFlightExtraction extraction = existing != null ? existing : candidate;
        boolean owner = existing == null;

        if (owner) {
            try {
                candidate.task = extractionExecutor.submit(
                        () -> runExtraction(virtualBookId, fileName, work, omnibusFile, target, directory, candidate));
            } catch (RejectedExecutionException e) {
                inFlight.remove(fileName, candidate);
                candidate.result.completeExceptionally(e);
                metricsService.recordExtractionFailure();
                throw new ExtractionFailedException(virtualBookId, e);
            }
        } else {
            logger.debug("Joining running extraction of {} for virtual book {}", fileName, virtualBookId);
        }

        try {
            return extraction.result.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            metricsService.recordExtractionTimeout();
            if (owner) {
                cancel(fileName, extraction);
            }
            logger.warn("Extraction of virtual book {} timed out after {}", virtualBookId, timeout);
            throw new ExtractionTimeoutException(virtualBookId, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (owner) {
                cancel(fileName, extraction);
            }
            throw new ExtractionFailedException(virtualBookId, e);
        } catch (ExecutionException e) {
            throw new ExtractionFailedException(virtualBookId, e.getCause());
        } catch (CancellationException e) {
            throw new ExtractionFailedException(virtualBookId, e);
        }
    }

    private void runExtraction(String virtualBookId, String fileName, Work work, Path omnibusFile,
                               Path target, Path directory, InFlightExtraction extraction) {
        long start = System.nanoTime();
        metricsService.extractionStarted();
        Path temp = null;
        Path extracted = null;
        Exception failure = null;
        try {
            // Another request may have finished this file between the cache check and registration
            if (isFresh(target, omnibusFile)) {
                extracted = target;
                return;
            }
            logger.info("Extracting '{}' ({}) from {} for virtual book {}",
                    work.title(), work.href(), omnibusFile.getFileName(), virtualBookId);
            // Taken before slicing so a source changed mid-run is re-sliced on the next request
            String sourceStamp = sourceStamp(omnibusFile);
            temp = Files.createTempFile(directory, stripExtension(fileName) + "-", CacheFileNames.TEMP_EXTENSION);
            activeTempFiles.add(temp.getFileName().toString());

            archiveSlicer.extract(work, omnibusFile, temp);
            Path stampFile = stampFileOf(target);
            Files.deleteIfExists(stampFile);
            moveIntoPlace(temp, target);
            writeStamp(stampFile, sourceStamp);
            logger.info("Extracted virtual book {} to {} in {} ms", virtualBookId, fileName,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            extracted = target;
        } catch (Exception e) {
            deleteQuietly(temp);
            metricsService.recordExtractionFailure();
            logger.error("Extraction of virtual book {} from {} failed: {}",
                    virtualBookId, omnibusFile.getFileName(), e.getMessage(), e);
            failure = e;
        } finally {
            if (temp != null) {
                activeTempFiles.remove(temp.getFileName().toString());
            }
            // Unregister before completing so a later request starts afresh instead of joining a finished run
            inFlight.remove(fileName, extraction);
            metricsService.extractionFinished(System.nanoTime() - start);
            if (failure != null) {
                extraction.result.completeExceptionally(failure);
            } else {
                extraction.result.complete(extracted);
            }
        }
    }

    private void cancel(String fileName, InFlightExtraction extraction) {
        Future<?> task = extraction.task;
        if (task != null) {
            task.cancel(true);
        }
        // A task cancelled before it started never runs its own cleanup
        extraction.result.completeExceptionally(new CancellationException("Extraction of " + fileName + " cancelled"));
        inFlight.remove(fileName, extraction);
    }

    private boolean isFresh(Path cached, Path omnibusFile) {
        if (!Files.isRegularFile(cached)) {
            return false;
        }
        if (!invalidateOnSourceChange) {
            return true;
        }
        Path stampFile = stampFileOf(cached);
        if (!Files.isRegularFile(stampFile)) {
            return false;
        }
        try {
            return Files.readString(stampFile, StandardCharsets.UTF_8).trim().equals(sourceStamp(omnibusFile));
        } catch (IOException e) {
            logger.debug("Could not compare {} with its source stamp: {}", cached, e.getMessage());
            return false;
        }
    }

    /**
     * Modification time and size of the omnibus file, the version an extraction was sliced from.
     */
    static String sourceStamp(Path omnibusFile) throws IOException {
        return Files.getLastModifiedTime(omnibusFile).toMillis() + ":" + Files.size(omnibusFile);
    }

    private static Path stampFileOf(Path cached) {
        return cached.resolveSibling(CacheFileNames.sourceStampFileName(cached.getFileName().toString()));
    }

    private static void writeStamp(Path stampFile, String sourceStamp) {
        try {
            Files.writeString(stampFile, sourceStamp, StandardCharsets.UTF_8);
        } catch (IOException e) {
            // The extraction stays valid, it is only sliced again on the next request
            logger.warn("Failed to record source stamp {}: {}", stampFile, e.getMessage());
        }
    }

    private static void removeOrphanedStamp(Path stampFile) {
        Path extracted = stampFile.resolveSibling(CacheFileNames.extractedFileNameOfStamp(stampFile));
        if (!Files.exists(extracted)) {
            deleteQuietly(stampFile);
        }
    }

    private Path cacheDirectory(String virtualBookId) {
        Path directory = cacheDirectory;
        if (directory != null) {
            return directory;
        }
        synchronized (this) {
            if (cacheDirectory == null) {
                try {
                    Path created = Files.createDirectories(configuredCacheDirectory);
                    File asFile = created.toFile();
                    asFile.setReadable(true, true);
                    asFile.setWritable(true, true);
                    asFile.setExecutable(true, true);
                    logger.info("Using omnibus extraction cache directory {}", created.toAbsolutePath());
                    cacheDirectory = created;
                } catch (IOException e) {
                    throw new ExtractionFailedException(virtualBookId, e);
                }
            }
            return cacheDirectory;
        }
    }

    private CacheCleanupSummary countOnly(Path directory) {
        int scanned = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                if (Files.isRegularFile(file)) {
                    scanned++;
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to list cache directory {}: {}", directory, e.getMessage());
        }
        return new CacheCleanupSummary(scanned, 0, 0, 0);
    }

    private static Resource toResource(String virtualBookId, Path file) {
        if (!Files.isReadable(file)) {
            throw new ResourceAccessFailedException(virtualBookId, file,
                    new NoSuchFileException(file.toString(), null, "not readable"));
        }
        try {
            return new UrlResource(file.toUri());
        } catch (MalformedURLException e) {
            throw new ResourceAccessFailedException(virtualBookId, file, e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to delete partial extraction {}: {}", file, e.getMessage());
        }
    }

    private static String stripExtension(String fileName) {
        return fileName.endsWith(CacheFileNames.EXTRACTED_EXTENSION)
                ? fileName.substring(0, fileName.length() - CacheFileNames.EXTRACTED_EXTENSION.length())
                : fileName;
    }

    enum EvictionOutcome {
        KEPT,
        DELETED,
        VANISHED,
        FAILED
    }

    private static final class InFlightExtraction {
        private final CompletableFuture<Path> result = new CompletableFuture<>();
        private volatile Future<?> task;
    }
}
