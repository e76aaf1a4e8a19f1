package com.williamcallahan.omnibus_engine.controller;

import com.williamcallahan.omnibus_engine.controller.support.ErrorResponseUtils;
import com.williamcallahan.omnibus_engine.exception.ExtractionFailedException;
import com.williamcallahan.omnibus_engine.exception.ExtractionTimeoutException;
import com.williamcallahan.omnibus_engine.exception.ResourceAccessFailedException;
import com.williamcallahan.omnibus_engine.exception.VirtualBookContentException;
import com.williamcallahan.omnibus_engine.exception.VirtualBookContentNotFoundException;
import com.williamcallahan.omnibus_engine.model.OmnibusBook;
import com.williamcallahan.omnibus_engine.model.VirtualBook;
import com.williamcallahan.omnibus_engine.repository.VirtualBookRepository;
import com.williamcallahan.omnibus_engine.service.content.SubdocumentExtractionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Serves the extracted EPUB of a virtual book
 *
 * @author William Callahan
 *
 * Features:
 * - Streams the work as a standalone EPUB download
 * - HEAD reports whether content can be served without slicing anything
 * - Maps not-found failures to 404, timeouts to 503 and other failures to 500
 */
@RestController
@RequestMapping("/api/virtual-books")
@Slf4j
public class VirtualBookContentController {

    private static final MediaType EPUB = MediaType.parseMediaType(OmnibusBook.EPUB_MEDIA_TYPE);

    private final SubdocumentExtractionService extractionService;
    private final VirtualBookRepository virtualBookRepository;

    public VirtualBookContentController(SubdocumentExtractionService extractionService,
                                        VirtualBookRepository virtualBookRepository) {
        this.extractionService = extractionService;
        this.virtualBookRepository = virtualBookRepository;
    }

    @GetMapping("/{id}/file")
    public ResponseEntity<Resource> getFile(@PathVariable String id) {
        log.info("Serving extracted content for virtual book {}", id);
        Resource content = extractionService.getContent(id);
        String title = virtualBookRepository.findById(id).map(VirtualBook::title).orElse(id);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(downloadName(title), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .contentType(EPUB)
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(content);
    }

    @RequestMapping(value = "/{id}/file", method = RequestMethod.HEAD)
    public ResponseEntity<Void> headFile(@PathVariable String id) {
        if (extractionService.contentExists(id)) {
            return ResponseEntity.ok().contentType(EPUB).build();
        }
        return ResponseEntity.notFound().build();
    }

    @ExceptionHandler(VirtualBookContentNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(VirtualBookContentNotFoundException e) {
        log.warn("Virtual book content not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponseUtils.contentErrorBody("Virtual book content not found", e));
    }

    @ExceptionHandler(ExtractionTimeoutException.class)
    public ResponseEntity<Map<String, String>> handleTimeout(ExtractionTimeoutException e) {
        log.warn("Virtual book extraction timed out: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, "5")
                .body(ErrorResponseUtils.contentErrorBody("Extraction timed out", e));
    }

    @ExceptionHandler({ExtractionFailedException.class, ResourceAccessFailedException.class})
    public ResponseEntity<Map<String, String>> handleFailure(VirtualBookContentException e) {
        log.error("Virtual book content unavailable: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponseUtils.contentErrorBody("Failed to extract virtual book content", e));
    }

    static String downloadName(String title) {
        String cleaned = title == null ? "" : title.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_").strip();
        return (cleaned.isEmpty() ? "book" : cleaned) + ".epub";
    }
}
