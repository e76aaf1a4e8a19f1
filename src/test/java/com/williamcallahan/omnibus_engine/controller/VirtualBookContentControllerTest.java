package com.williamcallahan.omnibus_engine.controller;

import com.williamcallahan.omnibus_engine.exception.ExtractionFailedException;
import com.williamcallahan.omnibus_engine.exception.ExtractionTimeoutException;
import com.williamcallahan.omnibus_engine.exception.InvalidOmnibusReferenceException;
import com.williamcallahan.omnibus_engine.exception.VirtualBookContentNotFoundException;
import com.williamcallahan.omnibus_engine.model.BookMetadata;
import com.williamcallahan.omnibus_engine.model.VirtualBook;
import com.williamcallahan.omnibus_engine.repository.VirtualBookRepository;
import com.williamcallahan.omnibus_engine.service.content.SubdocumentExtractionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.head;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Verifies the download endpoint of virtual books and how content failures map to HTTP statuses
 *
 * @author William Callahan
 */
@WebMvcTest(VirtualBookContentController.class)
@ActiveProfiles("test")
class VirtualBookContentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SubdocumentExtractionService extractionService;

    @MockBean
    private VirtualBookRepository virtualBookRepository;

    private static VirtualBook virtualBook(String id, String title) {
        return new VirtualBook(id, "omnibus-1", title, title, 1, 1, Instant.EPOCH, 1,
                BookMetadata.empty(), "file:///library/austen.epub#OEBPS/emma.xhtml");
    }

    @Test
    void getFile_streamsEpubAsAttachment() throws Exception {
        byte[] epub = "PK-epub-bytes".getBytes(StandardCharsets.UTF_8);
        given(extractionService.getContent("vb-1")).willReturn(new ByteArrayResource(epub));
        given(virtualBookRepository.findById("vb-1")).willReturn(Optional.of(virtualBook("vb-1", "Emma")));

        mockMvc.perform(get("/api/virtual-books/vb-1/file"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/epub+zip"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("attachment")))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("Emma.epub")))
                .andExpect(content().bytes(epub));
    }

    @Test
    void getFile_unknownVirtualBook_is404() throws Exception {
        given(extractionService.getContent("missing"))
                .willThrow(new VirtualBookContentNotFoundException("missing", "Virtual book missing does not exist"));

        mockMvc.perform(get("/api/virtual-books/missing/file"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.virtualBookId").value("missing"))
                .andExpect(jsonPath("$.error").value("Virtual book content not found"));
    }

    @Test
    void getFile_invalidOmnibusReference_is404() throws Exception {
        given(extractionService.getContent("vb-1"))
                .willThrow(new InvalidOmnibusReferenceException("vb-1", "file:///gone.epub", "file does not exist"));

        mockMvc.perform(get("/api/virtual-books/vb-1/file"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getFile_timeout_is503WithRetryAfter() throws Exception {
        given(extractionService.getContent("vb-1"))
                .willThrow(new ExtractionTimeoutException("vb-1", Duration.ofSeconds(60)));

        mockMvc.perform(get("/api/virtual-books/vb-1/file"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "5"))
                .andExpect(jsonPath("$.virtualBookId").value("vb-1"));
    }

    @Test
    void getFile_extractionFailure_is500() throws Exception {
        given(extractionService.getContent("vb-1"))
                .willThrow(new ExtractionFailedException("vb-1", new IOException("corrupt entry")));

        mockMvc.perform(get("/api/virtual-books/vb-1/file"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Failed to extract virtual book content"));
    }

    @Test
    void headFile_reportsAvailabilityWithoutExtracting() throws Exception {
        given(extractionService.contentExists("vb-1")).willReturn(true);
        given(extractionService.contentExists("missing")).willReturn(false);

        mockMvc.perform(head("/api/virtual-books/vb-1/file")).andExpect(status().isOk());
        mockMvc.perform(head("/api/virtual-books/missing/file")).andExpect(status().isNotFound());
    }

    @Test
    void downloadName_replacesCharactersUnsafeInFileNames() {
        assertThat(VirtualBookContentController.downloadName("Pride/Prejudice: Vol?")).isEqualTo("Pride_Prejudice_ Vol_.epub");
        assertThat(VirtualBookContentController.downloadName("  ")).isEqualTo("book.epub");
    }
}
