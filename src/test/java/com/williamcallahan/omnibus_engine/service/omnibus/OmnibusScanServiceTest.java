package com.williamcallahan.omnibus_engine.service.omnibus;

import com.williamcallahan.omnibus_engine.exception.ContainerUnreadableException;
import com.williamcallahan.omnibus_engine.model.BookMetadata;
import com.williamcallahan.omnibus_engine.model.OmnibusBook;
import com.williamcallahan.omnibus_engine.model.VirtualBook;
import com.williamcallahan.omnibus_engine.model.Work;
import com.williamcallahan.omnibus_engine.repository.VirtualBookRepository;
import com.williamcallahan.omnibus_engine.service.content.SubdocumentExtractionService;
import com.williamcallahan.omnibus_engine.service.epub.EpubContainer;
import com.williamcallahan.omnibus_engine.service.epub.EpubContainerReader;
import com.williamcallahan.omnibus_engine.types.OmnibusType;
import com.williamcallahan.omnibus_engine.types.ScanResult;
import com.williamcallahan.omnibus_engine.types.WorkType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class OmnibusScanServiceTest {

    private static final Path OMNIBUS_PATH = Path.of("/library/poe.epub");
    private static final OmnibusBook OMNIBUS = new OmnibusBook("omnibus-1", "Poe Collected",
            OMNIBUS_PATH.toUri().toString(), OmnibusBook.EPUB_MEDIA_TYPE, Instant.parse("2024-01-01T00:00:00Z"), 4096);

    private EpubContainerReader containerReader;
    private OmnibusDetector detector;
    private OmnibusWorkExtractor workExtractor;
    private VirtualBookRepository repository;
    private SubdocumentExtractionService extractionService;
    private OmnibusScanService scanService;
    private EpubContainer container;

    @BeforeEach
    void setUp() {
        containerReader = mock(EpubContainerReader.class);
        detector = mock(OmnibusDetector.class);
        workExtractor = mock(OmnibusWorkExtractor.class);
        repository = mock(VirtualBookRepository.class);
        extractionService = mock(SubdocumentExtractionService.class);
        scanService = new OmnibusScanService(containerReader, detector, workExtractor, repository, extractionService);
        container = new EpubContainer("poe.epub", "OEBPS/content.opf", null, null, List.of(), List.of());
        given(containerReader.open(OMNIBUS_PATH)).willReturn(container);
        given(repository.findByOmnibusId("omnibus-1")).willReturn(List.of());
    }

    @Test
    void scan_createsVirtualBooksWithGlobalOrdinals() {
        given(detector.detect(container)).willReturn(OmnibusType.GENERIC_OMNIBUS);
        given(workExtractor.extractWorks(container)).willReturn(List.of(
                new Work("The Raven", "OEBPS/raven.xhtml", 1, WorkType.POEM,
                        Map.of("author0", "Edgar Allan Poe", "description", "Poems", "language", "en")),
                new Work("Untitled", "", 2, WorkType.GENERIC_ENTRY, Map.of()),
                new Work("Annabel Lee", "OEBPS/annabel.xhtml", 3, WorkType.POEM, Map.of("author0", "Edgar Allan Poe"))));

        ScanResult result = scanService.scan(OMNIBUS);

        assertThat(result).isEqualTo(new ScanResult("omnibus-1", OmnibusType.GENERIC_OMNIBUS, 2));
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<VirtualBook>> captor = ArgumentCaptor.forClass(List.class);
        verify(repository).replaceForOmnibus(eq("omnibus-1"), captor.capture());
        List<VirtualBook> stored = captor.getValue();

        assertThat(stored).extracting(VirtualBook::title).containsExactly("The Raven", "Annabel Lee");
        assertThat(stored).extracting(VirtualBook::number).containsExactly(1f, 2f);
        VirtualBook raven = stored.get(0);
        assertThat(raven.url()).isEqualTo(OMNIBUS.url() + "#OEBPS/raven.xhtml");
        assertThat(raven.workHref()).isEqualTo("OEBPS/raven.xhtml");
        assertThat(raven.fileSize()).isEqualTo(4096);
        assertThat(raven.metadata()).isEqualTo(new BookMetadata("The Raven", List.of("Edgar Allan Poe"),
                "Part of omnibus: Poe Collected\n\nPoems", "en", null));
    }

    @Test
    void virtualBookIds_areStableAcrossScans() {
        Work work = new Work("The Raven", "OEBPS/raven.xhtml", 1, WorkType.POEM, Map.of());

        assertThat(OmnibusScanService.virtualBookId("omnibus-1", work))
                .isEqualTo(OmnibusScanService.virtualBookId("omnibus-1", work))
                .isNotEqualTo(OmnibusScanService.virtualBookId("omnibus-2", work));
    }

    @Test
    void delphiWorksWithSamePositionInDifferentSections_getDistinctIds() {
        Work first = new Work("Emma", "OEBPS/a.xhtml", 1, WorkType.DELPHI_CHAPTER, Map.of("section", "Novels"));
        Work second = new Work("Emma", "OEBPS/a.xhtml", 1, WorkType.DELPHI_CHAPTER, Map.of("section", "Letters"));

        assertThat(OmnibusScanService.virtualBookId("o", first)).isNotEqualTo(OmnibusScanService.virtualBookId("o", second));
    }

    @Test
    void shakespeareAuthorOverride_becomesTheOnlyAuthor() {
        Work work = new Work("Hamlet", "h.xhtml", 1, WorkType.PLAY,
                Map.of("author", "William Shakespeare", "author0", "Editor"));

        assertThat(OmnibusScanService.toBookMetadata(OMNIBUS, work).authors()).containsExactly("William Shakespeare");
    }

    @Test
    void rescan_evictsPreviousExtractions() {
        VirtualBook previous = new VirtualBook("old-id", "omnibus-1", "Old", null, 1, 1, null, 0, null, "x#y");
        given(repository.findByOmnibusId("omnibus-1")).willReturn(List.of(previous));
        given(detector.detect(container)).willReturn(OmnibusType.DELPHI_CLASSICS);
        given(workExtractor.extractWorks(container)).willReturn(List.of());

        scanService.scan(OMNIBUS);

        verify(extractionService).evictExtractions(OMNIBUS_PATH, List.of("old-id"));
        verify(repository).replaceForOmnibus("omnibus-1", List.of());
    }

    @Test
    void notAnOmnibus_removesStaleVirtualBooks() {
        VirtualBook previous = new VirtualBook("old-id", "omnibus-1", "Old", null, 1, 1, null, 0, null, "x#y");
        given(repository.findByOmnibusId("omnibus-1")).willReturn(List.of(previous));
        given(detector.detect(container)).willReturn(OmnibusType.NONE);

        ScanResult result = scanService.scan(OMNIBUS);

        assertThat(result).isEqualTo(ScanResult.notAnOmnibus("omnibus-1"));
        verify(repository).deleteByOmnibusId("omnibus-1");
        verify(workExtractor, never()).extractWorks(any(EpubContainer.class));
    }

    @Test
    void nonEpub_isSkippedWithoutOpeningIt() {
        OmnibusBook pdf = new OmnibusBook("pdf-1", "Manual", "file:///library/manual.pdf", "application/pdf", null, 1);

        assertThat(scanService.scan(pdf)).isEqualTo(ScanResult.notAnOmnibus("pdf-1"));
        verifyNoInteractions(containerReader, repository);
    }

    @Test
    void unreadableContainer_keepsExistingRecords() {
        given(containerReader.open(OMNIBUS_PATH)).willThrow(new ContainerUnreadableException("poe.epub", "corrupt"));

        assertThat(scanService.scan(OMNIBUS)).isEqualTo(ScanResult.notAnOmnibus("omnibus-1"));
        verify(repository, never()).deleteByOmnibusId(anyString());
        verify(repository, never()).replaceForOmnibus(anyString(), anyList());
    }
}
