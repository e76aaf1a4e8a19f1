package com.williamcallahan.omnibus_engine.service.omnibus;

import com.williamcallahan.omnibus_engine.config.OmnibusConfigurationProperties;
import com.williamcallahan.omnibus_engine.model.TocEntry;
import com.williamcallahan.omnibus_engine.model.Work;
import com.williamcallahan.omnibus_engine.service.epub.ContainerMetadataReader;
import com.williamcallahan.omnibus_engine.service.epub.EpubContainer;
import com.williamcallahan.omnibus_engine.service.epub.EpubContainerReader;
import com.williamcallahan.omnibus_engine.service.epub.ZipEpubContainerReader;
import com.williamcallahan.omnibus_engine.exception.ContainerUnreadableException;
import com.williamcallahan.omnibus_engine.types.WorkType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.williamcallahan.omnibus_engine.testutil.EpubFixtures.epub;
import static com.williamcallahan.omnibus_engine.testutil.EpubFixtures.nav;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OmnibusWorkExtractorTest {

    @TempDir
    Path tempDir;

    private OmnibusWorkExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = newExtractor(new ZipEpubContainerReader());
    }

    private static OmnibusWorkExtractor newExtractor(EpubContainerReader reader) {
        return new OmnibusWorkExtractor(
                reader,
                new ContainerMetadataReader(),
                new TocStructureClassifier(new OmnibusConfigurationProperties()),
                new WorkExtractionStrategies());
    }

    @Test
    void genericPoetryCollection_yieldsNormalizedPoems() throws Exception {
        Path file = epub()
                .title("Selected Poems of Edgar Allan Poe")
                .creator("Edgar Allan Poe")
                .document("raven.xhtml", "<h1>The Raven</h1><p>Once upon a midnight dreary</p>")
                .document("annabel.xhtml", "<h1>Annabel Lee</h1><p>It was many and many a year ago</p>")
                .toc(TocEntry.leaf("I. The Raven", "raven.xhtml"), TocEntry.leaf("II. Annabel Lee", "annabel.xhtml"))
                .writeTo(tempDir.resolve("poe.epub"));

        List<Work> works = extractor.extractWorks(file);

        assertThat(works)
                .extracting(Work::title, Work::position, Work::type, Work::href)
                .containsExactly(
                        tuple("The Raven", 1, WorkType.POEM, "OEBPS/raven.xhtml"),
                        tuple("Annabel Lee", 2, WorkType.POEM, "OEBPS/annabel.xhtml"));
        assertThat(works.get(0).metadata())
                .containsEntry(ContainerMetadataReader.AUTHOR_PREFIX + "0", "Edgar Allan Poe")
                .containsEntry(ContainerMetadataReader.LANGUAGE, "en");
    }

    @Test
    void delphiLayout_readFromNavigationDocument() throws Exception {
        Path file = epub()
                .title("Delphi Complete Works of Jane Austen")
                .publisher("Delphi Classics")
                .document("novels.xhtml", "<h1>The Novels</h1>")
                .document("emma.xhtml", "<p>Emma</p>")
                .document("persuasion.xhtml", "<p>Persuasion</p>")
                .document("letters.xhtml", "<h1>The Letters</h1>")
                .document("cassandra.xhtml", "<p>Dear Cassandra</p>")
                .toc(nav("The Novels", "novels.xhtml", nav("Emma", "emma.xhtml"), nav("Persuasion", "persuasion.xhtml")),
                     nav("The Letters", "letters.xhtml", nav("To Cassandra", "cassandra.xhtml")))
                .navDocumentOnly()
                .writeTo(tempDir.resolve("austen.epub"));

        List<Work> works = extractor.extractWorks(file);

        assertThat(works)
                .extracting(Work::title, Work::position, w -> w.metadata().get("section"))
                .containsExactly(
                        tuple("Emma", 1, "The Novels"),
                        tuple("Persuasion", 2, "The Novels"),
                        tuple("To Cassandra", 1, "The Letters"));
    }

    @Test
    void unclassifiableToc_fallsBackToSpine() throws Exception {
        Path file = epub()
                .title("Stories")
                .document("one.xhtml", "<p>one</p>")
                .document("two.xhtml", "<p>two</p>")
                .document("three.xhtml", "<p>three</p>")
                .toc(TocEntry.leaf("Contents", "one.xhtml"))
                .writeTo(tempDir.resolve("stories.epub"));

        List<Work> works = extractor.extractWorks(file);

        assertThat(works).extracting(Work::title)
                .containsExactly("Work 1", "Work 2", "Work 3");
        assertThat(works).extracting(Work::type).containsOnly(WorkType.OTHER);
    }

    @Test
    void emptyStrategyResult_fallsBackToSpine() {
        EpubContainerReader reader = mock(EpubContainerReader.class);
        // No table of contents at all
        EpubContainer container = new EpubContainer("odd.epub", "content.opf", null, null,
                List.of("a.xhtml", "b.xhtml"), List.of());
        when(reader.open(any())).thenReturn(container);

        List<Work> works = newExtractor(reader).extractWorks(tempDir.resolve("odd.epub"));

        assertThat(works).extracting(Work::href).containsExactly("a.xhtml", "b.xhtml");
    }

    @Test
    void unreadableContainer_yieldsNoWorks() throws Exception {
        Path notAZip = Files.writeString(tempDir.resolve("broken.epub"), "not a zip", StandardCharsets.UTF_8);

        assertThat(extractor.extractWorks(notAZip)).isEmpty();
        assertThat(extractor.extractWorks(tempDir.resolve("missing.epub"))).isEmpty();
    }

    @Test
    void readerFailure_isNeverPropagated() {
        EpubContainerReader reader = mock(EpubContainerReader.class);
        when(reader.open(any())).thenThrow(new ContainerUnreadableException("x.epub", "boom"));

        assertThat(newExtractor(reader).extractWorks(tempDir.resolve("x.epub"))).isEmpty();
    }
}
