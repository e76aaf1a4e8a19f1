package com.williamcallahan.omnibus_engine.service.epub;

import com.williamcallahan.omnibus_engine.exception.ContainerUnreadableException;
import com.williamcallahan.omnibus_engine.model.TocEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.williamcallahan.omnibus_engine.testutil.EpubFixtures.epub;
import static com.williamcallahan.omnibus_engine.testutil.EpubFixtures.nav;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZipEpubContainerReaderTest {

    @TempDir
    Path tempDir;

    private final ZipEpubContainerReader reader = new ZipEpubContainerReader();

    @Test
    void open_readsMetadataSpineAndNcxHierarchy() throws Exception {
        Path file = epub()
                .title("The Works of Edgar Allan Poe")
                .creator("Edgar Allan Poe")
                .publisher("Project Gutenberg")
                .description("Tales and poems")
                .language("en-US")
                .document("tales.xhtml", "<h1>Tales</h1>")
                .document("usher.xhtml", "<p>During the whole of a dull, dark, and soundless day</p>")
                .resource("css/style.css", "text/css", "body { margin: 0 }")
                .toc(nav("Tales", "tales.xhtml", nav("The Fall of the House of Usher", "usher.xhtml#start")))
                .writeTo(tempDir.resolve("poe.epub"));

        EpubContainer container = reader.open(file);

        assertThat(container.name()).isEqualTo("poe.epub");
        assertThat(container.packagePath()).isEqualTo("OEBPS/content.opf");
        assertThat(container.spine()).containsExactly("OEBPS/tales.xhtml", "OEBPS/usher.xhtml");
        assertThat(container.metadata().firstTitle()).isEqualTo("The Works of Edgar Allan Poe");
        assertThat(container.metadata().creators()).containsExactly("Edgar Allan Poe");
        assertThat(container.metadata().publishers()).containsExactly("Project Gutenberg");
        assertThat(container.metadata().descriptions()).containsExactly("Tales and poems");
        assertThat(container.metadata().language()).isEqualTo("en-US");

        assertThat(container.toc()).hasSize(1);
        TocEntry tales = container.toc().get(0);
        assertThat(tales.title()).isEqualTo("Tales");
        assertThat(tales.href()).isEqualTo("OEBPS/tales.xhtml");
        assertThat(tales.children())
                .containsExactly(TocEntry.leaf("The Fall of the House of Usher", "OEBPS/usher.xhtml#start"));
    }

    @Test
    void open_keysManifestByArchivePath() throws Exception {
        Path file = epub()
                .title("Styled")
                .document("chapter.xhtml", "<p>Text</p>")
                .resource("css/style.css", "text/css", "p { color: black }")
                .toc(TocEntry.leaf("Chapter", "chapter.xhtml"))
                .writeTo(tempDir.resolve("styled.epub"));

        EpubContainer container = reader.open(file);

        assertThat(container.manifestItem("OEBPS/css/style.css"))
                .hasValueSatisfying(item -> assertThat(item.isStylesheet()).isTrue());
        assertThat(container.manifestItem("OEBPS/chapter.xhtml"))
                .hasValueSatisfying(item -> assertThat(item.isContentDocument()).isTrue());
        assertThat(container.manifestItem("OEBPS/toc.ncx"))
                .hasValueSatisfying(item -> assertThat(item.isNcx()).isTrue());
    }

    @Test
    void open_fallsBackToNavigationDocumentWithoutNcx() throws Exception {
        Path file = epub()
                .title("Collected Stories")
                .document("part1.xhtml", "<h1>Part One</h1>")
                .document("story.xhtml", "<p>Once</p>")
                .toc(nav("Part One", "part1.xhtml", nav("A Story", "story.xhtml")), nav("Unlinked", null))
                .navDocumentOnly()
                .writeTo(tempDir.resolve("stories.epub"));

        EpubContainer container = reader.open(file);

        assertThat(container.toc()).hasSize(2);
        assertThat(container.toc().get(0).title()).isEqualTo("Part One");
        assertThat(container.toc().get(0).children())
                .containsExactly(TocEntry.leaf("A Story", "OEBPS/story.xhtml"));
        // Span labels carry a title but no target
        assertThat(container.toc().get(1)).isEqualTo(TocEntry.leaf("Unlinked", null));
    }

    @Test
    void open_missingContainerXml_isUnreadable() throws Exception {
        Path file = epub()
                .title("Broken")
                .document("a.xhtml", "<p>a</p>")
                .withoutContainerXml()
                .writeTo(tempDir.resolve("broken.epub"));

        assertThatThrownBy(() -> reader.open(file))
                .isInstanceOf(ContainerUnreadableException.class)
                .hasMessageContaining("broken.epub")
                .hasMessageContaining("META-INF/container.xml");
    }

    @Test
    void open_notAZipArchive_isUnreadable() throws Exception {
        Path file = tempDir.resolve("plain.epub");
        Files.write(file, "just some text".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> reader.open(file))
                .isInstanceOf(ContainerUnreadableException.class)
                .satisfies(e -> assertThat(((ContainerUnreadableException) e).getContainerName()).isEqualTo("plain.epub"));
    }

    @Test
    void open_missingFile_isUnreadable() {
        assertThatThrownBy(() -> reader.open(tempDir.resolve("absent.epub")))
                .isInstanceOf(ContainerUnreadableException.class)
                .hasMessageContaining("does not exist");
    }
}
