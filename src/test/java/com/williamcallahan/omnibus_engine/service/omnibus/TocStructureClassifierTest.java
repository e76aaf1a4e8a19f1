package com.williamcallahan.omnibus_engine.service.omnibus;

import com.williamcallahan.omnibus_engine.config.OmnibusConfigurationProperties;
import com.williamcallahan.omnibus_engine.model.TocEntry;
import com.williamcallahan.omnibus_engine.types.TocType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.williamcallahan.omnibus_engine.testutil.EpubFixtures.nav;
import static org.assertj.core.api.Assertions.assertThat;

class TocStructureClassifierTest {

    private TocStructureClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new TocStructureClassifier(new OmnibusConfigurationProperties());
    }

    @Test
    void emptyOrNullToc_isUnknown() {
        assertThat(classifier.classify(List.of())).isEqualTo(TocType.UNKNOWN);
        assertThat(classifier.classify(null)).isEqualTo(TocType.UNKNOWN);
    }

    @Test
    void playTitle_winsOverDelphiShape() {
        List<TocEntry> toc = List.of(
                nav("Hamlet", "hamlet.xhtml",
                        nav("Act I", "hamlet.xhtml#a1"),
                        nav("Act II", "hamlet.xhtml#a2")),
                nav("The Sonnets", "sonnets.xhtml"));

        assertThat(classifier.classify(toc)).isEqualTo(TocType.SHAKESPEARE);
    }

    @Test
    void playKeyword_matchesCaseInsensitivelyInsideTitles() {
        List<TocEntry> toc = List.of(TocEntry.leaf("THE TRAGEDY OF KING LEAR", "lear.xhtml"));

        assertThat(classifier.classify(toc)).isEqualTo(TocType.SHAKESPEARE);
    }

    @Test
    void firstEntryWithOnlyLeafChildren_isDelphi() {
        List<TocEntry> toc = List.of(
                nav("The Novels", "novels.xhtml",
                        nav("Emma", "emma.xhtml"),
                        nav("Persuasion", "persuasion.xhtml")),
                nav("The Letters", "letters.xhtml",
                        nav("To Cassandra", "cassandra.xhtml",
                                nav("Part 1", "cassandra.xhtml#p1"))));

        assertThat(classifier.classify(toc)).isEqualTo(TocType.DELPHI_CLASSICS);
    }

    @Test
    void nestedGrandchildrenUnderFirstEntry_fallThroughToGeneric() {
        List<TocEntry> toc = List.of(
                nav("Book One", "one.xhtml", nav("Chapter 1", "one.xhtml#c1", nav("Scene", "one.xhtml#s"))),
                nav("Book Two", "two.xhtml"));

        assertThat(classifier.classify(toc)).isEqualTo(TocType.GENERIC);
    }

    @Test
    void singleLeafEntry_isUnknown() {
        assertThat(classifier.classify(List.of(TocEntry.leaf("Contents", "toc.xhtml")))).isEqualTo(TocType.UNKNOWN);
    }

    @Test
    void configuredKeywords_replaceDefaults() {
        OmnibusConfigurationProperties properties = new OmnibusConfigurationProperties();
        properties.getDetection().setShakespeareKeywords(List.of("Tempest"));
        TocStructureClassifier custom = new TocStructureClassifier(properties);

        assertThat(custom.classify(List.of(TocEntry.leaf("The Tempest", "t.xhtml")))).isEqualTo(TocType.SHAKESPEARE);
        assertThat(custom.classify(List.of(TocEntry.leaf("Hamlet", "h.xhtml"), TocEntry.leaf("Other", "o.xhtml"))))
                .isEqualTo(TocType.GENERIC);
    }
}
