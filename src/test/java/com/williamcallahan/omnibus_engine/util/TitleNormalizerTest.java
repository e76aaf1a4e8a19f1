package com.williamcallahan.omnibus_engine.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Test suite for TitleNormalizer table-of-contents label cleanup.
 */
class TitleNormalizerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "  12. The Tempest (1611)  | The Tempest",
        "3 - Hamlet                | Hamlet",
        "I. The Raven              | The Raven",
        "IV) Annabel Lee           | Annabel Lee",
        "XLII. Eleonora            | Eleonora",
        "M. Butterfly              | M. Butterfly",
        "C. Auguste Dupin          | C. Auguste Dupin",
        "The Raven [Illustrated];  | The Raven",
        "Poems {Vol. 2} Notes...   | Poems Notes",
        "I Am Legend               | I Am Legend",
        "1984                      | 1984",
        "Macbeth   (Folio)   Text  | Macbeth Text"
    })
    void normalize_stripsIndexesAnnotationsAndTrailingPunctuation(String raw, String expected) {
        assertEquals(expected, TitleNormalizer.normalize(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "  12. The Tempest (1611)  ",
        "1. 2. 3. Nested Index",
        "(1) (2) Only Brackets",
        "II. 4 - Mixed.;",
        "[",
        "...",
        "   "
    })
    void normalize_isIdempotent(String raw) {
        String once = TitleNormalizer.normalize(raw);
        assertEquals(once, TitleNormalizer.normalize(once));
    }

    @Test
    void normalize_nullAndBlankInput_returnEmpty() {
        assertEquals("", TitleNormalizer.normalize(null));
        assertEquals("", TitleNormalizer.normalize("   "));
        assertEquals("", TitleNormalizer.normalize("(1611)"));
    }
}
