package com.williamcallahan.omnibus_engine.service.epub;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class EpubResourceReferenceScannerTest {

    private final EpubResourceReferenceScanner scanner = new EpubResourceReferenceScanner();

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void scanDocument_collectsEmbeddedResourcesButNotHyperlinks() {
        String xhtml = "<html xmlns=\"http://www.w3.org/1999/xhtml\" xmlns:xlink=\"http://www.w3.org/1999/xlink\">"
                + "<head><link rel=\"stylesheet\" href=\"../css/main.css\"/>"
                + "<style>h1 { background: url('../images/rule.png'); }</style></head>"
                + "<body><img src=\"../images/plate%201.jpg\"/>"
                + "<svg><image xlink:href=\"../images/map.svg\"/></svg>"
                + "<p style=\"background-image: url(../images/bg.gif)\">text</p>"
                + "<a href=\"chapter2.xhtml\">next</a><a href=\"#note1\">1</a>"
                + "<img src=\"https://example.org/remote.png\"/></body></html>";

        assertThat(scanner.scanDocument("OEBPS/text/chapter1.xhtml", bytes(xhtml))).containsExactlyInAnyOrder(
                "OEBPS/css/main.css",
                "OEBPS/images/rule.png",
                "OEBPS/images/plate 1.jpg",
                "OEBPS/images/map.svg",
                "OEBPS/images/bg.gif");
    }

    @Test
    void scanStylesheet_followsImportsAndUrls() {
        String css = "@import \"fonts.css\";\n"
                + "@font-face { font-family: Body; src: url(\"../fonts/Body.otf\"); }\n"
                + "body { background: url(data:image/png;base64,AAAA); }";

        assertThat(scanner.scanStylesheet("OEBPS/css/main.css", bytes(css)))
                .containsExactlyInAnyOrder("OEBPS/css/fonts.css", "OEBPS/fonts/Body.otf");
    }
}
