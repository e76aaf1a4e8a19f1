package com.williamcallahan.omnibus_engine.service.epub;

import com.williamcallahan.omnibus_engine.util.EpubPaths;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the archive resources a content document or stylesheet depends on:
 * images, stylesheets, fonts, media and other embedded files.
 * Hyperlinks between content documents are deliberately not followed so one work never pulls in the next.
 */
@Component
public class EpubResourceReferenceScanner {

    private static final Pattern CSS_URL = Pattern.compile("url\\(\\s*['\"]?([^'\")]+?)['\"]?\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CSS_IMPORT = Pattern.compile("@import\\s+['\"]([^'\"]+)['\"]", Pattern.CASE_INSENSITIVE);
    private static final String[] EMBEDDING_ATTRIBUTES = {"src", "data-src", "poster", "data", "xlink:href"};

    /**
     * Archive paths referenced by an XHTML content document.
     *
     * @param documentPath archive path of the document, used to resolve relative references
     * @param content raw document bytes
     */
    public Set<String> scanDocument(String documentPath, byte[] content) {
        String baseDir = EpubPaths.directoryOf(documentPath);
        Document doc = Jsoup.parse(new String(content, StandardCharsets.UTF_8), "", Parser.xmlParser());
        Set<String> references = new LinkedHashSet<>();

        for (Element element : doc.getAllElements()) {
            String tag = ZipEpubContainerReader.localName(element).toLowerCase(Locale.ROOT);
            for (String attribute : EMBEDDING_ATTRIBUTES) {
                if (element.hasAttr(attribute)) {
                    add(references, baseDir, element.attr(attribute));
                }
            }
            // <a href> points at other documents; every other href (link, image, use) is an embedded dependency
            if (element.hasAttr("href") && !tag.equals("a")) {
                add(references, baseDir, element.attr("href"));
            }
            if (element.hasAttr("style")) {
                references.addAll(scanCss(baseDir, element.attr("style")));
            }
            if (tag.equals("style")) {
                references.addAll(scanCss(baseDir, element.wholeText() + element.data()));
            }
        }
        references.remove(documentPath);
        return references;
    }

    /**
     * Archive paths referenced by a stylesheet through {@code url(...)} or {@code @import}.
     */
    public Set<String> scanStylesheet(String stylesheetPath, byte[] content) {
        Set<String> references = scanCss(EpubPaths.directoryOf(stylesheetPath), new String(content, StandardCharsets.UTF_8));
        references.remove(stylesheetPath);
        return references;
    }

    private Set<String> scanCss(String baseDir, String css) {
        Set<String> references = new LinkedHashSet<>();
        if (css == null || css.isEmpty()) {
            return references;
        }
        Matcher imports = CSS_IMPORT.matcher(css);
        while (imports.find()) {
            add(references, baseDir, imports.group(1));
        }
        Matcher urls = CSS_URL.matcher(css);
        while (urls.find()) {
            add(references, baseDir, urls.group(1));
        }
        return references;
    }

    private static void add(Set<String> references, String baseDir, String reference) {
        if (reference == null || reference.isBlank() || reference.trim().startsWith("#")) {
            return;
        }
        String resolved = EpubPaths.resolve(baseDir, reference);
        if (resolved != null && !resolved.isEmpty()) {
            references.add(resolved);
        }
    }
}
