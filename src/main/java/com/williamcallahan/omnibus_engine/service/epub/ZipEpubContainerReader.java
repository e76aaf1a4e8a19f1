/**
 * Reads EPUB 2 and EPUB 3 archives from the local filesystem
 *
 * @author William Callahan
 *
 * Features:
 * - Locates the package document through META-INF/container.xml
 * - Parses manifest, spine and Dublin Core metadata with the jsoup XML parser
 * - Builds the table of contents from the NCX, or from the EPUB 3 navigation document when no NCX exists
 * - Resolves every href to an archive path relative to the archive root
 */
package com.williamcallahan.omnibus_engine.service.epub;

import com.williamcallahan.omnibus_engine.exception.ContainerUnreadableException;
import com.williamcallahan.omnibus_engine.model.TocEntry;
import com.williamcallahan.omnibus_engine.util.EpubPaths;
import com.williamcallahan.omnibus_engine.util.ValidationUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

@Component
public class ZipEpubContainerReader implements EpubContainerReader {

    private static final Logger logger = LoggerFactory.getLogger(ZipEpubContainerReader.class);

    static final String CONTAINER_XML = "META-INF/container.xml";
    private static final String PACKAGE_MEDIA_TYPE = "application/oebps-package+xml";

    @Override
    public EpubContainer open(Path epubFile) {
        String name = epubFile.getFileName() == null ? epubFile.toString() : epubFile.getFileName().toString();
        if (!Files.isRegularFile(epubFile)) {
            throw new ContainerUnreadableException(name, "file does not exist");
        }
        try (ZipFile zip = new ZipFile(epubFile.toFile(), StandardCharsets.UTF_8)) {
            String packagePath = findPackagePath(zip, name);
            Document opf = parseXml(zip, packagePath, name);
            String packageDir = EpubPaths.directoryOf(packagePath);

            Map<String, ManifestItem> manifestById = readManifest(opf, packageDir);
            Map<String, ManifestItem> manifestByHref = new LinkedHashMap<>();
            manifestById.values().forEach(item -> manifestByHref.putIfAbsent(item.href(), item));

            Element spineElement = firstByLocalName(opf, "spine").orElse(null);
            List<String> spine = readSpine(spineElement, manifestById, name);
            List<TocEntry> toc = readToc(zip, spineElement, manifestById, name);
            EpubPackageMetadata metadata = readMetadata(opf);

            logger.debug("Opened EPUB {}: {} manifest items, {} spine items, {} top-level TOC entries",
                    name, manifestByHref.size(), spine.size(), toc.size());
            return new EpubContainer(name, packagePath, metadata, manifestByHref, spine, toc);
        } catch (ZipException e) {
            throw new ContainerUnreadableException(name, "not a valid zip archive", e);
        } catch (IOException e) {
            throw new ContainerUnreadableException(name, e.getMessage(), e);
        }
    }

    private String findPackagePath(ZipFile zip, String name) throws IOException {
        Document container = parseXml(zip, CONTAINER_XML, name);
        String fallback = null;
        for (Element rootfile : elementsByLocalName(container, "rootfile")) {
            String fullPath = rootfile.attr("full-path");
            if (!ValidationUtils.hasText(fullPath)) {
                continue;
            }
            if (PACKAGE_MEDIA_TYPE.equalsIgnoreCase(rootfile.attr("media-type"))) {
                return EpubPaths.normalize(fullPath);
            }
            if (fallback == null) {
                fallback = EpubPaths.normalize(fullPath);
            }
        }
        if (fallback == null) {
            throw new ContainerUnreadableException(name, "container.xml declares no package document");
        }
        return fallback;
    }

    private Map<String, ManifestItem> readManifest(Document opf, String packageDir) {
        Map<String, ManifestItem> items = new LinkedHashMap<>();
        Optional<Element> manifest = firstByLocalName(opf, "manifest");
        if (manifest.isEmpty()) {
            return items;
        }
        for (Element item : childrenByLocalName(manifest.get(), "item")) {
            String id = item.attr("id");
            String href = EpubPaths.resolve(packageDir, item.attr("href"));
            if (!ValidationUtils.hasText(id) || href == null) {
                logger.debug("Skipping manifest item without id or local href: {}", item.attr("href"));
                continue;
            }
            items.putIfAbsent(id, new ManifestItem(id, href, item.attr("media-type"), item.attr("properties")));
        }
        return items;
    }

    private List<String> readSpine(Element spineElement, Map<String, ManifestItem> manifestById, String name) {
        List<String> spine = new ArrayList<>();
        if (spineElement == null) {
            return spine;
        }
        for (Element itemref : childrenByLocalName(spineElement, "itemref")) {
            ManifestItem item = manifestById.get(itemref.attr("idref"));
            if (item == null) {
                logger.debug("Spine of {} references unknown manifest id '{}'", name, itemref.attr("idref"));
                continue;
            }
            spine.add(item.href());
        }
        return spine;
    }

    private List<TocEntry> readToc(ZipFile zip, Element spineElement, Map<String, ManifestItem> manifestById,
                                   String name) throws IOException {
        ManifestItem ncx = findNcx(spineElement, manifestById);
        if (ncx != null && zip.getEntry(ncx.href()) != null) {
            Document ncxDoc = parseXml(zip, ncx.href(), name);
            List<TocEntry> entries = firstByLocalName(ncxDoc, "navMap")
                    .map(navMap -> readNavPoints(navMap, EpubPaths.directoryOf(ncx.href())))
                    .orElse(List.of());
            if (!entries.isEmpty()) {
                return entries;
            }
        }

        ManifestItem nav = manifestById.values().stream().filter(i -> i.hasProperty("nav")).findFirst().orElse(null);
        if (nav != null && zip.getEntry(nav.href()) != null) {
            Document navDoc = parseXml(zip, nav.href(), name);
            return readNavDocument(navDoc, EpubPaths.directoryOf(nav.href()));
        }
        logger.debug("EPUB {} has no readable table of contents", name);
        return List.of();
    }

    private static ManifestItem findNcx(Element spineElement, Map<String, ManifestItem> manifestById) {
        if (spineElement != null && spineElement.hasAttr("toc")) {
            ManifestItem declared = manifestById.get(spineElement.attr("toc"));
            if (declared != null) {
                return declared;
            }
        }
        return manifestById.values().stream().filter(ManifestItem::isNcx).findFirst().orElse(null);
    }

    private List<TocEntry> readNavPoints(Element parent, String baseDir) {
        List<TocEntry> entries = new ArrayList<>();
        for (Element navPoint : childrenByLocalName(parent, "navPoint")) {
            String title = firstByLocalName(navPoint, "navLabel")
                    .flatMap(label -> firstByLocalName(label, "text"))
                    .map(Element::text)
                    .filter(ValidationUtils::hasText)
                    .orElse(null);
            String href = childrenByLocalName(navPoint, "content").stream()
                    .findFirst()
                    .map(content -> resolveKeepingFragment(baseDir, content.attr("src")))
                    .orElse(null);
            entries.add(new TocEntry(title, href, readNavPoints(navPoint, baseDir)));
        }
        return entries;
    }

    private List<TocEntry> readNavDocument(Document navDoc, String baseDir) {
        List<Element> navs = elementsByLocalName(navDoc, "nav");
        Element tocNav = navs.stream()
                .filter(nav -> nav.attr("epub:type").toLowerCase(Locale.ROOT).contains("toc"))
                .findFirst()
                .orElse(navs.isEmpty() ? null : navs.get(0));
        if (tocNav == null) {
            return List.of();
        }
        return firstByLocalName(tocNav, "ol")
                .map(ol -> readNavList(ol, baseDir))
                .orElse(List.of());
    }

    private List<TocEntry> readNavList(Element ol, String baseDir) {
        List<TocEntry> entries = new ArrayList<>();
        for (Element li : childrenByLocalName(ol, "li")) {
            Element label = li.children().stream()
                    .filter(child -> localName(child).equals("a") || localName(child).equals("span"))
                    .findFirst()
                    .orElse(null);
            String title = label == null || !ValidationUtils.hasText(label.text()) ? null : label.text();
            String href = label != null && localName(label).equals("a")
                    ? resolveKeepingFragment(baseDir, label.attr("href"))
                    : null;
            List<TocEntry> children = childrenByLocalName(li, "ol").stream()
                    .findFirst()
                    .map(nested -> readNavList(nested, baseDir))
                    .orElse(List.of());
            entries.add(new TocEntry(title, href, children));
        }
        return entries;
    }

    private EpubPackageMetadata readMetadata(Document opf) {
        Optional<Element> metadata = firstByLocalName(opf, "metadata");
        if (metadata.isEmpty()) {
            return EpubPackageMetadata.empty();
        }
        Element root = metadata.get();
        List<String> languages = texts(root, "language");
        return new EpubPackageMetadata(
                texts(root, "title"),
                texts(root, "creator"),
                texts(root, "description"),
                languages.isEmpty() ? null : languages.get(0),
                texts(root, "publisher"),
                texts(root, "identifier"),
                texts(root, "date"),
                texts(root, "subject"),
                texts(root, "rights"));
    }

    private static String resolveKeepingFragment(String baseDir, String href) {
        String path = EpubPaths.resolve(baseDir, href);
        if (path == null) {
            return null;
        }
        String fragment = EpubPaths.fragmentOf(href);
        return fragment == null ? path : path + "#" + fragment;
    }

    static Document parseXml(ZipFile zip, String entryName, String containerName) throws IOException {
        ZipEntry entry = zip.getEntry(entryName);
        if (entry == null) {
            throw new ContainerUnreadableException(containerName, "missing entry " + entryName);
        }
        try (InputStream in = zip.getInputStream(entry)) {
            return Jsoup.parse(in, StandardCharsets.UTF_8.name(), "", Parser.xmlParser());
        }
    }

    private static List<String> texts(Element parent, String localName) {
        List<String> values = new ArrayList<>();
        for (Element element : childrenByLocalName(parent, localName)) {
            String text = element.text().trim();
            if (!text.isEmpty()) {
                values.add(text);
            }
        }
        return values;
    }

    static String localName(Element element) {
        String tag = element.tagName();
        int colon = tag.indexOf(':');
        return colon < 0 ? tag : tag.substring(colon + 1);
    }

    private static List<Element> childrenByLocalName(Element parent, String localName) {
        List<Element> matches = new ArrayList<>();
        for (Element child : parent.children()) {
            if (localName(child).equalsIgnoreCase(localName)) {
                matches.add(child);
            }
        }
        return matches;
    }

    private static List<Element> elementsByLocalName(Element root, String localName) {
        List<Element> matches = new ArrayList<>();
        for (Element element : root.getAllElements()) {
            if (localName(element).equalsIgnoreCase(localName)) {
                matches.add(element);
            }
        }
        return matches;
    }

    private static Optional<Element> firstByLocalName(Element root, String localName) {
        for (Element element : root.getAllElements()) {
            if (element != root && localName(element).equalsIgnoreCase(localName)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }
}
