/**
 * Carves a single work out of an omnibus EPUB into a standalone EPUB
 *
 * @author William Callahan
 *
 * Features:
 * - Keeps the work's first document and every following spine document up to the next work boundary
 * - Pulls in stylesheets, images and fonts referenced by the kept documents, transitively
 * - Regenerates the package document and an NCX scoped to the work
 * - Writes entries in a fixed order with a fixed timestamp so repeated slicing is byte-identical
 * - Stops between entries when the calling thread is interrupted
 */
package com.williamcallahan.omnibus_engine.service.epub;

import com.williamcallahan.omnibus_engine.exception.ContainerUnreadableException;
import com.williamcallahan.omnibus_engine.model.TocEntry;
import com.williamcallahan.omnibus_engine.model.Work;
import com.williamcallahan.omnibus_engine.util.EpubPaths;
import com.williamcallahan.omnibus_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

@Component
public class EpubArchiveSlicer implements ArchiveSlicer {

    private static final Logger logger = LoggerFactory.getLogger(EpubArchiveSlicer.class);

    static final String MIMETYPE_ENTRY = "mimetype";
    static final byte[] EPUB_MIMETYPE = "application/epub+zip".getBytes(StandardCharsets.US_ASCII);
    // 2000-01-01T00:00:00Z on every entry
    static final long ENTRY_TIME = 946684800000L;
    private static final String NCX_MEDIA_TYPE = "application/x-dtbncx+xml";

    private static final Map<String, String> MEDIA_TYPES_BY_EXTENSION = Map.ofEntries(
            Map.entry("xhtml", "application/xhtml+xml"),
            Map.entry("html", "application/xhtml+xml"),
            Map.entry("htm", "application/xhtml+xml"),
            Map.entry("css", "text/css"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("gif", "image/gif"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("webp", "image/webp"),
            Map.entry("ttf", "font/ttf"),
            Map.entry("otf", "font/otf"),
            Map.entry("woff", "font/woff"),
            Map.entry("woff2", "font/woff2"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("js", "application/javascript"));

    private final EpubContainerReader containerReader;
    private final EpubResourceReferenceScanner referenceScanner;

    public EpubArchiveSlicer(EpubContainerReader containerReader, EpubResourceReferenceScanner referenceScanner) {
        this.containerReader = containerReader;
        this.referenceScanner = referenceScanner;
    }

    @Override
    public void extract(Work work, Path sourceContainer, Path destination) throws IOException {
        checkInterrupted();
        EpubContainer container = openContainer(sourceContainer);
        String startDocument = EpubPaths.stripFragment(work.href());

        try (ZipFile source = new ZipFile(sourceContainer.toFile(), StandardCharsets.UTF_8)) {
            if (!ValidationUtils.hasText(startDocument) || source.getEntry(startDocument) == null) {
                throw new IOException("Work '" + work.title() + "' starts at '" + work.href()
                        + "' which is not present in " + container.name());
            }

            List<String> documents = selectDocuments(container, work.href());
            Set<String> resources = collectResources(source, container, documents);
            String packageDir = EpubPaths.directoryOf(container.packagePath());
            String ncxPath = uniquePath(packageDir + "toc.ncx", documents, resources);
            TocEntry workEntry = findEntry(container.toc(), work.href());

            logger.debug("Slicing '{}' from {}: {} documents, {} resources",
                    work.title(), container.name(), documents.size(), resources.size());

            try (OutputStream fileOut = Files.newOutputStream(destination);
                 ZipOutputStream zip = new ZipOutputStream(new BufferedOutputStream(fileOut), StandardCharsets.UTF_8)) {
                writeMimetype(zip);
                writeEntry(zip, ZipEpubContainerReader.CONTAINER_XML, containerXml(container.packagePath()));
                writeEntry(zip, container.packagePath(), packageDocument(work, container, documents, resources, ncxPath));
                writeEntry(zip, ncxPath, ncx(work, container, workEntry, documents, ncxPath));
                for (String path : documents) {
                    copyEntry(source, zip, path);
                }
                for (String path : resources) {
                    copyEntry(source, zip, path);
                }
            }
        }
    }

    private EpubContainer openContainer(Path sourceContainer) throws InterruptedIOException {
        try {
            return containerReader.open(sourceContainer);
        } catch (ContainerUnreadableException e) {
            // Reads of an interrupted thread come back empty and look like a broken archive
            if (Thread.currentThread().isInterrupted()) {
                InterruptedIOException interrupted = new InterruptedIOException("Slicing interrupted");
                interrupted.initCause(e);
                throw interrupted;
            }
            throw e;
        }
    }

    /**
     * Content documents of the work in reading order: the start document and every spine item
     * before the next boundary, where a boundary is the document of any TOC entry at the work's depth or above.
     */
    List<String> selectDocuments(EpubContainer container, String workHref) {
        String startDocument = EpubPaths.stripFragment(workHref);
        List<String> spine = container.spine();
        int start = spine.indexOf(startDocument);
        if (start < 0) {
            return List.of(startDocument);
        }

        int depth = depthOf(container.toc(), workHref);
        if (depth < 0) {
            return List.of(startDocument);
        }
        Set<String> boundaries = new LinkedHashSet<>();
        collectBoundaries(container.toc(), depth, 0, boundaries);

        List<String> documents = new ArrayList<>();
        documents.add(startDocument);
        for (int i = start + 1; i < spine.size(); i++) {
            String candidate = spine.get(i);
            if (boundaries.contains(candidate) && !candidate.equals(startDocument)) {
                break;
            }
            if (!documents.contains(candidate)) {
                documents.add(candidate);
            }
        }
        return documents;
    }

    private Set<String> collectResources(ZipFile source, EpubContainer container, List<String> documents) throws IOException {
        Set<String> resources = new TreeSet<>();
        Set<String> visited = new LinkedHashSet<>(documents);
        Deque<String> pending = new ArrayDeque<>(documents);
        Set<String> spineDocuments = Set.copyOf(container.spine());

        while (!pending.isEmpty()) {
            checkInterrupted();
            String path = pending.poll();
            ZipEntry entry = source.getEntry(path);
            if (entry == null) {
                continue;
            }
            byte[] content = readEntry(source, entry);
            Set<String> references;
            if (isStylesheet(container, path)) {
                references = referenceScanner.scanStylesheet(path, content);
            } else if (isMarkup(container, path)) {
                references = referenceScanner.scanDocument(path, content);
            } else {
                continue;
            }
            for (String reference : references) {
                // Other spine documents belong to other works
                if (spineDocuments.contains(reference) || source.getEntry(reference) == null) {
                    continue;
                }
                if (visited.add(reference)) {
                    resources.add(reference);
                    pending.add(reference);
                }
            }
        }
        return resources;
    }

    private String packageDocument(Work work, EpubContainer container, List<String> documents,
                                   Set<String> resources, String ncxPath) {
        String packageDir = EpubPaths.directoryOf(container.packagePath());
        EpubPackageMetadata metadata = container.metadata();
        String identifier = "urn:uuid:" + UUID.nameUUIDFromBytes(
                (ValidationUtils.firstNonBlank(metadata.identifiers().isEmpty() ? null : metadata.identifiers().get(0), container.name())
                        + "|" + work.href()).getBytes(StandardCharsets.UTF_8));

        StringBuilder opf = new StringBuilder();
        opf.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
           .append("<package xmlns=\"http://www.idpf.org/2007/opf\" version=\"2.0\" unique-identifier=\"bookid\">\n")
           .append("  <metadata xmlns:dc=\"http://purl.org/dc/elements/1.1/\" xmlns:opf=\"http://www.idpf.org/2007/opf\">\n");
        element(opf, "dc:identifier", identifier, " id=\"bookid\"");
        element(opf, "dc:title", work.title().isEmpty() ? container.name() : work.title(), "");
        for (String creator : metadata.creators()) {
            element(opf, "dc:creator", creator, "");
        }
        element(opf, "dc:language", ValidationUtils.firstNonBlank(metadata.language(), "en"), "");
        for (String publisher : metadata.publishers()) {
            element(opf, "dc:publisher", publisher, "");
        }
        for (String description : metadata.descriptions()) {
            element(opf, "dc:description", description, "");
        }
        for (String date : metadata.dates()) {
            element(opf, "dc:date", date, "");
        }
        for (String subject : metadata.subjects()) {
            element(opf, "dc:subject", subject, "");
        }
        for (String rights : metadata.rights()) {
            element(opf, "dc:rights", rights, "");
        }
        if (ValidationUtils.hasText(metadata.firstTitle())) {
            element(opf, "dc:source", metadata.firstTitle(), "");
        }
        opf.append("  </metadata>\n  <manifest>\n");
        opf.append("    <item id=\"ncx\" href=\"").append(escape(EpubPaths.relativize(packageDir, ncxPath)))
           .append("\" media-type=\"").append(NCX_MEDIA_TYPE).append("\"/>\n");
        int index = 1;
        for (String path : documents) {
            manifestItem(opf, "doc" + index++, packageDir, path, mediaTypeOf(container, path));
        }
        index = 1;
        for (String path : resources) {
            manifestItem(opf, "res" + index++, packageDir, path, mediaTypeOf(container, path));
        }
        opf.append("  </manifest>\n  <spine toc=\"ncx\">\n");
        for (int i = 1; i <= documents.size(); i++) {
            opf.append("    <itemref idref=\"doc").append(i).append("\"/>\n");
        }
        opf.append("  </spine>\n</package>\n");
        return opf.toString();
    }

    private String ncx(Work work, EpubContainer container, TocEntry workEntry, List<String> documents, String ncxPath) {
        String ncxDir = EpubPaths.directoryOf(ncxPath);
        StringBuilder ncx = new StringBuilder();
        ncx.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
           .append("<ncx xmlns=\"http://www.daisy.org/z3986/2005/ncx/\" version=\"2005-1\">\n")
           .append("  <head/>\n")
           .append("  <docTitle><text>").append(escape(work.title())).append("</text></docTitle>\n")
           .append("  <navMap>\n");
        int[] playOrder = {1};
        String title = work.title().isEmpty() ? container.name() : work.title();
        List<TocEntry> children = workEntry == null ? List.of() : workEntry.children();
        navPoint(ncx, title, work.href(), children, documents, ncxDir, playOrder, "    ");
        ncx.append("  </navMap>\n</ncx>\n");
        return ncx.toString();
    }

    private void navPoint(StringBuilder ncx, String title, String href, List<TocEntry> children,
                          List<String> documents, String ncxDir, int[] playOrder, String indent) {
        int order = playOrder[0]++;
        ncx.append(indent).append("<navPoint id=\"navPoint-").append(order).append("\" playOrder=\"").append(order).append("\">\n")
           .append(indent).append("  <navLabel><text>").append(escape(title)).append("</text></navLabel>\n")
           .append(indent).append("  <content src=\"").append(escape(relativeHref(ncxDir, href))).append("\"/>\n");
        for (TocEntry child : children) {
            if (child.href() == null || !documents.contains(EpubPaths.stripFragment(child.href()))) {
                continue;
            }
            String childTitle = ValidationUtils.firstNonBlank(child.title(), title);
            navPoint(ncx, childTitle, child.href(), child.children(), documents, ncxDir, playOrder, indent + "  ");
        }
        ncx.append(indent).append("</navPoint>\n");
    }

    private static String containerXml(String packagePath) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<container version=\"1.0\" xmlns=\"urn:oasis:names:tc:opendocument:xmlns:container\">\n"
                + "  <rootfiles>\n"
                + "    <rootfile full-path=\"" + escape(packagePath) + "\" media-type=\"application/oebps-package+xml\"/>\n"
                + "  </rootfiles>\n"
                + "</container>\n";
    }

    private static void writeMimetype(ZipOutputStream zip) throws IOException {
        ZipEntry entry = new ZipEntry(MIMETYPE_ENTRY);
        entry.setMethod(ZipEntry.STORED);
        entry.setSize(EPUB_MIMETYPE.length);
        entry.setCompressedSize(EPUB_MIMETYPE.length);
        CRC32 crc = new CRC32();
        crc.update(EPUB_MIMETYPE);
        entry.setCrc(crc.getValue());
        entry.setTime(ENTRY_TIME);
        zip.putNextEntry(entry);
        zip.write(EPUB_MIMETYPE);
        zip.closeEntry();
    }

    private static void writeEntry(ZipOutputStream zip, String name, String content) throws IOException {
        checkInterrupted();
        ZipEntry entry = new ZipEntry(name);
        entry.setTime(ENTRY_TIME);
        zip.putNextEntry(entry);
        zip.write(content.getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
    }

    private static void copyEntry(ZipFile source, ZipOutputStream zip, String name) throws IOException {
        checkInterrupted();
        ZipEntry sourceEntry = source.getEntry(name);
        if (sourceEntry == null) {
            logger.debug("Skipping missing archive entry {}", name);
            return;
        }
        ZipEntry entry = new ZipEntry(name);
        entry.setTime(ENTRY_TIME);
        zip.putNextEntry(entry);
        try (InputStream in = source.getInputStream(sourceEntry)) {
            in.transferTo(zip);
        }
        zip.closeEntry();
    }

    private static byte[] readEntry(ZipFile source, ZipEntry entry) throws IOException {
        try (InputStream in = source.getInputStream(entry)) {
            return in.readAllBytes();
        }
    }

    private static void checkInterrupted() throws InterruptedIOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("Slicing interrupted");
        }
    }

    /**
     * Depth of the TOC entry of a work. An exact href match anywhere in the tree wins over
     * an entry that only points at the same document.
     */
    private static int depthOf(List<TocEntry> entries, String href) {
        int exact = depthOf(entries, entry -> href.equals(entry.href()), 0);
        if (exact >= 0) {
            return exact;
        }
        String document = EpubPaths.stripFragment(href);
        return depthOf(entries, entry -> entry.href() != null
                && document.equals(EpubPaths.stripFragment(entry.href())), 0);
    }

    private static int depthOf(List<TocEntry> entries, Predicate<TocEntry> matches, int depth) {
        for (TocEntry entry : entries) {
            if (matches.test(entry)) {
                return depth;
            }
        }
        for (TocEntry entry : entries) {
            int nested = depthOf(entry.children(), matches, depth + 1);
            if (nested >= 0) {
                return nested;
            }
        }
        return -1;
    }

    private static TocEntry findEntry(List<TocEntry> entries, String href) {
        for (TocEntry entry : entries) {
            if (href.equals(entry.href())) {
                return entry;
            }
            TocEntry nested = findEntry(entry.children(), href);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    private static void collectBoundaries(List<TocEntry> entries, int maxDepth, int depth, Set<String> boundaries) {
        if (depth > maxDepth) {
            return;
        }
        for (TocEntry entry : entries) {
            if (entry.href() != null) {
                boundaries.add(EpubPaths.stripFragment(entry.href()));
            }
            collectBoundaries(entry.children(), maxDepth, depth + 1, boundaries);
        }
    }

    private static String uniquePath(String preferred, List<String> documents, Set<String> resources) {
        String candidate = preferred;
        int suffix = 1;
        while (documents.contains(candidate) || resources.contains(candidate)) {
            candidate = preferred.replace(".ncx", "-" + suffix++ + ".ncx");
        }
        return candidate;
    }

    private static boolean isStylesheet(EpubContainer container, String path) {
        return mediaTypeOf(container, path).equals("text/css");
    }

    private static boolean isMarkup(EpubContainer container, String path) {
        String mediaType = mediaTypeOf(container, path);
        return mediaType.equals("application/xhtml+xml") || mediaType.equals("text/html") || mediaType.equals("image/svg+xml");
    }

    static String mediaTypeOf(EpubContainer container, String path) {
        return container.manifestItem(path)
                .map(ManifestItem::mediaType)
                .filter(ValidationUtils::hasText)
                .orElseGet(() -> {
                    int dot = path.lastIndexOf('.');
                    String extension = dot < 0 ? "" : path.substring(dot + 1).toLowerCase(Locale.ROOT);
                    return MEDIA_TYPES_BY_EXTENSION.getOrDefault(extension, "application/octet-stream");
                });
    }

    private static String relativeHref(String fromDir, String href) {
        String fragment = EpubPaths.fragmentOf(href);
        String relative = EpubPaths.relativize(fromDir, EpubPaths.stripFragment(href));
        return fragment == null ? relative : relative + "#" + fragment;
    }

    private static void manifestItem(StringBuilder opf, String id, String packageDir, String path, String mediaType) {
        opf.append("    <item id=\"").append(id)
           .append("\" href=\"").append(escape(EpubPaths.relativize(packageDir, path)))
           .append("\" media-type=\"").append(escape(mediaType)).append("\"/>\n");
    }

    private static void element(StringBuilder sb, String name, String value, String attributes) {
        sb.append("    <").append(name).append(attributes).append('>')
          .append(escape(value))
          .append("</").append(name).append(">\n");
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&apos;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
