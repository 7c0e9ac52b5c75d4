package com.dnobretech.epublocator.epub;

import com.dnobretech.epublocator.dto.PackageDocument;
import com.dnobretech.epublocator.dto.SpinePosition;
import com.dnobretech.epublocator.exception.MalformedPackageException;
import com.dnobretech.epublocator.markup.DocumentDialect;
import com.dnobretech.epublocator.markup.MarkupParser;
import com.dnobretech.epublocator.markup.MarkupTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OPF → manifest (id → href), spine (idrefs em ordem) e a posição do &lt;spine&gt; entre os filhos de &lt;package&gt;.
 * Prefixos de namespace (opf:item etc.) são ignorados na comparação de nomes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PackageDescriptorParser {

    private final MarkupParser parser;

    public PackageDocument parse(Path descriptor, String entryName) {
        if (!Files.isRegularFile(descriptor)) {
            throw new MalformedPackageException("package descriptor não encontrado: " + entryName);
        }
        MarkupTree tree;
        try {
            tree = parser.parse(descriptor, DocumentDialect.XML);
        } catch (IOException e) {
            throw new MalformedPackageException("falha ao ler " + entryName + ": " + e.getMessage(), e);
        }
        return parse(tree, descriptor, entryName);
    }

    PackageDocument parse(MarkupTree tree, Path descriptor, String entryName) {
        int pkg = tree.documentElement();
        if (pkg == MarkupTree.NO_NODE || !"package".equals(tree.localName(pkg))) {
            throw new MalformedPackageException(entryName + ": elemento raiz não é <package>");
        }

        Map<String, String> manifest = readManifest(tree, pkg, entryName);
        List<String> spine = readSpine(tree, pkg, entryName);
        SpinePosition position = spinePosition(tree, pkg);

        log.debug("[opf] {}: manifest={} spine={} spinePos={}/{}",
                entryName, manifest.size(), spine.size(), position.ordinal(), position.total());
        return new PackageDocument(entryName, descriptor, manifest, spine, position);
    }

    private static Map<String, String> readManifest(MarkupTree tree, int pkg, String entryName) {
        Map<String, String> manifest = new LinkedHashMap<>();
        for (int section : tree.childElements(pkg, "manifest")) {
            for (int item : tree.childElements(section, "item")) {
                String id = tree.attribute(item, "id");
                String href = tree.attribute(item, "href");
                if (id == null || id.isBlank() || href == null || href.isBlank()) {
                    throw new MalformedPackageException(entryName + ": <item> sem id/href (id=" + id + ", href=" + href + ")");
                }
                // id repetido: o último vence
                String previous = manifest.put(id, href);
                if (previous != null) {
                    log.debug("[opf] id duplicado no manifest: {} ({} → {})", id, previous, href);
                }
            }
        }
        return manifest;
    }

    private static List<String> readSpine(MarkupTree tree, int pkg, String entryName) {
        List<String> spine = new ArrayList<>();
        for (int section : tree.childElements(pkg, "spine")) {
            for (int itemref : tree.childElements(section, "itemref")) {
                String idref = tree.attribute(itemref, "idref");
                if (idref == null || idref.isBlank()) {
                    throw new MalformedPackageException(entryName + ": <itemref> sem idref");
                }
                spine.add(idref);
            }
        }
        return spine;
    }

    static SpinePosition spinePosition(MarkupTree tree, int pkg) {
        List<Integer> children = tree.childElements(pkg);
        for (int i = 0; i < children.size(); i++) {
            if ("spine".equals(tree.localName(children.get(i)))) {
                return new SpinePosition(i + 1, children.size());
            }
        }
        return SpinePosition.absent(children.size());
    }
}
