package com.dnobretech.epublocator.epub;

import com.dnobretech.epublocator.dto.ElementStep;
import com.dnobretech.epublocator.dto.SpineDocument;
import com.dnobretech.epublocator.dto.StructuralAddress;
import com.dnobretech.epublocator.exception.DocumentUnreadableException;
import com.dnobretech.epublocator.markup.DocumentDialect;
import com.dnobretech.epublocator.markup.MarkupParser;
import com.dnobretech.epublocator.markup.MarkupTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Varre os documentos do spine na ordem de leitura e devolve o endereço do primeiro nó de texto
 * que contém a query.
 * <p>
 * Regras:
 * <ul>
 *   <li>só o primeiro match (primeiro documento, primeiro nó de texto em ordem de documento) é reportado;</li>
 *   <li>o match fica dentro de um único nó de texto: uma query quebrada por markup
 *       (ex.: {@code foo <b>bar</b>}) não é encontrada;</li>
 *   <li>offsets em code points sobre o texto cru do nó.</li>
 * </ul>
 */
@Slf4j
@Component
public class TextLocator {

    private final MarkupParser parser;
    private final DocumentDialect dialect;

    public TextLocator(MarkupParser parser,
                       @Value("${locator.document-dialect:xml}") String dialect) {
        this.parser = parser;
        this.dialect = DocumentDialect.fromConfig(dialect);
    }

    public Optional<StructuralAddress> locate(List<SpineDocument> documents, String query) {
        if (query == null || query.isEmpty()) {
            throw new IllegalArgumentException("query vazia");
        }
        int total = documents.size();
        for (int i = 0; i < total; i++) {
            SpineDocument doc = documents.get(i);
            MarkupTree tree = read(doc);
            Optional<StructuralAddress> hit = scan(tree, query, i + 1, total, doc.entryName());
            if (hit.isPresent()) return hit;
            log.debug("[locate] sem match em {} ({}/{})", doc.entryName(), i + 1, total);
        }
        return Optional.empty();
    }

    private MarkupTree read(SpineDocument doc) {
        try {
            return parser.parse(doc.file(), dialect);
        } catch (IOException | UncheckedIOException e) {
            throw new DocumentUnreadableException(doc.entryName(), e);
        }
    }

    static Optional<StructuralAddress> scan(MarkupTree tree, String query, int spineIndex, int spineTotal, String file) {
        // índices da arena já estão em ordem de documento (pré-ordem)
        for (int node = 0; node < tree.size(); node++) {
            if (!tree.isText(node)) continue;
            int parent = tree.parent(node);
            if (parent == MarkupTree.NO_NODE || !tree.isElement(parent)) continue;   // texto fora de qualquer elemento

            String text = tree.text(node);
            int at = text.indexOf(query);
            if (at < 0) continue;

            int start = text.codePointCount(0, at);
            int end = start + query.codePointCount(0, query.length());

            List<ElementStep> elementPath = ancestorSteps(tree, parent);
            List<Integer> indexPath = new ArrayList<>(elementPath.size());
            // o elemento mais externo (html) entra no elementPath mas não no indexPath
            for (int s = 1; s < elementPath.size(); s++) indexPath.add(elementPath.get(s).ordinal());

            return Optional.of(StructuralAddress.builder()
                    .spineIndex(spineIndex)
                    .spineTotal(spineTotal)
                    .matchedFile(file)
                    .elementPath(elementPath)
                    .indexPath(indexPath)
                    .matchStart(start)
                    .matchEnd(end)
                    .build());
        }
        return Optional.empty();
    }

    /** Do elemento dado até a raiz; devolvido na ordem raiz → folha. */
    static List<ElementStep> ancestorSteps(MarkupTree tree, int element) {
        List<ElementStep> steps = new ArrayList<>();
        for (int cur = element; cur != MarkupTree.NO_NODE && tree.isElement(cur); cur = tree.parent(cur)) {
            steps.add(new ElementStep(tree.name(cur), tree.sameNameOrdinal(cur)));
        }
        Collections.reverse(steps);
        return steps;
    }
}
