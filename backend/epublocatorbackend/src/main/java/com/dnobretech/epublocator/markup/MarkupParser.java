package com.dnobretech.epublocator.markup;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.ParseSettings;
import org.jsoup.parser.Parser;
import org.jsoup.parser.Tag;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parse (jsoup) → {@link MarkupTree}. Serve tanto para o container.xml/OPF quanto para as páginas XHTML.
 * Comentários, doctype, declarações e DataNode (conteúdo de script/style no modo HTML) ficam fora da árvore.
 */
@Slf4j
@Component
public class MarkupParser {

    public MarkupTree parse(Path file, DocumentDialect dialect) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, dialect, file.toUri().toString());
        }
    }

    /** charset detectado pelo jsoup (BOM, declaração XML ou meta); default UTF-8. */
    public MarkupTree parse(InputStream in, DocumentDialect dialect, String baseUri) throws IOException {
        Document doc = Jsoup.parse(in, null, baseUri, newParser(dialect));
        return toTree(doc, dialect == DocumentDialect.XML);
    }

    private static Parser newParser(DocumentDialect dialect) {
        // nomes de tag/atributo em minúsculo nos dois modos
        return dialect == DocumentDialect.HTML
                ? Parser.htmlParser().settings(ParseSettings.htmlDefault)
                : Parser.xmlParser().settings(ParseSettings.htmlDefault);
    }

    /**
     * @param voidAware no modo XML o jsoup aninha o que vem depois de um {@code <br>} sem barra dentro dele;
     *                  com true, elementos void do HTML (br, img, hr...) ficam sem filhos e esse conteúdo
     *                  volta para o pai, logo depois do elemento.
     */
    static MarkupTree toTree(Document doc, boolean voidAware) {
        MarkupTree.Builder b = MarkupTree.builder();
        Deque<Integer> open = new ArrayDeque<>();
        open.push(0); // DOCUMENT

        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof Document) return;
                if (node instanceof Element el) {
                    int id = b.addElement(open.peek(), el.normalName(), attributesOf(el));
                    // void: os "filhos" viram irmãos seguintes
                    open.push(voidAware && Tag.valueOf(el.normalName()).isEmpty() ? open.peek() : id);
                } else if (node instanceof TextNode t) {
                    b.addText(open.peek(), t.getWholeText());
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element && !(node instanceof Document)) open.pop();
            }
        }, doc);

        MarkupTree tree = b.build();
        log.trace("[markup] {} nós", tree.size());
        return tree;
    }

    private static Map<String, String> attributesOf(Element el) {
        if (el.attributesSize() == 0) return null;
        Map<String, String> out = new LinkedHashMap<>();
        for (Attribute a : el.attributes()) out.put(a.getKey(), a.getValue());
        return out;
    }
}
