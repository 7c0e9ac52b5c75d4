package com.dnobretech.epublocator.markup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Árvore imutável de um documento (XML ou XHTML), guardada como arena:
 * cada nó é um índice int, com pai/filhos/nome/atributos/texto em arrays paralelos.
 * <p>
 * Os índices seguem a ordem do documento (pré-ordem, profundidade primeiro),
 * então percorrer 0..size-1 é percorrer o fonte na ordem em que aparece.
 * O nó 0 é sempre o DOCUMENT.
 */
public final class MarkupTree {

    public static final int NO_NODE = -1;

    private final NodeKind[] kinds;
    private final String[] names;        // nome normalizado (minúsculo, com prefixo se houver)
    private final int[] parents;
    private final List<List<Integer>> children;
    private final List<Map<String, String>> attributes;
    private final String[] texts;

    private MarkupTree(Builder b) {
        int n = b.kinds.size();
        this.kinds = b.kinds.toArray(new NodeKind[0]);
        this.names = b.names.toArray(new String[0]);
        this.texts = b.texts.toArray(new String[0]);
        this.parents = new int[n];
        for (int i = 0; i < n; i++) parents[i] = b.parents.get(i);
        List<List<Integer>> ch = new ArrayList<>(n);
        for (List<Integer> c : b.children) ch.add(Collections.unmodifiableList(c));
        this.children = Collections.unmodifiableList(ch);
        List<Map<String, String>> at = new ArrayList<>(n);
        for (Map<String, String> a : b.attributes) at.add(a == null ? Map.of() : Collections.unmodifiableMap(a));
        this.attributes = Collections.unmodifiableList(at);
    }

    public int size() {
        return kinds.length;
    }

    int documentNode() {
        return 0;
    }

    /** Elemento mais externo (ex.: html, package), ou NO_NODE se o documento não tem elementos. */
    public int documentElement() {
        for (int c : children.get(0)) {
            if (kinds[c] == NodeKind.ELEMENT) return c;
        }
        return NO_NODE;
    }

    NodeKind kind(int node) {
        return kinds[node];
    }

    public boolean isElement(int node) {
        return kinds[node] == NodeKind.ELEMENT;
    }

    public boolean isText(int node) {
        return kinds[node] == NodeKind.TEXT;
    }

    /** Nome do elemento, com prefixo de namespace se o fonte tinha (ex.: "opf:package"). */
    public String name(int node) {
        return names[node];
    }

    /** Nome sem prefixo de namespace ("opf:spine" → "spine"). */
    public String localName(int node) {
        String n = names[node];
        if (n == null) return null;
        int colon = n.indexOf(':');
        return colon < 0 ? n : n.substring(colon + 1);
    }

    public int parent(int node) {
        return parents[node];
    }

    public List<Integer> children(int node) {
        return children.get(node);
    }

    /** Texto cru (entidades já decodificadas) de um nó TEXT; null para os demais. */
    public String text(int node) {
        return texts[node];
    }

    /**
     * Valor do atributo. Procura o nome exato e, se não achar, um atributo com
     * o mesmo nome local ("opf:idref" serve para "idref").
     */
    public String attribute(int node, String name) {
        Map<String, String> a = attributes.get(node);
        String v = a.get(name);
        if (v != null) return v;
        for (Map.Entry<String, String> e : a.entrySet()) {
            String k = e.getKey();
            int colon = k.indexOf(':');
            if (colon >= 0 && k.substring(colon + 1).equals(name)) return e.getValue();
        }
        return null;
    }

    public List<Integer> childElements(int node) {
        List<Integer> out = new ArrayList<>();
        for (int c : children.get(node)) {
            if (kinds[c] == NodeKind.ELEMENT) out.add(c);
        }
        return out;
    }

    public List<Integer> childElements(int node, String localName) {
        List<Integer> out = new ArrayList<>();
        for (int c : children.get(node)) {
            if (kinds[c] == NodeKind.ELEMENT && localName.equals(localName(c))) out.add(c);
        }
        return out;
    }

    /** Primeiro elemento (em ordem de documento) com esse nome local, ou NO_NODE. */
    int firstElement(String localName) {
        for (int i = 0; i < kinds.length; i++) {
            if (kinds[i] == NodeKind.ELEMENT && localName.equals(localName(i))) return i;
        }
        return NO_NODE;
    }

    public List<Integer> elements(String localName) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < kinds.length; i++) {
            if (kinds[i] == NodeKind.ELEMENT && localName.equals(localName(i))) out.add(i);
        }
        return out;
    }

    /**
     * Posição 1-based do elemento entre os irmãos de mesmo nome:
     * 1 + quantidade de irmãos anteriores com o mesmo nome.
     */
    public int sameNameOrdinal(int node) {
        int p = parents[node];
        if (p == NO_NODE) return 1;
        int ordinal = 1;
        for (int sibling : children.get(p)) {
            if (sibling == node) break;
            if (kinds[sibling] == NodeKind.ELEMENT && names[sibling].equals(names[node])) ordinal++;
        }
        return ordinal;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Monta a arena; usado só pelo parser, na ordem de visita pré-ordem. */
    public static final class Builder {
        private final List<NodeKind> kinds = new ArrayList<>();
        private final List<String> names = new ArrayList<>();
        private final List<Integer> parents = new ArrayList<>();
        private final List<List<Integer>> children = new ArrayList<>();
        private final List<Map<String, String>> attributes = new ArrayList<>();
        private final List<String> texts = new ArrayList<>();

        private Builder() {
            add(NodeKind.DOCUMENT, NO_NODE, "#document", null, null);
        }

        public int addElement(int parent, String name, Map<String, String> attrs) {
            return add(NodeKind.ELEMENT, parent, name, attrs, null);
        }

        public int addText(int parent, String text) {
            return add(NodeKind.TEXT, parent, null, null, text);
        }

        private int add(NodeKind kind, int parent, String name, Map<String, String> attrs, String text) {
            int id = kinds.size();
            kinds.add(kind);
            names.add(name);
            parents.add(parent);
            children.add(new ArrayList<>());
            attributes.add(attrs);
            texts.add(text);
            if (parent != NO_NODE) children.get(parent).add(id);
            return id;
        }

        public MarkupTree build() {
            return new MarkupTree(this);
        }
    }
}
