package com.dnobretech.epublocator.markup;

import java.util.Locale;

/**
 * Como um arquivo é lido para a árvore.
 * XML mantém a estrutura do fonte; HTML passa pelo tree builder tolerante do jsoup
 * (que pode inserir html/head/body/tbody).
 */
public enum DocumentDialect {
    XML,
    HTML;

    public static DocumentDialect fromConfig(String value) {
        if (value == null || value.isBlank()) return XML;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("locator.document-dialect inválido: " + value + " (use xml|html)", e);
        }
    }
}
