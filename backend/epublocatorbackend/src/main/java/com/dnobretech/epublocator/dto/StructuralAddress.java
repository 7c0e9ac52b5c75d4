package com.dnobretech.epublocator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Endereço estrutural de um match.
 * matchStart/matchEnd contam caracteres (code points) no texto cru do nó, não bytes nem unidades UTF-16.
 */
@Builder
public record StructuralAddress(
        int spineIndex,                 // 1-based
        int spineTotal,
        String matchedFile,             // entrada dentro do EPUB
        List<ElementStep> elementPath,  // raiz → pai do nó de texto
        List<Integer> indexPath,        // mesmo caminho, sem o elemento raiz
        int matchStart,
        int matchEnd
) {
    public StructuralAddress {
        if (spineIndex < 1 || spineIndex > spineTotal) {
            throw new IllegalArgumentException("spineIndex fora de [1, " + spineTotal + "]: " + spineIndex);
        }
        if (matchStart < 0 || matchEnd <= matchStart) {
            throw new IllegalArgumentException("offsets inválidos: " + matchStart + ".." + matchEnd);
        }
        elementPath = List.copyOf(elementPath);
        indexPath = List.copyOf(indexPath);
        if (indexPath.size() != elementPath.size() - 1) {
            throw new IllegalArgumentException("indexPath deve ter um passo a menos que elementPath");
        }
    }

    /** ex.: html[1]/body[1]/div[1]/p[1] */
    @JsonProperty("elementPathText")
    public String elementPathText() {
        return elementPath.stream().map(ElementStep::toString).collect(Collectors.joining("/"));
    }

    /** ex.: 1/1/1 */
    @JsonProperty("indexPathText")
    public String indexPathText() {
        return indexPath.stream().map(String::valueOf).collect(Collectors.joining("/"));
    }
}
