package com.dnobretech.epublocator.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Resultado de uma busca: address == null significa "não encontrado" (não é erro). */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocateResult(
        String archive,
        String query,
        SpinePosition spineXmlPosition,
        StructuralAddress address
) {
    public static LocateResult notFound(String archive, String query, SpinePosition spineXmlPosition) {
        return new LocateResult(archive, query, spineXmlPosition, null);
    }

    @JsonProperty("found")
    public boolean found() {
        return address != null;
    }
}
