package com.dnobretech.epublocator.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.file.Path;

public record SpineDocument(
        String idref,
        String href,
        @JsonIgnore Path file,   // dentro do staging; deixa de existir quando o staging é apagado
        String entryName         // caminho dentro do EPUB, ex.: OEBPS/ch2.xhtml
) {}
