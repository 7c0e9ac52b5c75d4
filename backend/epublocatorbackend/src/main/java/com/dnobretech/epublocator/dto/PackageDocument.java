package com.dnobretech.epublocator.dto;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OPF já parseado: manifest (id → href relativo ao diretório do OPF) e spine (idrefs na ordem de leitura).
 */
public record PackageDocument(
        String entryName,
        Path descriptor,
        Map<String, String> manifest,
        List<String> spine,
        SpinePosition spinePosition
) {
    public PackageDocument {
        manifest = Collections.unmodifiableMap(new LinkedHashMap<>(manifest));
        spine = List.copyOf(spine);
    }

    public Path baseDir() {
        Path parent = descriptor.getParent();
        return parent != null ? parent : descriptor.getFileSystem().getPath("");
    }
}
