package com.dnobretech.epublocator.epub;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Diretório temporário com o EPUB extraído. Fechar = apagar recursivamente.
 * Usar sempre em try-with-resources: sucesso, "não encontrado" e erro passam pelo mesmo close().
 */
@Slf4j
@Getter
public class StagingArea implements AutoCloseable {

    private final Path root;
    private final String archiveName;

    StagingArea(Path root, String archiveName) {
        this.root = root.toAbsolutePath().normalize();
        this.archiveName = archiveName;
    }

    /** Resolve um caminho relativo à raiz do EPUB; null se escapar do staging (../). */
    public Path resolve(String relative) {
        Path p = root.resolve(relative).normalize();
        return p.startsWith(root) ? p : null;
    }

    public boolean contains(Path p) {
        return p.toAbsolutePath().normalize().startsWith(root);
    }

    /** Nome da entrada dentro do EPUB, sempre com '/'. */
    public String entryName(Path p) {
        Path rel = root.relativize(p.toAbsolutePath().normalize());
        StringBuilder sb = new StringBuilder();
        for (Path part : rel) {
            if (sb.length() > 0) sb.append('/');
            sb.append(part);
        }
        return sb.toString();
    }

    @Override
    public void close() {
        if (!Files.exists(root)) return;
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        } catch (IOException e) {
            log.warn("[staging] não consegui listar {} para limpeza: {}", root, e.toString());
            return;
        }
        int failed = 0;
        for (Path p : paths) {
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                failed++;
                log.warn("[staging] falha ao apagar {}: {}", p, e.toString());
            }
        }
        if (failed == 0) log.debug("[staging] removido {}", root);
    }
}
