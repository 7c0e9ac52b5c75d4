package com.dnobretech.epublocator.epub;

import com.dnobretech.epublocator.exception.MalformedContainerException;
import com.dnobretech.epublocator.exception.MissingContainerException;
import com.dnobretech.epublocator.markup.DocumentDialect;
import com.dnobretech.epublocator.markup.MarkupParser;
import com.dnobretech.epublocator.markup.MarkupTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * META-INF/container.xml → caminho do OPF (package descriptor).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContainerResolver {

    public static final String CONTAINER_PATH = "META-INF/container.xml";

    private final MarkupParser parser;

    public Path resolvePackagePath(StagingArea staging) {
        Path container = staging.getRoot().resolve(CONTAINER_PATH);
        if (!Files.isRegularFile(container)) {
            throw new MissingContainerException(container);
        }

        MarkupTree tree;
        try {
            tree = parser.parse(container, DocumentDialect.XML);
        } catch (IOException e) {
            throw new MalformedContainerException("falha ao ler " + CONTAINER_PATH + ": " + e.getMessage(), e);
        }

        String fullPath = null;
        int declarations = 0;
        for (int rootfile : tree.elements("rootfile")) {
            String fp = tree.attribute(rootfile, "full-path");
            if (fp == null || fp.isBlank()) continue;
            declarations++;
            if (fullPath == null) fullPath = fp.trim();
        }
        if (fullPath == null) {
            throw new MalformedContainerException(CONTAINER_PATH + " sem <rootfile full-path=\"...\">");
        }
        if (declarations > 1) {
            log.debug("[container] {} rootfiles declarados, usando o primeiro: {}", declarations, fullPath);
        }

        Path opf = resolveRootfile(staging, fullPath);
        log.debug("[container] package descriptor = {}", fullPath);
        return opf;
    }

    static Path resolveRootfile(StagingArea staging, String fullPath) {
        Path opf;
        try {
            opf = staging.resolve(fullPath);
        } catch (InvalidPathException e) {
            throw new MalformedContainerException("rootfile full-path inválido: " + fullPath, e);
        }
        if (opf == null) {
            throw new MalformedContainerException("rootfile full-path fora do EPUB: " + fullPath);
        }
        return opf;
    }
}
