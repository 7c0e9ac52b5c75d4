package com.dnobretech.epublocator.service.impl;

import com.dnobretech.epublocator.dto.LocateResult;
import com.dnobretech.epublocator.dto.PackageDocument;
import com.dnobretech.epublocator.dto.PackageOverview;
import com.dnobretech.epublocator.dto.SpineDocument;
import com.dnobretech.epublocator.dto.StructuralAddress;
import com.dnobretech.epublocator.epub.ArchiveStager;
import com.dnobretech.epublocator.epub.ContainerResolver;
import com.dnobretech.epublocator.epub.PackageDescriptorParser;
import com.dnobretech.epublocator.epub.SpineResolver;
import com.dnobretech.epublocator.epub.StagingArea;
import com.dnobretech.epublocator.epub.TextLocator;
import com.dnobretech.epublocator.exception.EpubLocateException;
import com.dnobretech.epublocator.service.EpubLocateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class EpubLocateServiceImpl implements EpubLocateService {

    private final ArchiveStager stager;
    private final ContainerResolver containerResolver;
    private final PackageDescriptorParser packageParser;
    private final SpineResolver spineResolver;
    private final TextLocator textLocator;

    @Override
    public LocateResult locate(Path epub, String query) {
        requireQuery(query);
        try (StagingArea staging = stager.stage(epub)) {
            return locate(staging, query);
        }
    }

    @Override
    public LocateResult locate(MultipartFile epub, String query) throws IOException {
        requireQuery(query);
        try (InputStream in = epub.getInputStream();
             StagingArea staging = stager.stage(in, nameOf(epub))) {
            return locate(staging, query);
        }
    }

    @Override
    public PackageOverview inspect(MultipartFile epub) throws IOException {
        try (InputStream in = epub.getInputStream();
             StagingArea staging = stager.stage(in, nameOf(epub))) {
            try {
                PackageDocument pkg = readPackage(staging);
                List<SpineDocument> docs = spineResolver.resolve(pkg, staging);
                return new PackageOverview(staging.getArchiveName(), pkg.entryName(),
                        pkg.spinePosition(), pkg.manifest().size(), docs);
            } catch (EpubLocateException e) {
                log.warn("[inspect] {} falhou: {}", staging.getArchiveName(), e.getMessage());
                throw e;
            }
        }
    }

    // ===== Pipeline: container → OPF → spine → varredura =====
    private LocateResult locate(StagingArea staging, String query) {
        String archive = staging.getArchiveName();
        try {
            PackageDocument pkg = readPackage(staging);
            List<SpineDocument> docs = spineResolver.resolve(pkg, staging);
            Optional<StructuralAddress> hit = textLocator.locate(docs, query);

            if (hit.isEmpty()) {
                log.info("[locate] {}: query não encontrada no spine ({} documentos)", archive, docs.size());
                return LocateResult.notFound(archive, query, pkg.spinePosition());
            }
            StructuralAddress a = hit.get();
            log.info("[locate] {}: match em {} spine={}/{} path={} offsets={}..{}",
                    archive, a.matchedFile(), a.spineIndex(), a.spineTotal(),
                    a.elementPathText(), a.matchStart(), a.matchEnd());
            return new LocateResult(archive, query, pkg.spinePosition(), a);
        } catch (EpubLocateException e) {
            log.warn("[locate] {} falhou: {}", archive, e.getMessage());
            throw e;
        }
    }

    private PackageDocument readPackage(StagingArea staging) {
        Path opf = containerResolver.resolvePackagePath(staging);
        return packageParser.parse(opf, staging.entryName(opf));
    }

    private static void requireQuery(String query) {
        if (query == null || query.isEmpty()) {
            throw new IllegalArgumentException("query não pode ser vazia");
        }
    }

    private static String nameOf(MultipartFile f) {
        String n = f.getOriginalFilename();
        return (n == null || n.isBlank()) ? f.getName() : n;
    }
}
