package com.dnobretech.epublocator.epub;

import com.dnobretech.epublocator.dto.PackageDocument;
import com.dnobretech.epublocator.dto.SpineDocument;
import com.dnobretech.epublocator.exception.MalformedPackageException;
import com.dnobretech.epublocator.exception.UnresolvedSpineItemException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * spine (idrefs) + manifest → lista de documentos na ordem de leitura, 1:1 com o spine.
 * idref fora do manifest é erro fatal: pular esconderia uma página da ordem de leitura.
 */
@Slf4j
@Component
public class SpineResolver {

    public List<SpineDocument> resolve(PackageDocument pkg, StagingArea staging) {
        Path baseDir = pkg.baseDir();
        List<SpineDocument> out = new ArrayList<>(pkg.spine().size());
        for (String idref : pkg.spine()) {
            String href = pkg.manifest().get(idref);
            if (href == null) {
                throw new UnresolvedSpineItemException(idref, pkg.entryName());
            }
            Path file;
            try {
                file = baseDir.resolve(hrefToPath(href)).normalize();
            } catch (InvalidPathException e) {
                throw new MalformedPackageException(pkg.entryName() + ": href inválido (id=" + idref + ", href=" + href + ")", e);
            }
            if (!staging.contains(file)) {
                throw new MalformedPackageException(pkg.entryName() + ": href fora do EPUB (id=" + idref + ", href=" + href + ")");
            }
            out.add(new SpineDocument(idref, href, file, staging.entryName(file)));
        }
        log.debug("[spine] {} documentos resolvidos", out.size());
        return List.copyOf(out);
    }

    /** href do manifest é uma URL relativa: tira o fragmento e decodifica %XX ('+' é literal). */
    static String hrefToPath(String href) {
        String h = href.trim();
        int hash = h.indexOf('#');
        if (hash >= 0) h = h.substring(0, hash);
        if (h.indexOf('%') >= 0) {
            try {
                h = URLDecoder.decode(h.replace("+", "%2B"), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                log.debug("[spine] href com escape inválido, usando literal: {}", href);
            }
        }
        return h;
    }
}
