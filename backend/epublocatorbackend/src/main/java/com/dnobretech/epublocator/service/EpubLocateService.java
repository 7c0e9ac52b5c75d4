package com.dnobretech.epublocator.service;

import com.dnobretech.epublocator.dto.LocateResult;
import com.dnobretech.epublocator.dto.PackageOverview;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;

public interface EpubLocateService {

    /** Procura a primeira ocorrência de query no EPUB; não encontrar não é erro. */
    LocateResult locate(Path epub, String query);

    LocateResult locate(MultipartFile epub, String query) throws IOException;

    /** Manifest/spine resolvidos, sem busca. */
    PackageOverview inspect(MultipartFile epub) throws IOException;
}
