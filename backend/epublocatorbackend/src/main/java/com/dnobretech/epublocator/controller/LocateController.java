package com.dnobretech.epublocator.controller;

import com.dnobretech.epublocator.dto.LocateResult;
import com.dnobretech.epublocator.dto.PackageOverview;
import com.dnobretech.epublocator.service.EpubLocateService;
import com.dnobretech.epublocator.util.LocateReportFormatter;
import jakarta.validation.constraints.NotEmpty;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/epub")
public class LocateController {

    private final EpubLocateService service;
    private final LocateReportFormatter reportFormatter;

    /**
     * Procura a primeira ocorrência literal de query no EPUB, na ordem de leitura.
     *
     * @param file  EPUB (multipart)
     * @param query texto exato; não pode ser vazio
     * @return found=false quando não há match (200, não é erro)
     */
    @PostMapping(value = "/locate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<LocateResult> locate(@RequestPart("file") MultipartFile file,
                                               @RequestParam @NotEmpty String query) throws Exception {
        return ResponseEntity.ok(service.locate(file, query));
    }

    /** Mesmo que /locate, em texto puro. */
    @PostMapping(value = "/locate/report", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> report(@RequestPart("file") MultipartFile file,
                                         @RequestParam @NotEmpty String query) throws Exception {
        return ResponseEntity.ok(reportFormatter.format(service.locate(file, query)));
    }

    @PostMapping(value = "/spine", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PackageOverview> spine(@RequestPart("file") MultipartFile file) throws Exception {
        return ResponseEntity.ok(service.inspect(file));
    }
}
