package com.dnobretech.epublocator.epub;

import com.dnobretech.epublocator.exception.StagingFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Extrai o EPUB (zip) para um diretório temporário.
 */
@Slf4j
@Component
public class ArchiveStager {

    private static final String PREFIX = "epub-locate-";

    @Value("${locator.staging-dir:${java.io.tmpdir}}")
    private String stagingDir;

    public ArchiveStager() {
    }

    ArchiveStager(String stagingDir) {
        this.stagingDir = stagingDir;
    }

    public StagingArea stage(Path archive) {
        if (!Files.isRegularFile(archive)) {
            throw new StagingFailureException("EPUB não encontrado ou não é arquivo: " + archive);
        }
        try (InputStream in = Files.newInputStream(archive)) {
            return stage(in, archive.toString());
        } catch (IOException e) {
            throw new StagingFailureException("falha ao ler EPUB " + archive + ": " + e.getMessage(), e);
        }
    }

    public StagingArea stage(InputStream archive, String archiveName) {
        StagingArea area;
        try {
            Path parent = Path.of(stagingDir);
            Files.createDirectories(parent);
            area = new StagingArea(Files.createTempDirectory(parent, PREFIX), archiveName);
        } catch (IOException e) {
            throw new StagingFailureException("falha ao criar diretório de staging em " + stagingDir, e);
        }

        try {
            int entries = extract(archive, area);
            if (entries == 0) {
                throw new StagingFailureException("EPUB vazio ou não é um zip: " + archiveName);
            }
            log.debug("[staging] {} → {} ({} entradas)", archiveName, area.getRoot(), entries);
            return area;
        } catch (IOException e) {
            area.close();
            throw new StagingFailureException("EPUB corrompido " + archiveName + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            area.close();
            throw e;
        }
    }

    private static int extract(InputStream archive, StagingArea area) throws IOException {
        int count = 0;
        try (ZipInputStream zin = new ZipInputStream(new BufferedInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zin.getNextEntry()) != null) {
                Path target;
                try {
                    target = area.resolve(entry.getName());
                } catch (InvalidPathException e) {
                    throw new StagingFailureException("nome de entrada inválido: " + entry.getName(), e);
                }
                if (target == null) {
                    // zip-slip
                    throw new StagingFailureException("entrada fora do diretório do EPUB: " + entry.getName());
                }
                if (target.equals(area.getRoot())) continue;
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    Files.copy(zin, target, StandardCopyOption.REPLACE_EXISTING);
                }
                count++;
                zin.closeEntry();
            }
        }
        return count;
    }
}
