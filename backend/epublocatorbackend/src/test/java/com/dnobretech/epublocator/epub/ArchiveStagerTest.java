package com.dnobretech.epublocator.epub;

import com.dnobretech.epublocator.EpubFixtures;
import com.dnobretech.epublocator.exception.StagingFailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchiveStagerTest {

    @TempDir
    Path tmp;

    private Path stagingParent() throws IOException {
        return Files.createDirectories(tmp.resolve("staging"));
    }

    private long leftovers() throws IOException {
        try (Stream<Path> s = Files.list(tmp.resolve("staging"))) {
            return s.count();
        }
    }

    @Test
    void extractsEntriesAndDeletesEverythingOnClose() throws IOException {
        ArchiveStager stager = new ArchiveStager(stagingParent().toString());
        Path epub = EpubFixtures.twoChapters("<p>a</p>", "<p>b</p>").writeTo(tmp.resolve("book.epub"));

        Path root;
        try (StagingArea area = stager.stage(epub)) {
            root = area.getRoot();
            assertThat(root.getFileName().toString()).startsWith("epub-locate-");
            assertThat(root.resolve("META-INF/container.xml")).isRegularFile();
            assertThat(root.resolve("OEBPS/ch2.xhtml")).isRegularFile();
            assertThat(area.getArchiveName()).isEqualTo(epub.toString());
        }
        assertThat(root).doesNotExist();
        assertThat(leftovers()).isZero();
    }

    @Test
    void entryNameUsesForwardSlashesRelativeToArchiveRoot() throws IOException {
        ArchiveStager stager = new ArchiveStager(stagingParent().toString());
        byte[] zip = EpubFixtures.twoChapters("<p>a</p>", "<p>b</p>").bytes();

        try (StagingArea area = stager.stage(new ByteArrayInputStream(zip), "upload.epub")) {
            Path ch1 = area.getRoot().resolve("OEBPS").resolve("ch1.xhtml");
            assertThat(area.entryName(ch1)).isEqualTo("OEBPS/ch1.xhtml");
            assertThat(area.resolve("../fora.txt")).isNull();
        }
    }

    @Test
    void notAZipFailsAndLeavesNothingBehind() throws IOException {
        ArchiveStager stager = new ArchiveStager(stagingParent().toString());
        byte[] garbage = "isto não é um zip".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> stager.stage(new ByteArrayInputStream(garbage), "lixo.epub"))
                .isInstanceOf(StagingFailureException.class)
                .hasMessageContaining("lixo.epub");
        assertThat(leftovers()).isZero();
    }

    @Test
    void missingArchiveFails() throws IOException {
        ArchiveStager stager = new ArchiveStager(stagingParent().toString());

        assertThatThrownBy(() -> stager.stage(tmp.resolve("nao-existe.epub")))
                .isInstanceOf(StagingFailureException.class);
    }

    @Test
    void entryEscapingStagingRootIsRejected() throws IOException {
        ArchiveStager stager = new ArchiveStager(stagingParent().toString());
        byte[] zip = EpubFixtures.epub().entry("../../evil.txt", "x").bytes();

        assertThatThrownBy(() -> stager.stage(new ByteArrayInputStream(zip), "evil.epub"))
                .isInstanceOf(StagingFailureException.class)
                .hasMessageContaining("evil.txt");
        assertThat(leftovers()).isZero();
        assertThat(tmp.resolve("evil.txt")).doesNotExist();
    }

    @Test
    void entryNameWithNulByteIsRejected() throws IOException {
        ArchiveStager stager = new ArchiveStager(stagingParent().toString());
        byte[] zip = EpubFixtures.epub().entry("OEBPS/ch\u00001.xhtml", "x").bytes();

        assertThatThrownBy(() -> stager.stage(new ByteArrayInputStream(zip), "nul.epub"))
                .isInstanceOf(StagingFailureException.class)
                .hasMessageContaining("nome de entrada inválido");
        assertThat(leftovers()).isZero();
    }
}
