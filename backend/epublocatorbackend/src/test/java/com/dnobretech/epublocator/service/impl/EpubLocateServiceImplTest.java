package com.dnobretech.epublocator.service.impl;

import com.dnobretech.epublocator.EpubFixtures;
import com.dnobretech.epublocator.dto.LocateResult;
import com.dnobretech.epublocator.dto.PackageOverview;
import com.dnobretech.epublocator.dto.SpineDocument;
import com.dnobretech.epublocator.dto.SpinePosition;
import com.dnobretech.epublocator.epub.ArchiveStager;
import com.dnobretech.epublocator.epub.ContainerResolver;
import com.dnobretech.epublocator.epub.PackageDescriptorParser;
import com.dnobretech.epublocator.epub.SpineResolver;
import com.dnobretech.epublocator.epub.TextLocator;
import com.dnobretech.epublocator.exception.DocumentUnreadableException;
import com.dnobretech.epublocator.exception.MissingContainerException;
import com.dnobretech.epublocator.exception.UnresolvedSpineItemException;
import com.dnobretech.epublocator.markup.MarkupParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EpubLocateServiceImplTest {

    @TempDir
    Path tmp;

    private Path stagingDir;
    private EpubLocateServiceImpl service;

    @BeforeEach
    void setUp() throws IOException {
        stagingDir = Files.createDirectories(tmp.resolve("staging"));
        ArchiveStager stager = new ArchiveStager();
        ReflectionTestUtils.setField(stager, "stagingDir", stagingDir.toString());
        MarkupParser parser = new MarkupParser();
        service = new EpubLocateServiceImpl(
                stager,
                new ContainerResolver(parser),
                new PackageDescriptorParser(parser),
                new SpineResolver(),
                new TextLocator(parser, "xml"));
    }

    private Path book(EpubFixtures fixture) throws IOException {
        return fixture.writeTo(tmp.resolve("book.epub"));
    }

    private void assertStagingCleaned() throws IOException {
        try (Stream<Path> s = Files.list(stagingDir)) {
            assertThat(s).isEmpty();
        }
    }

    @Test
    void locatesQueryInSecondSpineDocument() throws IOException {
        Path epub = book(EpubFixtures.twoChapters(
                "<p>Nothing here</p>",
                "<div><p>Hello world</p></div>"));

        LocateResult r = service.locate(epub, "world");

        assertThat(r.found()).isTrue();
        assertThat(r.spineXmlPosition()).isEqualTo(new SpinePosition(3, 3));
        assertThat(r.address().spineIndex()).isEqualTo(2);
        assertThat(r.address().spineTotal()).isEqualTo(2);
        assertThat(r.address().matchedFile()).isEqualTo("OEBPS/ch2.xhtml");
        assertThat(r.address().matchStart()).isEqualTo(6);
        assertThat(r.address().matchEnd()).isEqualTo(11);
        assertThat(r.address().elementPathText()).isEqualTo("html[1]/body[1]/div[1]/p[1]");
        assertThat(r.address().indexPathText()).isEqualTo("1/1/1");
        assertStagingCleaned();
    }

    @Test
    void absentQueryIsNotFoundAndCleansUp() throws IOException {
        Path epub = book(EpubFixtures.twoChapters("<p>um</p>", "<p>dois</p>"));

        LocateResult r = service.locate(epub, "inexistente");

        assertThat(r.found()).isFalse();
        assertThat(r.address()).isNull();
        assertThat(r.spineXmlPosition().ordinal()).isEqualTo(3);
        assertStagingCleaned();
    }

    @Test
    void locateIsIdempotent() throws IOException {
        Path epub = book(EpubFixtures.twoChapters("<p>abc</p>", "<p>xyz abc</p>"));

        assertThat(service.locate(epub, "abc")).isEqualTo(service.locate(epub, "abc"));
    }

    @Test
    void unresolvedSpineItemIsFatalAndStillCleansUp() throws IOException {
        Path epub = book(EpubFixtures.epub()
                .entry("META-INF/container.xml", EpubFixtures.container("OEBPS/content.opf"))
                .entry("OEBPS/content.opf", EpubFixtures.opf(
                        "<item id=\"c1\" href=\"ch1.xhtml\"/>",
                        "<itemref idref=\"c1\"/><itemref idref=\"cX\"/>"))
                .entry("OEBPS/ch1.xhtml", EpubFixtures.xhtml("One", "<p>texto</p>")));

        assertThatThrownBy(() -> service.locate(epub, "texto"))
                .isInstanceOf(UnresolvedSpineItemException.class)
                .hasMessageContaining("cX");
        assertStagingCleaned();
    }

    @Test
    void missingContainerIsFatalAndStillCleansUp() throws IOException {
        Path epub = book(EpubFixtures.twoChapters("<p>a</p>", "<p>b</p>").without("META-INF/container.xml"));

        assertThatThrownBy(() -> service.locate(epub, "a")).isInstanceOf(MissingContainerException.class);
        assertStagingCleaned();
    }

    @Test
    void spineDocumentMissingFromArchiveIsFatal() throws IOException {
        Path epub = book(EpubFixtures.twoChapters("<p>a</p>", "<p>b</p>").without("OEBPS/ch1.xhtml"));

        assertThatThrownBy(() -> service.locate(epub, "b"))
                .isInstanceOf(DocumentUnreadableException.class)
                .hasMessageContaining("OEBPS/ch1.xhtml");
        assertStagingCleaned();
    }

    @Test
    void emptyQueryIsRejectedBeforeStaging() throws IOException {
        Path epub = book(EpubFixtures.twoChapters("<p>a</p>", "<p>b</p>"));

        assertThatThrownBy(() -> service.locate(epub, "")).isInstanceOf(IllegalArgumentException.class);
        assertStagingCleaned();
    }

    @Test
    void locatesFromUpload() throws IOException {
        MockMultipartFile upload = new MockMultipartFile("file", "livro.epub", "application/epub+zip",
                EpubFixtures.twoChapters("<p>Olá mundo</p>", "<p>fim</p>").bytes());

        LocateResult r = service.locate(upload, "mundo");

        assertThat(r.archive()).isEqualTo("livro.epub");
        assertThat(r.address().spineIndex()).isEqualTo(1);
        assertThat(r.address().matchStart()).isEqualTo(4);
        assertStagingCleaned();
    }

    @Test
    void inspectListsSpineDocuments() throws IOException {
        MockMultipartFile upload = new MockMultipartFile("file", "livro.epub", "application/epub+zip",
                EpubFixtures.twoChapters("<p>a</p>", "<p>b</p>").bytes());

        PackageOverview o = service.inspect(upload);

        assertThat(o.descriptor()).isEqualTo("OEBPS/content.opf");
        assertThat(o.spineXmlPosition()).isEqualTo(new SpinePosition(3, 3));
        assertThat(o.manifestSize()).isEqualTo(2);
        assertThat(o.spine()).extracting(SpineDocument::entryName)
                .containsExactly("OEBPS/ch1.xhtml", "OEBPS/ch2.xhtml");
        assertStagingCleaned();
    }
}
