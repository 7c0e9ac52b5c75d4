package com.dnobretech.epublocator.epub;

import com.dnobretech.epublocator.dto.PackageDocument;
import com.dnobretech.epublocator.dto.SpineDocument;
import com.dnobretech.epublocator.dto.SpinePosition;
import com.dnobretech.epublocator.exception.MalformedPackageException;
import com.dnobretech.epublocator.exception.UnresolvedSpineItemException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpineResolverTest {

    @TempDir
    Path root;

    private final SpineResolver resolver = new SpineResolver();

    private PackageDocument pkg(Map<String, String> manifest, List<String> spine) {
        return new PackageDocument("OEBPS/content.opf", root.resolve("OEBPS/content.opf"),
                manifest, spine, new SpinePosition(3, 3));
    }

    private static Map<String, String> manifest(String... idHref) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < idHref.length; i += 2) m.put(idHref[i], idHref[i + 1]);
        return m;
    }

    @Test
    void mapsSpineToFilesInReadingOrder() {
        StagingArea staging = new StagingArea(root, "t.epub");

        List<SpineDocument> docs = resolver.resolve(
                pkg(manifest("c1", "ch1.xhtml", "c2", "ch2.xhtml"), List.of("c2", "c1")), staging);

        assertThat(docs).extracting(SpineDocument::entryName).containsExactly("OEBPS/ch2.xhtml", "OEBPS/ch1.xhtml");
        assertThat(docs).extracting(SpineDocument::idref).containsExactly("c2", "c1");
        assertThat(docs.get(0).file()).isEqualTo(root.toAbsolutePath().normalize().resolve("OEBPS/ch2.xhtml"));
    }

    @Test
    void resolutionIsDeterministic() {
        StagingArea staging = new StagingArea(root, "t.epub");
        PackageDocument p = pkg(manifest("c1", "text/../ch1.xhtml"), List.of("c1", "c1"));

        List<SpineDocument> docs = resolver.resolve(p, staging);

        assertThat(docs).hasSize(2);
        assertThat(docs.get(0)).isEqualTo(docs.get(1));
        assertThat(resolver.resolve(p, staging)).isEqualTo(docs);
        assertThat(docs.get(0).entryName()).isEqualTo("OEBPS/ch1.xhtml");
    }

    @Test
    void unknownIdrefIsFatal() {
        StagingArea staging = new StagingArea(root, "t.epub");

        assertThatThrownBy(() -> resolver.resolve(pkg(manifest("c1", "ch1.xhtml"), List.of("c1", "cX")), staging))
                .isInstanceOf(UnresolvedSpineItemException.class)
                .satisfies(e -> assertThat(((UnresolvedSpineItemException) e).getIdref()).isEqualTo("cX"));
    }

    @Test
    void hrefEscapingArchiveIsRejected() {
        StagingArea staging = new StagingArea(root, "t.epub");

        assertThatThrownBy(() -> resolver.resolve(pkg(manifest("c1", "../../../ch1.xhtml"), List.of("c1")), staging))
                .isInstanceOf(MalformedPackageException.class);
    }

    @Test
    void hrefIsPercentDecodedAndFragmentDropped() {
        assertThat(SpineResolver.hrefToPath("Cap%C3%ADtulo%201.xhtml#top")).isEqualTo("Capítulo 1.xhtml");
        assertThat(SpineResolver.hrefToPath("a+b.xhtml")).isEqualTo("a+b.xhtml");
        assertThat(SpineResolver.hrefToPath("a+b%20c.xhtml")).isEqualTo("a+b c.xhtml");
    }

    @Test
    void hrefDecodingToInvalidPathIsMalformedPackage() {
        StagingArea staging = new StagingArea(root, "t.epub");

        assertThatThrownBy(() -> resolver.resolve(pkg(manifest("c1", "ch%001.xhtml"), List.of("c1")), staging))
                .isInstanceOf(MalformedPackageException.class)
                .hasMessageContaining("c1");
    }
}
