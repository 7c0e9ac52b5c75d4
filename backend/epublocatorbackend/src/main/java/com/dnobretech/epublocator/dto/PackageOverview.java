package com.dnobretech.epublocator.dto;

import java.util.List;

public record PackageOverview(
        String archive,
        String descriptor,          // entrada do OPF dentro do EPUB
        SpinePosition spineXmlPosition,
        int manifestSize,
        List<SpineDocument> spine
) {}
