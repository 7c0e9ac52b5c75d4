package com.dnobretech.epublocator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Posição do elemento spine entre os filhos diretos de package.
 * ordinal é 1-based; -1 quando o OPF não tem spine. total é sempre a contagem real de filhos.
 */
public record SpinePosition(int ordinal, int total) {

    public static final int ABSENT = -1;

    public static SpinePosition absent(int total) {
        return new SpinePosition(ABSENT, total);
    }

    @JsonProperty("present")
    public boolean present() {
        return ordinal != ABSENT;
    }
}
