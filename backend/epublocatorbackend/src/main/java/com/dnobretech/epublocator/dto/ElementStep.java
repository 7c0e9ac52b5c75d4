package com.dnobretech.epublocator.dto;

/** Um passo do caminho de elementos: nome da tag + posição entre irmãos de mesmo nome (1-based). */
public record ElementStep(String tagName, int ordinal) {

    @Override
    public String toString() {
        return tagName + "[" + ordinal + "]";
    }
}
