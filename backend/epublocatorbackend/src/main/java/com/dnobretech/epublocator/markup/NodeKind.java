package com.dnobretech.epublocator.markup;

public enum NodeKind {
    DOCUMENT,
    ELEMENT,
    TEXT
}
