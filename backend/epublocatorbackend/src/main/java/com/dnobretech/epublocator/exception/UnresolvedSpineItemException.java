package com.dnobretech.epublocator.exception;

import lombok.Getter;

/** itemref do spine aponta para um id que não existe no manifest. */
@Getter
public class UnresolvedSpineItemException extends EpubLocateException {

    private final String idref;

    public UnresolvedSpineItemException(String idref, String descriptor) {
        super("spine itemref idref=" + idref + " não existe no manifest de " + descriptor);
        this.idref = idref;
    }
}
