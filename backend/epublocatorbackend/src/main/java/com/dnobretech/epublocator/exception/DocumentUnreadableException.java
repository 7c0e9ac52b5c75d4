package com.dnobretech.epublocator.exception;

import lombok.Getter;

/** Um documento do spine não pôde ser lido/parseado; a varredura inteira é abortada. */
@Getter
public class DocumentUnreadableException extends EpubLocateException {

    private final String file;

    public DocumentUnreadableException(String file, Throwable cause) {
        super("documento do spine ilegível: " + file + (cause != null ? " (" + cause.getMessage() + ")" : ""), cause);
        this.file = file;
    }
}
