package com.dnobretech.epublocator.exception;

/** Arquivo EPUB ilegível, corrompido ou com entrada que escapa do diretório de staging. */
public class StagingFailureException extends EpubLocateException {

    public StagingFailureException(String message) {
        super(message);
    }

    public StagingFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
