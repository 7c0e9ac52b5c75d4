package com.dnobretech.epublocator.exception;

/**
 * Base das falhas fatais do pipeline de localização.
 * Todas são determinísticas (estrutura/parse), então nada é re-tentado.
 */
public abstract class EpubLocateException extends RuntimeException {

    protected EpubLocateException(String message) {
        super(message);
    }

    protected EpubLocateException(String message, Throwable cause) {
        super(message, cause);
    }
}
