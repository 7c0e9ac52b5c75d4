package com.dnobretech.epublocator.exception;

public class MalformedContainerException extends EpubLocateException {

    public MalformedContainerException(String message) {
        super(message);
    }

    public MalformedContainerException(String message, Throwable cause) {
        super(message, cause);
    }
}
