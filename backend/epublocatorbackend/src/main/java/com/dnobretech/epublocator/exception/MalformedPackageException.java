package com.dnobretech.epublocator.exception;

public class MalformedPackageException extends EpubLocateException {

    public MalformedPackageException(String message) {
        super(message);
    }

    public MalformedPackageException(String message, Throwable cause) {
        super(message, cause);
    }
}
