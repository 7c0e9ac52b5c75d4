package com.dnobretech.epublocator.exception;

import java.nio.file.Path;

public class MissingContainerException extends EpubLocateException {

    public MissingContainerException(Path expected) {
        super("META-INF/container.xml não encontrado: " + expected);
    }
}
