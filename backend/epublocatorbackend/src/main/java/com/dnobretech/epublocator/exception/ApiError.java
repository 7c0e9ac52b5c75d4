package com.dnobretech.epublocator.exception;

import java.time.Instant;

/** Corpo de erro da API; exception = nome simples da falha (ex.: UnresolvedSpineItemException). */
public record ApiError(
        int status,
        String error,
        String exception,
        String message,
        String path,
        Instant timestamp
) {}
