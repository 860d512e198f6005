package com.architecture.patchgraph.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class PatchIOException extends RuntimeException {

    public PatchIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
