package com.architecture.patchgraph.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Malformed patch text. Parsing stops at the first one.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class PatchParseException extends RuntimeException {

    public PatchParseException(String message) {
        super(message);
    }
}
