package com.architecture.patchgraph.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Bad arguments while wiring nodes: negative port indices or an outlet beyond a node's count.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class PatchConnectionException extends RuntimeException {

    public PatchConnectionException(String message) {
        super(message);
    }
}
