package com.architecture.patchgraph.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;

/**
 * One or more connections point at ports or nodes that do not exist.
 * Carries every violation found, not just the first.
 */
@Getter
@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class InvalidConnectionException extends RuntimeException {

    private final List<String> violations;

    public InvalidConnectionException(List<String> violations) {
        super(formatMessage(violations));
        this.violations = List.copyOf(violations);
    }

    private static String formatMessage(List<String> violations) {
        StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(violations.size()).append(" invalid connection(s):");
        for (String violation : violations) {
            sb.append("\n  - ").append(violation);
        }
        return sb.toString();
    }
}
