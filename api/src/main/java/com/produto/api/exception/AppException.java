package com.produto.api.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class for errors that map directly to an HTTP status.
 */
@Getter
public class AppException extends RuntimeException {

    private final HttpStatus status;

    public AppException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }
}
