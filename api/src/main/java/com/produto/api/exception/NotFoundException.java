package com.produto.api.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends AppException {

    public NotFoundException(String message) {
        super(message, HttpStatus.NOT_FOUND);
    }

    public static NotFoundException produto(Long id) {
        return new NotFoundException("Produto with id " + id + " not found");
    }
}
